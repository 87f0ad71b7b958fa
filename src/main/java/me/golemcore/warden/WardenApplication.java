/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.warden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Warden.
 *
 * <p>
 * Warden lets an LLM-driven agent read and write files, search content and run
 * shell commands in a project workspace while a human stays in control. Every
 * tool call the model streams goes through one pipeline:
 *
 * <pre>
 * Security Gate  → absolute path/command veto, cannot be overridden
 * Policy         → allow / deny / ask rules, snapshot-swapped
 * Approval       → ticket resolved out of band by the human
 * Tool executor  → bounded by timeout, result spliced back in request order
 * </pre>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ChatController (SSE), ApprovalsController, SessionsController
 * Domain Layer       → ExchangeOrchestrator, ToolCallPipeline, ApprovalCoordinator
 * Infrastructure     → LLM/Storage Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code warden.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(WardenApplication.class, args);
    }

}
