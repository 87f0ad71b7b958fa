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

package me.golemcore.warden.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for Warden, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code warden.*} prefix:
 * <ul>
 * <li>{@link WorkspaceProperties} - workspace root and ignore list</li>
 * <li>{@link LlmProperties} - model endpoint settings</li>
 * <li>{@link ReasoningProperties} - reasoning markers</li>
 * <li>{@link ToolsProperties} - timeouts and resource caps</li>
 * <li>{@link ApprovalProperties} - approval ticket lifetime</li>
 * <li>{@link PermissionProperties} - seed allow/deny rules</li>
 * <li>{@link ExchangeProperties} - model round-trip limits</li>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "warden")
@Data
public class WardenProperties {

    private WorkspaceProperties workspace = new WorkspaceProperties();
    private LlmProperties llm = new LlmProperties();
    private ReasoningProperties reasoning = new ReasoningProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ApprovalProperties approvals = new ApprovalProperties();
    private PermissionProperties permissions = new PermissionProperties();
    private ExchangeProperties exchange = new ExchangeProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class WorkspaceProperties {
        private String root = "${user.dir}";
        private String ignoreFile = ".wardenignore";
        private List<String> ignorePatterns = new ArrayList<>();

        public Path resolveRoot() {
            return expandPath(root);
        }
    }

    @Data
    public static class LlmProperties {
        private String baseUrl = "http://127.0.0.1:1234/v1";
        private String apiKey = "";
        private String model = "local-model";
        private String systemPrompt = "You are a helpful coding assistant working inside the user's project. "
                + "Use the available tools when you need to inspect or change files or run commands.";
        private long connectTimeout = 10000;
        private long readTimeout = 300000;
        private double temperature = 0.7;
        private int contextWindow = 8192;
    }

    @Data
    public static class ReasoningProperties {
        private String openMarker = "<think>";
        private String closeMarker = "</think>";
    }

    @Data
    public static class ToolsProperties {
        private int defaultTimeoutSeconds = 10;
        private int maxTimeoutSeconds = 60;
        private long readMaxBytes = 10L * 1024 * 1024;
        private int grepDefaultMaxResults = 50;
        private int grepMaxResults = 500;
        private int maxOutputChars = 100_000;
        private int dispatchThreads = 4;
        private String allowedEnvVars = "";
    }

    @Data
    public static class ApprovalProperties {
        private long timeoutMinutes = 10;
    }

    @Data
    public static class PermissionProperties {
        private List<String> allow = new ArrayList<>();
        private List<String> deny = new ArrayList<>();
    }

    @Data
    public static class ExchangeProperties {
        private int maxModelCalls = 25;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/warden";
    }

    /**
     * Expands {@code ${user.home}} and {@code ${user.dir}} left unresolved in
     * defaults and returns an absolute, normalized path.
     */
    public static Path expandPath(String value) {
        String expanded = value
                .replace("${user.home}", System.getProperty("user.home"))
                .replace("${user.dir}", System.getProperty("user.dir"));
        return Paths.get(expanded).toAbsolutePath().normalize();
    }
}
