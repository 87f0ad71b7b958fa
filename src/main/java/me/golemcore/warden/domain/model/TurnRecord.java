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

package me.golemcore.warden.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Finalized assistant turn handed to the session store as one atomic write.
 */
@Data
@Builder
public class TurnRecord {

    private String messageId;
    private String content;
    private String reasoning;
    private String modelId;

    @Builder.Default
    private List<ToolInvocation> toolInvocations = new ArrayList<>();

    @Builder.Default
    private List<ThinkingStep> thinkingSteps = new ArrayList<>();

    @Builder.Default
    private TokenUsage usage = TokenUsage.empty();

    private boolean interrupted;

    /**
     * Context window of the model that produced the turn, 0 when unknown.
     */
    private int contextWindow;
}
