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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Durable record of one tool call and its outcome. Created once the call is
 * fully resolved (executed, blocked, denied or rejected) and never changed
 * afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocation {

    private String messageId;
    private String toolCallId;
    private String toolName;
    private Map<String, Object> arguments;
    private String result;
    private String error;
    private String errorKind;
    private ToolInvocationStatus status;
    private String ticketId;
    private Instant completedAt;

    @JsonIgnore
    public boolean isSuccessful() {
        return status == ToolInvocationStatus.COMPLETED;
    }
}
