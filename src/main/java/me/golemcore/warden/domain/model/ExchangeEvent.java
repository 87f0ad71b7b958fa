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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Event streamed to the client during an exchange. Serialized as one SSE
 * {@code data} object whose {@code type} field names the event.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExchangeEvent {

    private Type type;
    private String sessionId;
    private String exchangeId;
    private String content;
    private List<Source> sources;
    private String ticketId;
    private String tool;
    private Map<String, Object> args;
    private String description;
    private String result;
    private String error;
    private String errorKind;
    private ToolInvocationStatus status;
    private Long input;
    private Long output;
    private Long reasoning;
    private Long cache;
    private String messageId;
    private String message;

    public enum Type {
        SESSION("session"), SOURCES("sources"), CONTENT("content"), REASONING("reasoning"),
        TOOL_APPROVAL_REQUEST("tool_approval_request"), TOOL_INVOCATION_COMPLETED("tool_invocation_completed"),
        USAGE("usage"), DONE("done"), ERROR("error");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }

    public static ExchangeEvent session(String sessionId, String exchangeId) {
        return ExchangeEvent.builder().type(Type.SESSION).sessionId(sessionId).exchangeId(exchangeId).build();
    }

    public static ExchangeEvent sources(List<Source> sources) {
        return ExchangeEvent.builder().type(Type.SOURCES).sources(sources).build();
    }

    public static ExchangeEvent content(String delta) {
        return ExchangeEvent.builder().type(Type.CONTENT).content(delta).build();
    }

    public static ExchangeEvent reasoning(String delta) {
        return ExchangeEvent.builder().type(Type.REASONING).content(delta).build();
    }

    public static ExchangeEvent approvalRequest(ApprovalTicket ticket) {
        return ExchangeEvent.builder()
                .type(Type.TOOL_APPROVAL_REQUEST)
                .ticketId(ticket.getId())
                .tool(ticket.getToolName())
                .args(ticket.getArguments())
                .description(ticket.getDescription())
                .build();
    }

    public static ExchangeEvent invocationCompleted(ToolInvocation invocation) {
        return ExchangeEvent.builder()
                .type(Type.TOOL_INVOCATION_COMPLETED)
                .tool(invocation.getToolName())
                .args(invocation.getArguments())
                .result(invocation.getResult())
                .error(invocation.getError())
                .errorKind(invocation.getErrorKind())
                .status(invocation.getStatus())
                .build();
    }

    public static ExchangeEvent usage(TokenUsage usage) {
        return ExchangeEvent.builder()
                .type(Type.USAGE)
                .input(usage.getInputTokens())
                .output(usage.getOutputTokens())
                .reasoning(usage.getReasoningTokens())
                .cache(usage.getCacheTokens())
                .build();
    }

    public static ExchangeEvent done(String messageId) {
        return ExchangeEvent.builder().type(Type.DONE).messageId(messageId).build();
    }

    public static ExchangeEvent error(String message) {
        return ExchangeEvent.builder().type(Type.ERROR).message(message).build();
    }
}
