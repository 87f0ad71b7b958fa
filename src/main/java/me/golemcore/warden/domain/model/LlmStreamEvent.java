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

/**
 * One event of the ordered model stream consumed by an exchange.
 */
@Data
@Builder
public class LlmStreamEvent {

    private Type type;
    private String text;
    private ToolCall toolCall;
    private TokenUsage usage;
    private String finishReason;
    private String error;

    public enum Type {
        /** A piece of text, possibly containing reasoning markers. */
        TEXT_DELTA,
        /** A fully assembled tool call. */
        TOOL_CALL_REQUEST,
        /** The model stopped to wait for the results of the requested calls. */
        TOOL_RESULT_NEEDED,
        /** Token accounting for the response. */
        USAGE,
        /** The model finished its answer. */
        TURN_COMPLETE,
        /** The transport failed mid-stream. */
        ERROR
    }

    public static LlmStreamEvent text(String text) {
        return LlmStreamEvent.builder().type(Type.TEXT_DELTA).text(text).build();
    }

    public static LlmStreamEvent toolCall(ToolCall toolCall) {
        return LlmStreamEvent.builder().type(Type.TOOL_CALL_REQUEST).toolCall(toolCall).build();
    }

    public static LlmStreamEvent toolResultNeeded() {
        return LlmStreamEvent.builder().type(Type.TOOL_RESULT_NEEDED).finishReason("tool_calls").build();
    }

    public static LlmStreamEvent usage(TokenUsage usage) {
        return LlmStreamEvent.builder().type(Type.USAGE).usage(usage).build();
    }

    public static LlmStreamEvent complete(String finishReason) {
        return LlmStreamEvent.builder().type(Type.TURN_COMPLETE).finishReason(finishReason).build();
    }

    public static LlmStreamEvent error(String error) {
        return LlmStreamEvent.builder().type(Type.ERROR).error(error).build();
    }
}
