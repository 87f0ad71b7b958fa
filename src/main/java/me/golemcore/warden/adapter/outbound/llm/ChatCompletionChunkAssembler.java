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

package me.golemcore.warden.adapter.outbound.llm;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.LlmStreamEvent;
import me.golemcore.warden.domain.model.TokenUsage;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns the {@code data:} payloads of an OpenAI-compatible
 * {@code /chat/completions} stream into {@link LlmStreamEvent}s.
 *
 * <p>
 * Tool calls arrive as fragments keyed by index (id and name first, arguments
 * split over many chunks); they are assembled and emitted in index order once
 * the choice finishes. Providers that stream reasoning in a separate
 * {@code reasoning_content} field get it wrapped in the reasoning markers so
 * downstream parsing sees one text channel.
 *
 * <p>
 * One instance per response; not thread-safe.
 */
@Slf4j
class ChatCompletionChunkAssembler {

    static final String DONE = "[DONE]";

    private final ObjectMapper objectMapper;
    private final String openMarker;
    private final String closeMarker;
    private final Map<Integer, ToolCallBuilder> toolCalls = new TreeMap<>();
    private boolean inReasoning;
    private boolean finished;

    ChatCompletionChunkAssembler(ObjectMapper objectMapper, String openMarker, String closeMarker) {
        this.objectMapper = objectMapper;
        this.openMarker = openMarker;
        this.closeMarker = closeMarker;
    }

    /**
     * Consumes one SSE data payload.
     */
    List<LlmStreamEvent> accept(String data) {
        List<LlmStreamEvent> events = new ArrayList<>();
        if (data == null || data.isBlank()) {
            return events;
        }
        if (DONE.equals(data.trim())) {
            events.addAll(finish());
            return events;
        }

        JsonNode root;
        ChatCompletionChunk chunk;
        try {
            root = objectMapper.readTree(data);
            chunk = objectMapper.treeToValue(root, ChatCompletionChunk.class);
        } catch (JsonProcessingException e) {
            throw new LlmPort.LlmException("Malformed stream chunk: " + e.getOriginalMessage(), e);
        }

        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            JsonNode message = error.get("message");
            events.add(LlmStreamEvent.error(message != null ? message.asText() : error.toString()));
            return events;
        }

        if (chunk.getChoices() != null && !chunk.getChoices().isEmpty()) {
            ChunkChoice choice = chunk.getChoices().get(0);
            if (choice.getDelta() != null) {
                acceptDelta(choice.getDelta(), events);
            }
            if (choice.getFinishReason() != null) {
                events.addAll(finishChoice(choice.getFinishReason()));
            }
        }

        if (chunk.getUsage() != null) {
            events.add(LlmStreamEvent.usage(toTokenUsage(chunk.getUsage())));
        }
        return events;
    }

    /**
     * Flushes state at stream end: closes an open reasoning block and emits tool
     * calls the provider never finished explicitly.
     */
    List<LlmStreamEvent> finish() {
        List<LlmStreamEvent> events = new ArrayList<>();
        closeReasoning(events);
        if (!finished && !toolCalls.isEmpty()) {
            events.addAll(finishChoice("tool_calls"));
        }
        return events;
    }

    private void acceptDelta(ChunkDelta delta, List<LlmStreamEvent> events) {
        if (delta.getReasoningContent() != null && !delta.getReasoningContent().isEmpty()) {
            if (!inReasoning) {
                inReasoning = true;
                events.add(LlmStreamEvent.text(openMarker + delta.getReasoningContent()));
            } else {
                events.add(LlmStreamEvent.text(delta.getReasoningContent()));
            }
        }
        if (delta.getContent() != null && !delta.getContent().isEmpty()) {
            closeReasoning(events);
            events.add(LlmStreamEvent.text(delta.getContent()));
        }
        if (delta.getToolCalls() != null) {
            closeReasoning(events);
            for (ChunkToolCall fragment : delta.getToolCalls()) {
                ToolCallBuilder builder = toolCalls.computeIfAbsent(fragment.getIndex(), i -> new ToolCallBuilder());
                if (fragment.getId() != null) {
                    builder.id = fragment.getId();
                }
                if (fragment.getFunction() != null) {
                    if (fragment.getFunction().getName() != null) {
                        builder.name.append(fragment.getFunction().getName());
                    }
                    if (fragment.getFunction().getArguments() != null) {
                        builder.arguments.append(fragment.getFunction().getArguments());
                    }
                }
            }
        }
    }

    private List<LlmStreamEvent> finishChoice(String finishReason) {
        List<LlmStreamEvent> events = new ArrayList<>();
        closeReasoning(events);
        finished = true;
        if (toolCalls.isEmpty()) {
            events.add(LlmStreamEvent.complete(finishReason));
            return events;
        }
        for (ToolCallBuilder builder : toolCalls.values()) {
            events.add(LlmStreamEvent.toolCall(ToolCall.builder()
                    .id(builder.id)
                    .name(builder.name.toString())
                    .arguments(parseArguments(builder.name.toString(), builder.arguments.toString()))
                    .build()));
        }
        toolCalls.clear();
        events.add(LlmStreamEvent.toolResultNeeded());
        return events;
    }

    private void closeReasoning(List<LlmStreamEvent> events) {
        if (inReasoning) {
            inReasoning = false;
            events.add(LlmStreamEvent.text(closeMarker));
        }
    }

    private Map<String, Object> parseArguments(String toolName, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Unparseable arguments for tool {}: {}", toolName, e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    private static TokenUsage toTokenUsage(ChunkUsage usage) {
        return TokenUsage.builder()
                .inputTokens(usage.getPromptTokens())
                .outputTokens(usage.getCompletionTokens())
                .totalTokens(usage.getTotalTokens())
                .reasoningTokens(usage.getCompletionTokensDetails() != null
                        ? usage.getCompletionTokensDetails().getReasoningTokens()
                        : 0)
                .cacheTokens(usage.getPromptTokensDetails() != null
                        ? usage.getPromptTokensDetails().getCachedTokens()
                        : 0)
                .build();
    }

    private static final class ToolCallBuilder {
        private String id;
        private final StringBuilder name = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();
    }

    // Stream DTOs
    @Data
    static class ChatCompletionChunk {
        private String id;
        private String model;
        private List<ChunkChoice> choices;
        private ChunkUsage usage;
    }

    @Data
    static class ChunkChoice {
        private int index;
        private ChunkDelta delta;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    static class ChunkDelta {
        private String role;
        private String content;
        @JsonProperty("reasoning_content")
        private String reasoningContent;
        @JsonProperty("tool_calls")
        private List<ChunkToolCall> toolCalls;
    }

    @Data
    static class ChunkToolCall {
        private int index;
        private String id;
        private String type;
        private ChunkFunction function;
    }

    @Data
    static class ChunkFunction {
        private String name;
        private String arguments;
    }

    @Data
    static class ChunkUsage {
        @JsonProperty("prompt_tokens")
        private long promptTokens;
        @JsonProperty("completion_tokens")
        private long completionTokens;
        @JsonProperty("total_tokens")
        private long totalTokens;
        @JsonProperty("completion_tokens_details")
        private CompletionDetails completionTokensDetails;
        @JsonProperty("prompt_tokens_details")
        private PromptDetails promptTokensDetails;
    }

    @Data
    static class CompletionDetails {
        @JsonProperty("reasoning_tokens")
        private long reasoningTokens;
    }

    @Data
    static class PromptDetails {
        @JsonProperty("cached_tokens")
        private long cachedTokens;
    }
}
