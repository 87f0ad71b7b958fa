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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.LlmMessage;
import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.domain.model.LlmStreamEvent;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.LlmPort;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * LLM adapter for OpenAI-compatible streaming APIs ({@code /chat/completions}
 * with {@code stream=true}), using a reactive {@link WebClient}.
 *
 * <p>
 * Works with any server that speaks the OpenAI wire format (local inference
 * servers, proxies, hosted providers). The response is read as server-sent
 * events and assembled by {@link ChatCompletionChunkAssembler}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code warden.llm.base-url} - Base URL of the API (including
 * {@code /v1})
 * <li>{@code warden.llm.api-key} - Bearer token, optional for local servers
 * <li>{@code warden.llm.model} - Default model
 * <li>{@code warden.llm.connect-timeout} / {@code read-timeout} - in
 * milliseconds
 * </ul>
 */
@Component
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmPort {

    private static final int MAX_ERROR_BODY = 500;
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE = new ParameterizedTypeReference<>() {
    };

    private final WardenProperties properties;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public OpenAiCompatibleLlmAdapter(WardenProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        WardenProperties.LlmProperties llm = properties.getLlm();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) llm.getConnectTimeout())
                .responseTimeout(Duration.ofMillis(llm.getReadTimeout()));
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(llm.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024));
        if (llm.getApiKey() != null && !llm.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + llm.getApiKey());
        }
        this.webClient = builder.build();
        log.info("[LLM] OpenAI-compatible adapter for {}", llm.getBaseUrl());
    }

    @Override
    public Flux<LlmStreamEvent> chatStream(LlmRequest request) {
        return Flux.defer(() -> {
            ChatCompletionChunkAssembler assembler = new ChatCompletionChunkAssembler(objectMapper,
                    properties.getReasoning().getOpenMarker(), properties.getReasoning().getCloseMarker());
            ChatCompletionRequest body = buildRequest(request);
            log.debug("[LLM] Streaming {} messages to model {}", body.getMessages().size(), body.getModel());

            return webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(error -> new LlmException("HTTP " + response.statusCode().value() + ": "
                                    + truncate(error))))
                    .bodyToFlux(SSE_TYPE)
                    .mapNotNull(ServerSentEvent::data)
                    .takeWhile(data -> !ChatCompletionChunkAssembler.DONE.equals(data.trim()))
                    .concatMapIterable(assembler::accept)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(assembler.finish())))
                    .onErrorMap(error -> !(error instanceof LlmException),
                            error -> new LlmException("Model connection failed: " + error.getMessage(), error));
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String baseUrl = properties.getLlm().getBaseUrl();
        return baseUrl != null && !baseUrl.isBlank();
    }

    ChatCompletionRequest buildRequest(LlmRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : getCurrentModel());
        apiRequest.setTemperature(request.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens());
        apiRequest.setStream(true);
        apiRequest.setStreamOptions(Map.of("include_usage", true));

        apiRequest.setMessages(request.getMessages().stream()
                .map(this::toApiMessage)
                .toList());

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(tool -> {
                        ApiToolFunction function = new ApiToolFunction();
                        function.setName(tool.getName());
                        function.setDescription(tool.getDescription());
                        function.setParameters(tool.getInputSchema());
                        ApiTool apiTool = new ApiTool();
                        apiTool.setType("function");
                        apiTool.setFunction(function);
                        return apiTool;
                    })
                    .toList());
        }
        return apiRequest;
    }

    private ApiMessage toApiMessage(LlmMessage message) {
        ApiMessage apiMessage = new ApiMessage();
        apiMessage.setRole(message.getRole());
        apiMessage.setContent(message.getContent());
        if (message.hasToolCalls()) {
            if (message.getContent() != null && message.getContent().isBlank()) {
                apiMessage.setContent(null);
            }
            apiMessage.setToolCalls(message.getToolCalls().stream()
                    .map(call -> {
                        ApiFunction function = new ApiFunction();
                        function.setName(call.getName());
                        function.setArguments(toJson(call.getArguments()));
                        ApiToolCall apiCall = new ApiToolCall();
                        apiCall.setId(call.getId());
                        apiCall.setType("function");
                        apiCall.setFunction(function);
                        return apiCall;
                    })
                    .toList());
        }
        apiMessage.setToolCallId(message.getToolCallId());
        return apiMessage;
    }

    private String toJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private static String truncate(String text) {
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private boolean stream;
        @JsonProperty("stream_options")
        private Map<String, Object> streamOptions;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    static class ApiFunction {
        private String name;
        private String arguments;
    }
}
