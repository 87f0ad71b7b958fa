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

package me.golemcore.warden.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.warden.domain.model.ExchangeEvent;
import me.golemcore.warden.domain.model.ExchangeRequest;
import me.golemcore.warden.domain.service.ExchangeOrchestrator;
import me.golemcore.warden.domain.service.ExchangeRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Map;

/**
 * Conversation endpoint. Each request streams one exchange as server-sent
 * events; closing the connection aborts it.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ExchangeOrchestrator orchestrator;
    private final ExchangeRegistry exchangeRegistry;

    @PostMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ExchangeEvent>> chat(@RequestBody ChatRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
        ExchangeRequest exchangeRequest = ExchangeRequest.builder()
                .message(request.getMessage())
                .attachments(request.getAttachments() != null
                        ? new ArrayList<>(request.getAttachments())
                        : new ArrayList<>())
                .sessionId(request.getSessionId())
                .model(request.getModel())
                .systemPrompt(request.getSystemPrompt())
                .build();
        return orchestrator.run(exchangeRequest)
                .map(event -> ServerSentEvent.builder(event)
                        .event(event.getType().getCode())
                        .build());
    }

    @PostMapping("/{sessionId}/abort")
    public Mono<ResponseEntity<Map<String, Object>>> abort(@PathVariable String sessionId) {
        if (!exchangeRegistry.abort(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No active exchange for session " + sessionId);
        }
        return Mono.just(ResponseEntity.ok(Map.of("sessionId", sessionId, "aborted", true)));
    }
}
