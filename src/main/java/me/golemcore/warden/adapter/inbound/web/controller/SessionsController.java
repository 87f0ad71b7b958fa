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
import me.golemcore.warden.adapter.inbound.web.dto.RenameSessionRequest;
import me.golemcore.warden.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.warden.domain.model.ChatSession;
import me.golemcore.warden.domain.model.TokenUsage;
import me.golemcore.warden.domain.service.ExchangeRegistry;
import me.golemcore.warden.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Session browser and management endpoints.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final SessionPort sessionPort;
    private final ExchangeRegistry exchangeRegistry;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> dtos = sessionPort.listAll().stream()
                .map(this::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ChatSession>> getSession(@PathVariable String id) {
        ChatSession session = sessionPort.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found"));
        return Mono.just(ResponseEntity.ok(session));
    }

    @PatchMapping("/{id}")
    public Mono<ResponseEntity<SessionSummaryDto>> renameSession(@PathVariable String id,
            @RequestBody RenameSessionRequest request) {
        if (request == null || request.getTitle() == null || request.getTitle().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "title is required");
        }
        return Mono.just(ResponseEntity.ok(toSummary(sessionPort.rename(id, request.getTitle()))));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSession(@PathVariable String id) {
        if (exchangeRegistry.isActive(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Session has an active exchange");
        }
        sessionPort.delete(id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @DeleteMapping("/{id}/messages/{ordinal}/sources/{index}")
    public Mono<ResponseEntity<Void>> removeSource(@PathVariable String id, @PathVariable long ordinal,
            @PathVariable int index) {
        sessionPort.removeSource(id, ordinal, index);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private SessionSummaryDto toSummary(ChatSession session) {
        TokenUsage usage = session.getTokenUsage() != null ? session.getTokenUsage() : TokenUsage.empty();
        return SessionSummaryDto.builder()
                .id(session.getId())
                .title(session.getTitle())
                .preview(session.preview())
                .modelId(session.getModelId())
                .messageCount(session.getMessages() != null ? session.getMessages().size() : 0)
                .totalTokens(usage.getTotalTokens())
                .contextWindow(usage.getContextWindow())
                .contextUtilization(usage.getContextUtilization())
                .approachingLimit(usage.isApproachingLimit())
                .createdAt(session.getCreatedAt() != null ? session.getCreatedAt().toString() : null)
                .updatedAt(session.getUpdatedAt() != null ? session.getUpdatedAt().toString() : null)
                .active(exchangeRegistry.isActive(session.getId()))
                .build();
    }
}
