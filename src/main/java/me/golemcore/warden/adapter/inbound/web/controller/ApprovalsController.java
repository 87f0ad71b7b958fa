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
import me.golemcore.warden.adapter.inbound.web.dto.ApprovalDecisionRequest;
import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalTicket;
import me.golemcore.warden.domain.model.PersistScope;
import me.golemcore.warden.domain.service.ApprovalCoordinator;
import me.golemcore.warden.domain.service.ApprovalResolutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Human decisions on pending tool calls.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalsController {

    private final ApprovalCoordinator approvalCoordinator;
    private final ApprovalResolutionService resolutionService;

    @GetMapping
    public Mono<ResponseEntity<List<ApprovalTicket>>> listPending() {
        return Mono.just(ResponseEntity.ok(approvalCoordinator.listPending()));
    }

    @GetMapping("/{ticketId}")
    public Mono<ResponseEntity<ApprovalTicket>> getTicket(@PathVariable String ticketId) {
        return Mono.just(ResponseEntity.ok(approvalCoordinator.get(ticketId)
                .orElseThrow(() -> new ApprovalCoordinator.TicketNotFoundException(ticketId))));
    }

    @PostMapping("/{ticketId}")
    public Mono<ResponseEntity<ApprovalTicket>> decide(@PathVariable String ticketId,
            @RequestBody ApprovalDecisionRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "decision is required");
        }
        ApprovalDecision decision = ApprovalDecision.parse(request.getDecision());
        PersistScope persistScope = PersistScope.parse(request.getPersistScope());
        return Mono.just(ResponseEntity.ok(resolutionService.decide(ticketId, decision, persistScope)));
    }
}
