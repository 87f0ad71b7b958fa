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

package me.golemcore.warden.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalTicket;
import me.golemcore.warden.domain.model.PermissionRule;
import me.golemcore.warden.domain.model.PersistScope;
import me.golemcore.warden.port.outbound.PermissionPolicyPort;
import org.springframework.stereotype.Service;

/**
 * Applies a human decision arriving out of band: resolves the ticket and,
 * when asked to remember it, records an "always" or "never" rule for the tool
 * or its scope.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalResolutionService {

    private final ApprovalCoordinator approvalCoordinator;
    private final PermissionPolicyPort permissionPolicy;

    /**
     * The ticket is resolved before any rule is written, so a duplicate or late
     * decision never changes the policy.
     */
    public ApprovalTicket decide(String ticketId, ApprovalDecision decision, PersistScope persistScope) {
        if (persistScope == PersistScope.SCOPE) {
            ApprovalTicket pending = approvalCoordinator.get(ticketId)
                    .orElseThrow(() -> new ApprovalCoordinator.TicketNotFoundException(ticketId));
            if (pending.getScopeHint() == null || pending.getScopeHint().isBlank()) {
                throw new IllegalArgumentException("Tool " + pending.getToolName() + " has no scope to remember");
            }
        }
        ApprovalTicket resolved = approvalCoordinator.resolve(ticketId, decision);
        if (persistScope != null) {
            String subject = subjectFor(resolved, persistScope);
            PermissionRule rule = decision == ApprovalDecision.APPROVE
                    ? PermissionRule.allow(subject)
                    : PermissionRule.deny(subject);
            permissionPolicy.addRule(rule);
            log.info("[Approval] Remembered {} for {}", rule.getEffect(), subject);
        }
        return resolved;
    }

    private static String subjectFor(ApprovalTicket ticket, PersistScope persistScope) {
        return persistScope == PersistScope.SCOPE
                ? PermissionRule.subjectOf(ticket.getToolName(), ticket.getScopeHint())
                : ticket.getToolName();
    }
}
