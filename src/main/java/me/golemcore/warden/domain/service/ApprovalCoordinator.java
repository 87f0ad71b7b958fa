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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalState;
import me.golemcore.warden.domain.model.ApprovalTicket;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Tracks approval tickets and routes human decisions back to the suspended
 * tool call that opened them.
 *
 * <p>
 * Each ticket is backed by one {@link CompletableFuture}. Completing that
 * future is the single terminal transition: whichever of resolve, supersede or
 * expiry gets there first wins, and every later attempt sees the ticket as
 * already resolved. Decisions are looked up by ticket id, so tickets opened
 * together may be decided in any order.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Pending tickets expire as Rejected after
 * {@code warden.approvals.timeout-minutes}
 * <li>Waiters get a dependent copy of the future, so a cancelled waiter never
 * changes the ticket state
 * <li>Resolved tickets are kept for an hour to answer duplicate decisions
 * </ul>
 */
@Service
@Slf4j
public class ApprovalCoordinator {

    static final String REASON_SUPERSEDED = "superseded";
    static final String REASON_TIMED_OUT = "timed out";
    private static final Duration RESOLVED_RETENTION = Duration.ofHours(1);

    private final Map<String, TicketEntry> tickets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration timeout;
    private final ScheduledThreadPoolExecutor scheduler;

    @Autowired
    public ApprovalCoordinator(WardenProperties properties, Clock clock) {
        this(Duration.ofMinutes(properties.getApprovals().getTimeoutMinutes()), clock);
    }

    ApprovalCoordinator(Duration timeout, Clock clock) {
        this.timeout = timeout;
        this.clock = clock;
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "approval-timeouts");
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.scheduler.scheduleAtFixedRate(this::purgeResolved, 5, 5, TimeUnit.MINUTES);
        log.info("[Approval] Ticket timeout: {}", timeout);
    }

    @PreDestroy
    public void destroy() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Registers a new pending ticket.
     *
     * @param request
     *            ticket fields; id, state and timestamps are assigned here
     * @return the pending ticket and a future completing with its terminal
     *         snapshot
     */
    public ApprovalHandle openTicket(ApprovalTicket request) {
        String ticketId = UUID.randomUUID().toString();
        ApprovalTicket pendingView = request.toBuilder()
                .id(ticketId)
                .state(ApprovalState.PENDING)
                .reason(null)
                .createdAt(clock.instant())
                .resolvedAt(null)
                .build();
        TicketEntry entry = new TicketEntry(pendingView, new CompletableFuture<>());
        tickets.put(ticketId, entry);
        ScheduledFuture<?> expiry = scheduler.schedule(() -> expire(ticketId), timeout.toMillis(),
                TimeUnit.MILLISECONDS);
        entry.outcome().whenComplete((terminal, error) -> expiry.cancel(false));

        log.info("[Approval] Opened ticket {} for {} (exchange {})", ticketId, request.getToolName(),
                request.getExchangeId());
        return new ApprovalHandle(pendingView, entry.outcome().copy());
    }

    /**
     * Applies a human decision to exactly one pending ticket.
     *
     * @throws TicketNotFoundException
     *             when no ticket has this id
     * @throws TicketAlreadyResolvedException
     *             when the ticket already reached a terminal state
     */
    public ApprovalTicket resolve(String ticketId, ApprovalDecision decision) {
        TicketEntry entry = tickets.get(ticketId);
        if (entry == null) {
            throw new TicketNotFoundException(ticketId);
        }
        ApprovalState target = decision == ApprovalDecision.APPROVE ? ApprovalState.APPROVED : ApprovalState.REJECTED;
        String reason = decision == ApprovalDecision.APPROVE ? "approved by user" : "rejected by user";
        if (!transition(entry, target, reason)) {
            ApprovalTicket current = entry.view();
            log.warn("[Approval] Duplicate decision {} for ticket {} already {}", decision, ticketId,
                    current.getState());
            throw new TicketAlreadyResolvedException(ticketId, current.getState());
        }
        log.info("[Approval] Ticket {} {}", ticketId, target);
        return entry.view();
    }

    /**
     * Forces a pending ticket to {@link ApprovalState#SUPERSEDED} and unblocks
     * its waiter. A ticket that is already terminal keeps its state.
     */
    public ApprovalTicket supersede(String ticketId) {
        TicketEntry entry = tickets.get(ticketId);
        if (entry == null) {
            throw new TicketNotFoundException(ticketId);
        }
        if (transition(entry, ApprovalState.SUPERSEDED, REASON_SUPERSEDED)) {
            log.info("[Approval] Ticket {} superseded", ticketId);
        }
        return entry.view();
    }

    /**
     * Supersedes every pending ticket opened by the exchange.
     *
     * @return number of tickets that were still pending
     */
    public int supersedeExchange(String exchangeId) {
        int superseded = 0;
        for (TicketEntry entry : tickets.values()) {
            if (exchangeId.equals(entry.pendingView().getExchangeId())
                    && transition(entry, ApprovalState.SUPERSEDED, REASON_SUPERSEDED)) {
                superseded++;
            }
        }
        if (superseded > 0) {
            log.info("[Approval] Superseded {} pending tickets of exchange {}", superseded, exchangeId);
        }
        return superseded;
    }

    public Optional<ApprovalTicket> get(String ticketId) {
        TicketEntry entry = tickets.get(ticketId);
        return entry == null ? Optional.empty() : Optional.of(entry.view());
    }

    public List<ApprovalTicket> listPending() {
        return tickets.values().stream()
                .filter(entry -> !entry.outcome().isDone())
                .map(TicketEntry::pendingView)
                .sorted(Comparator.comparing(ApprovalTicket::getCreatedAt))
                .toList();
    }

    /**
     * Timers still queued: one per pending ticket plus the purge task.
     */
    int scheduledTaskCount() {
        return scheduler.getQueue().size();
    }

    void expire(String ticketId) {
        TicketEntry entry = tickets.get(ticketId);
        if (entry != null && transition(entry, ApprovalState.REJECTED, REASON_TIMED_OUT)) {
            log.info("[Approval] Ticket {} timed out, rejecting", ticketId);
        }
    }

    private boolean transition(TicketEntry entry, ApprovalState state, String reason) {
        if (entry.outcome().isDone()) {
            return false;
        }
        ApprovalTicket terminal = entry.pendingView().toBuilder()
                .state(state)
                .reason(reason)
                .resolvedAt(clock.instant())
                .build();
        return entry.outcome().complete(terminal);
    }

    private void purgeResolved() {
        Instant cutoff = clock.instant().minus(RESOLVED_RETENTION);
        tickets.entrySet().removeIf(e -> {
            CompletableFuture<ApprovalTicket> outcome = e.getValue().outcome();
            return outcome.isDone() && outcome.join().getResolvedAt().isBefore(cutoff);
        });
    }

    /**
     * Pending ticket plus the future the tool call waits on.
     */
    public record ApprovalHandle(ApprovalTicket ticket, CompletableFuture<ApprovalTicket> decision) {
    }

    private record TicketEntry(ApprovalTicket pendingView, CompletableFuture<ApprovalTicket> outcome) {

        ApprovalTicket view() {
            return outcome.isDone() ? outcome.join() : pendingView;
        }
    }

    public static class TicketNotFoundException extends NoSuchElementException {

        private static final long serialVersionUID = 1L;

        public TicketNotFoundException(String ticketId) {
            super("Approval ticket not found: " + ticketId);
        }
    }

    public static class TicketAlreadyResolvedException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        private final ApprovalState state;

        public TicketAlreadyResolvedException(String ticketId, ApprovalState state) {
            super("Approval ticket " + ticketId + " is already " + state.name().toLowerCase(Locale.ROOT));
            this.state = state;
        }

        public ApprovalState getState() {
            return state;
        }
    }
}
