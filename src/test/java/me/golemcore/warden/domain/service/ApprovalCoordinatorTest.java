package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalState;
import me.golemcore.warden.domain.model.ApprovalTicket;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalCoordinatorTest {

    private static final String EXCHANGE_ID = "exchange-1";

    private ApprovalCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new ApprovalCoordinator(Duration.ofMinutes(10), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        coordinator.destroy();
    }

    private ApprovalCoordinator.ApprovalHandle open(String exchangeId, String toolName) {
        return coordinator.openTicket(ApprovalTicket.builder()
                .exchangeId(exchangeId)
                .sessionId("session-1")
                .toolCallId("call_1")
                .toolName(toolName)
                .arguments(Map.of("command", "ls"))
                .description("Run command: ls")
                .scopeHint("ls")
                .build());
    }

    @Test
    void openedTicketIsPendingAndListed() {
        ApprovalCoordinator.ApprovalHandle handle = open(EXCHANGE_ID, "bash");

        assertEquals(ApprovalState.PENDING, handle.ticket().getState());
        assertNotNull(handle.ticket().getId());
        assertNotNull(handle.ticket().getCreatedAt());
        assertFalse(handle.decision().isDone());
        assertEquals(List.of(handle.ticket().getId()),
                coordinator.listPending().stream().map(ApprovalTicket::getId).toList());
    }

    @Test
    void resolvedTicketsDropTheirExpiryTimers() {
        int baseline = coordinator.scheduledTaskCount();
        List<ApprovalCoordinator.ApprovalHandle> handles = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            handles.add(open(EXCHANGE_ID + "-" + i, "bash"));
        }
        assertEquals(baseline + 100, coordinator.scheduledTaskCount());

        for (int i = 0; i < handles.size(); i++) {
            String ticketId = handles.get(i).ticket().getId();
            if (i % 2 == 0) {
                coordinator.resolve(ticketId, ApprovalDecision.APPROVE);
            } else {
                coordinator.supersede(ticketId);
            }
        }

        assertEquals(baseline, coordinator.scheduledTaskCount());
    }

    @Test
    void approveCompletesWaiter() throws Exception {
        ApprovalCoordinator.ApprovalHandle handle = open(EXCHANGE_ID, "bash");

        ApprovalTicket resolved = coordinator.resolve(handle.ticket().getId(), ApprovalDecision.APPROVE);

        assertEquals(ApprovalState.APPROVED, resolved.getState());
        assertEquals(ApprovalState.APPROVED, handle.decision().get(1, TimeUnit.SECONDS).getState());
        assertTrue(coordinator.listPending().isEmpty());
    }

    @Test
    void secondDecisionIsRejectedAndKeepsFirstOutcome() {
        ApprovalCoordinator.ApprovalHandle handle = open(EXCHANGE_ID, "bash");
        String ticketId = handle.ticket().getId();
        coordinator.resolve(ticketId, ApprovalDecision.REJECT);

        ApprovalCoordinator.TicketAlreadyResolvedException ex = assertThrows(
                ApprovalCoordinator.TicketAlreadyResolvedException.class,
                () -> coordinator.resolve(ticketId, ApprovalDecision.APPROVE));

        assertEquals(ApprovalState.REJECTED, ex.getState());
        assertEquals(ApprovalState.REJECTED, coordinator.get(ticketId).orElseThrow().getState());
    }

    @Test
    void unknownTicketThrowsNotFound() {
        assertThrows(ApprovalCoordinator.TicketNotFoundException.class,
                () -> coordinator.resolve("missing", ApprovalDecision.APPROVE));
        assertTrue(coordinator.get("missing").isEmpty());
    }

    @Test
    void concurrentDecisionsProduceExactlyOneTransition() throws Exception {
        ApprovalCoordinator.ApprovalHandle handle = open(EXCHANGE_ID, "bash");
        String ticketId = handle.ticket().getId();
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger losers = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < threads; i++) {
                ApprovalDecision decision = i % 2 == 0 ? ApprovalDecision.APPROVE : ApprovalDecision.REJECT;
                executor.submit(() -> {
                    start.await();
                    try {
                        coordinator.resolve(ticketId, decision);
                        winners.incrementAndGet();
                    } catch (ApprovalCoordinator.TicketAlreadyResolvedException e) {
                        losers.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, winners.get());
        assertEquals(threads - 1, losers.get());
        assertTrue(handle.decision().isDone());
    }

    @Test
    void decisionsRouteByTicketIdInAnyOrder() throws Exception {
        ApprovalCoordinator.ApprovalHandle first = open(EXCHANGE_ID, "write_file");
        ApprovalCoordinator.ApprovalHandle second = open(EXCHANGE_ID, "bash");

        coordinator.resolve(second.ticket().getId(), ApprovalDecision.APPROVE);

        assertFalse(first.decision().isDone());
        assertEquals(ApprovalState.APPROVED, second.decision().get(1, TimeUnit.SECONDS).getState());

        coordinator.resolve(first.ticket().getId(), ApprovalDecision.REJECT);
        assertEquals(ApprovalState.REJECTED, first.decision().get(1, TimeUnit.SECONDS).getState());
    }

    @Test
    void supersedeExchangeOnlyTouchesItsOwnPendingTickets() {
        ApprovalCoordinator.ApprovalHandle pending = open(EXCHANGE_ID, "bash");
        ApprovalCoordinator.ApprovalHandle approved = open(EXCHANGE_ID, "grep");
        ApprovalCoordinator.ApprovalHandle other = open("exchange-2", "bash");
        coordinator.resolve(approved.ticket().getId(), ApprovalDecision.APPROVE);

        assertEquals(1, coordinator.supersedeExchange(EXCHANGE_ID));

        assertEquals(ApprovalState.SUPERSEDED, pending.decision().join().getState());
        assertEquals(ApprovalCoordinator.REASON_SUPERSEDED, pending.decision().join().getReason());
        assertEquals(ApprovalState.APPROVED, coordinator.get(approved.ticket().getId()).orElseThrow().getState());
        assertFalse(other.decision().isDone());
    }

    @Test
    void lateDecisionAfterSupersedeFails() {
        ApprovalCoordinator.ApprovalHandle handle = open(EXCHANGE_ID, "bash");
        coordinator.supersede(handle.ticket().getId());

        assertThrows(ApprovalCoordinator.TicketAlreadyResolvedException.class,
                () -> coordinator.resolve(handle.ticket().getId(), ApprovalDecision.APPROVE));
    }

    @Test
    void expireRejectsPendingTicket() {
        ApprovalCoordinator.ApprovalHandle handle = open(EXCHANGE_ID, "bash");

        coordinator.expire(handle.ticket().getId());

        ApprovalTicket outcome = handle.decision().join();
        assertEquals(ApprovalState.REJECTED, outcome.getState());
        assertEquals(ApprovalCoordinator.REASON_TIMED_OUT, outcome.getReason());
    }

    @Test
    void pendingTicketTimesOutOnSchedule() throws Exception {
        ApprovalCoordinator shortLived = new ApprovalCoordinator(Duration.ofMillis(50), Clock.systemUTC());
        try {
            ApprovalCoordinator.ApprovalHandle handle = shortLived.openTicket(ApprovalTicket.builder()
                    .exchangeId(EXCHANGE_ID)
                    .toolName("bash")
                    .build());

            ApprovalTicket outcome = handle.decision().get(5, TimeUnit.SECONDS);

            assertEquals(ApprovalState.REJECTED, outcome.getState());
        } finally {
            shortLived.destroy();
        }
    }

    @Test
    void cancellingWaiterDoesNotResolveTicket() {
        ApprovalCoordinator.ApprovalHandle handle = open(EXCHANGE_ID, "bash");

        handle.decision().cancel(true);

        assertEquals(ApprovalState.PENDING, coordinator.get(handle.ticket().getId()).orElseThrow().getState());
        assertEquals(ApprovalState.APPROVED,
                coordinator.resolve(handle.ticket().getId(), ApprovalDecision.APPROVE).getState());
    }
}
