package me.golemcore.warden.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenUsageTest {

    @Test
    void utilizationFollowsTotalAgainstWindow() {
        TokenUsage usage = TokenUsage.empty();
        usage.applyContextWindow(1000);

        usage.add(TokenUsage.builder().inputTokens(600).outputTokens(100).build());
        assertEquals(0.7, usage.getContextUtilization(), 1e-9);
        assertFalse(usage.isApproachingLimit());

        usage.add(TokenUsage.builder().inputTokens(120).outputTokens(10).build());
        assertEquals(0.83, usage.getContextUtilization(), 1e-9);
        assertTrue(usage.isApproachingLimit());
        assertFalse(usage.isOverLimit());

        usage.add(TokenUsage.builder().totalTokens(200).build());
        assertTrue(usage.isOverLimit());
    }

    @Test
    void unknownWindowMeansNoUtilization() {
        TokenUsage usage = TokenUsage.builder().totalTokens(5000).build();

        usage.updateUtilization();

        assertEquals(0.0, usage.getContextUtilization());
        assertFalse(usage.isApproachingLimit());
    }

    @Test
    void shrinkingWindowRecomputesUtilization() {
        TokenUsage usage = TokenUsage.builder().totalTokens(4000).build();

        usage.applyContextWindow(8000);
        assertEquals(0.5, usage.getContextUtilization(), 1e-9);
        usage.applyContextWindow(4000);
        assertEquals(1.0, usage.getContextUtilization(), 1e-9);
        usage.applyContextWindow(-1);
        assertEquals(0, usage.getContextWindow());
        assertEquals(0.0, usage.getContextUtilization());
    }
}
