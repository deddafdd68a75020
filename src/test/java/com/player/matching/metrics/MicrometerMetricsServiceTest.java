package com.player.matching.metrics;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchTier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
    }

    @Test
    @DisplayName("Should count tiers by tag")
    void testTierCounter() {
        metrics.incrementTier(MatchTier.EXACT);
        metrics.incrementTier(MatchTier.EXACT);
        metrics.incrementTier(MatchTier.NONE);

        assertEquals(2.0, registry.get("player.match.tier").tag("tier", "EXACT").counter().count());
        assertEquals(1.0, registry.get("player.match.tier").tag("tier", "NONE").counter().count());
    }

    @Test
    @DisplayName("Should count issues by code")
    void testIssueCounter() {
        metrics.incrementIssue(MatchIssue.DOB_MOB_SWAP);

        assertEquals(1.0, registry.get("player.match.issue").tag("issue", "dob-mob-swap").counter().count());
    }

    @Test
    @DisplayName("Should record durations, similarity and batch size")
    void testTimerAndSummaries() {
        metrics.recordMatchDuration(MatchTier.FUZZY, Duration.ofMillis(3));
        metrics.recordSimilarityScore(0.95);
        metrics.recordBatchSize(12);

        assertEquals(1, registry.get("player.match.duration").tag("tier", "FUZZY").timer().count());
        assertEquals(0.95, registry.get("player.match.similarity").summary().totalAmount(), 1e-9);
        assertEquals(12.0, registry.get("player.match.batch.size").summary().totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("No-op service accepts every call")
    void testNoOp() {
        MetricsService noOp = new NoOpMetricsService();
        assertDoesNotThrow(() -> {
            noOp.incrementTier(MatchTier.EXACT);
            noOp.incrementIssue(MatchIssue.SEX_MISMATCH);
            noOp.recordMatchDuration(MatchTier.EXACT, Duration.ZERO);
            noOp.recordSimilarityScore(0.9);
            noOp.recordBatchSize(1);
        });
    }
}
