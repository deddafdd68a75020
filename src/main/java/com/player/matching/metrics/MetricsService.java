package com.player.matching.metrics;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchTier;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so matching works without any
 * metrics registry.
 */
public interface MetricsService {

    void recordMatchDuration(MatchTier tier, Duration duration);

    void incrementTier(MatchTier tier);

    void incrementIssue(MatchIssue issue);

    void recordSimilarityScore(double score);

    void recordBatchSize(int size);
}
