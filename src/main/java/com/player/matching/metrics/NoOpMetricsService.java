package com.player.matching.metrics;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchTier;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(MatchTier tier, Duration duration) {
    }

    @Override
    public void incrementTier(MatchTier tier) {
    }

    @Override
    public void incrementIssue(MatchIssue issue) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
