package com.player.matching.metrics;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code player.match.duration} - Timer (tag: tier)</li>
 *   <li>{@code player.match.tier} - Counter (tag: tier)</li>
 *   <li>{@code player.match.issue} - Counter (tag: issue)</li>
 *   <li>{@code player.match.similarity} - DistributionSummary of fuzzy scores</li>
 *   <li>{@code player.match.batch.size} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary batchSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("player.match.similarity")
                .description("Distribution of combined name similarity for fuzzy matches")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("player.match.batch.size")
                .description("Number of event records per matching run")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(MatchTier tier, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(tier.name(), k ->
                Timer.builder("player.match.duration")
                        .description("Duration of single-record matching")
                        .tag("tier", tier.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTier(MatchTier tier) {
        counter("player.match.tier", "Number of event records per match tier", "tier", tier.name()).increment();
    }

    @Override
    public void incrementIssue(MatchIssue issue) {
        counter("player.match.issue", "Number of secondary issues detected", "issue", issue.getCode()).increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ':' + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
