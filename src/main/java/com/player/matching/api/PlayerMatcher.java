package com.player.matching.api;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchOutcome;
import com.player.matching.core.model.MatchResult;
import com.player.matching.core.model.MatchTier;
import com.player.matching.core.model.PlayerRecord;
import com.player.matching.decision.ConfidenceScorer;
import com.player.matching.logging.LogContext;
import com.player.matching.matching.FieldComparators;
import com.player.matching.matching.MatchingEngine;
import com.player.matching.metrics.MetricsService;
import com.player.matching.metrics.NoOpMetricsService;
import com.player.matching.report.MatchSummary;
import com.player.matching.rules.NormalizedPlayer;
import com.player.matching.rules.PlayerNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for reconciling event records against a reference roster.
 *
 * <p>Matching is a pure function of its inputs: the same records and options always give
 * the same ordered results. Neither the event list nor the reference set is modified, and
 * reference-set order is significant for tie-breaking.</p>
 *
 * <pre>
 * PlayerMatcher matcher = new PlayerMatcher();
 * List&lt;MatchResult&gt; results = matcher.matchAll(eventRecords, referenceSet, 0.85);
 * </pre>
 */
public class PlayerMatcher {
    private static final Logger log = LoggerFactory.getLogger(PlayerMatcher.class);

    private final PlayerNormalizer normalizer;
    private final MatchingEngine engine;
    private final MetricsService metricsService;
    private final MatchingOptions defaultOptions;

    public PlayerMatcher() {
        this(MatchingOptions.defaults());
    }

    public PlayerMatcher(MatchingOptions defaultOptions) {
        this(defaultOptions, new NoOpMetricsService());
    }

    public PlayerMatcher(MatchingOptions defaultOptions, MetricsService metricsService) {
        this(new PlayerNormalizer(), defaultOptions, metricsService);
    }

    public PlayerMatcher(PlayerNormalizer normalizer, MatchingOptions defaultOptions,
                         MetricsService metricsService) {
        this(normalizer, new MatchingEngine(normalizer, new FieldComparators()),
                defaultOptions, metricsService);
    }

    public PlayerMatcher(PlayerNormalizer normalizer, MatchingEngine engine,
                         MatchingOptions defaultOptions, MetricsService metricsService) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Matches one event record with the default issue penalty.
     *
     * @throws IllegalArgumentException if {@code fuzzyThreshold} is outside [0.0, 1.0]
     */
    public MatchResult match(PlayerRecord eventRecord, List<PlayerRecord> referenceSet, double fuzzyThreshold) {
        return match(eventRecord, referenceSet, defaultOptions.toBuilder().fuzzyThreshold(fuzzyThreshold).build());
    }

    public MatchResult match(PlayerRecord eventRecord, List<PlayerRecord> referenceSet) {
        return match(eventRecord, referenceSet, defaultOptions);
    }

    public MatchResult match(PlayerRecord eventRecord, List<PlayerRecord> referenceSet, MatchingOptions options) {
        Objects.requireNonNull(eventRecord, "eventRecord is required");
        Objects.requireNonNull(referenceSet, "referenceSet is required");
        Objects.requireNonNull(options, "options is required");

        List<NormalizedPlayer> normalizedReferences = normalizer.normalizeAll(referenceSet);
        return matchOne(eventRecord, normalizedReferences, options, new ConfidenceScorer(options.getIssuePenalty()));
    }

    /**
     * Matches every event record, returning results in event-record order.
     *
     * @throws IllegalArgumentException if {@code fuzzyThreshold} is outside [0.0, 1.0]
     */
    public List<MatchResult> matchAll(List<PlayerRecord> eventRecords, List<PlayerRecord> referenceSet,
                                      double fuzzyThreshold) {
        return matchAll(eventRecords, referenceSet,
                defaultOptions.toBuilder().fuzzyThreshold(fuzzyThreshold).build());
    }

    public List<MatchResult> matchAll(List<PlayerRecord> eventRecords, List<PlayerRecord> referenceSet) {
        return matchAll(eventRecords, referenceSet, defaultOptions);
    }

    public List<MatchResult> matchAll(List<PlayerRecord> eventRecords, List<PlayerRecord> referenceSet,
                                      MatchingOptions options) {
        Objects.requireNonNull(eventRecords, "eventRecords is required");
        Objects.requireNonNull(referenceSet, "referenceSet is required");
        Objects.requireNonNull(options, "options is required");

        try (LogContext ctx = LogContext.forMatchRun(LogContext.generateCorrelationId())) {
            long start = System.nanoTime();
            log.info("match.started events={} references={} options={}",
                    eventRecords.size(), referenceSet.size(), options);

            List<NormalizedPlayer> normalizedReferences = normalizer.normalizeAll(referenceSet);
            ConfidenceScorer scorer = new ConfidenceScorer(options.getIssuePenalty());

            List<MatchResult> results = new ArrayList<>(eventRecords.size());
            for (PlayerRecord eventRecord : eventRecords) {
                results.add(matchOne(eventRecord, normalizedReferences, options, scorer));
            }
            metricsService.recordBatchSize(eventRecords.size());

            long durationMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
            MatchSummary summary = MatchSummary.from(results);
            log.info("match.completed summary={} durationMs={}", summary, durationMs);
            return List.copyOf(results);
        }
    }

    public MatchingOptions getDefaultOptions() {
        return defaultOptions;
    }

    private MatchResult matchOne(PlayerRecord eventRecord, List<NormalizedPlayer> normalizedReferences,
                                 MatchingOptions options, ConfidenceScorer scorer) {
        Objects.requireNonNull(eventRecord, "eventRecord is required");
        try (LogContext ctx = LogContext.forRecord(LogContext.generateCorrelationId(), eventRecord.externalId())) {
            long start = System.nanoTime();
            MatchOutcome outcome = engine.matchNormalized(eventRecord, normalizedReferences,
                    options.getFuzzyThreshold());
            MatchResult result = scorer.score(outcome);
            recordMetrics(result, Duration.ofNanos(System.nanoTime() - start));
            return result;
        }
    }

    private void recordMetrics(MatchResult result, Duration duration) {
        metricsService.recordMatchDuration(result.tier(), duration);
        metricsService.incrementTier(result.tier());
        if (result.tier() == MatchTier.FUZZY) {
            metricsService.recordSimilarityScore(result.outcome().similarity());
        }
        for (MatchIssue issue : result.issues()) {
            metricsService.incrementIssue(issue);
        }
    }
}
