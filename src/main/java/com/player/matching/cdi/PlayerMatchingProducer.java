package com.player.matching.cdi;

import com.player.matching.api.MatchingOptions;
import com.player.matching.api.PlayerMatcher;
import com.player.matching.bulk.CsvReportExporter;
import com.player.matching.bulk.DelimitedPlayerImporter;
import com.player.matching.bulk.PlayerImporter;
import com.player.matching.bulk.ReportExporter;
import com.player.matching.metrics.MetricsService;
import com.player.matching.metrics.MicrometerMetricsService;
import com.player.matching.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the player matcher from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * player-matching:
 *   fuzzy-threshold: 0.85
 *   issue-penalty: 0.05
 * </pre>
 *
 * <p>Invalid values fail at startup, before any matching. Outside a CDI container the
 * producer can be instantiated directly and its fields set by hand.</p>
 */
@ApplicationScoped
public class PlayerMatchingProducer {

    private static final Logger log = LoggerFactory.getLogger(PlayerMatchingProducer.class);

    @Inject
    @ConfigProperty(name = "player-matching.fuzzy-threshold", defaultValue = "0.85")
    double fuzzyThreshold = MatchingOptions.DEFAULT_FUZZY_THRESHOLD;

    @Inject
    @ConfigProperty(name = "player-matching.issue-penalty", defaultValue = "0.05")
    double issuePenalty = MatchingOptions.DEFAULT_ISSUE_PENALTY;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Produces
    public MatchingOptions matchingOptions() {
        MatchingOptions options = MatchingOptions.builder()
                .fuzzyThreshold(fuzzyThreshold)
                .issuePenalty(issuePenalty)
                .build();
        log.info("config.loaded options={}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public PlayerMatcher playerMatcher(MatchingOptions options) {
        return new PlayerMatcher(options, metricsService());
    }

    @Produces
    @ApplicationScoped
    public PlayerImporter playerImporter() {
        return new DelimitedPlayerImporter();
    }

    @Produces
    @ApplicationScoped
    public ReportExporter reportExporter() {
        return new CsvReportExporter();
    }

    MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("metrics.enabled registry={}", meterRegistry.get().getClass().getSimpleName());
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}
