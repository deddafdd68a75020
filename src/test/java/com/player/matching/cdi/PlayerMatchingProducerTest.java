package com.player.matching.cdi;

import com.player.matching.api.MatchingOptions;
import com.player.matching.api.PlayerMatcher;
import com.player.matching.bulk.CsvReportExporter;
import com.player.matching.bulk.DelimitedPlayerImporter;
import com.player.matching.metrics.MicrometerMetricsService;
import com.player.matching.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlayerMatchingProducerTest {

    @Mock
    Instance<MeterRegistry> meterRegistry;

    private PlayerMatchingProducer producer;

    @BeforeEach
    void setUp() {
        producer = new PlayerMatchingProducer();
    }

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void testDefaults() {
        MatchingOptions options = producer.matchingOptions();

        assertEquals(MatchingOptions.DEFAULT_FUZZY_THRESHOLD, options.getFuzzyThreshold());
        assertEquals(MatchingOptions.DEFAULT_ISSUE_PENALTY, options.getIssuePenalty());
    }

    @Test
    @DisplayName("Configured values are used")
    void testConfigured() {
        producer.fuzzyThreshold = 0.9;
        producer.issuePenalty = 0.1;

        MatchingOptions options = producer.matchingOptions();
        PlayerMatcher matcher = producer.playerMatcher(options);

        assertEquals(0.9, matcher.getDefaultOptions().getFuzzyThreshold());
        assertEquals(0.1, matcher.getDefaultOptions().getIssuePenalty());
    }

    @Test
    @DisplayName("Invalid configuration fails at startup")
    void testInvalid() {
        producer.fuzzyThreshold = 1.5;
        assertThrows(IllegalArgumentException.class, producer::matchingOptions);
    }

    @Test
    @DisplayName("Uses Micrometer when a registry is available")
    void testMetricsService() {
        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());

        when(meterRegistry.isResolvable()).thenReturn(true);
        when(meterRegistry.get()).thenReturn(new SimpleMeterRegistry());
        producer.meterRegistry = meterRegistry;

        assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());
    }

    @Test
    @DisplayName("Produces the default importer and exporter")
    void testBulkProducers() {
        assertInstanceOf(DelimitedPlayerImporter.class, producer.playerImporter());
        assertInstanceOf(CsvReportExporter.class, producer.reportExporter());
    }
}
