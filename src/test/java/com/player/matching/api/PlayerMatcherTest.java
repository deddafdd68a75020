package com.player.matching.api;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchResult;
import com.player.matching.core.model.MatchTier;
import com.player.matching.core.model.PlayerRecord;
import com.player.matching.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PlayerMatcherTest {

    private static final PlayerRecord REFERENCE = PlayerRecord.builder()
            .externalId("R1")
            .lastName("Müller")
            .firstName("Jan")
            .sex("M")
            .association("GER")
            .birthDate(12, 5, 1990)
            .build();

    private PlayerMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new PlayerMatcher();
    }

    private static PlayerRecord event(String last, String first) {
        return REFERENCE.toBuilder().externalId("E1").lastName(last).firstName(first).build();
    }

    @Nested
    @DisplayName("Single record")
    class SingleRecord {

        @Test
        @DisplayName("Identical record is an exact match with full confidence")
        void testExact() {
            MatchResult result = matcher.match(event("Müller", "Jan"), List.of(REFERENCE), 0.85);

            assertEquals(MatchTier.EXACT, result.tier());
            assertSame(REFERENCE, result.referenceRecord());
            assertEquals(1.0, result.confidence(), 1e-9);
            assertTrue(result.issues().isEmpty());
        }

        @Test
        @DisplayName("Missing diacritic is a fuzzy match")
        void testDiacriticFuzzy() {
            MatchResult result = matcher.match(event("Muller", "Jan"), List.of(REFERENCE), 0.85);

            assertEquals(MatchTier.FUZZY, result.tier());
            assertEquals(0.95, result.confidence(), 1e-9);
            assertTrue(result.issues().isEmpty());
        }

        @Test
        @DisplayName("Swapped names match at 0.9")
        void testNameSwap() {
            MatchResult result = matcher.match(event("Jan", "Müller"), List.of(REFERENCE), 0.85);

            assertEquals(MatchTier.NAME_SWAP, result.tier());
            assertEquals(0.9, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Sex mismatch costs one penalty")
        void testSexMismatch() {
            PlayerRecord event = REFERENCE.toBuilder().externalId("E1").sex("W").build();

            MatchResult result = matcher.match(event, List.of(REFERENCE), 0.85);

            assertEquals(MatchTier.EXACT, result.tier());
            assertEquals(List.of(MatchIssue.SEX_MISMATCH), result.issues());
            assertEquals(0.95, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Transposed day and month are flagged")
        void testDobMobSwap() {
            PlayerRecord event = REFERENCE.toBuilder().externalId("E1").dayOfBirth(5).monthOfBirth(12).build();

            MatchResult result = matcher.match(event, List.of(REFERENCE), 0.85);

            assertEquals(List.of(MatchIssue.DOB_MOB_SWAP), result.issues());
            assertEquals(0.95, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Unrelated name yields no match with zero confidence")
        void testNoMatch() {
            MatchResult result = matcher.match(event("Smith", "John"), List.of(REFERENCE), 0.85);

            assertEquals(MatchTier.NONE, result.tier());
            assertNull(result.referenceRecord());
            assertEquals(0.0, result.confidence());
            assertTrue(result.issues().isEmpty());
        }

        @Test
        @DisplayName("Threshold outside [0, 1] fails before matching")
        void testInvalidThreshold() {
            assertThrows(IllegalArgumentException.class,
                    () -> matcher.match(event("Müller", "Jan"), List.of(REFERENCE), 1.5));
            assertThrows(IllegalArgumentException.class,
                    () -> matcher.matchAll(List.of(), List.of(REFERENCE), -0.5));
        }

        @Test
        @DisplayName("Default options threshold is used when none is given")
        void testDefaultOptions() {
            PlayerMatcher strict = new PlayerMatcher(MatchingOptions.withFuzzyThreshold(0.96));

            assertEquals(MatchTier.NONE, strict.match(event("Muller", "Jan"), List.of(REFERENCE)).tier());
            assertEquals(MatchTier.FUZZY, matcher.match(event("Muller", "Jan"), List.of(REFERENCE)).tier());
        }
    }

    @Nested
    @DisplayName("Batch")
    class Batch {

        @Test
        @DisplayName("Results follow event order, one per event")
        void testOrder() {
            List<PlayerRecord> events = List.of(
                    event("Smith", "John"),
                    event("Müller", "Jan"),
                    event("Jan", "Müller"),
                    event("Muller", "Jan"));

            List<MatchResult> results = matcher.matchAll(events, List.of(REFERENCE), 0.85);

            assertEquals(events.size(), results.size());
            for (int i = 0; i < events.size(); i++) {
                assertSame(events.get(i), results.get(i).eventRecord());
            }
            assertEquals(List.of(MatchTier.NONE, MatchTier.EXACT, MatchTier.NAME_SWAP, MatchTier.FUZZY),
                    results.stream().map(MatchResult::tier).toList());
        }

        @Test
        @DisplayName("Matching is deterministic and does not modify inputs")
        void testDeterministic() {
            List<PlayerRecord> events = new ArrayList<>(List.of(event("Muller", "Jan"), event("Jan", "Müller")));
            List<PlayerRecord> references = new ArrayList<>(List.of(REFERENCE,
                    REFERENCE.toBuilder().externalId("R2").build()));
            List<PlayerRecord> eventsCopy = List.copyOf(events);
            List<PlayerRecord> referencesCopy = List.copyOf(references);

            List<MatchResult> first = matcher.matchAll(events, references, 0.85);
            List<MatchResult> second = matcher.matchAll(events, references, 0.85);

            assertEquals(first, second);
            assertEquals(eventsCopy, events);
            assertEquals(referencesCopy, references);
        }

        @Test
        @DisplayName("Empty event list yields an empty result")
        void testEmpty() {
            assertTrue(matcher.matchAll(List.of(), List.of(REFERENCE), 0.85).isEmpty());
        }

        @Test
        @DisplayName("Returned list is immutable")
        void testImmutable() {
            List<MatchResult> results = matcher.matchAll(List.of(event("Müller", "Jan")), List.of(REFERENCE));
            assertThrows(UnsupportedOperationException.class, results::clear);
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Mock
        MetricsService metricsService;

        @Test
        @DisplayName("Should record tier, issues and batch size")
        void testMetricsRecorded() {
            PlayerMatcher instrumented = new PlayerMatcher(MatchingOptions.defaults(), metricsService);
            PlayerRecord sexMismatch = REFERENCE.toBuilder().externalId("E2").sex("W").build();

            instrumented.matchAll(List.of(event("Müller", "Jan"), sexMismatch, event("Smith", "John")),
                    List.of(REFERENCE));

            verify(metricsService, times(2)).incrementTier(MatchTier.EXACT);
            verify(metricsService).incrementTier(MatchTier.NONE);
            verify(metricsService).incrementIssue(MatchIssue.SEX_MISMATCH);
            verify(metricsService, times(3)).recordMatchDuration(any(MatchTier.class), any(Duration.class));
            verify(metricsService).recordBatchSize(3);
            verify(metricsService, never()).recordSimilarityScore(anyDouble());
        }

        @Test
        @DisplayName("Should record similarity for fuzzy matches")
        void testSimilarityRecorded() {
            PlayerMatcher instrumented = new PlayerMatcher(MatchingOptions.defaults(), metricsService);

            instrumented.match(event("Muller", "Jan"), List.of(REFERENCE));

            verify(metricsService).incrementTier(MatchTier.FUZZY);
            verify(metricsService).recordSimilarityScore(anyDouble());
            verify(metricsService).recordMatchDuration(eq(MatchTier.FUZZY), any(Duration.class));
        }
    }
}
