package com.player.matching.decision;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchOutcome;
import com.player.matching.core.model.MatchResult;
import com.player.matching.core.model.MatchTier;
import com.player.matching.core.model.PlayerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {

    private static final PlayerRecord EVENT = PlayerRecord.builder().lastName("Muller").firstName("Jan").build();
    private static final PlayerRecord REFERENCE = PlayerRecord.builder().lastName("Müller").firstName("Jan").build();

    private final ConfidenceScorer scorer = new ConfidenceScorer(0.05);

    private static MatchOutcome outcome(MatchTier tier, double similarity, List<MatchIssue> issues) {
        return new MatchOutcome(EVENT, REFERENCE, tier, similarity, issues);
    }

    @ParameterizedTest
    @DisplayName("Base confidence per tier without issues")
    @CsvSource({
            "EXACT,1.0,1.0",
            "NAME_SWAP,1.0,0.9",
            "FUZZY,0.95,0.95",
            "FUZZY,0.87,0.87"
    })
    void testBaseConfidence(MatchTier tier, double similarity, double expected) {
        MatchResult result = scorer.score(outcome(tier, similarity, List.of()));
        assertEquals(expected, result.confidence(), 1e-9);
    }

    @Test
    @DisplayName("No match scores 0.0")
    void testNoMatch() {
        assertEquals(0.0, scorer.score(MatchOutcome.noMatch(EVENT)).confidence());
    }

    @Test
    @DisplayName("Each issue subtracts the penalty")
    void testPenalty() {
        MatchResult one = scorer.score(outcome(MatchTier.EXACT, 1.0, List.of(MatchIssue.SEX_MISMATCH)));
        MatchResult two = scorer.score(outcome(MatchTier.NAME_SWAP, 1.0,
                List.of(MatchIssue.DOB_MOB_SWAP, MatchIssue.SEX_MISMATCH)));

        assertEquals(0.95, one.confidence(), 1e-9);
        assertEquals(0.8, two.confidence(), 1e-9);
        assertEquals(two.issues(), List.of(MatchIssue.DOB_MOB_SWAP, MatchIssue.SEX_MISMATCH));
    }

    @Test
    @DisplayName("Confidence never drops below 0.0")
    void testFloor() {
        ConfidenceScorer harsh = new ConfidenceScorer(0.3);
        List<MatchIssue> issues = List.of(MatchIssue.DOB_MISMATCH, MatchIssue.MOB_MISMATCH,
                MatchIssue.SEX_MISMATCH, MatchIssue.NATIONALITY_MISMATCH);

        assertEquals(0.0, harsh.score(outcome(MatchTier.FUZZY, 0.9, issues)).confidence());
    }

    @ParameterizedTest
    @DisplayName("Penalty outside [0, 1] is rejected")
    @ValueSource(doubles = {-0.01, 1.01, Double.NaN})
    void testInvalidPenalty(double penalty) {
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceScorer(penalty));
    }
}
