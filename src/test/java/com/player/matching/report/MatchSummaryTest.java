package com.player.matching.report;

import com.player.matching.api.PlayerMatcher;
import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchResult;
import com.player.matching.core.model.MatchTier;
import com.player.matching.core.model.PlayerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatchSummaryTest {

    private static final PlayerRecord REFERENCE = PlayerRecord.builder()
            .externalId("R1").lastName("Müller").firstName("Jan").sex("M").association("GER")
            .birthDate(12, 5, 1990).build();

    private static List<MatchResult> sampleResults() {
        return new PlayerMatcher().matchAll(List.of(
                REFERENCE.toBuilder().externalId("E1").build(),
                REFERENCE.toBuilder().externalId("E2").lastName("Jan").firstName("Müller").build(),
                REFERENCE.toBuilder().externalId("E3").lastName("Muller").dayOfBirth(5).monthOfBirth(12).build(),
                REFERENCE.toBuilder().externalId("E4").sex("W").association("AUT").build(),
                PlayerRecord.builder().externalId("E5").lastName("Smith").firstName("John").build()
        ), List.of(REFERENCE));
    }

    @Test
    @DisplayName("Should count tiers and issues")
    void testCounts() {
        MatchSummary summary = MatchSummary.from(sampleResults());

        assertEquals(5, summary.total());
        assertEquals(2, summary.count(MatchTier.EXACT));
        assertEquals(1, summary.count(MatchTier.NAME_SWAP));
        assertEquals(1, summary.count(MatchTier.FUZZY));
        assertEquals(1, summary.count(MatchTier.NONE));
        assertEquals(1, summary.count(MatchIssue.DOB_MOB_SWAP));
        assertEquals(1, summary.count(MatchIssue.SEX_MISMATCH));
        assertEquals(1, summary.count(MatchIssue.NATIONALITY_MISMATCH));
        assertEquals(0, summary.count(MatchIssue.BIRTH_YEAR_MISMATCH));
        assertEquals(2, summary.recordsWithIssues());
    }

    @Test
    @DisplayName("Empty results give zero counts for every key")
    void testEmpty() {
        MatchSummary summary = MatchSummary.from(List.of());

        assertEquals(0, summary.total());
        assertEquals(MatchTier.values().length, summary.tierCounts().size());
        assertEquals(MatchIssue.values().length, summary.issueCounts().size());
        assertEquals(0, summary.count(MatchTier.EXACT));
    }

    @Test
    @DisplayName("Should render a readable report")
    void testRender() {
        String report = MatchSummary.from(sampleResults()).render("Open 2026");

        assertTrue(report.startsWith("=== Match report: Open 2026 ==="));
        assertTrue(report.contains("Event records:"));
        assertTrue(report.contains("Name swaps:"));
        assertTrue(report.contains("DoB/MoB swapped:"));
        assertTrue(report.contains("Records with issues:"));
    }

    @Test
    @DisplayName("toString is compact for log lines")
    void testToString() {
        assertEquals("MatchSummary{total=5, exact=2, nameSwap=1, fuzzy=1, none=1, withIssues=2}",
                MatchSummary.from(sampleResults()).toString());
    }
}
