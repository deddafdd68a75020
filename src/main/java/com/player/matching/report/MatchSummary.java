package com.player.matching.report;

import com.player.matching.core.model.MatchIssue;
import com.player.matching.core.model.MatchResult;
import com.player.matching.core.model.MatchTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate statistics over the results of one matching run.
 *
 * @param total             number of event records
 * @param tierCounts        results per tier, every tier present
 * @param issueCounts       occurrences per issue, every issue present
 * @param recordsWithIssues matched records that carry at least one issue
 */
public record MatchSummary(
        long total,
        Map<MatchTier, Long> tierCounts,
        Map<MatchIssue, Long> issueCounts,
        long recordsWithIssues
) {
    public MatchSummary {
        tierCounts = Collections.unmodifiableMap(new EnumMap<>(tierCounts));
        issueCounts = Collections.unmodifiableMap(new EnumMap<>(issueCounts));
    }

    public static MatchSummary from(List<MatchResult> results) {
        Objects.requireNonNull(results, "results is required");
        Map<MatchTier, Long> tiers = new EnumMap<>(MatchTier.class);
        for (MatchTier tier : MatchTier.values()) {
            tiers.put(tier, 0L);
        }
        Map<MatchIssue, Long> issues = new EnumMap<>(MatchIssue.class);
        for (MatchIssue issue : MatchIssue.values()) {
            issues.put(issue, 0L);
        }

        long withIssues = 0;
        for (MatchResult result : results) {
            tiers.merge(result.tier(), 1L, Long::sum);
            for (MatchIssue issue : result.issues()) {
                issues.merge(issue, 1L, Long::sum);
            }
            if (result.hasMatch() && !result.issues().isEmpty()) {
                withIssues++;
            }
        }
        return new MatchSummary(results.size(), tiers, issues, withIssues);
    }

    public long count(MatchTier tier) {
        return tierCounts.getOrDefault(tier, 0L);
    }

    public long count(MatchIssue issue) {
        return issueCounts.getOrDefault(issue, 0L);
    }

    /**
     * Renders the plain-text run summary.
     */
    public String render(String title) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("=== Match report: %s ===%n", title != null ? title : ""));
        line(sb, "Event records", total);
        line(sb, "Exact matches", count(MatchTier.EXACT));
        line(sb, "Name swaps", count(MatchTier.NAME_SWAP));
        line(sb, "Fuzzy matches", count(MatchTier.FUZZY));
        line(sb, "DoB/MoB swapped", count(MatchIssue.DOB_MOB_SWAP));
        line(sb, "No match", count(MatchTier.NONE));
        sb.append(String.format("---%n"));
        line(sb, "Records with issues", recordsWithIssues);
        line(sb, "  - day of birth", count(MatchIssue.DOB_MISMATCH));
        line(sb, "  - month of birth", count(MatchIssue.MOB_MISMATCH));
        line(sb, "  - year of birth", count(MatchIssue.BIRTH_YEAR_MISMATCH));
        line(sb, "  - nationality", count(MatchIssue.NATIONALITY_MISMATCH));
        line(sb, "  - sex", count(MatchIssue.SEX_MISMATCH));
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, long value) {
        sb.append(String.format("%-26s%5d%n", label + ":", value));
    }

    @Override
    public String toString() {
        return "MatchSummary{total=" + total +
                ", exact=" + count(MatchTier.EXACT) +
                ", nameSwap=" + count(MatchTier.NAME_SWAP) +
                ", fuzzy=" + count(MatchTier.FUZZY) +
                ", none=" + count(MatchTier.NONE) +
                ", withIssues=" + recordsWithIssues + '}';
    }
}
