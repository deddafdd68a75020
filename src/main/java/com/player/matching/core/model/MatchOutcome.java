package com.player.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of matching one event record against the reference set, before scoring.
 *
 * @param eventRecord     the event record that was matched
 * @param referenceRecord the selected reference record, {@code null} when the tier is NONE
 * @param tier            the tier that produced the match
 * @param similarity      1.0 for EXACT and NAME_SWAP, the combined name score for FUZZY, 0.0 for NONE
 * @param issues          secondary issues found for the pair, in detection order
 */
public record MatchOutcome(
        PlayerRecord eventRecord,
        PlayerRecord referenceRecord,
        MatchTier tier,
        double similarity,
        List<MatchIssue> issues
) {
    public MatchOutcome {
        Objects.requireNonNull(eventRecord, "eventRecord is required");
        Objects.requireNonNull(tier, "tier is required");
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("Similarity must be between 0.0 and 1.0");
        }
        if (tier.isMatch() == (referenceRecord == null)) {
            throw new IllegalArgumentException(
                    "referenceRecord must be present exactly when tier is a match, tier=" + tier);
        }
        issues = issues != null ? List.copyOf(issues) : List.of();
        if (!tier.isMatch() && !issues.isEmpty()) {
            throw new IllegalArgumentException("An unmatched outcome cannot carry issues");
        }
    }

    /**
     * Creates the outcome for an event record no reference record matched.
     */
    public static MatchOutcome noMatch(PlayerRecord eventRecord) {
        return new MatchOutcome(eventRecord, null, MatchTier.NONE, 0.0, List.of());
    }

    public boolean hasMatch() {
        return tier.isMatch();
    }
}
