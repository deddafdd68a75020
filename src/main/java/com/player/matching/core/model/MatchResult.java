package com.player.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Final verdict for one event record: the outcome plus confidence and issues.
 */
public record MatchResult(
        MatchOutcome outcome,
        double confidence,
        List<MatchIssue> issues
) {
    public MatchResult {
        Objects.requireNonNull(outcome, "outcome is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public PlayerRecord eventRecord() {
        return outcome.eventRecord();
    }

    /**
     * Returns the matched reference record, or {@code null} if there was no match.
     */
    public PlayerRecord referenceRecord() {
        return outcome.referenceRecord();
    }

    public MatchTier tier() {
        return outcome.tier();
    }

    public boolean hasMatch() {
        return outcome.hasMatch();
    }

    public boolean hasIssue(MatchIssue issue) {
        return issues.contains(issue);
    }

    /**
     * Issue codes in detection order, e.g. {@code ["dob-mob-swap", "sex-mismatch"]}.
     */
    public List<String> issueCodes() {
        return issues.stream().map(MatchIssue::getCode).toList();
    }
}
