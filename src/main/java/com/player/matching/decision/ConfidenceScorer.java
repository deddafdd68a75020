package com.player.matching.decision;

import com.player.matching.core.model.MatchOutcome;
import com.player.matching.core.model.MatchResult;

/**
 * Turns a {@link MatchOutcome} into a scored {@link MatchResult}.
 *
 * <p>Base confidence by tier: EXACT 1.0, NAME_SWAP 0.9, FUZZY the combined name similarity,
 * NONE 0.0. Every secondary issue subtracts the issue penalty; the result never drops
 * below 0.0.</p>
 */
public class ConfidenceScorer {

    public static final double NAME_SWAP_CONFIDENCE = 0.9;

    private final double issuePenalty;

    public ConfidenceScorer(double issuePenalty) {
        if (Double.isNaN(issuePenalty) || issuePenalty < 0.0 || issuePenalty > 1.0) {
            throw new IllegalArgumentException("issuePenalty must be between 0.0 and 1.0");
        }
        this.issuePenalty = issuePenalty;
    }

    public MatchResult score(MatchOutcome outcome) {
        double base = baseConfidence(outcome);
        double confidence = Math.max(0.0, base - issuePenalty * outcome.issues().size());
        return new MatchResult(outcome, confidence, outcome.issues());
    }

    /**
     * Confidence before issue penalties.
     */
    public double baseConfidence(MatchOutcome outcome) {
        return switch (outcome.tier()) {
            case EXACT -> 1.0;
            case NAME_SWAP -> NAME_SWAP_CONFIDENCE;
            case FUZZY -> outcome.similarity();
            case NONE -> 0.0;
        };
    }

    public double getIssuePenalty() {
        return issuePenalty;
    }
}
