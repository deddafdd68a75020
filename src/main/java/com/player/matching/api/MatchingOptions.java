package com.player.matching.api;

/**
 * Tunable parameters of a matching run.
 * Both values are validated when set, so an invalid configuration fails before any matching.
 */
public class MatchingOptions {

    public static final double DEFAULT_FUZZY_THRESHOLD = 0.85;
    public static final double DEFAULT_ISSUE_PENALTY = 0.05;
    private static final double STRICT_FUZZY_THRESHOLD = 0.92;

    private final double fuzzyThreshold;
    private final double issuePenalty;

    private MatchingOptions(Builder builder) {
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.issuePenalty = builder.issuePenalty;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public double getIssuePenalty() {
        return issuePenalty;
    }

    /**
     * Creates default options (threshold 0.85, penalty 0.05).
     */
    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that only accept close fuzzy matches.
     */
    public static MatchingOptions strict() {
        return builder().fuzzyThreshold(STRICT_FUZZY_THRESHOLD).build();
    }

    /**
     * Creates default options with the given fuzzy threshold.
     *
     * @throws IllegalArgumentException if the threshold is outside [0.0, 1.0]
     */
    public static MatchingOptions withFuzzyThreshold(double fuzzyThreshold) {
        return builder().fuzzyThreshold(fuzzyThreshold).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .fuzzyThreshold(fuzzyThreshold)
                .issuePenalty(issuePenalty);
    }

    public static class Builder {
        private double fuzzyThreshold = DEFAULT_FUZZY_THRESHOLD;
        private double issuePenalty = DEFAULT_ISSUE_PENALTY;

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            validateUnitInterval(fuzzyThreshold, "fuzzyThreshold");
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder issuePenalty(double issuePenalty) {
            validateUnitInterval(issuePenalty, "issuePenalty");
            this.issuePenalty = issuePenalty;
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }

        private void validateUnitInterval(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "fuzzyThreshold=" + fuzzyThreshold +
                ", issuePenalty=" + issuePenalty +
                '}';
    }
}
