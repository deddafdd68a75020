package com.player.matching.similarity;

/**
 * Per-field and combined name similarity for one (event, reference) pair.
 */
public record NameSimilarity(
        double lastNameScore,
        double firstNameScore,
        double combinedScore
) {
    @Override
    public String toString() {
        return String.format(
                "NameSimilarity{lastName=%.4f, firstName=%.4f, combined=%.4f}",
                lastNameScore, firstNameScore, combinedScore);
    }
}
