package com.player.matching.similarity;

/**
 * Scores how alike two normalized name tokens are, from 0.0 (nothing in common) to 1.0.
 *
 * <p>Implementations used for matching must be symmetric and score two equal tokens,
 * including two empty ones, as 1.0.</p>
 */
@FunctionalInterface
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    /**
     * Name used in logs.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
