package com.player.matching.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores last name against last name and first name against first name, then combines
 * the two with the arithmetic mean.
 */
public class NameSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(NameSimilarityScorer.class);

    private static final double LAST_NAME_WEIGHT = 0.5;
    private static final double FIRST_NAME_WEIGHT = 0.5;

    private final SimilarityAlgorithm algorithm;

    public NameSimilarityScorer() {
        this(new JaroWinklerSimilarity());
    }

    public NameSimilarityScorer(SimilarityAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    /**
     * Computes the similarity breakdown for two normalized name pairs.
     */
    public NameSimilarity score(String eventLastName, String eventFirstName,
                                String referenceLastName, String referenceFirstName) {
        double lastNameScore = algorithm.compute(eventLastName, referenceLastName);
        double firstNameScore = algorithm.compute(eventFirstName, referenceFirstName);
        double combined = LAST_NAME_WEIGHT * lastNameScore + FIRST_NAME_WEIGHT * firstNameScore;

        if (log.isTraceEnabled()) {
            log.trace("{} scores for '{} {}' vs '{} {}': lastName={}, firstName={}, combined={}",
                    algorithm.getName(), eventLastName, eventFirstName,
                    referenceLastName, referenceFirstName, lastNameScore, firstNameScore, combined);
        }
        return new NameSimilarity(lastNameScore, firstNameScore, combined);
    }

    public SimilarityAlgorithm getAlgorithm() {
        return algorithm;
    }
}
