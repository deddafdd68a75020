package com.player.matching.similarity;

/**
 * Jaro-Winkler similarity over Unicode code points.
 *
 * <p>Two empty strings score 1.0, an empty and a non-empty string score 0.0. Names that
 * share a prefix of up to four code points are boosted, but only once the plain Jaro score
 * exceeds the boost threshold.</p>
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_SCALING_FACTOR = 0.1;
    private static final double DEFAULT_BOOST_THRESHOLD = 0.7;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final double scalingFactor;
    private final double boostThreshold;

    public JaroWinklerSimilarity() {
        this(DEFAULT_SCALING_FACTOR, DEFAULT_BOOST_THRESHOLD);
    }

    public JaroWinklerSimilarity(double scalingFactor, double boostThreshold) {
        if (scalingFactor < 0 || scalingFactor > 0.25) {
            throw new IllegalArgumentException("scalingFactor must be between 0.0 and 0.25, got " + scalingFactor);
        }
        if (boostThreshold < 0 || boostThreshold > 1.0) {
            throw new IllegalArgumentException("boostThreshold must be between 0.0 and 1.0, got " + boostThreshold);
        }
        this.scalingFactor = scalingFactor;
        this.boostThreshold = boostThreshold;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        // Greedy matching depends on argument order; scan the lexicographically smaller string first
        boolean inOrder = s1.compareTo(s2) <= 0;
        int[] left = (inOrder ? s1 : s2).codePoints().toArray();
        int[] right = (inOrder ? s2 : s1).codePoints().toArray();

        double jaro = jaro(left, right);
        if (jaro <= boostThreshold) {
            return jaro;
        }
        double boosted = jaro + commonPrefixLength(left, right) * scalingFactor * (1.0 - jaro);
        return Math.min(1.0, boosted);
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    /**
     * Plain Jaro similarity of two code point sequences.
     */
    static double jaro(int[] left, int[] right) {
        int window = Math.max(0, Math.max(left.length, right.length) / 2 - 1);
        boolean[] leftMatched = new boolean[left.length];
        boolean[] rightMatched = new boolean[right.length];

        int matches = markMatches(left, right, window, leftMatched, rightMatched);
        if (matches == 0) {
            return 0.0;
        }

        double m = matches;
        double t = countOutOfOrder(left, right, leftMatched, rightMatched) / 2.0;
        return (m / left.length + m / right.length + (m - t) / m) / 3.0;
    }

    private static int markMatches(int[] left, int[] right, int window,
                                   boolean[] leftMatched, boolean[] rightMatched) {
        int matches = 0;
        for (int i = 0; i < left.length; i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(right.length, i + window + 1);
            for (int j = from; j < to; j++) {
                if (!rightMatched[j] && left[i] == right[j]) {
                    leftMatched[i] = true;
                    rightMatched[j] = true;
                    matches++;
                    break;
                }
            }
        }
        return matches;
    }

    /**
     * Walks both match sequences in order and counts positions whose code points differ.
     */
    private static int countOutOfOrder(int[] left, int[] right, boolean[] leftMatched, boolean[] rightMatched) {
        int outOfOrder = 0;
        int j = 0;
        for (int i = 0; i < left.length; i++) {
            if (!leftMatched[i]) {
                continue;
            }
            while (!rightMatched[j]) {
                j++;
            }
            if (left[i] != right[j]) {
                outOfOrder++;
            }
            j++;
        }
        return outOfOrder;
    }

    private static int commonPrefixLength(int[] left, int[] right) {
        int limit = Math.min(MAX_PREFIX_LENGTH, Math.min(left.length, right.length));
        int length = 0;
        while (length < limit && left[length] == right[length]) {
            length++;
        }
        return length;
    }
}
