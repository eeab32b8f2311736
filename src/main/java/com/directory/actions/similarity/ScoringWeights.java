package com.directory.actions.similarity;

/**
 * Weights of the blended score computed by {@link WeightedNameScorer}.
 */
public record ScoringWeights(
        double jaroWinklerWeight,
        double levenshteinWeight,
        double tokenWeight
) {
    public ScoringWeights {
        if (jaroWinklerWeight < 0 || levenshteinWeight < 0 || tokenWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = jaroWinklerWeight + levenshteinWeight + tokenWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Token overlap first, prefix-aware similarity second. Works for "Surname Name" queries
     * in either order.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(0.35, 0.15, 0.5);
    }

    /**
     * Favours edit distance, for operators who type handles rather than names.
     */
    public static ScoringWeights typoTolerant() {
        return new ScoringWeights(0.3, 0.5, 0.2);
    }
}
