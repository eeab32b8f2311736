package com.directory.actions.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / longerLength}.
 * Catches single-letter typos in surnames and account handles.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String left, String right) {
        if (left == null || right == null || left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        int longer = Math.max(left.length(), right.length());
        return 1.0 - (double) distance(left, right) / longer;
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    static int distance(String left, String right) {
        char[] a = left.toCharArray();
        char[] b = right.toCharArray();
        int[] costs = new int[b.length + 1];
        for (int j = 0; j <= b.length; j++) {
            costs[j] = j;
        }
        for (int i = 1; i <= a.length; i++) {
            int diagonal = costs[0];
            costs[0] = i;
            for (int j = 1; j <= b.length; j++) {
                int above = costs[j];
                int substitution = diagonal + (a[i - 1] == b[j - 1] ? 0 : 1);
                costs[j] = Math.min(substitution, Math.min(above, costs[j - 1]) + 1);
                diagonal = above;
            }
        }
        return costs[b.length];
    }
}
