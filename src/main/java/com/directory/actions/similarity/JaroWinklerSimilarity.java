package com.directory.actions.similarity;

/**
 * Jaro-Winkler similarity. Rewards a shared leading prefix, which suits surnames
 * typed without the given name or with a truncated ending.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double PREFIX_SCALE = 0.1;
    private static final int PREFIX_CAP = 4;

    @Override
    public double compute(String left, String right) {
        if (left == null || right == null || left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        double jaro = jaro(left, right);
        int prefix = commonPrefix(left, right, PREFIX_CAP);
        return jaro + prefix * PREFIX_SCALE * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    private static int commonPrefix(String left, String right, int cap) {
        int limit = Math.min(cap, Math.min(left.length(), right.length()));
        int n = 0;
        while (n < limit && left.charAt(n) == right.charAt(n)) {
            n++;
        }
        return n;
    }

    private static double jaro(String left, String right) {
        int window = Math.max(0, Math.max(left.length(), right.length()) / 2 - 1);
        boolean[] leftHit = new boolean[left.length()];
        boolean[] rightHit = new boolean[right.length()];

        int matches = 0;
        for (int i = 0; i < left.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(right.length() - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (!rightHit[j] && left.charAt(i) == right.charAt(j)) {
                    leftHit[i] = true;
                    rightHit[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int cursor = 0;
        for (int i = 0; i < left.length(); i++) {
            if (!leftHit[i]) {
                continue;
            }
            while (!rightHit[cursor]) {
                cursor++;
            }
            if (left.charAt(i) != right.charAt(cursor)) {
                halfTranspositions++;
            }
            cursor++;
        }

        double m = matches;
        return (m / left.length() + m / right.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}
