package com.directory.actions.similarity;

import java.util.List;

/**
 * Share of query tokens found in the candidate, where a candidate token counts as a hit
 * when it starts with the query token. Word order does not matter, so
 * "наталья устинова" fully matches "устинова наталья".
 */
public class TokenContainmentSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String query, String candidate) {
        List<String> queryTokens = NameNormalizer.tokens(query);
        List<String> candidateTokens = NameNormalizer.tokens(candidate);
        if (queryTokens.isEmpty() || candidateTokens.isEmpty()) {
            return 0.0;
        }
        int hits = 0;
        for (String token : queryTokens) {
            if (candidateTokens.stream().anyMatch(c -> c.startsWith(token))) {
                hits++;
            }
        }
        return (double) hits / queryTokens.size();
    }

    @Override
    public String getName() {
        return "TokenContainment";
    }
}
