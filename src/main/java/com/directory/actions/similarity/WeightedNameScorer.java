package com.directory.actions.similarity;

import com.directory.actions.core.model.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores a free-text query against a directory identity.
 *
 * <p>Scores fall into tiers so that stronger kinds of match always sort first:</p>
 * <ul>
 *   <li>exact handle or exact label: 1.0</li>
 *   <li>label starts with the query: [0.9, 1.0)</li>
 *   <li>some word of the label starts with the query: [0.8, 0.9)</li>
 *   <li>anything else: [0.0, 0.8)</li>
 * </ul>
 * Inside a tier the position comes from a weighted blend of Jaro-Winkler,
 * Levenshtein and token containment.
 */
public class WeightedNameScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(WeightedNameScorer.class);

    private static final double LABEL_PREFIX_FLOOR = 0.9;
    private static final double WORD_PREFIX_FLOOR = 0.8;
    private static final double CEILING = 0.999;

    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final TokenContainmentSimilarity tokens = new TokenContainmentSimilarity();
    private final ScoringWeights weights;

    public WeightedNameScorer() {
        this(ScoringWeights.defaultWeights());
    }

    public WeightedNameScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    /**
     * Scores the query against the identity's label and handle.
     */
    public double score(String query, Identity identity) {
        String normalizedQuery = NameNormalizer.normalize(query);
        if (!normalizedQuery.isEmpty() && normalizedQuery.equals(NameNormalizer.normalize(identity.handle()))) {
            return 1.0;
        }
        return compute(normalizedQuery, NameNormalizer.normalize(identity.label()));
    }

    /**
     * Scores two strings. Inputs are normalised here as well, so raw text is accepted.
     */
    @Override
    public double compute(String query, String candidate) {
        String q = NameNormalizer.normalize(query);
        String c = NameNormalizer.normalize(candidate);
        if (q.isEmpty() || c.isEmpty()) {
            return 0.0;
        }
        if (q.equals(c)) {
            return 1.0;
        }

        double blended = blend(q, c);
        double score;
        if (c.startsWith(q)) {
            score = within(LABEL_PREFIX_FLOOR, CEILING, blended);
        } else if (NameNormalizer.tokens(c).stream().anyMatch(token -> token.startsWith(q))) {
            score = within(WORD_PREFIX_FLOOR, LABEL_PREFIX_FLOOR, blended);
        } else {
            score = within(0.0, WORD_PREFIX_FLOOR, blended);
        }

        log.trace("Name score '{}' vs '{}': blended={} final={}", q, c, blended, score);
        return score;
    }

    @Override
    public String getName() {
        return "WeightedName";
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    private double blend(String q, String c) {
        return weights.jaroWinklerWeight() * jaroWinkler.compute(q, c)
                + weights.levenshteinWeight() * levenshtein.compute(q, c)
                + weights.tokenWeight() * tokens.compute(q, c);
    }

    private static double within(double floor, double ceiling, double fraction) {
        // Strictly below the ceiling so tiers never overlap
        return floor + (ceiling - floor) * Math.min(fraction, 0.999);
    }
}
