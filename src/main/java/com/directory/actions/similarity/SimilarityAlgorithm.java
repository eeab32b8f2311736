package com.directory.actions.similarity;

/**
 * String similarity measure used when ranking directory candidates.
 * Implementations return a score between 0.0 (unrelated) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Scores two already-normalised strings.
     *
     * @param left  first string
     * @param right second string
     * @return similarity between 0.0 and 1.0
     */
    double compute(String left, String right);

    /**
     * Short name used in debug logging.
     */
    String getName();
}
