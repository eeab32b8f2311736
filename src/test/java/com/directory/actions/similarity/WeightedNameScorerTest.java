package com.directory.actions.similarity;

import com.directory.actions.core.model.Identity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeightedNameScorerTest {

    private final WeightedNameScorer scorer = new WeightedNameScorer();

    private static Identity identity(String handle, String displayName) {
        return new Identity(handle, displayName, "CN=" + displayName + ",DC=corp", true);
    }

    @Nested
    @DisplayName("Tiers")
    class Tiers {

        @Test
        @DisplayName("Exact handle scores 1.0")
        void testExactHandle() {
            assertEquals(1.0, scorer.score("IVANOVA", identity("ivanova", "Ivanova Natalia")));
        }

        @Test
        @DisplayName("Label starting with the query scores at least 0.9")
        void testLabelPrefix() {
            double score = scorer.score("Ivanova", identity("nivanova", "Ivanova N."));
            assertTrue(score >= 0.9 && score < 1.0, "score was " + score);
        }

        @Test
        @DisplayName("Word inside the label starting with the query scores in [0.8, 0.9)")
        void testWordPrefix() {
            double score = scorer.score("Ivanova", identity("aivanova", "Anna Ivanova"));
            assertTrue(score >= 0.8 && score < 0.9, "score was " + score);
        }

        @Test
        @DisplayName("A typo falls below the prefix tiers")
        void testTypo() {
            double score = scorer.score("Ivnaova", identity("nivanova", "Ivanova N."));
            assertTrue(score < 0.8, "score was " + score);
            assertTrue(score > scorer.score("Ivnaova", identity("ppetrov", "Petrov Pavel")));
        }

        @Test
        @DisplayName("Prefix match outranks a mid-label match")
        void testPrefixBeatsContains() {
            double prefix = scorer.score("Ivanova", identity("ivanova_a", "Ivanova Anna"));
            double contains = scorer.score("Ivanova", identity("aivanova", "Anna Ivanova"));
            assertTrue(prefix > contains);
        }
    }

    @Test
    @DisplayName("Normalisation folds case and ё")
    void testNormalisation() {
        assertEquals(1.0, scorer.compute("королев иван", "Королёв, Иван"));
    }

    @Test
    @DisplayName("Reversed name order scores higher than an unrelated name")
    void testTokenOrder() {
        double reversed = scorer.compute("наталья устинова", "Устинова Наталья");
        double unrelated = scorer.compute("наталья устинова", "Петрова Анна");
        assertTrue(reversed > unrelated);
    }

    @Test
    @DisplayName("Empty input scores 0")
    void testEmpty() {
        assertEquals(0.0, scorer.compute("", "Ivanova"));
        assertEquals(0.0, scorer.compute("Ivanova", "  "));
    }
}
