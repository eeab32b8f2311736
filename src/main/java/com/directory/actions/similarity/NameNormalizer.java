package com.directory.actions.similarity;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalises person names and account labels before comparison.
 * Lower-cases, folds {@code ё} to {@code е}, drops punctuation and collapses whitespace.
 */
public final class NameNormalizer {

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}«»“”‘’]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private NameNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String lowered = value.toLowerCase(Locale.ROOT).replace('ё', 'е');
        String stripped = PUNCTUATION.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }
}
