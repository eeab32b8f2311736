package com.directory.actions.directory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generates temporary passwords that satisfy the default AD complexity policy:
 * at least one upper-case letter, lower-case letter, digit and special character.
 */
public class PasswordGenerator {

    public static final int DEFAULT_LENGTH = 12;
    private static final int MIN_LENGTH = 9;

    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    private static final String DIGITS = "0123456789";
    // No quotes or backticks: the value is interpolated into a script
    private static final String SPECIAL = "!@#$%^&*";
    private static final String ALL = UPPER + LOWER + DIGITS + SPECIAL;

    private final SecureRandom random;

    public PasswordGenerator() {
        this(new SecureRandom());
    }

    public PasswordGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate() {
        return generate(DEFAULT_LENGTH);
    }

    /**
     * @param length requested length; values below 9 fall back to {@value #DEFAULT_LENGTH}
     */
    public String generate(int length) {
        int effective = length < MIN_LENGTH ? DEFAULT_LENGTH : length;
        List<Character> chars = new ArrayList<>(effective);
        chars.add(pick(UPPER));
        chars.add(pick(LOWER));
        chars.add(pick(DIGITS));
        chars.add(pick(SPECIAL));
        while (chars.size() < effective) {
            chars.add(pick(ALL));
        }
        Collections.shuffle(chars, random);

        StringBuilder sb = new StringBuilder(effective);
        chars.forEach(sb::append);
        return sb.toString();
    }

    private char pick(String alphabet) {
        return alphabet.charAt(random.nextInt(alphabet.length()));
    }
}
