package com.directory.actions.directory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PasswordGeneratorTest {

    private final PasswordGenerator generator = new PasswordGenerator();

    @RepeatedTest(20)
    @DisplayName("Passwords contain every character class")
    void testComplexity() {
        String password = generator.generate();

        assertEquals(PasswordGenerator.DEFAULT_LENGTH, password.length());
        assertTrue(password.chars().anyMatch(Character::isUpperCase));
        assertTrue(password.chars().anyMatch(Character::isLowerCase));
        assertTrue(password.chars().anyMatch(Character::isDigit));
        assertTrue(password.chars().anyMatch(c -> "!@#$%^&*".indexOf(c) >= 0));
        assertFalse(password.contains("'"));
        assertFalse(password.contains("`"));
    }

    @Test
    @DisplayName("Short lengths fall back to the default")
    void testLength() {
        assertEquals(PasswordGenerator.DEFAULT_LENGTH, generator.generate(4).length());
        assertEquals(20, generator.generate(20).length());
    }
}
