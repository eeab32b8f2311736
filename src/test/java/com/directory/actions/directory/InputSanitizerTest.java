package com.directory.actions.directory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class InputSanitizerTest {

    @Test
    @DisplayName("Single quotes are doubled and backticks escaped")
    void testEscapePowerShell() {
        assertEquals("O''Brien", InputSanitizer.escapePowerShell("O'Brien"));
        assertEquals("a``b", InputSanitizer.escapePowerShell("a`b"));
        assertEquals("``''", InputSanitizer.escapePowerShell("`'"));
        assertEquals("", InputSanitizer.escapePowerShell(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\u2018", "\u2019", "\u201A", "\u201B"})
    @DisplayName("Typographic single quotes are doubled like ASCII ones")
    void testEscapeTypographicQuotes(String quote) {
        assertEquals("O" + quote + quote + "Brien", InputSanitizer.escapePowerShell("O" + quote + "Brien"));
    }

    @Test
    @DisplayName("A typographic quote cannot close the literal")
    void testTypographicQuoteInjection() {
        String escaped = InputSanitizer.escapePowerShell("x\u2019; Remove-ADUser bob; \u2018");

        assertEquals("x\u2019\u2019; Remove-ADUser bob; \u2018\u2018", escaped);
    }

    @Test
    @DisplayName("Like patterns escape wildcards with a backtick")
    void testEscapeLikePattern() {
        assertEquals("a`[b`]", InputSanitizer.escapeLikePattern("a[b]"));
        assertEquals("`*`?", InputSanitizer.escapeLikePattern("*?"));
        assertEquals("O''Brien``", InputSanitizer.escapeLikePattern("O'Brien`"));
        assertEquals("O\u2019\u2019Brien `[x", InputSanitizer.escapeLikePattern("O\u2019Brien [x"));
        assertEquals("", InputSanitizer.escapeLikePattern(null));
    }

    @Test
    @DisplayName("Line breaks and control characters are rejected")
    void testEscapeRejectsControlCharacters() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.escapePowerShell("a\nRemove-ADUser"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.escapePowerShell("a\u0000b"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ivanov", "j.doe", "a_b-c", "User01"})
    @DisplayName("Valid handles pass")
    void testValidHandles(String handle) {
        assertDoesNotThrow(() -> InputSanitizer.validateHandle(handle));
        assertTrue(InputSanitizer.isValidHandle(handle));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "ivan ov", "a'b", "Иванов", "x;y", "a$b"})
    @DisplayName("Handles with other characters are rejected")
    void testInvalidHandles(String handle) {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateHandle(handle));
        assertFalse(InputSanitizer.isValidHandle(handle));
    }

    @Test
    @DisplayName("Handles longer than 64 characters are rejected")
    void testHandleLength() {
        assertFalse(InputSanitizer.isValidHandle("a".repeat(65)));
        assertTrue(InputSanitizer.isValidHandle("a".repeat(64)));
    }

    @Test
    @DisplayName("Queries are bounded and free of control characters")
    void testValidateQuery() {
        assertDoesNotThrow(() -> InputSanitizer.validateQuery("Иванова Н."));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateQuery(" "));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateQuery("a\u0007"));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateQuery("x".repeat(InputSanitizer.MAX_QUERY_LENGTH + 1)));
    }
}
