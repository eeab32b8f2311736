package com.directory.actions.intake;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedIntentClassifierTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");
    private static final LocalDate TODAY = LocalDate.of(2025, 1, 10);

    private RuleBasedIntentClassifier classifier;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-10T09:00:00Z"), BERLIN);
        classifier = new RuleBasedIntentClassifier(new DateExtractor(clock, BERLIN));
    }

    @Nested
    @DisplayName("Password reset")
    class Reset {

        @ParameterizedTest
        @CsvSource({
                "смени пароль ivanov, ivanov",
                "Reset password for Alice, Alice",
                "сбрось пароль для Иванова Н., Иванова Н",
                "reset alice, alice",
                "поменять пароль пользователя petrov, petrov"
        })
        @DisplayName("Should recognise reset phrases and keep the person")
        void testResetPhrases(String text, String query) {
            ClassifiedText result = classifier.classify(text);

            assertEquals(Intent.RESET_PASSWORD, result.intent());
            assertEquals(query, result.extractedQuery());
            assertTrue(result.date().isEmpty());
        }

        @Test
        @DisplayName("Reset without a person has no query")
        void testResetWithoutQuery() {
            ClassifiedText result = classifier.classify("смени пароль");

            assertEquals(Intent.RESET_PASSWORD, result.intent());
            assertTrue(result.query().isEmpty());
        }
    }

    @Nested
    @DisplayName("Deactivation")
    class Disable {

        @Test
        @DisplayName("Absolute date with a Russian verb")
        void testAbsoluteDate() {
            ClassifiedText result = classifier.classify("заблокируй Иванова 15.03.2025");

            assertEquals(Intent.DISABLE_ACCOUNT, result.intent());
            assertEquals("Иванова", result.extractedQuery());
            assertEquals(LocalDate.of(2025, 3, 15), result.extractedDate());
        }

        @Test
        @DisplayName("Relative date word")
        void testTomorrow() {
            ClassifiedText result = classifier.classify("отключи petrov завтра");

            assertEquals(Intent.DISABLE_ACCOUNT, result.intent());
            assertEquals("petrov", result.extractedQuery());
            assertEquals(TODAY.plusDays(1), result.extractedDate());
        }

        @Test
        @DisplayName("Dismissal wording with a day offset")
        void testInDays() {
            ClassifiedText result = classifier.classify("Петрова уволена через 3 дня");

            assertEquals(Intent.DISABLE_ACCOUNT, result.intent());
            assertEquals("Петрова", result.extractedQuery());
            assertEquals(TODAY.plusDays(3), result.extractedDate());
        }

        @Test
        @DisplayName("English phrase with a two-digit year")
        void testEnglishShortYear() {
            ClassifiedText result = classifier.classify("disable account alice 01-04-25");

            assertEquals(Intent.DISABLE_ACCOUNT, result.intent());
            assertEquals("alice", result.extractedQuery());
            assertEquals(LocalDate.of(2025, 4, 1), result.extractedDate());
        }

        @Test
        @DisplayName("No date leaves the date empty")
        void testNoDate() {
            ClassifiedText result = classifier.classify("schedule block bob");

            assertEquals(Intent.DISABLE_ACCOUNT, result.intent());
            assertEquals("bob", result.extractedQuery());
            assertNull(result.extractedDate());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"jobs", "list jobs", "Задачи", "  список задач "})
    @DisplayName("Job listing commands")
    void testListJobs(String text) {
        assertEquals(Intent.LIST_JOBS, classifier.classify(text).intent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"привет", "how are you", "   ", "пароль"})
    @DisplayName("Unrelated text has no intent")
    void testNone(String text) {
        ClassifiedText result = classifier.classify(text);

        assertEquals(Intent.NONE, result.intent());
        assertTrue(result.query().isEmpty());
    }

    @Test
    @DisplayName("Null text has no intent")
    void testNull() {
        assertEquals(ClassifiedText.none(), classifier.classify(null));
    }

    @Test
    @DisplayName("Query cleanup strips filler words and punctuation")
    void testCleanQuery() {
        assertEquals("Иванов", RuleBasedIntentClassifier.cleanQuery(" для пользователя «Иванов», пожалуйста! "));
        assertEquals("j.doe", RuleBasedIntentClassifier.cleanQuery(" - j.doe ."));
    }
}
