package com.directory.actions.intake;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class DateExtractorTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    private DateExtractor extractor;

    @BeforeEach
    void setUp() {
        // 23:30 UTC is already the next day in Berlin
        extractor = new DateExtractor(Clock.fixed(Instant.parse("2025-01-09T23:30:00Z"), BERLIN), BERLIN);
    }

    @Test
    @DisplayName("Today is taken in the desk time zone")
    void testTodayInZone() {
        assertEquals(LocalDate.of(2025, 1, 10), extractor.today());
    }

    @ParameterizedTest
    @CsvSource({
            "до 15.03.2025, 2025-03-15",
            "с 1/4/2025, 2025-04-01",
            "31-12-24, 2024-12-31",
            "завтра, 2025-01-11",
            "послезавтра, 2025-01-12",
            "сегодня, 2025-01-10",
            "Tomorrow, 2025-01-11",
            "через 10 дней, 2025-01-20",
            "in 1 day, 2025-01-11"
    })
    @DisplayName("Should read numeric and relative dates")
    void testFind(String text, LocalDate expected) {
        assertEquals(expected, extractor.find(text).orElseThrow().date());
    }

    @Test
    @DisplayName("Impossible numeric dates are skipped in favour of later ones")
    void testInvalidDateSkipped() {
        DateExtractor.Match match = extractor.find("31.02.2025 или 01.03.2025").orElseThrow();

        assertEquals(LocalDate.of(2025, 3, 1), match.date());
        assertEquals("01.03.2025", match.matchedText());
    }

    @Test
    @DisplayName("Numeric dates win over relative words")
    void testNumericFirst() {
        assertEquals(LocalDate.of(2025, 2, 1), extractor.find("завтра или 01.02.2025").orElseThrow().date());
    }

    @Test
    @DisplayName("Text without a date gives nothing")
    void testNoDate() {
        assertTrue(extractor.find("заблокируй ivanov").isEmpty());
        assertTrue(extractor.find("").isEmpty());
        assertTrue(extractor.find(null).isEmpty());
    }
}
