package com.directory.actions.intake;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a calendar date in Russian or English operator text.
 *
 * <p>Understands {@code dd.MM.yyyy}, {@code dd-MM-yy} and {@code dd/MM/yyyy}, the relative words
 * "сегодня", "завтра", "послезавтра", "today", "tomorrow", and "через N дней" / "in N days".
 * Relative dates are computed in the desk time zone.</p>
 */
public class DateExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    static final Pattern NUMERIC = Pattern.compile("\\b(\\d{1,2})[./-](\\d{1,2})[./-](\\d{4}|\\d{2})\\b", FLAGS);
    static final Pattern IN_DAYS = Pattern.compile("\\b(?:через|in)\\s+(\\d{1,3})\\s+(?:дн[яей]+|день|days?)\\b", FLAGS);
    static final Pattern RELATIVE = Pattern.compile("\\b(послезавтра|завтра|сегодня|tomorrow|today)\\b", FLAGS);

    private final Clock clock;
    private final ZoneId zone;

    public DateExtractor(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    /**
     * @return the first date found together with the matched text, or empty
     */
    public Optional<Match> find(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = NUMERIC.matcher(text);
        while (m.find()) {
            Optional<LocalDate> date = numericDate(m.group(1), m.group(2), m.group(3));
            if (date.isPresent()) {
                return Optional.of(new Match(date.get(), m.group()));
            }
        }
        m = IN_DAYS.matcher(text);
        if (m.find()) {
            return Optional.of(new Match(today().plusDays(Integer.parseInt(m.group(1))), m.group()));
        }
        m = RELATIVE.matcher(text);
        if (m.find()) {
            String word = m.group(1).toLowerCase(Locale.ROOT);
            LocalDate date = switch (word) {
                case "послезавтра" -> today().plusDays(2);
                case "завтра", "tomorrow" -> today().plusDays(1);
                default -> today();
            };
            return Optional.of(new Match(date, m.group()));
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> numericDate(String day, String month, String year) {
        int y = Integer.parseInt(year);
        if (year.length() == 2) {
            y += 2000;
        }
        try {
            return Optional.of(LocalDate.of(y, Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * A date and the text it was read from.
     */
    public record Match(LocalDate date, String matchedText) {
    }
}
