package com.directory.actions.intake;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of classifying one message.
 *
 * @param intent         recognised intent, {@link Intent#NONE} when nothing matched
 * @param extractedQuery the rest of the message naming the person, null when empty
 * @param extractedDate  date mentioned in the message, null when none
 */
public record ClassifiedText(Intent intent, String extractedQuery, LocalDate extractedDate) {

    public ClassifiedText {
        Objects.requireNonNull(intent, "intent is required");
        if (extractedQuery != null && extractedQuery.isBlank()) {
            extractedQuery = null;
        }
    }

    public static ClassifiedText none() {
        return new ClassifiedText(Intent.NONE, null, null);
    }

    public Optional<String> query() {
        return Optional.ofNullable(extractedQuery);
    }

    public Optional<LocalDate> date() {
        return Optional.ofNullable(extractedDate);
    }
}
