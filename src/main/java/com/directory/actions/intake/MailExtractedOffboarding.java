package com.directory.actions.intake;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Offboarding notice extracted from an HR mail.
 *
 * @param handleOrName an explicit account handle, or a "Surname Name" pair to resolve
 * @param targetDate   last working day, null when the mail gives none
 * @param messageId    Message-ID of the source mail, kept as provenance
 */
public record MailExtractedOffboarding(
        String handleOrName,
        LocalDate targetDate,
        String messageId
) implements AdminRequest {

    /** Principal mail-derived requests run as. */
    public static final String SYSTEM_PRINCIPAL = "system:mail";

    public MailExtractedOffboarding {
        Objects.requireNonNull(handleOrName, "handleOrName is required");
        if (handleOrName.isBlank()) {
            throw new IllegalArgumentException("handleOrName must not be blank");
        }
        messageId = messageId != null ? messageId : "";
    }

    @Override
    public String principal() {
        return SYSTEM_PRINCIPAL;
    }

    public Optional<LocalDate> date() {
        return Optional.ofNullable(targetDate);
    }
}
