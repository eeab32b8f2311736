package com.directory.actions.audit;

import com.directory.actions.core.model.JobType;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Types of auditable operations. The wire name is what lands in the {@code action} column.
 */
public enum AuditAction {
    RESET_PASSWORD,
    SCHEDULE_DISABLE,
    DISABLE_ACCOUNT,
    MAIL_OFFBOARDING,
    OPERATOR_ADDED,
    OPERATOR_REMOVED,
    SELECTION_EXPIRED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Audit action recorded when a job of the given type completes.
     */
    public static AuditAction forJob(JobType type) {
        return switch (type) {
            case DISABLE_ACCOUNT -> DISABLE_ACCOUNT;
        };
    }

    public static Optional<AuditAction> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(a -> a.wireName().equals(wireName))
                .findFirst();
    }
}
