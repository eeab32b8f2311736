package com.directory.actions.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * One line of the audit trail.
 *
 * <p>{@code target} is the account handle the action was about and {@code actorId} the operator
 * (or {@code system:mail}) who caused it; either may be absent, blank values are stored as absent.
 * Details are flat strings; the keys {@code status}, {@code reason} and {@code job_id} are shared by
 * every job outcome entry.</p>
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String target,
        String actorId,
        Map<String, String> details,
        Instant timestamp
) {
    static final String STATUS_KEY = "status";
    static final String JOB_ID_KEY = "job_id";

    public AuditEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("audit entry id must not be blank");
        }
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestamp, "timestamp");
        target = blankToNull(target);
        actorId = blankToNull(actorId);
        details = details == null ? Map.of() : withoutNullValues(details);
    }

    /**
     * The {@code status} detail ({@code ok} or {@code failed}) for job outcome entries.
     */
    public Optional<String> outcome() {
        return Optional.ofNullable(details.get(STATUS_KEY));
    }

    public boolean isFailure() {
        return outcome().filter("failed"::equals).isPresent();
    }

    /**
     * The job this entry belongs to, when the {@code job_id} detail holds a number.
     */
    public OptionalLong jobId() {
        String raw = details.get(JOB_ID_KEY);
        if (raw == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Map<String, String> withoutNullValues(Map<String, String> raw) {
        Map<String, String> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return Map.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String target;
        private String actorId;
        private final Map<String, String> details = new LinkedHashMap<>();
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        /** Adds all details; null maps are ignored. */
        public Builder details(Map<String, String> details) {
            if (details != null) {
                details.forEach(this::detail);
            }
            return this;
        }

        public Builder detail(String key, String value) {
            if (key != null && value != null) {
                details.put(key, value);
            }
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, target, actorId, details, timestamp);
        }
    }
}
