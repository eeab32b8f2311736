package com.directory.actions.core.model;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * An action waiting for a single resolved identity before it can be dispatched or persisted.
 *
 * @param kind         what to do
 * @param targetQuery  the free-text query the identity was resolved from
 * @param requestedBy  principal that asked for the action
 * @param scheduledFor due time for deactivations, null for immediate actions
 * @param source       provenance of the request
 */
public record PendingAction(
        ActionKind kind,
        String targetQuery,
        String requestedBy,
        ZonedDateTime scheduledFor,
        RequestSource source
) {
    public PendingAction {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(targetQuery, "targetQuery is required");
        Objects.requireNonNull(requestedBy, "requestedBy is required");
        Objects.requireNonNull(source, "source is required");
        if (kind == ActionKind.DISABLE && scheduledFor == null) {
            throw new IllegalArgumentException("A deactivation needs a scheduled time");
        }
    }

    public static PendingAction reset(String targetQuery, String requestedBy) {
        return new PendingAction(ActionKind.RESET, targetQuery, requestedBy, null, RequestSource.CHAT);
    }

    public static PendingAction disable(String targetQuery, String requestedBy,
                                        ZonedDateTime scheduledFor, RequestSource source) {
        return new PendingAction(ActionKind.DISABLE, targetQuery, requestedBy, scheduledFor, source);
    }

    public Optional<ZonedDateTime> schedule() {
        return Optional.ofNullable(scheduledFor);
    }
}
