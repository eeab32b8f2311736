package com.directory.actions.core.model;

import java.util.Objects;

/**
 * Snapshot of a directory account as returned by the directory search.
 * Never mutated locally; the handle (sAMAccountName) is the stable key.
 */
public record Identity(
        String handle,
        String displayName,
        String distinguishedName,
        boolean enabled
) {
    public Identity {
        Objects.requireNonNull(handle, "handle is required");
        if (handle.isBlank()) {
            throw new IllegalArgumentException("handle must not be blank");
        }
        displayName = displayName != null ? displayName : "";
        distinguishedName = distinguishedName != null ? distinguishedName : "";
    }

    /**
     * Label used for ranking and for selection buttons: {@code "Display Name (handle)"}.
     */
    public String label() {
        return displayName.isEmpty() ? handle : displayName + " (" + handle + ")";
    }
}
