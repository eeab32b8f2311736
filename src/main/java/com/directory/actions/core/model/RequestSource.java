package com.directory.actions.core.model;

import java.util.Locale;

/**
 * Where a request came from. Stored as job provenance metadata.
 */
public enum RequestSource {
    CHAT,
    MAIL;

    public String metadataValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
