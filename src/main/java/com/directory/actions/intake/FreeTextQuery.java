package com.directory.actions.intake;

import java.util.Objects;

/**
 * A chat message typed by an operator.
 */
public record FreeTextQuery(String principal, String text) implements AdminRequest {

    public FreeTextQuery {
        Objects.requireNonNull(principal, "principal is required");
        text = text != null ? text : "";
    }
}
