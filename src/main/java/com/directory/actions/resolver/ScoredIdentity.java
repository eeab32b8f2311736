package com.directory.actions.resolver;

import com.directory.actions.core.model.Identity;

import java.util.Objects;

/**
 * An identity with its similarity to the query it was resolved from.
 */
public record ScoredIdentity(Identity identity, double score) {

    public ScoredIdentity {
        Objects.requireNonNull(identity, "identity is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }

    public String handle() {
        return identity.handle();
    }
}
