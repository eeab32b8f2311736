package com.directory.actions.disambiguation;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * Opaque single-use key handed to the requester together with the candidate list.
 * Twelve URL-safe characters, short enough to share a chat callback payload with a handle.
 */
public record DisambiguationToken(String value) {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 9;

    public DisambiguationToken {
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank() || value.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Token must be non-blank and must not contain ':'");
        }
    }

    public static DisambiguationToken generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return new DisambiguationToken(Base64.getUrlEncoder().withoutPadding().encodeToString(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
