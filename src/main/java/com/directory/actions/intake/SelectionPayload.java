package com.directory.actions.intake;

import com.directory.actions.directory.InputSanitizer;
import com.directory.actions.disambiguation.DisambiguationToken;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Callback payload attached to a selection button: which session and which candidate.
 * Encoded as {@code sel:<token>:<handle>} and parsed once where callbacks enter the desk.
 */
public record SelectionPayload(DisambiguationToken token, String handle) {

    public static final String PREFIX = "sel:";

    /** Chat callback data limit. */
    public static final int MAX_ENCODED_BYTES = 64;

    public SelectionPayload {
        Objects.requireNonNull(token, "token is required");
        InputSanitizer.validateHandle(handle);
    }

    public String encode() {
        return PREFIX + token.value() + ":" + handle;
    }

    public boolean fitsCallbackLimit() {
        return encode().getBytes(StandardCharsets.UTF_8).length <= MAX_ENCODED_BYTES;
    }

    /**
     * Parses callback data. Anything that is not a well-formed selection gives empty.
     */
    public static Optional<SelectionPayload> parse(String data) {
        if (data == null || !data.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String rest = data.substring(PREFIX.length());
        int sep = rest.indexOf(':');
        if (sep <= 0 || sep == rest.length() - 1) {
            return Optional.empty();
        }
        String handle = rest.substring(sep + 1);
        if (!InputSanitizer.isValidHandle(handle)) {
            return Optional.empty();
        }
        return Optional.of(new SelectionPayload(new DisambiguationToken(rest.substring(0, sep)), handle));
    }
}
