package com.directory.actions.directory;

/**
 * Validation and escaping for values that end up inside PowerShell scripts.
 * Every query, handle and password is checked here before a script is built.
 */
public final class InputSanitizer {

    /** Maximum allowed length for free-text name queries. */
    public static final int MAX_QUERY_LENGTH = 200;

    /** Maximum allowed length for account handles. */
    public static final int MAX_HANDLE_LENGTH = 64;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a free-text name query.
     * Rejects null, blank, overly long, or control-character-containing queries.
     *
     * @param query the query to validate
     * @throws IllegalArgumentException if the query is invalid
     */
    public static void validateQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be null or blank");
        }
        if (query.length() > MAX_QUERY_LENGTH) {
            throw new IllegalArgumentException(
                    "Query exceeds maximum length of " + MAX_QUERY_LENGTH +
                            " characters (was " + query.length() + ")");
        }
        if (containsControlCharacters(query)) {
            throw new IllegalArgumentException("Query must not contain control characters");
        }
    }

    /**
     * Validates an account handle (sAMAccountName).
     * Only letters, digits, dot, underscore and hyphen are allowed.
     *
     * @param handle the handle to validate
     * @throws IllegalArgumentException if the handle is invalid
     */
    public static void validateHandle(String handle) {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("Handle must not be null or blank");
        }
        if (handle.length() > MAX_HANDLE_LENGTH) {
            throw new IllegalArgumentException(
                    "Handle exceeds maximum length of " + MAX_HANDLE_LENGTH + " characters");
        }
        if (!handle.matches("^[A-Za-z0-9._-]+$")) {
            throw new IllegalArgumentException(
                    "Handle must contain only letters, digits, '.', '_' and '-', got: '" + handle + "'");
        }
    }

    /**
     * Whether the handle passes {@link #validateHandle(String)}.
     */
    public static boolean isValidHandle(String handle) {
        try {
            validateHandle(handle);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Characters PowerShell accepts as single-quote delimiters. */
    private static final String SINGLE_QUOTES = "'\u2018\u2019\u201A\u201B";

    /** Wildcard metacharacters of the {@code -like} operator. */
    private static final String LIKE_WILDCARDS = "*?[]";

    /**
     * Escapes a value for use inside a single-quoted PowerShell string.
     * Backticks are doubled first, then every single-quote character,
     * including the typographic ones PowerShell treats as delimiters.
     *
     * @param value raw value
     * @return escaped value, empty for null
     * @throws IllegalArgumentException if the value contains control characters
     */
    public static String escapePowerShell(String value) {
        if (value == null) {
            return "";
        }
        if (containsControlCharacters(value) || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Script values must not contain control characters or line breaks");
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '`' || SINGLE_QUOTES.indexOf(c) >= 0) {
                sb.append(c);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Escapes a value for use as a literal inside a single-quoted {@code -like} pattern.
     * Applies {@link #escapePowerShell(String)}, then prefixes {@code * ? [ ]} with a backtick.
     *
     * @param value raw value
     * @return escaped pattern fragment, empty for null
     */
    public static String escapeLikePattern(String value) {
        String quoted = escapePowerShell(value);
        StringBuilder sb = new StringBuilder(quoted.length() + 4);
        for (int i = 0; i < quoted.length(); i++) {
            char c = quoted.charAt(i);
            if (LIKE_WILDCARDS.indexOf(c) >= 0) {
                sb.append('`');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
