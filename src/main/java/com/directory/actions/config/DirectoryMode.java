package com.directory.actions.config;

import java.util.Locale;

/**
 * Which directory backend the desk talks to.
 */
public enum DirectoryMode {
    /** ActiveDirectory cmdlets through a local PowerShell process. */
    POWERSHELL,
    /** Logs every call and reports success without touching a directory. */
    NOOP;

    public static DirectoryMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "desk.directory.mode must be 'powershell' or 'noop', got '" + value + "'", e);
        }
    }
}
