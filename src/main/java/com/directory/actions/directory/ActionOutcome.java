package com.directory.actions.directory;

/**
 * Result of a directory action.
 *
 * @param success whether the backend reported success
 * @param message backend output on success, failure reason otherwise
 */
public record ActionOutcome(boolean success, String message) {

    public ActionOutcome {
        message = message != null ? message : "";
    }

    public static ActionOutcome ok(String message) {
        return new ActionOutcome(true, message);
    }

    public static ActionOutcome failed(String reason) {
        return new ActionOutcome(false, reason);
    }
}
