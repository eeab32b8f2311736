package com.directory.actions.core.model;

/**
 * Kind of administrative action a requester asked for.
 */
public enum ActionKind {
    /**
     * Password reset, executed immediately once the identity is settled.
     */
    RESET,

    /**
     * Account deactivation, persisted and executed at its scheduled time.
     */
    DISABLE
}
