package com.directory.actions.operator;

/**
 * Outcome of an add or remove on the operator roster.
 */
public enum RosterChange {
    ADDED,
    REMOVED,
    /** The operator was already present (add) or absent (remove). */
    UNCHANGED,
    /** The actor is not the super-admin. */
    DENIED
}
