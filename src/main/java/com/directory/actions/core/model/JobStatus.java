package com.directory.actions.core.model;

/**
 * Lifecycle state of a persisted job.
 * Transitions only move forward; rows are never deleted.
 */
public enum JobStatus {
    /**
     * Waiting for its timer.
     */
    SCHEDULED,

    /**
     * Claimed by the executor while the directory call is outstanding.
     * Still counts as a live job for duplicate detection.
     */
    IN_PROGRESS,

    /**
     * Directory action succeeded. Terminal.
     */
    DONE,

    /**
     * Directory action failed, timed out or was interrupted. Terminal, never retried.
     */
    FAILED;

    public boolean isLive() {
        return this == SCHEDULED || this == IN_PROGRESS;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
