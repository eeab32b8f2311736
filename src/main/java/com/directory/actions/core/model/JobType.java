package com.directory.actions.core.model;

/**
 * Types of deferred work stored in the job table.
 */
public enum JobType {
    DISABLE_ACCOUNT
}
