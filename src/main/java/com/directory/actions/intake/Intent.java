package com.directory.actions.intake;

/**
 * What an operator message asks for.
 */
public enum Intent {
    RESET_PASSWORD,
    DISABLE_ACCOUNT,
    LIST_JOBS,
    NONE
}
