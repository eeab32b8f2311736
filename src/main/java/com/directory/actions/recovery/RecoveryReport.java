package com.directory.actions.recovery;

/**
 * Outcome of one startup recovery pass.
 *
 * @param restored    scheduled jobs armed, overdue ones included
 * @param overdue     armed jobs whose due time had already passed
 * @param skipped     unreadable rows left untouched
 * @param interrupted jobs found mid-execution and failed
 */
public record RecoveryReport(int restored, int overdue, int skipped, int interrupted) {

    public static RecoveryReport empty() {
        return new RecoveryReport(0, 0, 0, 0);
    }
}
