package com.directory.actions.metrics;

import com.directory.actions.core.model.JobStatus;
import com.directory.actions.core.model.JobType;

import java.time.Duration;

/**
 * No-op implementation of {@link SchedulerMetrics}.
 * Used by default when no meter registry is configured.
 */
public class NoOpSchedulerMetrics implements SchedulerMetrics {

    public static final NoOpSchedulerMetrics INSTANCE = new NoOpSchedulerMetrics();

    @Override
    public void incrementJobScheduled(JobType type) {
    }

    @Override
    public void incrementJobCompleted(JobType type, JobStatus outcome) {
    }

    @Override
    public void recordActionDuration(JobType type, Duration duration) {
    }

    @Override
    public void recordRecovery(int restored, int overdue, int interrupted) {
    }
}
