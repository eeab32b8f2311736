package com.directory.actions.metrics;

import com.directory.actions.core.model.JobStatus;
import com.directory.actions.core.model.JobType;

import java.time.Duration;

/**
 * Records scheduler and executor metrics.
 * The default {@link NoOpSchedulerMetrics} does nothing, so the library works without a registry.
 */
public interface SchedulerMetrics {

    void incrementJobScheduled(JobType type);

    /**
     * @param outcome terminal status the job reached
     */
    void incrementJobCompleted(JobType type, JobStatus outcome);

    void recordActionDuration(JobType type, Duration duration);

    void recordRecovery(int restored, int overdue, int interrupted);
}
