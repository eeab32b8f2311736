package com.directory.actions.scheduler;

import com.directory.actions.core.model.Job;
import com.directory.actions.core.model.JobStatus;
import com.directory.actions.core.model.JobType;
import com.directory.actions.metrics.SchedulerMetrics;
import com.directory.actions.store.JobPersistenceException;
import com.directory.actions.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Schedules account deactivations: the job is written to the store first and armed only after
 * the write succeeded, so an armed timer always has a durable row behind it.
 */
public class DeactivationScheduler {
    private static final Logger log = LoggerFactory.getLogger(DeactivationScheduler.class);

    private final JobStore jobStore;
    private final JobScheduler jobScheduler;
    private final SchedulerMetrics metrics;

    public DeactivationScheduler(JobStore jobStore, JobScheduler jobScheduler, SchedulerMetrics metrics) {
        this.jobStore = jobStore;
        this.jobScheduler = jobScheduler;
        this.metrics = metrics;
    }

    /**
     * Persists and arms a deactivation. Re-submitting the same handle and due time returns the
     * existing job and leaves exactly one timer armed for it. When the timer thread has been shut
     * down the job stays persisted unarmed and is picked up by recovery on the next start.
     *
     * @throws JobPersistenceException if the job could not be written; no timer is armed then
     */
    public Job schedule(String targetHandle, ZonedDateTime runAt, String createdBy, Map<String, String> metadata) {
        Job job = jobStore.createJob(JobType.DISABLE_ACCOUNT, targetHandle, runAt, createdBy, metadata);
        if (job.status() != JobStatus.SCHEDULED) {
            log.info("job.already_running jobId={} target={} status={}", job.id(), targetHandle, job.status());
            return job;
        }
        try {
            jobScheduler.arm(job.id(), job.runAt().toInstant());
        } catch (RejectedExecutionException e) {
            log.warn("job.arm_rejected jobId={} target={} reason=scheduler shut down; restored at next start",
                    job.id(), targetHandle);
            return job;
        }
        metrics.incrementJobScheduled(job.jobType());
        log.info("job.scheduled jobId={} target={} runAt={} createdBy={}",
                job.id(), targetHandle, job.runAt(), createdBy);
        return job;
    }
}
