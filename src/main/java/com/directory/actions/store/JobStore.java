package com.directory.actions.store;

import com.directory.actions.core.model.Job;
import com.directory.actions.core.model.JobType;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for scheduled jobs and their lifecycle.
 *
 * <p>Status only moves forward: {@code SCHEDULED -> IN_PROGRESS -> DONE | FAILED}. Rows are
 * never deleted. All methods throw {@link JobPersistenceException} when storage fails.</p>
 */
public interface JobStore {

    /**
     * Persists a job, or refreshes the live job with the same type, handle and due second.
     *
     * @return the stored job; its id equals the existing job's id when a duplicate was collapsed
     */
    Job createJob(JobType jobType, String targetHandle, ZonedDateTime runAt,
                  String createdBy, Map<String, String> metadata);

    /**
     * Atomically moves a job from {@code SCHEDULED} to {@code IN_PROGRESS}.
     *
     * @return true if this caller won the claim
     */
    boolean claim(long id);

    /**
     * Marks a live job {@code DONE}. No-op for jobs that are already terminal or unknown.
     *
     * @return true if the status changed
     */
    boolean markDone(long id);

    /**
     * Marks a live job {@code FAILED}. No-op for jobs that are already terminal or unknown.
     *
     * @return true if the status changed
     */
    boolean markFailed(long id, String reason);

    Optional<Job> findById(long id);

    /**
     * Reads all {@code SCHEDULED} rows, ascending by due time, separating unreadable rows.
     */
    ScheduledScan scanScheduled();

    /**
     * Readable {@code SCHEDULED} jobs, ascending by due time.
     */
    default List<Job> listScheduled() {
        return scanScheduled().jobs();
    }

    /**
     * Jobs for one handle, newest first, any status.
     */
    List<Job> findByHandle(String targetHandle);

    /**
     * Most recently created jobs, newest first, any status.
     */
    List<Job> listRecent(int limit);

    /**
     * Fails every job left {@code IN_PROGRESS}, which only happens when the process died while
     * the directory call was outstanding.
     *
     * @return ids of the jobs that were failed
     */
    List<Long> failInterrupted(String reason);
}
