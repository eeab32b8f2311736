package com.directory.actions.core.model;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * Durable unit of deferred work.
 * Created when a deactivation is requested, mutated only by the executor, never deleted.
 */
public record Job(
        long id,
        JobType jobType,
        String targetHandle,
        ZonedDateTime runAt,
        JobStatus status,
        String createdBy,
        Map<String, String> metadata,
        Instant createdAt,
        Instant finishedAt,
        String lastError
) {
    public Job {
        Objects.requireNonNull(jobType, "jobType is required");
        Objects.requireNonNull(targetHandle, "targetHandle is required");
        Objects.requireNonNull(runAt, "runAt is required");
        Objects.requireNonNull(status, "status is required");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public boolean isLive() {
        return status.isLive();
    }

    /**
     * Whether the job's due time is at or before the given instant.
     */
    public boolean isDueAt(Instant now) {
        return !runAt.toInstant().isAfter(now);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private JobType jobType = JobType.DISABLE_ACCOUNT;
        private String targetHandle;
        private ZonedDateTime runAt;
        private JobStatus status = JobStatus.SCHEDULED;
        private String createdBy;
        private Map<String, String> metadata;
        private Instant createdAt = Instant.now();
        private Instant finishedAt;
        private String lastError;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder jobType(JobType jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder targetHandle(String targetHandle) {
            this.targetHandle = targetHandle;
            return this;
        }

        public Builder runAt(ZonedDateTime runAt) {
            this.runAt = runAt;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Job build() {
            return new Job(id, jobType, targetHandle, runAt, status, createdBy, metadata,
                    createdAt, finishedAt, lastError);
        }
    }
}
