package com.directory.actions.scheduler;

import com.directory.actions.audit.AuditAction;
import com.directory.actions.audit.AuditService;
import com.directory.actions.core.model.Job;
import com.directory.actions.core.model.JobStatus;
import com.directory.actions.directory.ActionOutcome;
import com.directory.actions.directory.DirectoryActionExecutor;
import com.directory.actions.logging.LogContext;
import com.directory.actions.metrics.NoOpSchedulerMetrics;
import com.directory.actions.metrics.SchedulerMetrics;
import com.directory.actions.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fired jobs against the directory.
 *
 * <p>Each execution claims the job ({@code SCHEDULED -> IN_PROGRESS}) and skips it when the claim
 * is lost, so a job reaches the directory at most once. The directory call runs on the action
 * pool with a timeout and outside any store lock. The outcome is always written back as
 * {@code DONE} or {@code FAILED} with an audit entry. Failures are terminal; nothing is retried
 * and no exception leaves {@link #execute(long)}.</p>
 */
public class JobExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    public static final Duration DEFAULT_ACTION_TIMEOUT = Duration.ofSeconds(120);
    private static final int RUNNER_THREADS = 4;

    private final JobStore jobStore;
    private final DirectoryActionExecutor actionExecutor;
    private final AuditService auditService;
    private final SchedulerMetrics metrics;
    private final Duration actionTimeout;
    private final ExecutorService runnerPool;
    private final ExecutorService actionPool;

    public JobExecutor(JobStore jobStore, DirectoryActionExecutor actionExecutor, AuditService auditService) {
        this(jobStore, actionExecutor, auditService, NoOpSchedulerMetrics.INSTANCE, DEFAULT_ACTION_TIMEOUT);
    }

    public JobExecutor(JobStore jobStore, DirectoryActionExecutor actionExecutor, AuditService auditService,
                       SchedulerMetrics metrics, Duration actionTimeout) {
        if (actionTimeout.isNegative() || actionTimeout.isZero()) {
            throw new IllegalArgumentException("actionTimeout must be positive");
        }
        this.jobStore = jobStore;
        this.actionExecutor = actionExecutor;
        this.auditService = auditService;
        this.metrics = metrics;
        this.actionTimeout = actionTimeout;
        this.runnerPool = Executors.newFixedThreadPool(RUNNER_THREADS, namedThreads("desk-job-runner"));
        this.actionPool = Executors.newCachedThreadPool(namedThreads("desk-directory-action"));
    }

    /**
     * Hands a fired job to the runner pool so the timer thread is never blocked by a slow call.
     */
    public void submit(long jobId) {
        try {
            runnerPool.execute(() -> execute(jobId));
        } catch (RejectedExecutionException e) {
            log.warn("job.rejected jobId={} reason=executor shut down; job stays SCHEDULED", jobId);
        }
    }

    /**
     * Executes one job synchronously.
     *
     * @return the terminal status written, or empty when the job was missing, already claimed,
     * already terminal, or moved by someone else while the directory call was outstanding
     */
    public Optional<JobStatus> execute(long jobId) {
        try {
            Optional<Job> found = jobStore.findById(jobId);
            if (found.isEmpty()) {
                log.warn("job.missing jobId={}", jobId);
                return Optional.empty();
            }
            Job job = found.get();
            try (LogContext ignored = LogContext.forJob(job.id(), job.targetHandle())) {
                if (!jobStore.claim(jobId)) {
                    log.info("job.skipped jobId={} status={}", jobId, job.status());
                    return Optional.empty();
                }
                log.info("job.fired jobId={} type={} target={} runAt={}",
                        jobId, job.jobType(), job.targetHandle(), job.runAt());
                long start = System.nanoTime();
                ActionOutcome outcome = invoke(job);
                metrics.recordActionDuration(job.jobType(), Duration.ofNanos(System.nanoTime() - start));
                return complete(job, outcome);
            }
        } catch (RuntimeException e) {
            // Store failure around the claim or the write-back; a row left IN_PROGRESS is failed at next start
            log.error("job.execution_error jobId={}", jobId, e);
            return Optional.empty();
        }
    }

    private ActionOutcome invoke(Job job) {
        Future<ActionOutcome> call;
        try {
            call = actionPool.submit(() -> actionExecutor.performAction(job.jobType(), job.targetHandle()));
        } catch (RejectedExecutionException e) {
            return ActionOutcome.failed("executor shut down");
        }
        try {
            ActionOutcome outcome = call.get(actionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return outcome != null ? outcome : ActionOutcome.failed("no outcome returned");
        } catch (TimeoutException e) {
            call.cancel(true);
            return ActionOutcome.failed("timed out after " + actionTimeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("job.action_error jobId={} error={}", job.id(), cause.toString());
            return ActionOutcome.failed(describe(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return ActionOutcome.failed("interrupted");
        }
    }

    private Optional<JobStatus> complete(Job job, ActionOutcome outcome) {
        AuditAction auditAction = AuditAction.forJob(job.jobType());
        if (outcome.success()) {
            if (!jobStore.markDone(job.id())) {
                return discarded(job, JobStatus.DONE);
            }
            auditService.record(job.createdBy(), auditAction, job.targetHandle(), Map.of(
                    "status", "ok",
                    "job_id", Long.toString(job.id())));
            metrics.incrementJobCompleted(job.jobType(), JobStatus.DONE);
            log.info("job.done jobId={} target={}", job.id(), job.targetHandle());
            return Optional.of(JobStatus.DONE);
        }
        String reason = outcome.message().isBlank() ? "action failed" : outcome.message();
        if (!jobStore.markFailed(job.id(), reason)) {
            return discarded(job, JobStatus.FAILED);
        }
        auditService.record(job.createdBy(), auditAction, job.targetHandle(), Map.of(
                "status", "failed",
                "reason", reason,
                "job_id", Long.toString(job.id())));
        metrics.incrementJobCompleted(job.jobType(), JobStatus.FAILED);
        log.warn("job.failed jobId={} target={} reason='{}'", job.id(), job.targetHandle(), reason);
        return Optional.of(JobStatus.FAILED);
    }

    // The row left IN_PROGRESS while the call was outstanding; whoever moved it owns its audit entry.
    private Optional<JobStatus> discarded(Job job, JobStatus attempted) {
        String current = jobStore.findById(job.id()).map(j -> j.status().name()).orElse("MISSING");
        log.warn("job.outcome_discarded jobId={} target={} outcome={} status={}",
                job.id(), job.targetHandle(), attempted, current);
        return Optional.empty();
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        shutdownPool(runnerPool);
        shutdownPool(actionPool);
    }

    private static void shutdownPool(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
