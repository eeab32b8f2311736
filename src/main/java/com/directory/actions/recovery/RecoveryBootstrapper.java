package com.directory.actions.recovery;

import com.directory.actions.audit.AuditAction;
import com.directory.actions.audit.AuditService;
import com.directory.actions.core.model.Job;
import com.directory.actions.logging.LogContext;
import com.directory.actions.metrics.SchedulerMetrics;
import com.directory.actions.scheduler.JobScheduler;
import com.directory.actions.store.CorruptJobRow;
import com.directory.actions.store.JobStore;
import com.directory.actions.store.ScheduledScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Re-arms persisted jobs after a restart.
 *
 * <p>Jobs found {@code IN_PROGRESS} were cut off mid-call; their outcome is unknown, so they are
 * failed rather than repeated. Overdue {@code SCHEDULED} jobs fire after a short delay, future
 * ones at their due time. Running the pass twice leaves one timer per job.</p>
 */
public class RecoveryBootstrapper {
    private static final Logger log = LoggerFactory.getLogger(RecoveryBootstrapper.class);

    public static final Duration DEFAULT_OVERDUE_DELAY = Duration.ofSeconds(5);
    public static final String INTERRUPTED_REASON = "interrupted by restart";

    private final JobStore jobStore;
    private final JobScheduler jobScheduler;
    private final AuditService auditService;
    private final SchedulerMetrics metrics;
    private final Clock clock;
    private final Duration overdueDelay;

    public RecoveryBootstrapper(JobStore jobStore, JobScheduler jobScheduler, AuditService auditService,
                                SchedulerMetrics metrics, Clock clock, Duration overdueDelay) {
        if (overdueDelay.isNegative()) {
            throw new IllegalArgumentException("overdueDelay must not be negative");
        }
        this.jobStore = jobStore;
        this.jobScheduler = jobScheduler;
        this.auditService = auditService;
        this.metrics = metrics;
        this.clock = clock;
        this.overdueDelay = overdueDelay;
    }

    public RecoveryReport restoreOnStartup() {
        try (LogContext ignored = LogContext.forRecovery()) {
            int interrupted = failInterrupted();

            ScheduledScan scan = jobStore.scanScheduled();
            Instant now = clock.instant();
            int overdue = 0;
            for (Job job : scan.jobs()) {
                if (job.isDueAt(now)) {
                    jobScheduler.arm(job.id(), now.plus(overdueDelay));
                    overdue++;
                    log.info("recovery.overdue jobId={} target={} runAt={} firesIn={}ms",
                            job.id(), job.targetHandle(), job.runAt(), overdueDelay.toMillis());
                } else {
                    jobScheduler.arm(job.id(), job.runAt().toInstant());
                    log.debug("recovery.armed jobId={} target={} runAt={}",
                            job.id(), job.targetHandle(), job.runAt());
                }
            }
            for (CorruptJobRow row : scan.corrupt()) {
                log.error("recovery.skipped jobId={} target={} problem='{}'", row.id(), row.targetHandle(), row.problem());
            }

            RecoveryReport report = new RecoveryReport(scan.jobs().size(), overdue, scan.corrupt().size(), interrupted);
            metrics.recordRecovery(report.restored(), report.overdue(), report.interrupted());
            log.info("recovery.completed restored={} overdue={} skipped={} interrupted={}",
                    report.restored(), report.overdue(), report.skipped(), report.interrupted());
            return report;
        }
    }

    private int failInterrupted() {
        List<Long> ids = jobStore.failInterrupted(INTERRUPTED_REASON);
        for (Long id : ids) {
            jobStore.findById(id).ifPresent(job -> auditService.record(job.createdBy(),
                    AuditAction.forJob(job.jobType()), job.targetHandle(), Map.of(
                            "status", "failed",
                            "reason", INTERRUPTED_REASON,
                            "job_id", Long.toString(id))));
        }
        return ids.size();
    }
}
