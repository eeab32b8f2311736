package com.directory.actions.metrics;

import com.directory.actions.core.model.JobStatus;
import com.directory.actions.core.model.JobType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerSchedulerMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerSchedulerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerSchedulerMetrics(registry);
    }

    @Test
    @DisplayName("Should count scheduled jobs by type")
    void testScheduledCounter() {
        metrics.incrementJobScheduled(JobType.DISABLE_ACCOUNT);
        metrics.incrementJobScheduled(JobType.DISABLE_ACCOUNT);

        assertEquals(2.0, registry.get("desk.jobs.scheduled").tag("type", "disable_account").counter().count());
    }

    @Test
    @DisplayName("Should count completions by outcome")
    void testCompletedCounter() {
        metrics.incrementJobCompleted(JobType.DISABLE_ACCOUNT, JobStatus.DONE);
        metrics.incrementJobCompleted(JobType.DISABLE_ACCOUNT, JobStatus.FAILED);
        metrics.incrementJobCompleted(JobType.DISABLE_ACCOUNT, JobStatus.FAILED);

        assertEquals(1.0, registry.get("desk.jobs.completed").tag("outcome", "done").counter().count());
        assertEquals(2.0, registry.get("desk.jobs.completed").tag("outcome", "failed").counter().count());
    }

    @Test
    @DisplayName("Should time directory actions")
    void testActionTimer() {
        metrics.recordActionDuration(JobType.DISABLE_ACCOUNT, Duration.ofMillis(250));

        var timer = registry.get("desk.action.duration").timer();
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    @DisplayName("Should count recovered jobs by kind")
    void testRecovery() {
        metrics.recordRecovery(3, 1, 2);

        assertEquals(3.0, registry.get("desk.recovery.jobs").tag("kind", "restored").counter().count());
        assertEquals(1.0, registry.get("desk.recovery.jobs").tag("kind", "overdue").counter().count());
        assertEquals(2.0, registry.get("desk.recovery.jobs").tag("kind", "interrupted").counter().count());
    }

    @Test
    @DisplayName("No-op metrics accept every call")
    void testNoOp() {
        SchedulerMetrics noop = NoOpSchedulerMetrics.INSTANCE;
        assertDoesNotThrow(() -> {
            noop.incrementJobScheduled(JobType.DISABLE_ACCOUNT);
            noop.incrementJobCompleted(JobType.DISABLE_ACCOUNT, JobStatus.DONE);
            noop.recordActionDuration(JobType.DISABLE_ACCOUNT, Duration.ZERO);
            noop.recordRecovery(0, 0, 0);
        });
    }
}
