package com.directory.actions.metrics;

import com.directory.actions.core.model.JobStatus;
import com.directory.actions.core.model.JobType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link SchedulerMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code desk.jobs.scheduled} Counter (tag: type)</li>
 *   <li>{@code desk.jobs.completed} Counter (tags: type, outcome)</li>
 *   <li>{@code desk.action.duration} Timer (tag: type)</li>
 *   <li>{@code desk.recovery.jobs} Counter (tag: kind = restored | overdue | interrupted)</li>
 * </ul>
 */
public class MicrometerSchedulerMetrics implements SchedulerMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();

    public MicrometerSchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementJobScheduled(JobType type) {
        String key = "scheduled:" + type.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("desk.jobs.scheduled")
                        .description("Number of jobs persisted and armed")
                        .tag("type", tagValue(type.name()))
                        .register(registry)).increment();
    }

    @Override
    public void incrementJobCompleted(JobType type, JobStatus outcome) {
        String key = "completed:" + type.name() + ":" + outcome.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("desk.jobs.completed")
                        .description("Number of jobs that reached a terminal status")
                        .tag("type", tagValue(type.name()))
                        .tag("outcome", tagValue(outcome.name()))
                        .register(registry)).increment();
    }

    @Override
    public void recordActionDuration(JobType type, Duration duration) {
        timerCache.computeIfAbsent(type.name(), k ->
                Timer.builder("desk.action.duration")
                        .description("Duration of external directory actions")
                        .tag("type", tagValue(type.name()))
                        .register(registry)).record(duration);
    }

    @Override
    public void recordRecovery(int restored, int overdue, int interrupted) {
        recoveryCounter("restored").increment(restored);
        recoveryCounter("overdue").increment(overdue);
        recoveryCounter("interrupted").increment(interrupted);
    }

    private Counter recoveryCounter(String kind) {
        return counterCache.computeIfAbsent("recovery:" + kind, k ->
                Counter.builder("desk.recovery.jobs")
                        .description("Jobs handled by startup recovery")
                        .tag("kind", kind)
                        .register(registry));
    }

    private static String tagValue(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
