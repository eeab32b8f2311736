package com.directory.actions.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * In-process timer queue keyed by job id.
 *
 * <p>A single timer thread holds the pending timers ordered by fire time. At most one timer is
 * armed per job id: arming an id again cancels the earlier timer. When a timer fires the job id
 * is handed to the dispatch callback, which must not block the timer thread for long.</p>
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final ScheduledExecutorService timer;
    private final LongConsumer dispatcher;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<Long, ArmedTimer> armed = new HashMap<>();
    private long generation;

    /**
     * @param dispatcher receives the id of each job whose timer fired
     */
    public JobScheduler(LongConsumer dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "desk-job-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Arms (or re-arms) the timer for a job. A fire time in the past fires immediately.
     */
    public void arm(long jobId, Instant fireAt) {
        long delayMs = Math.max(0L, Duration.between(clock.instant(), fireAt).toMillis());
        synchronized (lock) {
            long gen = ++generation;
            ScheduledFuture<?> future = timer.schedule(() -> fire(jobId, gen), delayMs, TimeUnit.MILLISECONDS);
            ArmedTimer previous = armed.put(jobId, new ArmedTimer(gen, fireAt, future));
            if (previous != null) {
                previous.future().cancel(false);
                log.debug("timer.rearmed jobId={} previousFireAt={} fireAt={}", jobId, previous.fireAt(), fireAt);
            } else {
                log.debug("timer.armed jobId={} fireAt={} delayMs={}", jobId, fireAt, delayMs);
            }
        }
    }

    /**
     * @return true if a pending timer was cancelled
     */
    public boolean cancel(long jobId) {
        synchronized (lock) {
            ArmedTimer removed = armed.remove(jobId);
            if (removed == null) {
                return false;
            }
            removed.future().cancel(false);
            log.debug("timer.cancelled jobId={}", jobId);
            return true;
        }
    }

    public boolean isArmed(long jobId) {
        synchronized (lock) {
            return armed.containsKey(jobId);
        }
    }

    public int armedCount() {
        synchronized (lock) {
            return armed.size();
        }
    }

    /**
     * Fire time of the pending timer for a job, or null when none is armed.
     */
    public Instant fireTimeOf(long jobId) {
        synchronized (lock) {
            ArmedTimer t = armed.get(jobId);
            return t != null ? t.fireAt() : null;
        }
    }

    private void fire(long jobId, long gen) {
        synchronized (lock) {
            ArmedTimer current = armed.get(jobId);
            if (current == null || current.generation() != gen) {
                return;
            }
            armed.remove(jobId);
        }
        try {
            dispatcher.accept(jobId);
        } catch (RuntimeException e) {
            log.error("timer.dispatch_failed jobId={}", jobId, e);
        }
    }

    /**
     * Drops every pending timer. Jobs stay {@code SCHEDULED} in the store and are re-armed by
     * recovery on the next start.
     */
    public void shutdown() {
        synchronized (lock) {
            armed.values().forEach(t -> t.future().cancel(false));
            armed.clear();
        }
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Timer thread did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private record ArmedTimer(long generation, Instant fireAt, ScheduledFuture<?> future) {
    }
}
