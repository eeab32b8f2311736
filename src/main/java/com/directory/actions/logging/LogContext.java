package com.directory.actions.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forJob(job.id(), job.targetHandle())) {
 *     log.info("job.done jobId={}", job.id());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one job execution on the timer or action thread.
     */
    public static LogContext forJob(long jobId, String targetHandle) {
        LogContext ctx = new LogContext();
        ctx.put("jobId", Long.toString(jobId));
        ctx.put("target", targetHandle);
        ctx.put("operation", "job");
        return ctx;
    }

    /**
     * Context for one operator request.
     */
    public static LogContext forRequest(String correlationId, String principal) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("principal", principal);
        ctx.put("operation", "request");
        return ctx;
    }

    public static LogContext forRecovery() {
        LogContext ctx = new LogContext();
        ctx.put("operation", "recovery");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
