package com.media.lifecycle.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forJob(correlationId, jobId, "full_sync")) {
 *     log.info("reconcile.started jobId={}", jobId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a reconciliation run.
     */
    public static LogContext forJob(String correlationId, String jobId, String jobKind) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("jobId", jobId);
        ctx.put("jobKind", jobKind);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Context for deleting one media item.
     */
    public static LogContext forDeletion(String correlationId, String mediaId, boolean simulate) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("mediaId", mediaId);
        ctx.put("simulate", Boolean.toString(simulate));
        ctx.put("operation", "delete");
        return ctx;
    }

    /**
     * Context for adding or removing an exclusion.
     */
    public static LogContext forExclusion(String correlationId, String mediaId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("mediaId", mediaId);
        ctx.put("operation", "exclusion");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another key-value pair to this context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
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
