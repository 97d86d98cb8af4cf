package com.media.lifecycle.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the full and incremental reconciliation loops on one daemon thread.
 * Each loop waits one interval before its first run.
 */
class ReconciliationScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> fullTask;
    private ScheduledFuture<?> incrementalTask;

    synchronized void start(Duration fullInterval, Duration incrementalInterval,
                            Runnable fullRun, Runnable incrementalRun) {
        if (executor != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("media-reconcile-"));
        fullTask = executor.scheduleWithFixedDelay(guard("full", fullRun),
                fullInterval.toMillis(), fullInterval.toMillis(), TimeUnit.MILLISECONDS);
        incrementalTask = executor.scheduleWithFixedDelay(guard("incremental", incrementalRun),
                incrementalInterval.toMillis(), incrementalInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("scheduler.started fullInterval={} incrementalInterval={}", fullInterval, incrementalInterval);
    }

    /**
     * Cancels both loops. A run already in progress is left to finish; only later ticks
     * are prevented. Does not wait for the scheduler thread.
     */
    synchronized void stop() {
        if (executor == null) {
            return;
        }
        fullTask.cancel(false);
        incrementalTask.cancel(false);
        executor.shutdown();
        executor = null;
        fullTask = null;
        incrementalTask = null;
        log.info("scheduler.stopped");
    }

    @Override
    public void close() {
        stop();
    }

    // A task that throws is never run again by the executor.
    private static Runnable guard(String loop, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("scheduler.runFailed loop={} error={}", loop, e.getMessage(), e);
            }
        };
    }
}
