package com.media.lifecycle.core;

import com.media.lifecycle.logging.LogContext;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Caller context passed through a reconciliation run and on to every source call.
 * Sources may honor the deadline; the engine does not check it between steps.
 *
 * @param correlationId id that ties log lines and the job record together
 * @param triggeredBy   actor that started the work, e.g. {@code scheduler} or {@code api}
 * @param deadline      optional time after which sources should give up
 */
public record SyncContext(String correlationId, String triggeredBy, Instant deadline) {

    public static final String SCHEDULER = "scheduler";
    public static final String API = "api";

    public SyncContext {
        Objects.requireNonNull(correlationId, "correlationId is required");
        Objects.requireNonNull(triggeredBy, "triggeredBy is required");
    }

    /**
     * A context with a fresh correlation id and no deadline.
     */
    public static SyncContext background() {
        return of(SCHEDULER);
    }

    public static SyncContext of(String triggeredBy) {
        return new SyncContext(LogContext.generateCorrelationId(), triggeredBy, null);
    }

    public SyncContext withDeadline(Instant deadline) {
        return new SyncContext(correlationId, triggeredBy, deadline);
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isExpired(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }
}
