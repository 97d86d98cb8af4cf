package com.media.lifecycle.job;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One reconciliation run.
 *
 * @param id          unique job id
 * @param kind        full or incremental
 * @param status      current status
 * @param startedAt   start time
 * @param completedAt completion time, null while running
 * @param durationMs  run duration in milliseconds, 0 while running
 * @param summary     free-form counters and previews
 * @param error       last error seen during the run, or null
 */
public record JobRecord(
        String id,
        JobKind kind,
        JobStatus status,
        Instant startedAt,
        Instant completedAt,
        long durationMs,
        Map<String, Object> summary,
        String error
) {

    public JobRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
        summary = summary != null ? Collections.unmodifiableMap(new LinkedHashMap<>(summary)) : Map.of();
    }

    /**
     * Creates a new running job with a random id.
     */
    public static JobRecord start(JobKind kind, Instant startedAt) {
        return new JobRecord(UUID.randomUUID().toString(), kind, JobStatus.RUNNING,
                startedAt, null, 0, Map.of(), null);
    }

    /**
     * Returns a terminal copy of this job.
     *
     * @throws IllegalStateException if this job is already terminal
     * @throws IllegalArgumentException if {@code status} is not terminal
     */
    public JobRecord finish(JobStatus status, Instant completedAt, Map<String, Object> summary, String error) {
        if (this.status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " already finished with status " + this.status);
        }
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        long duration = Duration.between(startedAt, completedAt).toMillis();
        return new JobRecord(id, kind, status, startedAt, completedAt, duration, summary, error);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return completedAt != null;
    }
}
