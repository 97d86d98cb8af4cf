package com.media.lifecycle.job;

/**
 * Lifecycle of a job record. A job moves from {@code RUNNING} to exactly one terminal status.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
