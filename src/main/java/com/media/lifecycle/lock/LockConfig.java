package com.media.lifecycle.lock;

/**
 * Configuration for run locks.
 *
 * @param waitTimeoutMs how long a caller waits for a held lock before giving up; 0 means fail immediately
 */
public record LockConfig(long waitTimeoutMs) {

    public LockConfig {
        if (waitTimeoutMs < 0) {
            throw new IllegalArgumentException("waitTimeoutMs must be >= 0");
        }
    }

    /**
     * Fail immediately when the lock is held.
     */
    public static LockConfig defaults() {
        return new LockConfig(0);
    }
}
