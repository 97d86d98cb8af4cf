package com.media.lifecycle.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Scheduling of background reconciliation.
 *
 * @param fullInterval        delay between scheduled full reconciliations
 * @param incrementalInterval delay between scheduled incremental reconciliations
 * @param autoStart           whether {@code start()} launches a full reconciliation immediately
 */
public record SyncSettings(Duration fullInterval, Duration incrementalInterval, boolean autoStart) {

    public SyncSettings {
        Objects.requireNonNull(fullInterval, "fullInterval is required");
        Objects.requireNonNull(incrementalInterval, "incrementalInterval is required");
        if (fullInterval.isZero() || fullInterval.isNegative()) {
            throw new IllegalArgumentException("fullInterval must be positive");
        }
        if (incrementalInterval.isZero() || incrementalInterval.isNegative()) {
            throw new IllegalArgumentException("incrementalInterval must be positive");
        }
    }

    /**
     * Full every hour, incremental every 15 minutes, auto-start on.
     */
    public static SyncSettings defaults() {
        return new SyncSettings(Duration.ofHours(1), Duration.ofMinutes(15), true);
    }
}
