package com.media.lifecycle.health;

import com.media.lifecycle.core.SyncContext;
import com.media.lifecycle.source.MediaSource;

/**
 * Pings one external source. An unreachable source reports DOWN.
 */
public class SourceHealthCheck implements HealthCheck {

    private final MediaSource source;

    public SourceHealthCheck(MediaSource source) {
        this.source = source;
    }

    @Override
    public String name() {
        return "source:" + source.name();
    }

    @Override
    public HealthStatus check() {
        long start = System.nanoTime();
        try {
            source.ping(SyncContext.of("health"));
            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            return HealthStatus.up().withDetail("latencyMs", latencyMs);
        } catch (RuntimeException e) {
            return HealthStatus.failed("Unreachable", e);
        }
    }
}
