package com.media.lifecycle.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one health check, or of the whole engine once aggregated.
 *
 * @param status  severity
 * @param message short explanation, e.g. the failing source and its error
 * @param details measurements such as ping latency, or per-check results when aggregated
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status {
        UP,
        /** Reconciles, but the last full run lost at least one source. */
        DEGRADED,
        DOWN;

        public Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthStatus {
        Objects.requireNonNull(status, "status is required");
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String message) {
        return new HealthStatus(Status.DEGRADED, message, Map.of());
    }

    public static HealthStatus down(String message) {
        return new HealthStatus(Status.DOWN, message, Map.of());
    }

    /**
     * DOWN status for a component whose call failed, keeping the exception type as a detail.
     */
    public static HealthStatus failed(String what, RuntimeException e) {
        return down(what + ": " + e.getMessage()).withDetail("error", e.getClass().getSimpleName());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
