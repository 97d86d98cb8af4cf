package com.media.lifecycle.health;

/**
 * Checks one collaborator of the engine, typically an external source.
 * Implementations may throw; the registry reports a throwing check as DOWN.
 */
public interface HealthCheck {

    /**
     * Key of this check in the aggregated details, e.g. {@code source:radarr}.
     */
    String name();

    HealthStatus check();
}
