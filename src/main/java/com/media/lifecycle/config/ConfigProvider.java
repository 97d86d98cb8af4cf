package com.media.lifecycle.config;

import java.util.Objects;

/**
 * Supplies the current configuration snapshot. Called on every evaluation so that
 * configuration reloads take effect without restarting the engine.
 */
@FunctionalInterface
public interface ConfigProvider {

    LifecycleConfig current();

    /**
     * Returns a provider that always yields the given snapshot.
     */
    static ConfigProvider fixed(LifecycleConfig config) {
        Objects.requireNonNull(config, "config");
        return () -> config;
    }
}
