package com.media.lifecycle.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reloadable {@link ConfigProvider}. A configuration loader calls {@link #update}
 * after validating a new snapshot; readers see it on their next evaluation.
 */
public class AtomicConfigProvider implements ConfigProvider {
    private static final Logger log = LoggerFactory.getLogger(AtomicConfigProvider.class);

    private final AtomicReference<LifecycleConfig> current;

    public AtomicConfigProvider() {
        this(LifecycleConfig.defaults());
    }

    public AtomicConfigProvider(LifecycleConfig initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    @Override
    public LifecycleConfig current() {
        return current.get();
    }

    /**
     * Replaces the active snapshot and returns the previous one.
     */
    public LifecycleConfig update(LifecycleConfig config) {
        Objects.requireNonNull(config, "config");
        LifecycleConfig previous = current.getAndSet(config);
        log.info("config.reloaded movieRetention={} tvRetention={} advancedRules={} dryRun={}",
                config.retention().movieRetention(), config.retention().tvRetention(),
                config.advancedRules().size(), config.app().dryRun());
        return previous;
    }
}
