package com.media.lifecycle.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for the cache of derived library views.
 *
 * @param maxEntries upper bound on cached views
 * @param ttl        how long a view may be served before it is rebuilt, even without
 *                   an invalidating change
 * @param enabled    false to serve every view straight from the library
 */
public record CacheConfig(int maxEntries, Duration ttl, boolean enabled) {

    public CacheConfig {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        Objects.requireNonNull(ttl, "ttl is required");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * Room for every view with a ten minute TTL. Views are also dropped after each run.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(16, Duration.ofMinutes(10), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
