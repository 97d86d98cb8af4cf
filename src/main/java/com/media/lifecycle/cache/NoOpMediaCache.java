package com.media.lifecycle.cache;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpMediaCache implements MediaCache {

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void put(String key, Object value) {
    }

    @Override
    public void invalidateAll() {
    }
}
