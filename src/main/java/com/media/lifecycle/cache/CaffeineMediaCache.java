package com.media.lifecycle.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed {@link MediaCache} with size bound and write TTL.
 * When given a {@link MeterRegistry}, hit, miss and size meters are published under
 * the cache name {@value #METRIC_NAME}.
 */
public class CaffeineMediaCache implements MediaCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMediaCache.class);

    public static final String METRIC_NAME = "media";

    private final Cache<String, Object> cache;

    public CaffeineMediaCache(CacheConfig config, MeterRegistry registry) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .expireAfterWrite(config.ttl());
        if (registry != null) {
            builder.recordStats();
            this.cache = CaffeineCacheMetrics.monitor(registry, builder.<String, Object>build(), METRIC_NAME);
        } else {
            this.cache = builder.build();
        }
        log.info("cache.initialized maxEntries={} ttl={} metrics={}", config.maxEntries(), config.ttl(),
                registry != null);
    }

    /**
     * Creates the cache described by the config, or a no-op cache when it is disabled.
     */
    public static MediaCache create(CacheConfig config, MeterRegistry registry) {
        return config.enabled() ? new CaffeineMediaCache(config, registry) : new NoOpMediaCache();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = cache.getIfPresent(key);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    @Override
    public void put(String key, Object value) {
        if (value != null) {
            cache.put(key, value);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated scope=all");
    }
}
