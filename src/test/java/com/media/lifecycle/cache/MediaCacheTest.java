package com.media.lifecycle.cache;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MediaCache Tests")
class MediaCacheTest {

    @Nested
    @DisplayName("CaffeineMediaCache")
    class CaffeineTests {

        private final MediaCache cache = new CaffeineMediaCache(CacheConfig.defaults(), null);

        @Test
        @DisplayName("Should return cached values of the requested type")
        void typedGet() {
            cache.put(MediaCache.LEAVING_SOON, List.of("a"));

            assertEquals(List.of("a"), cache.get(MediaCache.LEAVING_SOON, List.class).orElseThrow());
            assertTrue(cache.get(MediaCache.LEAVING_SOON, String.class).isEmpty());
        }

        @Test
        @DisplayName("invalidateAll() should clear every entry")
        void invalidateAll() {
            cache.put(MediaCache.LEAVING_SOON, "x");
            cache.put(MediaCache.DELETION_TIMELINE, "y");

            cache.invalidateAll();

            assertTrue(cache.get(MediaCache.LEAVING_SOON, String.class).isEmpty());
            assertTrue(cache.get(MediaCache.DELETION_TIMELINE, String.class).isEmpty());
        }

        @Test
        @DisplayName("Null values should not be stored")
        void ignoresNull() {
            cache.put("k", null);
            assertTrue(cache.get("k", Object.class).isEmpty());
        }
    }

    @Nested
    @DisplayName("Cache metrics")
    class MetricsTests {

        @Test
        @DisplayName("Hits and misses should be published to the meter registry")
        void publishesHitsAndMisses() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            MediaCache cache = new CaffeineMediaCache(CacheConfig.defaults(), registry);

            cache.put(MediaCache.LEAVING_SOON, "x");
            cache.get(MediaCache.LEAVING_SOON, String.class);
            cache.get(MediaCache.DELETION_TIMELINE, String.class);

            assertEquals(1.0, registry.get("cache.gets")
                    .tag("cache", CaffeineMediaCache.METRIC_NAME).tag("result", "hit")
                    .functionCounter().count());
            assertEquals(1.0, registry.get("cache.gets")
                    .tag("cache", CaffeineMediaCache.METRIC_NAME).tag("result", "miss")
                    .functionCounter().count());
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Should reject a non-positive entry limit")
        void rejectsMaxEntries() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CacheConfig(0, Duration.ofMinutes(1), true));
        }

        @Test
        @DisplayName("Should reject a missing or non-positive TTL")
        void rejectsTtl() {
            assertThrows(NullPointerException.class, () -> new CacheConfig(10, null, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ZERO, true));
        }
    }

    @Nested
    @DisplayName("NoOpMediaCache")
    class NoOpTests {

        @Test
        @DisplayName("Should never return a value")
        void neverCaches() {
            MediaCache cache = new NoOpMediaCache();
            cache.put("k", "v");

            assertTrue(cache.get("k", String.class).isEmpty());
        }
    }

    @Test
    @DisplayName("create() should honor the enabled flag")
    void factory() {
        assertInstanceOf(CaffeineMediaCache.class, CaffeineMediaCache.create(CacheConfig.defaults(), null));
        assertInstanceOf(NoOpMediaCache.class,
                CaffeineMediaCache.create(CacheConfig.disabled(), new SimpleMeterRegistry()));
    }
}
