package com.media.lifecycle.cache;

import java.util.Optional;

/**
 * Cache for data derived from the media library, such as the leaving-soon list and
 * the deletion timeline. Entries are stale after any reconciliation, exclusion change
 * or deletion, and the engine clears them at those points.
 */
public interface MediaCache {

    String LEAVING_SOON = "library:leaving_soon";
    String DELETION_TIMELINE = "timeline:deletion";

    /**
     * Returns the cached value if present and of the requested type.
     */
    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value);

    void invalidateAll();
}
