package com.media.lifecycle.source;

import com.media.lifecycle.core.model.ProviderId;

import java.time.Instant;
import java.util.Map;

/**
 * A library entry reported by the media server, with per-user play data.
 *
 * @param id          media-server item id
 * @param name        title as known by the media server
 * @param providerIds provider ids keyed by {@link ProviderId#key()}
 * @param playCount   number of plays
 * @param lastPlayed  last play time, or null
 */
public record WatchedItem(String id, String name, Map<String, String> providerIds, int playCount, Instant lastPlayed) {

    public WatchedItem {
        providerIds = providerIds != null ? Map.copyOf(providerIds) : Map.of();
    }

    /**
     * Returns the id for the given provider, or null when absent or blank.
     */
    public String providerId(ProviderId provider) {
        String value = providerIds.get(provider.key());
        return value == null || value.isBlank() ? null : value;
    }
}
