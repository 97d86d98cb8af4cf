package com.media.lifecycle.source;

import java.time.Instant;
import java.util.Objects;

/**
 * One playback activity row.
 *
 * @param itemId    media-server item id that was played
 * @param watchedAt when the activity was recorded
 */
public record PlaybackEvent(String itemId, Instant watchedAt) {

    public PlaybackEvent {
        Objects.requireNonNull(itemId, "itemId is required");
        Objects.requireNonNull(watchedAt, "watchedAt is required");
    }
}
