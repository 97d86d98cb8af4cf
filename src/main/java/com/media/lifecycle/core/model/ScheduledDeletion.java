package com.media.lifecycle.core.model;

import java.time.Instant;

/**
 * An upcoming deletion, as shown in leaving-soon lists and the deletion timeline.
 */
public record ScheduledDeletion(
        String id,
        String title,
        int year,
        MediaType type,
        long fileSize,
        Instant deleteAfter,
        int daysUntilDue,
        String reason
) {

    public static ScheduledDeletion of(MediaItem item, String reason) {
        return new ScheduledDeletion(
                item.getId(),
                item.getTitle(),
                item.getYear(),
                item.getType(),
                item.getFileSize(),
                item.getDeleteAfter(),
                item.getDaysUntilDue(),
                reason
        );
    }
}
