package com.media.lifecycle.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A media item whose scheduled deletion time has passed and which is not excluded.
 *
 * @param id            internal media id
 * @param title         display title
 * @param year          release year
 * @param type          media type
 * @param fileSize      size on disk in bytes
 * @param deleteAfter   scheduled deletion time
 * @param daysOverdue   whole days since {@code deleteAfter}
 * @param reason        human-readable deletion reason
 * @param lastWatched   last play time, or null
 * @param requested     whether the item was requested
 * @param requestedBy   requester username, or null
 * @param requesterEmail requester email, or null
 */
public record DeletionCandidate(
        String id,
        String title,
        int year,
        MediaType type,
        long fileSize,
        Instant deleteAfter,
        long daysOverdue,
        String reason,
        Instant lastWatched,
        boolean requested,
        String requestedBy,
        String requesterEmail
) {

    public DeletionCandidate {
        Objects.requireNonNull(type, "type");
    }

    /**
     * Builds a candidate from an item that already carries its schedule.
     */
    public static DeletionCandidate of(MediaItem item, long daysOverdue) {
        return of(item, item.getDeleteAfter(), daysOverdue, item.getDeletionReason());
    }

    public static DeletionCandidate of(MediaItem item, Instant deleteAfter, long daysOverdue, String reason) {
        return new DeletionCandidate(
                item.getId(),
                item.getTitle(),
                item.getYear(),
                item.getType(),
                item.getFileSize(),
                deleteAfter,
                daysOverdue,
                reason,
                item.getLastWatched(),
                item.isRequested(),
                item.getRequester().username(),
                item.getRequester().email()
        );
    }
}
