package com.media.lifecycle.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All scheduled deletions grouped by the calendar day (UTC) they fall due.
 *
 * @param totalItems     number of scheduled, non-excluded items
 * @param totalSizeBytes combined size of those items
 * @param byDate         items keyed by due date, earliest first
 * @param leavingSoon    items due within the leaving-soon window
 */
public record DeletionTimeline(
        int totalItems,
        long totalSizeBytes,
        Map<LocalDate, List<ScheduledDeletion>> byDate,
        List<ScheduledDeletion> leavingSoon
) {

    public DeletionTimeline {
        byDate = byDate != null ? Collections.unmodifiableMap(new TreeMap<>(byDate)) : Map.of();
        leavingSoon = leavingSoon != null ? List.copyOf(leavingSoon) : List.of();
    }

    public static DeletionTimeline empty() {
        return new DeletionTimeline(0, 0, Map.of(), List.of());
    }
}
