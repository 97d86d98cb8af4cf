package com.media.lifecycle.reconcile;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the engine.
 *
 * @param running                       true between {@code start()} and {@code stop()}
 * @param totalItems                    items in the library
 * @param movies                        movies in the library
 * @param tvShows                       TV shows in the library
 * @param excluded                      items flagged as excluded
 * @param fullInterval                  configured full reconciliation interval
 * @param incrementalInterval           configured incremental interval
 * @param lastFullReconciliation        completion time of the latest full run, or null
 * @param lastIncrementalReconciliation completion time of the latest incremental run, or null
 * @param reconciliationInFlight        true while a run holds the run lock
 */
public record EngineStatus(
        boolean running,
        int totalItems,
        int movies,
        int tvShows,
        int excluded,
        Duration fullInterval,
        Duration incrementalInterval,
        Instant lastFullReconciliation,
        Instant lastIncrementalReconciliation,
        boolean reconciliationInFlight
) {}
