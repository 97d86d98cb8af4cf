package com.media.lifecycle.reconcile;

import com.media.lifecycle.job.JobKind;
import com.media.lifecycle.job.JobStatus;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one reconciliation run, mirroring the job record written to the ledger.
 *
 * @param jobId              id of the job record
 * @param kind               full or incremental
 * @param status             terminal status
 * @param movies             movies in the library after the run
 * @param tvShows            TV shows in the library after the run
 * @param totalMedia         all items in the library after the run
 * @param scheduledDeletions overdue candidates found
 * @param deletedCount       items actually deleted
 * @param dryRun             dry-run flag in effect
 * @param enableDeletion     deletion switch in effect
 * @param sourceErrors       one entry per failed source step
 * @param lastError          last error seen, or null
 * @param duration           wall-clock duration
 */
public record ReconciliationResult(
        String jobId,
        JobKind kind,
        JobStatus status,
        int movies,
        int tvShows,
        int totalMedia,
        int scheduledDeletions,
        int deletedCount,
        boolean dryRun,
        boolean enableDeletion,
        List<String> sourceErrors,
        String lastError,
        Duration duration
) {

    public ReconciliationResult {
        sourceErrors = sourceErrors != null ? List.copyOf(sourceErrors) : List.of();
    }

    public boolean hasErrors() {
        return lastError != null;
    }

    @Override
    public String toString() {
        return "ReconciliationResult{" +
                "jobId='" + jobId + '\'' +
                ", kind=" + kind +
                ", status=" + status +
                ", totalMedia=" + totalMedia +
                ", scheduledDeletions=" + scheduledDeletions +
                ", deletedCount=" + deletedCount +
                ", errors=" + sourceErrors.size() +
                ", duration=" + duration.toMillis() + "ms" +
                '}';
    }
}
