package com.media.lifecycle.metrics;

import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.job.JobKind;
import com.media.lifecycle.job.JobStatus;

import java.time.Duration;

/**
 * Records reconciliation metrics.
 * The default {@link NoOpReconciliationMetrics} does nothing.
 */
public interface ReconciliationMetrics {

    void recordRunDuration(JobKind kind, JobStatus status, Duration duration);

    void incrementRunRejected(JobKind kind);

    void recordItemsIngested(String source, int count);

    void incrementSourceFailure(String source);

    void recordDeletionCandidates(int count);

    void incrementDeleted(MediaType type);

    void incrementDeletionFailed(MediaType type);
}
