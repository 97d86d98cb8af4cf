package com.media.lifecycle.metrics;

import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.job.JobKind;
import com.media.lifecycle.job.JobStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link ReconciliationMetrics}.
 */
public class NoOpReconciliationMetrics implements ReconciliationMetrics {

    @Override
    public void recordRunDuration(JobKind kind, JobStatus status, Duration duration) {
    }

    @Override
    public void incrementRunRejected(JobKind kind) {
    }

    @Override
    public void recordItemsIngested(String source, int count) {
    }

    @Override
    public void incrementSourceFailure(String source) {
    }

    @Override
    public void recordDeletionCandidates(int count) {
    }

    @Override
    public void incrementDeleted(MediaType type) {
    }

    @Override
    public void incrementDeletionFailed(MediaType type) {
    }
}
