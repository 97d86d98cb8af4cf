package com.media.lifecycle.health;

import com.media.lifecycle.job.JobKind;
import com.media.lifecycle.job.JobLedger;
import com.media.lifecycle.job.JobRecord;
import com.media.lifecycle.job.JobStatus;

import java.util.Optional;

/**
 * Reports on the most recent full reconciliation: DOWN if it failed,
 * DEGRADED if it completed with source errors.
 */
public class ReconciliationHealthCheck implements HealthCheck {

    private static final int LOOKBACK = 10;

    private final JobLedger jobs;

    public ReconciliationHealthCheck(JobLedger jobs) {
        this.jobs = jobs;
    }

    @Override
    public String name() {
        return "reconciliation";
    }

    @Override
    public HealthStatus check() {
        Optional<JobRecord> last = jobs.getRecent(LOOKBACK).stream()
                .filter(job -> job.kind() == JobKind.FULL_RECONCILIATION && job.status().isTerminal())
                .findFirst();
        if (last.isEmpty()) {
            return HealthStatus.up("No completed full reconciliation yet");
        }
        JobRecord job = last.get();
        HealthStatus base;
        if (job.status() == JobStatus.FAILED) {
            base = HealthStatus.down("Last full reconciliation failed: " + job.error());
        } else if (job.error() != null) {
            base = HealthStatus.degraded("Last full reconciliation had errors: " + job.error());
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("jobId", job.id())
                .withDetail("completedAt", String.valueOf(job.completedAt()))
                .withDetail("durationMs", job.durationMs());
    }
}
