package com.media.lifecycle.job;

import java.util.List;
import java.util.Optional;

/**
 * Bounded history of reconciliation runs, most recent first.
 */
public interface JobLedger {

    /**
     * Prepends a job, evicting the oldest entries beyond capacity.
     */
    void add(JobRecord job);

    /**
     * Replaces the job with the same id.
     *
     * @return true if a job with that id was present
     */
    boolean update(JobRecord job);

    Optional<JobRecord> get(String id);

    /**
     * Returns up to {@code n} jobs, most recent first.
     */
    List<JobRecord> getRecent(int n);

    Optional<JobRecord> getLatest();

    List<JobRecord> getAll();
}
