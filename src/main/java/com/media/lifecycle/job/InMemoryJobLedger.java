package com.media.lifecycle.job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;

/**
 * Non-persistent job ledger. All methods synchronize on the ledger.
 */
public class InMemoryJobLedger implements JobLedger {

    public static final int DEFAULT_MAX_JOBS = 100;

    private final int maxJobs;
    private final LinkedList<JobRecord> jobs = new LinkedList<>();

    public InMemoryJobLedger() {
        this(DEFAULT_MAX_JOBS);
    }

    public InMemoryJobLedger(int maxJobs) {
        if (maxJobs <= 0) {
            throw new IllegalArgumentException("maxJobs must be > 0");
        }
        this.maxJobs = maxJobs;
    }

    @Override
    public synchronized void add(JobRecord job) {
        jobs.addFirst(job);
        while (jobs.size() > maxJobs) {
            jobs.removeLast();
        }
    }

    @Override
    public synchronized boolean update(JobRecord job) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(job.id())) {
                jobs.set(i, job);
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized Optional<JobRecord> get(String id) {
        return jobs.stream().filter(j -> j.id().equals(id)).findFirst();
    }

    @Override
    public synchronized List<JobRecord> getRecent(int n) {
        if (n <= 0) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(jobs.subList(0, Math.min(n, jobs.size()))));
    }

    @Override
    public synchronized Optional<JobRecord> getLatest() {
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.getFirst());
    }

    @Override
    public synchronized List<JobRecord> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(jobs));
    }
}
