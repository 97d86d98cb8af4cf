package com.media.lifecycle.job;

import com.media.lifecycle.storage.JsonFileStore;
import com.media.lifecycle.storage.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Job ledger backed by {@code jobs.json} in a data directory.
 * Keeps at most {@code maxJobs} entries, newest first, and rewrites the file on each change.
 */
public class FileJobLedger implements JobLedger {
    private static final Logger log = LoggerFactory.getLogger(FileJobLedger.class);

    public static final String FILE_NAME = "jobs.json";
    static final String VERSION = "1.0";

    private final JsonFileStore<Document> store;
    private final int maxJobs;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<JobRecord> jobs = new ArrayList<>();

    public FileJobLedger(Path dataDir) {
        this(dataDir, InMemoryJobLedger.DEFAULT_MAX_JOBS);
    }

    public FileJobLedger(Path dataDir, int maxJobs) {
        if (maxJobs <= 0) {
            throw new IllegalArgumentException("maxJobs must be > 0");
        }
        this.store = new JsonFileStore<>(dataDir.resolve(FILE_NAME), Document.class);
        this.maxJobs = maxJobs;
        load();
    }

    private void load() {
        try {
            store.read().ifPresent(doc -> {
                if (doc.jobs() != null) {
                    jobs.addAll(doc.jobs());
                    trim();
                }
                log.info("jobs.loaded count={} file={}", jobs.size(), store.file());
            });
        } catch (PersistenceException e) {
            log.warn("jobs.loadFailed file={} error={}, starting fresh", store.file(), e.getMessage());
        }
    }

    @Override
    public void add(JobRecord job) {
        lock.writeLock().lock();
        try {
            jobs.add(0, job);
            trim();
            save();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean update(JobRecord job) {
        lock.writeLock().lock();
        try {
            for (int i = 0; i < jobs.size(); i++) {
                if (jobs.get(i).id().equals(job.id())) {
                    jobs.set(i, job);
                    save();
                    return true;
                }
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<JobRecord> get(String id) {
        lock.readLock().lock();
        try {
            return jobs.stream().filter(j -> j.id().equals(id)).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<JobRecord> getRecent(int n) {
        lock.readLock().lock();
        try {
            if (n <= 0) {
                return List.of();
            }
            return Collections.unmodifiableList(new ArrayList<>(jobs.subList(0, Math.min(n, jobs.size()))));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<JobRecord> getLatest() {
        lock.readLock().lock();
        try {
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<JobRecord> getAll() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(jobs));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void trim() {
        while (jobs.size() > maxJobs) {
            jobs.remove(jobs.size() - 1);
        }
    }

    // caller holds the write lock
    private void save() {
        store.write(new Document(VERSION, new ArrayList<>(jobs)));
    }

    /**
     * On-disk layout of the jobs file.
     */
    public record Document(String version, List<JobRecord> jobs) {}
}
