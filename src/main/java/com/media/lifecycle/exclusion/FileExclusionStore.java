package com.media.lifecycle.exclusion;

import com.media.lifecycle.storage.JsonFileStore;
import com.media.lifecycle.storage.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exclusion store backed by {@code exclusions.json} in a data directory.
 * Every mutation rewrites the file while holding the write lock. A file that
 * cannot be parsed at startup is logged and replaced on the next mutation.
 */
public class FileExclusionStore implements ExclusionStore {
    private static final Logger log = LoggerFactory.getLogger(FileExclusionStore.class);

    public static final String FILE_NAME = "exclusions.json";
    static final String VERSION = "1.0";

    private final JsonFileStore<Document> store;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ExclusionRecord> records = new LinkedHashMap<>();
    private Instant updatedAt;

    public FileExclusionStore(Path dataDir) {
        this(dataDir, Clock.systemUTC());
    }

    public FileExclusionStore(Path dataDir, Clock clock) {
        this.store = new JsonFileStore<>(dataDir.resolve(FILE_NAME), Document.class);
        this.clock = clock;
        load();
    }

    private void load() {
        try {
            store.read().ifPresent(doc -> {
                if (doc.items() != null) {
                    records.putAll(doc.items());
                }
                updatedAt = doc.updatedAt();
                log.info("exclusions.loaded count={} file={}", records.size(), store.file());
            });
        } catch (PersistenceException e) {
            log.warn("exclusions.loadFailed file={} error={}, starting fresh", store.file(), e.getMessage());
        }
    }

    @Override
    public boolean isExcluded(String externalId) {
        lock.readLock().lock();
        try {
            return externalId != null && records.containsKey(externalId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void add(ExclusionRecord record) {
        lock.writeLock().lock();
        try {
            ExclusionRecord previous = records.put(record.externalId(), record);
            try {
                save();
            } catch (PersistenceException e) {
                if (previous != null) {
                    records.put(record.externalId(), previous);
                } else {
                    records.remove(record.externalId());
                }
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(String externalId) {
        lock.writeLock().lock();
        try {
            ExclusionRecord removed = records.remove(externalId);
            try {
                save();
            } catch (PersistenceException e) {
                if (removed != null) {
                    records.put(externalId, removed);
                }
                throw e;
            }
            return removed != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ExclusionRecord> get(String externalId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(externalId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ExclusionRecord> getAll() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(records.values()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Time of the last persisted mutation, or null if never written.
     */
    public Instant getUpdatedAt() {
        lock.readLock().lock();
        try {
            return updatedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private void save() {
        Instant now = clock.instant();
        store.write(new Document(VERSION, now, new LinkedHashMap<>(records)));
        updatedAt = now;
        log.debug("exclusions.saved count={}", records.size());
    }

    /**
     * On-disk layout of the exclusions file.
     */
    public record Document(String version, Instant updatedAt, Map<String, ExclusionRecord> items) {}
}
