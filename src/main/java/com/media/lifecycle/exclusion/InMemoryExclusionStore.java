package com.media.lifecycle.exclusion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent exclusion store. Thread-safe via ConcurrentHashMap.
 */
public class InMemoryExclusionStore implements ExclusionStore {

    private final Map<String, ExclusionRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean isExcluded(String externalId) {
        return externalId != null && records.containsKey(externalId);
    }

    @Override
    public void add(ExclusionRecord record) {
        records.put(record.externalId(), record);
    }

    @Override
    public boolean remove(String externalId) {
        return records.remove(externalId) != null;
    }

    @Override
    public Optional<ExclusionRecord> get(String externalId) {
        return Optional.ofNullable(records.get(externalId));
    }

    @Override
    public List<ExclusionRecord> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    @Override
    public int size() {
        return records.size();
    }
}
