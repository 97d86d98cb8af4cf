package com.media.lifecycle.exclusion;

import java.util.List;
import java.util.Optional;

/**
 * Set of media items protected from deletion regardless of retention policy.
 * Implementations persist each mutation before returning.
 */
public interface ExclusionStore {

    boolean isExcluded(String externalId);

    /**
     * Adds or replaces the exclusion keyed by {@link ExclusionRecord#externalId()}.
     *
     * @throws com.media.lifecycle.storage.PersistenceException if the change cannot be persisted
     */
    void add(ExclusionRecord record);

    /**
     * Removes an exclusion. Removing an id that is not excluded is a no-op.
     *
     * @return true if a record was removed
     * @throws com.media.lifecycle.storage.PersistenceException if the change cannot be persisted
     */
    boolean remove(String externalId);

    Optional<ExclusionRecord> get(String externalId);

    List<ExclusionRecord> getAll();

    int size();
}
