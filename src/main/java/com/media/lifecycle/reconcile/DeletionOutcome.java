package com.media.lifecycle.reconcile;

import com.media.lifecycle.core.model.DeletionCandidate;

import java.util.List;

/**
 * Result of executing a batch of deletions. Failed and skipped candidates are not listed.
 */
public record DeletionOutcome(int deletedCount, List<DeletionCandidate> deletedItems) {

    public DeletionOutcome {
        deletedItems = deletedItems != null ? List.copyOf(deletedItems) : List.of();
    }

    public static DeletionOutcome none() {
        return new DeletionOutcome(0, List.of());
    }
}
