package com.media.lifecycle.reconcile;

import com.media.lifecycle.core.model.DeletionCandidate;

import java.util.List;

/**
 * Overdue, non-excluded items, earliest deletion time first.
 */
public record CandidateSet(int count, List<DeletionCandidate> candidates) {

    public CandidateSet {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        if (count != candidates.size()) {
            throw new IllegalArgumentException("count " + count + " does not match " + candidates.size() + " candidates");
        }
    }

    public static CandidateSet of(List<DeletionCandidate> candidates) {
        return new CandidateSet(candidates.size(), candidates);
    }

    public static CandidateSet empty() {
        return new CandidateSet(0, List.of());
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
