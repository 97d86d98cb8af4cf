package com.media.lifecycle.reconcile;

/**
 * Counts from matching catalog items against the watch-history source.
 */
public record WatchMatchStats(int matched, int notFound, int mismatched) {

    public static WatchMatchStats empty() {
        return new WatchMatchStats(0, 0, 0);
    }

    public WatchMatchStats plus(WatchMatchStats other) {
        return new WatchMatchStats(matched + other.matched, notFound + other.notFound,
                mismatched + other.mismatched);
    }

    public int total() {
        return matched + notFound + mismatched;
    }
}
