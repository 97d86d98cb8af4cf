package com.media.lifecycle.core.model;

/**
 * Outcome of matching a catalog item against the primary watch-history source.
 */
public enum WatchMatchStatus {
    /** Not yet compared against the watch-history source. */
    UNKNOWN,
    MATCHED,
    NOT_FOUND,
    /** Same title found under a different provider id. */
    METADATA_MISMATCH
}
