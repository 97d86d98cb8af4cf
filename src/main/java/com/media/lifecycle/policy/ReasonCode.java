package com.media.lifecycle.policy;

/**
 * Machine-readable outcome of a policy evaluation.
 */
public enum ReasonCode {
    EXCLUDED,
    /** Requested item protected because no advanced rules are configured. */
    REQUESTED,
    RETENTION_DISABLED,
    INVALID_RETENTION,
    /** A require-watched rule matched an item with no plays. */
    NOT_WATCHED_YET,
    WITHIN_RETENTION,
    RETENTION_EXPIRED
}
