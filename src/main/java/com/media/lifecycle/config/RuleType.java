package com.media.lifecycle.config;

/**
 * Kind of advanced retention rule.
 */
public enum RuleType {
    /** Applies to items carrying a given catalog tag. */
    TAG,
    /** Applies to items requested by listed users. */
    USER,
    /** Applies to every item, optionally only once watched. */
    WATCHED
}
