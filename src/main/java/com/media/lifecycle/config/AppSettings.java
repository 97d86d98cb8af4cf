package com.media.lifecycle.config;

/**
 * Global switches for deletion behavior.
 *
 * @param dryRun          when true, deletions are computed but never executed
 * @param enableDeletion  master switch for executing deletions during a full reconciliation
 * @param leavingSoonDays window, in days, for the leaving-soon list
 */
public record AppSettings(boolean dryRun, boolean enableDeletion, int leavingSoonDays) {

    public AppSettings {
        if (leavingSoonDays < 0) {
            throw new IllegalArgumentException("leavingSoonDays must be >= 0");
        }
    }

    /**
     * Safe defaults: dry run on, deletion off, 14-day leaving-soon window.
     */
    public static AppSettings defaults() {
        return new AppSettings(true, false, 14);
    }

    /**
     * Returns true if a full reconciliation should actually remove candidates.
     */
    public boolean deletionsLive() {
        return enableDeletion && !dryRun;
    }
}
