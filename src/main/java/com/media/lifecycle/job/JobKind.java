package com.media.lifecycle.job;

/**
 * Kind of reconciliation run recorded in the ledger.
 */
public enum JobKind {
    FULL_RECONCILIATION("full_sync"),
    INCREMENTAL_RECONCILIATION("incremental_sync");

    private final String code;

    JobKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
