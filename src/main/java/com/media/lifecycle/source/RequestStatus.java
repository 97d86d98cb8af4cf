package com.media.lifecycle.source;

/**
 * Status of a media request.
 */
public enum RequestStatus {
    PENDING(1),
    APPROVED(2),
    DECLINED(3),
    FAILED(4),
    /** Approved and present in the library. */
    AVAILABLE(5);

    private final int code;

    RequestStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns true for statuses that mark an item as requested.
     */
    public boolean countsAsRequested() {
        return this == APPROVED || this == AVAILABLE;
    }

    public static RequestStatus fromCode(int code) {
        for (RequestStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown request status: " + code);
    }
}
