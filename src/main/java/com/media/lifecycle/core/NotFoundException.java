package com.media.lifecycle.core;

/**
 * Thrown when a referenced media item or job does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException media(String mediaId) {
        return new NotFoundException("Media not found: " + mediaId);
    }

    public static NotFoundException job(String jobId) {
        return new NotFoundException("Job not found: " + jobId);
    }
}
