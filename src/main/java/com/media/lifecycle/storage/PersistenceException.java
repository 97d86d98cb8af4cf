package com.media.lifecycle.storage;

/**
 * Thrown when an exclusion or job file cannot be read or written.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
