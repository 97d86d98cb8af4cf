package com.media.lifecycle.reconcile;

/**
 * Thrown when the engine is started twice, or when a reconciliation is requested
 * while another one is in flight.
 */
public class AlreadyRunningException extends RuntimeException {

    public AlreadyRunningException(String message) {
        super(message);
    }
}
