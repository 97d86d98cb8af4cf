package com.media.lifecycle.policy;

/**
 * Thrown when a retention string is not of the form {@code <n>d|h|m|s} or {@code never}.
 */
public class InvalidDurationException extends RuntimeException {

    public InvalidDurationException(String message) {
        super(message);
    }

    public InvalidDurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
