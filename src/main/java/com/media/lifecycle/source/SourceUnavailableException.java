package com.media.lifecycle.source;

/**
 * Thrown by a source when it cannot be reached or returns an unusable response.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
