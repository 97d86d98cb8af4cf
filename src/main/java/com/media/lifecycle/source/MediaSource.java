package com.media.lifecycle.source;

import com.media.lifecycle.core.SyncContext;

/**
 * Common surface of every external system the engine talks to.
 */
public interface MediaSource {

    /**
     * Short name used in logs, metrics and health output.
     */
    String name();

    /**
     * Checks that the source is reachable.
     *
     * @throws SourceUnavailableException if it is not
     */
    void ping(SyncContext ctx);
}
