package com.media.lifecycle.source;

import com.media.lifecycle.core.SyncContext;

import java.util.List;

/**
 * The media server: reports what has been watched and can rescan its library.
 * The engine never deletes through it.
 */
public interface WatchHistorySource extends MediaSource {

    List<WatchedItem> listMovies(SyncContext ctx);

    List<WatchedItem> listShows(SyncContext ctx);

    /**
     * Asks the media server to rescan so it notices removed files.
     */
    void refreshLibrary(SyncContext ctx);
}
