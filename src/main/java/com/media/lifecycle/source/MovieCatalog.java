package com.media.lifecycle.source;

import com.media.lifecycle.core.SyncContext;

import java.util.List;

/**
 * System of record for movie files.
 */
public interface MovieCatalog extends MediaSource {

    List<CatalogMovie> listMovies(SyncContext ctx);

    List<CatalogTag> listTags(SyncContext ctx);

    /**
     * Removes a movie from the catalog.
     *
     * @param deleteFiles also remove the files on disk
     */
    void deleteMovie(SyncContext ctx, int movieId, boolean deleteFiles);
}
