package com.media.lifecycle.source;

import com.media.lifecycle.core.SyncContext;

import java.util.List;

/**
 * System of record for TV series files.
 */
public interface SeriesCatalog extends MediaSource {

    List<CatalogSeries> listSeries(SyncContext ctx);

    List<CatalogTag> listTags(SyncContext ctx);

    /**
     * Removes a series from the catalog.
     *
     * @param deleteFiles also remove the files on disk
     */
    void deleteSeries(SyncContext ctx, int seriesId, boolean deleteFiles);
}
