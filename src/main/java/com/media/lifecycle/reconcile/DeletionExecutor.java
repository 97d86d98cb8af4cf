package com.media.lifecycle.reconcile;

import com.media.lifecycle.core.SyncContext;
import com.media.lifecycle.core.model.MediaItem;
import com.media.lifecycle.source.MovieCatalog;
import com.media.lifecycle.source.SeriesCatalog;
import com.media.lifecycle.source.WatchHistorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes an item from the catalogs that own it, then asks the media server to rescan.
 * The catalogs own the files, so nothing is deleted through the media server.
 */
class DeletionExecutor {
    private static final Logger log = LoggerFactory.getLogger(DeletionExecutor.class);

    private final MovieCatalog movieCatalog;
    private final SeriesCatalog seriesCatalog;
    private final WatchHistorySource watchHistory;

    DeletionExecutor(MovieCatalog movieCatalog, SeriesCatalog seriesCatalog, WatchHistorySource watchHistory) {
        this.movieCatalog = movieCatalog;
        this.seriesCatalog = seriesCatalog;
        this.watchHistory = watchHistory;
    }

    /**
     * Deletes the item and its files from every owning catalog.
     *
     * @throws com.media.lifecycle.source.SourceUnavailableException if a catalog delete fails
     */
    void delete(SyncContext ctx, MediaItem item) {
        boolean deletedFromCatalog = false;

        if (item.getMovieCatalogId() > 0) {
            if (movieCatalog != null) {
                movieCatalog.deleteMovie(ctx, item.getMovieCatalogId(), true);
                deletedFromCatalog = true;
                log.info("deletion.catalog source={} mediaId={} title='{}' catalogId={}",
                        movieCatalog.name(), item.getId(), item.getTitle(), item.getMovieCatalogId());
            } else {
                log.warn("deletion.noMovieCatalog mediaId={} catalogId={}", item.getId(), item.getMovieCatalogId());
            }
        }

        if (item.getSeriesCatalogId() > 0) {
            if (seriesCatalog != null) {
                seriesCatalog.deleteSeries(ctx, item.getSeriesCatalogId(), true);
                deletedFromCatalog = true;
                log.info("deletion.catalog source={} mediaId={} title='{}' catalogId={}",
                        seriesCatalog.name(), item.getId(), item.getTitle(), item.getSeriesCatalogId());
            } else {
                log.warn("deletion.noSeriesCatalog mediaId={} catalogId={}", item.getId(), item.getSeriesCatalogId());
            }
        }

        if (deletedFromCatalog && watchHistory != null) {
            try {
                watchHistory.refreshLibrary(ctx);
                log.info("deletion.refreshRequested source={} mediaId={}", watchHistory.name(), item.getId());
            } catch (RuntimeException e) {
                log.warn("deletion.refreshFailed source={} mediaId={} error={} (non-fatal)",
                        watchHistory.name(), item.getId(), e.getMessage());
            }
        }
    }
}
