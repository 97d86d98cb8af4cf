package com.media.lifecycle.core.model;

/**
 * Derives internal media ids from catalog-native ids.
 * The same id is used as the exclusion key, so exclusions survive re-ingest.
 */
public final class MediaIds {

    public static final String MOVIE_CATALOG = "movie-catalog";
    public static final String SERIES_CATALOG = "series-catalog";
    public static final String UNKNOWN = "unknown";

    private MediaIds() {
    }

    public static String movie(int movieCatalogId) {
        return "movie-" + movieCatalogId;
    }

    public static String series(int seriesCatalogId) {
        return "series-" + seriesCatalogId;
    }

    /**
     * Returns the catalog-qualified id of the catalog that owns the item,
     * or the item id when no catalog id is known.
     */
    public static String externalId(MediaItem item) {
        if (item.getMovieCatalogId() > 0) {
            return movie(item.getMovieCatalogId());
        }
        if (item.getSeriesCatalogId() > 0) {
            return series(item.getSeriesCatalogId());
        }
        return item.getId();
    }

    /**
     * Returns the tag of the catalog that owns the item.
     */
    public static String sourceSystem(MediaItem item) {
        if (item.getMovieCatalogId() > 0) {
            return MOVIE_CATALOG;
        }
        if (item.getSeriesCatalogId() > 0) {
            return SERIES_CATALOG;
        }
        return UNKNOWN;
    }
}
