package com.media.lifecycle.source;

import java.time.Instant;
import java.util.List;

/**
 * A series as listed by the series catalog.
 *
 * @param id               native catalog id
 * @param title            title
 * @param year             first-aired year
 * @param tvdbId           TVDB id, or null
 * @param added            when the catalog added the series
 * @param path             series folder
 * @param sizeOnDisk       bytes on disk across all episodes
 * @param episodeFileCount number of episode files held
 * @param tagIds           ids of the tags applied to the series
 */
public record CatalogSeries(
        int id,
        String title,
        int year,
        Integer tvdbId,
        Instant added,
        String path,
        long sizeOnDisk,
        int episodeFileCount,
        List<Integer> tagIds
) {

    public CatalogSeries {
        tagIds = tagIds != null ? List.copyOf(tagIds) : List.of();
    }
}
