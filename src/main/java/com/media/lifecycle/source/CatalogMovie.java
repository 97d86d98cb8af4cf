package com.media.lifecycle.source;

import java.time.Instant;
import java.util.List;

/**
 * A movie as listed by the movie catalog.
 *
 * @param id             native catalog id
 * @param title          title
 * @param year           release year
 * @param tmdbId         TMDB id, or null
 * @param added          when the catalog added the movie
 * @param path           movie folder
 * @param filePath       path of the movie file, or null
 * @param sizeOnDisk     bytes on disk
 * @param hasFile        false when the catalog tracks the movie but holds no file
 * @param qualityProfile quality name of the file, or null
 * @param tagIds         ids of the tags applied to the movie
 */
public record CatalogMovie(
        int id,
        String title,
        int year,
        Integer tmdbId,
        Instant added,
        String path,
        String filePath,
        long sizeOnDisk,
        boolean hasFile,
        String qualityProfile,
        List<Integer> tagIds
) {

    public CatalogMovie {
        tagIds = tagIds != null ? List.copyOf(tagIds) : List.of();
    }
}
