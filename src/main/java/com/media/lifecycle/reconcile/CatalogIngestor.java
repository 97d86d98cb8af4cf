package com.media.lifecycle.reconcile;

import com.media.lifecycle.core.SyncContext;
import com.media.lifecycle.core.model.MediaIds;
import com.media.lifecycle.core.model.MediaItem;
import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.source.CatalogMovie;
import com.media.lifecycle.source.CatalogSeries;
import com.media.lifecycle.source.CatalogTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns catalog listings into library items and replaces the matching entries.
 * Items without files on disk are skipped.
 */
class CatalogIngestor {
    private static final Logger log = LoggerFactory.getLogger(CatalogIngestor.class);

    private final MediaLibrary library;
    private final Clock clock;

    CatalogIngestor(MediaLibrary library, Clock clock) {
        this.library = library;
        this.clock = clock;
    }

    int ingestMovies(String sourceName, List<CatalogMovie> movies, Function<SyncContext, List<CatalogTag>> tagLoader,
                     SyncContext ctx) {
        Map<Integer, String> tags = loadTags(sourceName, tagLoader, ctx);
        List<MediaItem> items = new ArrayList<>(movies.size());
        for (CatalogMovie movie : movies) {
            if (!movie.hasFile()) {
                continue;
            }
            String filePath = movie.filePath() != null && !movie.filePath().isBlank()
                    ? movie.filePath() : movie.path();
            items.add(MediaItem.builder()
                    .id(MediaIds.movie(movie.id()))
                    .type(MediaType.MOVIE)
                    .title(movie.title())
                    .year(movie.year())
                    .tmdbId(movie.tmdbId())
                    .movieCatalogId(movie.id())
                    .addedAt(addedAt(movie.added(), movie.title()))
                    .filePath(filePath)
                    .fileSize(movie.sizeOnDisk())
                    .qualityProfile(movie.qualityProfile())
                    .tags(resolveTags(movie.tagIds(), tags))
                    .build());
        }
        library.putAll(items);
        log.info("ingest.movies source={} listed={} ingested={}", sourceName, movies.size(), items.size());
        return items.size();
    }

    int ingestSeries(String sourceName, List<CatalogSeries> series, Function<SyncContext, List<CatalogTag>> tagLoader,
                     SyncContext ctx) {
        Map<Integer, String> tags = loadTags(sourceName, tagLoader, ctx);
        List<MediaItem> items = new ArrayList<>(series.size());
        for (CatalogSeries show : series) {
            if (show.episodeFileCount() == 0) {
                continue;
            }
            items.add(MediaItem.builder()
                    .id(MediaIds.series(show.id()))
                    .type(MediaType.TV_SHOW)
                    .title(show.title())
                    .year(show.year())
                    .tvdbId(show.tvdbId())
                    .seriesCatalogId(show.id())
                    .addedAt(addedAt(show.added(), show.title()))
                    .filePath(show.path())
                    .fileSize(show.sizeOnDisk())
                    .tags(resolveTags(show.tagIds(), tags))
                    .build());
        }
        library.putAll(items);
        log.info("ingest.series source={} listed={} ingested={}", sourceName, series.size(), items.size());
        return items.size();
    }

    private Map<Integer, String> loadTags(String sourceName, Function<SyncContext, List<CatalogTag>> tagLoader,
                                          SyncContext ctx) {
        Map<Integer, String> labels = new HashMap<>();
        try {
            for (CatalogTag tag : tagLoader.apply(ctx)) {
                labels.put(tag.id(), tag.label());
            }
        } catch (RuntimeException e) {
            log.warn("ingest.tagsUnavailable source={} error={}, continuing without tags", sourceName, e.getMessage());
        }
        return labels;
    }

    private static Set<String> resolveTags(List<Integer> tagIds, Map<Integer, String> labels) {
        Set<String> resolved = new LinkedHashSet<>();
        for (Integer tagId : tagIds) {
            String label = labels.get(tagId);
            if (label != null) {
                resolved.add(label);
            }
        }
        return resolved;
    }

    private Instant addedAt(Instant added, String title) {
        if (added != null) {
            return added;
        }
        // Retention needs a base time; an unknown add date counts from now.
        log.warn("ingest.missingAddedDate title='{}'", title);
        return clock.instant();
    }
}
