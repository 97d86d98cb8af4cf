package com.media.lifecycle.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MediaItem Tests")
class MediaItemTest {

    private static final Instant ADDED = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Builder should require id, type and added time")
    void requiredFields() {
        assertThrows(NullPointerException.class, () -> MediaItem.builder().type(MediaType.MOVIE).addedAt(ADDED).build());
        assertThrows(NullPointerException.class, () -> MediaItem.builder().id("movie-1").addedAt(ADDED).build());
        assertThrows(NullPointerException.class, () -> MediaItem.builder().id("movie-1").type(MediaType.MOVIE).build());
    }

    @Test
    @DisplayName("Negative watch count should be rejected")
    void negativeWatchCount() {
        MediaItem item = movie().build();
        assertThrows(IllegalArgumentException.class, () -> item.setWatchCount(-1));
        assertThrows(IllegalArgumentException.class, () -> movie().watchCount(-1).build());
    }

    @Test
    @DisplayName("Retention base should prefer last watched")
    void retentionBase() {
        MediaItem item = movie().build();
        assertEquals(ADDED, item.retentionBase());

        Instant watched = ADDED.plusSeconds(3600);
        item.setLastWatched(watched);
        assertEquals(watched, item.retentionBase());
    }

    @Test
    @DisplayName("copy() should be independent of the original")
    void copyIsIndependent() {
        MediaItem item = movie().tags(Set.of("demo")).build();
        item.applySchedule(ADDED.plusSeconds(60), 3, "reason");

        MediaItem copy = item.copy();
        copy.clearSchedule();
        copy.setExcluded(true);

        assertTrue(item.hasScheduledDeletion());
        assertFalse(item.isExcluded());
        assertEquals(item, copy, "equality is by id");
        assertEquals(Set.of("demo"), copy.getTags());
    }

    @Test
    @DisplayName("Matching id should follow the type's provider")
    void matchingId() {
        MediaItem movie = movie().tmdbId(11).tvdbId(22).build();
        MediaItem show = MediaItem.builder().id("series-1").type(MediaType.TV_SHOW).addedAt(ADDED)
                .tmdbId(11).tvdbId(22).build();

        assertEquals(11, movie.getMatchingId());
        assertEquals(22, show.getMatchingId());
    }

    @Test
    @DisplayName("Requester defaults to none and markRequested replaces it")
    void requester() {
        MediaItem item = movie().build();
        assertFalse(item.getRequester().hasIdentity());

        item.markRequested(new Requester(5, "alice", null));

        assertTrue(item.isRequested());
        assertEquals("alice", item.getRequester().username());
    }

    @Test
    @DisplayName("External id should use the owning catalog")
    void externalIds() {
        assertEquals("movie-7", MediaIds.externalId(movie().movieCatalogId(7).build()));
        assertEquals(MediaIds.MOVIE_CATALOG, MediaIds.sourceSystem(movie().movieCatalogId(7).build()));
        MediaItem show = MediaItem.builder().id("series-3").type(MediaType.TV_SHOW).addedAt(ADDED)
                .seriesCatalogId(3).build();
        assertEquals("series-3", MediaIds.externalId(show));
        assertEquals(MediaIds.UNKNOWN, MediaIds.sourceSystem(movie().build()));
    }

    private static MediaItem.Builder movie() {
        return MediaItem.builder().id("movie-1").type(MediaType.MOVIE).title("Movie").addedAt(ADDED);
    }
}
