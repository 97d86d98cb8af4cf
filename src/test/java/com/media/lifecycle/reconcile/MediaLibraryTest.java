package com.media.lifecycle.reconcile;

import com.media.lifecycle.core.model.MediaItem;
import com.media.lifecycle.core.model.MediaType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MediaLibrary Tests")
class MediaLibraryTest {

    private final MediaLibrary library = new MediaLibrary();

    @Test
    @DisplayName("putAll should replace items with the same id")
    void putAllReplaces() {
        library.putAll(List.of(item("movie-1", "Old title"), item("movie-2", "Other")));
        library.putAll(List.of(item("movie-1", "New title")));

        assertEquals(2, library.size());
        assertEquals("New title", library.get("movie-1").orElseThrow().getTitle());
    }

    @Test
    @DisplayName("Accessors should hand out copies")
    void accessorsReturnCopies() {
        library.putAll(List.of(item("movie-1", "Title")));

        library.get("movie-1").orElseThrow().setWatchCount(9);
        library.snapshot().get(0).setExcluded(true);
        library.snapshotMap().get("movie-1").setWatchCount(5);

        MediaItem stored = library.get("movie-1").orElseThrow();
        assertEquals(0, stored.getWatchCount());
        assertFalse(stored.isExcluded());
    }

    @Test
    @DisplayName("update should mutate the stored item and report absence")
    void update() {
        library.putAll(List.of(item("movie-1", "Title")));

        assertTrue(library.update("movie-1", stored -> stored.setWatchCount(3)));
        assertFalse(library.update("movie-404", stored -> stored.setWatchCount(3)));

        assertEquals(3, library.get("movie-1").orElseThrow().getWatchCount());
    }

    @Test
    @DisplayName("read should not allow structural changes")
    void readIsUnmodifiable() {
        library.putAll(List.of(item("movie-1", "Title")));

        assertThrows(UnsupportedOperationException.class, () -> library.read(map -> map.remove("movie-1")));
        assertTrue(library.remove("movie-1").isPresent());
        assertEquals(0, library.size());
    }

    private static MediaItem item(String id, String title) {
        return MediaItem.builder()
                .id(id)
                .type(MediaType.MOVIE)
                .title(title)
                .year(2020)
                .movieCatalogId(Integer.parseInt(id.substring("movie-".length())))
                .addedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }
}
