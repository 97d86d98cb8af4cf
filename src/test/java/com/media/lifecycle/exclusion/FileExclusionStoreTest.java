package com.media.lifecycle.exclusion;

import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.storage.PersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExclusionStore Tests")
class FileExclusionStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("FileExclusionStore")
    class FileStoreTests {

        @Test
        @DisplayName("Exclusions should survive a restart")
        void persistsAcrossInstances() {
            FileExclusionStore store = new FileExclusionStore(tempDir, Clock.fixed(NOW, ZoneOffset.UTC));
            store.add(record("movie-1", "keep forever"));
            store.add(record("series-9", null));

            FileExclusionStore reopened = new FileExclusionStore(tempDir);

            assertEquals(2, reopened.size());
            assertTrue(reopened.isExcluded("movie-1"));
            assertEquals("keep forever", reopened.get("movie-1").orElseThrow().reason());
            assertEquals("", reopened.get("series-9").orElseThrow().reason());
            assertEquals(NOW, reopened.getUpdatedAt());
        }

        @Test
        @DisplayName("Remove should persist and report whether a record existed")
        void removePersists() {
            FileExclusionStore store = new FileExclusionStore(tempDir);
            store.add(record("movie-1", "r"));

            assertTrue(store.remove("movie-1"));
            assertFalse(store.remove("movie-1"));
            assertFalse(new FileExclusionStore(tempDir).isExcluded("movie-1"));
        }

        @Test
        @DisplayName("Adding the same id twice should replace the record")
        void addReplaces() {
            FileExclusionStore store = new FileExclusionStore(tempDir);
            store.add(record("movie-1", "first"));
            store.add(record("movie-1", "second"));

            assertEquals(1, store.size());
            assertEquals("second", store.get("movie-1").orElseThrow().reason());
        }

        @Test
        @DisplayName("Corrupt file should start an empty store")
        void corruptFileStartsFresh() throws IOException {
            Files.writeString(tempDir.resolve(FileExclusionStore.FILE_NAME), "not json at all");

            FileExclusionStore store = new FileExclusionStore(tempDir);

            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("Failed save should roll back and propagate")
        void failedSaveRollsBack() throws IOException {
            Path notADirectory = Files.writeString(tempDir.resolve("blocker"), "file");
            FileExclusionStore store = new FileExclusionStore(notADirectory);

            assertThrows(PersistenceException.class, () -> store.add(record("movie-1", "r")));
            assertFalse(store.isExcluded("movie-1"));
            assertEquals(0, store.size());
        }
    }

    @Nested
    @DisplayName("InMemoryExclusionStore")
    class InMemoryTests {

        @Test
        @DisplayName("Should add, list and remove exclusions")
        void roundTrip() {
            InMemoryExclusionStore store = new InMemoryExclusionStore();
            store.add(record("movie-1", "r"));

            assertTrue(store.isExcluded("movie-1"));
            assertFalse(store.isExcluded(null));
            assertEquals(1, store.getAll().size());
            assertTrue(store.remove("movie-1"));
            assertEquals(0, store.size());
        }
    }

    @Test
    @DisplayName("Blank external id should be rejected")
    void blankIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> record(" ", "r"));
    }

    private static ExclusionRecord record(String externalId, String reason) {
        return new ExclusionRecord(externalId, "movie-catalog", MediaType.MOVIE, "Title", NOW, "api", reason);
    }
}
