package com.media.lifecycle.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonFileStore Tests")
class JsonFileStoreTest {

    record Sample(String name, Instant at) {}

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Missing file should read as empty")
    void missingFile() {
        JsonFileStore<Sample> store = new JsonFileStore<>(tempDir.resolve("sample.json"), Sample.class);
        assertTrue(store.read().isEmpty());
    }

    @Test
    @DisplayName("Written document should be readable and leave no temp file")
    void writeThenRead() throws IOException {
        Path file = tempDir.resolve("nested/dir/sample.json");
        JsonFileStore<Sample> store = new JsonFileStore<>(file, Sample.class);
        Instant at = Instant.parse("2024-06-01T12:00:00Z");

        store.write(new Sample("first", at));

        Optional<Sample> read = store.read();
        assertEquals(new Sample("first", at), read.orElseThrow());
        assertTrue(Files.readString(file).contains("2024-06-01T12:00:00Z"), "timestamps stored as ISO-8601");
        assertFalse(Files.exists(file.resolveSibling("sample.json.tmp")));
    }

    @Test
    @DisplayName("Corrupt file should raise PersistenceException")
    void corruptFile() throws IOException {
        Path file = tempDir.resolve("sample.json");
        Files.writeString(file, "{ not json");
        JsonFileStore<Sample> store = new JsonFileStore<>(file, Sample.class);

        assertThrows(PersistenceException.class, store::read);
    }

    @Test
    @DisplayName("Unknown properties should be ignored")
    void unknownProperties() throws IOException {
        Path file = tempDir.resolve("sample.json");
        Files.writeString(file, "{\"name\":\"x\",\"at\":null,\"extra\":1}");
        JsonFileStore<Sample> store = new JsonFileStore<>(file, Sample.class);

        assertEquals("x", store.read().orElseThrow().name());
    }
}
