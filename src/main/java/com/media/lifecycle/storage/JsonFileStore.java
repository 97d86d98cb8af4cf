package com.media.lifecycle.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes one JSON document on disk.
 * Writes go to a sibling temp file that is then moved over the target,
 * so readers never observe a half-written file.
 *
 * @param <T> document type
 */
public class JsonFileStore<T> {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path file;
    private final Class<T> documentType;
    private final ObjectMapper objectMapper;

    public JsonFileStore(Path file, Class<T> documentType) {
        this.file = Objects.requireNonNull(file, "file");
        this.documentType = Objects.requireNonNull(documentType, "documentType");
        this.objectMapper = defaultMapper();
    }

    /**
     * The mapper used for persisted documents: ISO-8601 timestamps, indented output,
     * unknown properties ignored.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path file() {
        return file;
    }

    /**
     * Reads the document.
     *
     * @return the document, or empty if the file does not exist
     * @throws PersistenceException if the file exists but cannot be read or parsed
     */
    public Optional<T> read() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), documentType));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file, e);
        }
    }

    /**
     * Writes the document, creating parent directories as needed.
     *
     * @throws PersistenceException if the write fails
     */
    public void write(T document) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("storage.written file={}", file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + file, e);
        }
    }
}
