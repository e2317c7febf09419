/**
 * Single-file JSON persistence with atomic replacement
 *
 * @author William Callahan
 *
 * Features:
 * - Writes to a temp file in the target directory, then moves it over the target
 * - Readers never observe a partially written file
 * - Missing and corrupt files read as empty, with a warning for corruption
 * - Write failures are logged and reported to the caller, never thrown
 */

package com.williamcallahan.movie_discovery_engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

@Slf4j
public class JsonFileStore<T> {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public JsonFileStore(Path file, ObjectMapper objectMapper, Class<T> type) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.type = type;
    }

    /**
     * Read the stored document
     *
     * @return the document, or empty when the file is missing, unreadable or corrupt
     */
    public Optional<T> read() {
        if (!Files.exists(file)) {
            log.debug("No persisted state at {}", file);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), type));
        } catch (JsonProcessingException e) {
            LoggingUtils.warn(log, e, "Ignoring corrupt state file {}", file);
            return Optional.empty();
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Unable to read state file {}", file);
            return Optional.empty();
        }
    }

    /**
     * Replace the stored document
     *
     * @param document document to persist
     * @return true when the new document is on disk
     */
    public boolean write(T document) {
        Path tempFile = null;
        try {
            Path directory = file.toAbsolutePath().getParent();
            if (directory != null && !Files.exists(directory)) {
                Files.createDirectories(directory);
            }
            tempFile = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), document);
            moveIntoPlace(tempFile);
            return true;
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Unable to persist state file {}", file);
            deleteQuietly(tempFile);
            return false;
        }
    }

    public Path getFile() {
        return file;
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Unable to remove temp file {}: {}", path, e.getMessage());
        }
    }
}
