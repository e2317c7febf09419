package com.williamcallahan.movie_discovery_engine.util;

import com.williamcallahan.movie_discovery_engine.service.preference.SignalJournal;
import com.williamcallahan.movie_discovery_engine.testutil.CatalogFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileReadsAsEmpty() {
        JsonFileStore<SignalJournal.Document> store = new JsonFileStore<>(tempDir.resolve("absent.json"), CatalogFixtures.objectMapper(), SignalJournal.Document.class);

        assertThat(store.read()).isEmpty();
    }

    @Test
    void corruptFileReadsAsEmpty() throws Exception {
        Path file = tempDir.resolve("corrupt.json");
        Files.writeString(file, "{\"signals\": [ {\"itemId\": ");
        JsonFileStore<SignalJournal.Document> store = new JsonFileStore<>(file, CatalogFixtures.objectMapper(), SignalJournal.Document.class);

        assertThat(store.read()).isEmpty();
    }

    @Test
    void writeCreatesParentDirectoriesAndLeavesNoTempFiles() throws Exception {
        Path file = tempDir.resolve("nested/dir/state.json");
        JsonFileStore<SignalJournal.Document> store = new JsonFileStore<>(file, CatalogFixtures.objectMapper(), SignalJournal.Document.class);

        assertThat(store.write(new SignalJournal.Document())).isTrue();

        assertThat(file).exists();
        try (var files = Files.list(file.getParent())) {
            assertThat(files).containsExactly(file);
        }
        assertThat(store.read()).isPresent();
    }

    @Test
    void failedWriteIsReportedNotThrown() throws Exception {
        Path blocked = tempDir.resolve("blocked");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("occupant.txt"), "x");
        JsonFileStore<SignalJournal.Document> store = new JsonFileStore<>(blocked, CatalogFixtures.objectMapper(), SignalJournal.Document.class);

        assertThat(store.write(new SignalJournal.Document())).isFalse();
        assertThat(store.read()).isEmpty();
    }
}
