package com.resonance.matrix.migration;

import com.resonance.matrix.core.model.MigratedNode;
import com.resonance.matrix.core.model.MigrationCheckpoint;
import com.resonance.matrix.core.model.NodeType;
import com.resonance.matrix.error.CorruptionDetectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.resonance.matrix.migration.MigrationFixtures.MAPPER;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CheckpointStore Tests")
class CheckpointStoreTest {

    @TempDir
    Path tempDir;

    private CheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new CheckpointStore(tempDir, MAPPER);
    }

    @Test
    @DisplayName("No state file should mean a fresh start")
    void emptyStore() {
        assertTrue(store.load().isEmpty());
    }

    @Test
    @DisplayName("Saved checkpoint should load back unchanged")
    void saveAndLoad() {
        MigrationCheckpoint checkpoint = new MigrationCheckpoint(1000, 1000, 998, 2,
                Instant.parse("2025-06-01T12:00:00Z"), "node-999", 1, false, null);

        store.save(checkpoint);

        assertEquals(checkpoint, store.load().orElseThrow());
    }

    @Test
    @DisplayName("Parts should be numbered with four digits under the output directory")
    void partNaming() throws IOException {
        MigratedNode node = new MigratedNode("a", null, 0.5, NodeType.TOOL, "A", "/a", null, 0.5, 0, 0, false);

        Path part = store.writePart(3, List.of(node));

        assertEquals(tempDir.resolve("migration-output").resolve("nodes-batch-0003.json"), part);
        assertEquals("a", MAPPER.readTree(part.toFile()).get(0).get("ID").asText());
    }

    @Test
    @DisplayName("Unreadable or negative state should be corruption")
    void corruptState() throws IOException {
        Files.writeString(store.stateFile(), "{ not json");
        assertThrows(CorruptionDetectedException.class, () -> store.load());

        Files.writeString(store.stateFile(), "{\"lastProcessedIndex\":-5,\"checkpointCount\":0}");
        assertThrows(CorruptionDetectedException.class, () -> store.load());
    }

    @Test
    @DisplayName("Reset should delete state, log and parts")
    void reset() throws IOException {
        store.save(MigrationCheckpoint.initial());
        store.writePart(1, List.of());
        Files.writeString(store.logFile(), "{}\n");

        store.reset();

        assertFalse(Files.exists(store.stateFile()));
        assertFalse(Files.exists(store.logFile()));
        assertFalse(Files.exists(store.partFile(1)));
    }
}
