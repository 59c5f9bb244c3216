package com.resonance.matrix.migration;

import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.error.CorruptionDetectedException;
import com.resonance.matrix.error.SourceUnavailableException;
import com.resonance.matrix.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.resonance.matrix.migration.MigrationFixtures.MAPPER;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StreamingNodeReader Tests")
class StreamingNodeReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should stream the nodes field of a registry document")
    void registryDocument() throws IOException {
        Path input = MigrationFixtures.writeInput(tempDir, MigrationFixtures.nodes(5));

        List<String> ids = new ArrayList<>();
        try (StreamingNodeReader reader = new StreamingNodeReader(input, MAPPER)) {
            reader.forEachRemaining(node -> ids.add(node.getId()));
        }

        assertEquals(List.of("node-0", "node-1", "node-2", "node-3", "node-4"), ids);
        assertEquals(5, StreamingNodeReader.count(input, MAPPER));
    }

    @Test
    @DisplayName("Should stream a bare array and skip without binding")
    void bareArraySkip() throws IOException {
        Path input = tempDir.resolve("nodes.json");
        Files.writeString(input, "[{\"id\":\"a\"},{\"id\":\"b\",\"outboundLinks\":[\"a\"]},{\"id\":\"c\"}]");

        try (StreamingNodeReader reader = new StreamingNodeReader(input, MAPPER)) {
            assertEquals(2, reader.skip(2));
            assertEquals("c", reader.next().getId());
            assertFalse(reader.hasNext());
            assertEquals(0, reader.skip(10));
        }
    }

    @Test
    @DisplayName("Non-object elements should surface as nodes without an id")
    void nonObjectElement() throws IOException {
        Path input = tempDir.resolve("nodes.json");
        Files.writeString(input, "[42,{\"id\":\"a\"}]");

        try (StreamingNodeReader reader = new StreamingNodeReader(input, MAPPER)) {
            Node first = reader.next();
            assertNull(first.getId());
            assertEquals("a", reader.next().getId());
        }
    }

    @Test
    @DisplayName("An object that does not bind should fail validation and leave the stream usable")
    void unbindableObject() throws IOException {
        Path input = tempDir.resolve("nodes.json");
        Files.writeString(input, "[{\"id\":\"a\"},{\"id\":\"b\",\"resonanceScore\":\"high\"},{\"id\":\"c\"}]");

        try (StreamingNodeReader reader = new StreamingNodeReader(input, MAPPER)) {
            assertEquals("a", reader.next().getId());
            ValidationException e = assertThrows(ValidationException.class, reader::next);
            assertEquals("b", e.getNodeId());
            assertEquals(1, e.getIndex());
            assertEquals("c", reader.next().getId());
            assertFalse(reader.hasNext());
        }
    }

    @Test
    @DisplayName("A document without a node array should be corruption")
    void noNodeArray() throws IOException {
        Path input = tempDir.resolve("nodes.json");
        Files.writeString(input, "{\"version\":\"1.0\"}");

        assertThrows(CorruptionDetectedException.class, () -> new StreamingNodeReader(input, MAPPER));
    }

    @Test
    @DisplayName("A missing file should be unavailable")
    void missingFile() {
        assertThrows(SourceUnavailableException.class,
                () -> new StreamingNodeReader(tempDir.resolve("absent.json"), MAPPER));
    }
}
