package com.resonance.matrix.loader;

import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.core.model.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContentGraphLoader Tests")
class ContentGraphLoaderTest {

    @TempDir
    Path dataDir;

    @Nested
    @DisplayName("Node construction")
    class Construction {

        @Test
        @DisplayName("Should build ids, paths, tags and clusters for every kind")
        void buildsAllKinds() throws IOException {
            write("gates.json", "{\"gates\":[{\"id\":\"fathers-sons\",\"title\":\"Fathers & Sons\"}]}");
            write("pain-points.json", "{\"painPoints\":{\"fathers-sons\":[{\"id\":\"distance\",\"title\":\"Distance\"}]}}");
            write("tools.json", "{\"tools\":[{\"id\":\"letter\",\"slug\":\"letter-kit\",\"gateIds\":[\"fathers-sons\"]}]}");
            write("insights.json", "{\"insights\":[{\"slug\":\"silence\",\"title\":\"On Silence\"},{\"title\":\"Grief Waves!\"}]}");

            List<Node> nodes = new ContentGraphLoader(dataDir).load();

            assertEquals(5, nodes.size());

            Node gate = nodes.get(0);
            assertEquals("gate::fathers-sons", gate.getId());
            assertEquals(NodeType.GATE, gate.getType());
            assertEquals("/gates/fathers-sons", gate.getPath());
            assertEquals(Set.of("fathers-sons"), gate.getTags());
            assertEquals("fathers-sons", gate.getCluster());
            assertEquals(1.0, gate.getResonanceScore());
            assertEquals(0.0, gate.getDecayScore());
            assertNull(gate.getLastUpdated());

            Node pain = nodes.get(1);
            assertEquals("pain::fathers-sons::distance", pain.getId());
            assertEquals("/gates/fathers-sons/distance", pain.getPath());
            assertEquals(List.of("fathers-sons", "distance"), List.copyOf(pain.getTags()));

            Node tool = nodes.get(2);
            assertEquals("tool::letter", tool.getId());
            assertEquals("/tools/letter-kit", tool.getPath());
            assertEquals("fathers-sons", tool.getCluster());
            assertEquals("letter", tool.getTitle());

            assertEquals("insight::silence", nodes.get(3).getId());
            assertEquals("/insights/silence", nodes.get(3).getPath());
            assertEquals("insight::grief-waves", nodes.get(4).getId());
            assertEquals("insights", nodes.get(4).getCluster());
        }

        @Test
        @DisplayName("Gates may be a bare array and tools without gates cluster under 'tools'")
        void bareArraysAndToolFallback() throws IOException {
            write("gates.json", "[{\"id\":\"men-solo\"}]");
            write("tools.json", "{\"tools\":[{\"name\":\"Breathing Timer\"}]}");

            List<Node> nodes = new ContentGraphLoader(dataDir).load();

            assertEquals("gate::men-solo", nodes.get(0).getId());
            Node tool = nodes.get(1);
            assertEquals("tool::breathing-timer", tool.getId());
            assertEquals("Breathing Timer", tool.getTitle());
            assertEquals("tools", tool.getCluster());
            assertEquals(Set.of("tools"), tool.getTags());
        }

        @Test
        @DisplayName("A repeated gate id should keep only the first node")
        void duplicateIdsKeepFirst() throws IOException {
            write("gates.json", "{\"gates\":[{\"id\":\"fathers-sons\",\"title\":\"Fathers & Sons\"},"
                    + "{\"id\":\"men-solo\"},{\"id\":\"fathers-sons\",\"title\":\"Copy\"}]}");

            List<Node> nodes = new ContentGraphLoader(dataDir).load();

            assertEquals(2, nodes.size());
            assertEquals("gate::fathers-sons", nodes.get(0).getId());
            assertEquals("Fathers & Sons", nodes.get(0).getTitle());
            assertEquals("gate::men-solo", nodes.get(1).getId());
        }
    }

    @Nested
    @DisplayName("Tool merge")
    class ToolMerge {

        @Test
        @DisplayName("Canonical fields should win and empty fields should be filled from the fallback")
        void firstNonEmptyWins() throws IOException {
            write("tools-canonical.json", "{\"tools\":[{\"slug\":\"journal\",\"title\":\"Journal\",\"gateIds\":[]}]}");
            write("tools.json", "{\"tools\":[{\"id\":\"journal\",\"name\":\"Old Journal\","
                    + "\"summary\":\"Write it down\",\"gateIds\":[\"the-griever\"]}]}");

            List<ToolRecord> tools = new ContentGraphLoader(dataDir).loadTools();

            assertEquals(1, tools.size());
            ToolRecord tool = tools.get(0);
            assertEquals("journal", tool.id());
            assertEquals("Journal", tool.title());
            assertEquals("Write it down", tool.description());
            assertEquals(List.of("the-griever"), tool.gateIds());
            assertEquals("tools-canonical", tool.source());
        }

        @Test
        @DisplayName("Records without any identity should be dropped")
        void noIdentityDropped() throws IOException {
            write("tools.json", "{\"tools\":[{\"description\":\"orphan\"},{\"slug\":\"ok\"}]}");
            assertEquals(1, new ContentGraphLoader(dataDir).loadTools().size());
        }
    }

    @Nested
    @DisplayName("Degradation")
    class Degradation {

        @Test
        @DisplayName("Missing files should yield an empty registry")
        void missingFiles() {
            assertTrue(new ContentGraphLoader(dataDir.resolve("absent")).load().isEmpty());
        }

        @Test
        @DisplayName("Malformed files should be skipped without failing the load")
        void malformedFiles() throws IOException {
            write("gates.json", "{not json");
            write("insights.json", "{\"insights\":[{\"slug\":\"kept\"}]}");

            List<Node> nodes = new ContentGraphLoader(dataDir).load();

            assertEquals(1, nodes.size());
            assertEquals("insight::kept", nodes.get(0).getId());
        }
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(dataDir.resolve(name), content);
    }
}
