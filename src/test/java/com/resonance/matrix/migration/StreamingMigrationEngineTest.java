package com.resonance.matrix.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.resonance.matrix.core.model.MigrationCheckpoint;
import com.resonance.matrix.error.CorruptionDetectedException;
import com.resonance.matrix.error.ErrorEvent;
import com.resonance.matrix.error.ErrorSink;
import com.resonance.matrix.error.SourceUnavailableException;
import com.resonance.matrix.governor.ResourceGovernor;
import com.resonance.matrix.metrics.MicrometerMetricsService;
import com.resonance.matrix.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.resonance.matrix.migration.MigrationFixtures.MAPPER;
import static com.resonance.matrix.migration.MigrationFixtures.calmGovernor;
import static com.resonance.matrix.migration.MigrationFixtures.node;
import static com.resonance.matrix.migration.MigrationFixtures.nodes;
import static com.resonance.matrix.migration.MigrationFixtures.writeInput;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("StreamingMigrationEngine Tests")
class StreamingMigrationEngineTest {

    private static final MigrationConfig CONFIG = new MigrationConfig(500, 100, 1000,
            Set.copyOf(MigrationConfig.DEFAULT_ANCHORS));

    @TempDir
    Path tempDir;

    @Mock
    private ErrorSink errorSink;

    private StreamingMigrationEngine engine(ResourceGovernor governor) {
        return new StreamingMigrationEngine(CONFIG, governor, new NoOpMetricsService(), errorSink,
                Clock.systemUTC());
    }

    @Nested
    @DisplayName("Batching and checkpoints")
    class Batching {

        @Test
        @DisplayName("1,640 nodes should give batches of 500, 500, 500, 140 and one checkpoint")
        void referenceRun() throws IOException {
            Path input = writeInput(tempDir, nodes(1640));
            Path work = tempDir.resolve("work");
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            StreamingMigrationEngine engine = new StreamingMigrationEngine(CONFIG, calmGovernor(),
                    new MicrometerMetricsService(registry), errorSink, Clock.systemUTC());
            List<Integer> batchSizes = new ArrayList<>();

            MigrationResult result = engine.migrate(input, work, MigrationOptions.defaults(),
                    progress -> batchSizes.add(progress.nodesInBatch()));

            assertEquals(List.of(500, 500, 500, 140), batchSizes);
            assertEquals(1, result.checkpointsWritten());
            assertEquals(1.0, registry.counter("matrix.migration.checkpoints").count());
            assertTrue(result.isComplete());
            assertEquals(1640, result.checkpoint().totalProcessed());
            assertEquals(1640, result.migrated());
            assertEquals(2, result.checkpoint().checkpointCount());

            CheckpointStore store = new CheckpointStore(work, MAPPER);
            assertEquals(1000, MAPPER.readTree(store.partFile(1).toFile()).size());
            assertEquals(640, MAPPER.readTree(store.partFile(2).toFile()).size());
            assertTrue(store.load().orElseThrow().completed());
        }

        @Test
        @DisplayName("Output parts should carry the migration schema")
        void outputSchema() throws IOException {
            List<Map<String, Object>> input = new ArrayList<>();
            Map<String, Object> composite = node(0);
            composite.put("id", "pain::fathers-sons::distance");
            composite.remove("cluster");
            composite.put("resonanceScore", 1.5);
            composite.put("decayScore", 0.2);
            input.add(composite);
            Path work = tempDir.resolve("work");

            engine(calmGovernor()).migrate(writeInput(tempDir, input), work, MigrationOptions.defaults(), null);

            JsonNode migrated = MAPPER.readTree(new CheckpointStore(work, MAPPER).partFile(1).toFile()).get(0);
            assertEquals("pain::fathers-sons::distance", migrated.get("ID").asText());
            assertEquals("pain", migrated.get("ParentID").asText());
            assertEquals(1.0, migrated.get("RiskWeight").asDouble());
            assertTrue(migrated.get("isGoldStandard").asBoolean());
            assertEquals("tool", migrated.get("type").asText());
        }

        @Test
        @DisplayName("Gold-standard anchors should stay pinned across flushes")
        void anchorsPinned() throws IOException {
            List<Map<String, Object>> input = nodes(2500);
            input.get(10).put("cluster", "the-griever");
            input.get(2400).put("id", "gate::young-lions");

            MigrationResult result = engine(calmGovernor()).migrate(writeInput(tempDir, input),
                    tempDir.resolve("work"), MigrationOptions.defaults(), null);

            assertEquals(List.of("node-10", "gate::young-lions"),
                    result.goldStandardNodes().stream().map(n -> n.id()).toList());
        }
    }

    @Nested
    @DisplayName("Resume")
    class Resume {

        @Test
        @DisplayName("A cancelled and resumed run should write the same parts as an uninterrupted run")
        void resumedOutputIdentical() throws IOException {
            Path input = writeInput(tempDir, nodes(2750));
            Path straight = tempDir.resolve("straight");
            Path resumed = tempDir.resolve("resumed");

            engine(calmGovernor()).migrate(input, straight, MigrationOptions.defaults(), null);

            StreamingMigrationEngine engine = engine(calmGovernor());
            try (MigrationRun run = engine.start(input, resumed, MigrationOptions.defaults())) {
                run.next();
                run.next();
                run.next();
                run.cancel();
                assertFalse(run.hasNext());
                MigrationResult partial = run.getResult();
                assertTrue(partial.isAborted());
                assertEquals("cancelled", partial.abortReason());
                assertEquals(1000, partial.checkpoint().lastProcessedIndex());
            }

            MigrationResult second = engine.migrate(input, resumed, MigrationOptions.defaults(), null);
            assertEquals(1750, second.processed());
            assertTrue(second.isComplete());

            CheckpointStore a = new CheckpointStore(straight, MAPPER);
            CheckpointStore b = new CheckpointStore(resumed, MAPPER);
            for (int part = 1; part <= 3; part++) {
                assertArrayEquals(Files.readAllBytes(a.partFile(part)), Files.readAllBytes(b.partFile(part)),
                        "part " + part + " differs");
            }
            assertFalse(Files.exists(b.partFile(4)));
        }

        @Test
        @DisplayName("A completed checkpoint should make a rerun a no-op")
        void completedRerunNoOp() throws IOException {
            Path input = writeInput(tempDir, nodes(50));
            Path work = tempDir.resolve("work");
            engine(calmGovernor()).migrate(input, work, MigrationOptions.defaults(), null);

            MigrationResult rerun = engine(calmGovernor()).migrate(input, work, MigrationOptions.defaults(), null);

            assertEquals(0, rerun.processed());
            assertTrue(rerun.isComplete());
            assertEquals(50, rerun.checkpoint().migratedCount());
        }

        @Test
        @DisplayName("A fresh run should discard previous state")
        void freshRun() throws IOException {
            Path input = writeInput(tempDir, nodes(50));
            Path work = tempDir.resolve("work");
            engine(calmGovernor()).migrate(input, work, MigrationOptions.defaults(), null);

            MigrationResult fresh = engine(calmGovernor()).migrate(input, work,
                    new MigrationOptions(false, 0, true), null);

            assertEquals(50, fresh.processed());
            assertEquals(1, fresh.checkpoint().checkpointCount());
        }

        @Test
        @DisplayName("Limited runs should advance the checkpoint until the input is exhausted")
        void limitedRuns() throws IOException {
            Path input = writeInput(tempDir, nodes(1200));
            Path work = tempDir.resolve("work");
            MigrationOptions limited = new MigrationOptions(false, 700, false);

            MigrationResult first = engine(calmGovernor()).migrate(input, work, limited, null);
            assertEquals(700, first.processed());
            assertTrue(first.isPartial());
            assertFalse(first.isAborted());

            MigrationResult second = engine(calmGovernor()).migrate(input, work, limited, null);
            assertEquals(500, second.processed());
            assertTrue(second.isComplete());

            CheckpointStore store = new CheckpointStore(work, MAPPER);
            int total = 0;
            for (int part = 1; part <= second.checkpoint().checkpointCount(); part++) {
                total += MAPPER.readTree(store.partFile(part).toFile()).size();
            }
            assertEquals(1200, total);
        }
    }

    @Nested
    @DisplayName("Resource governor")
    class Governor {

        @Test
        @DisplayName("A hard kill should stop within one heartbeat and keep the last full checkpoint")
        void hardKillWithinHeartbeat() throws IOException {
            Path input = writeInput(tempDir, nodes(3000));
            Path work = tempDir.resolve("work");
            AtomicInteger samples = new AtomicInteger();
            // the heap explodes after about 1,050 nodes
            ResourceGovernor governor = MigrationFixtures.governor(() -> samples.incrementAndGet() > 14 ? 400 : 20);

            MigrationResult result = engine(governor).migrate(input, work, MigrationOptions.defaults(), null);

            assertTrue(result.isAborted());
            assertTrue(result.abortReason().startsWith("Hard kill"));
            assertEquals(1000, result.checkpoint().lastProcessedIndex());
            assertTrue(result.processed() - 1000 <= CONFIG.heartbeatInterval(),
                    "processed " + result.processed() + " nodes");

            CheckpointStore store = new CheckpointStore(work, MAPPER);
            MigrationCheckpoint persisted = store.load().orElseThrow();
            assertEquals(1000, persisted.lastProcessedIndex());
            assertFalse(persisted.completed());
            assertNotNull(persisted.abortReason());
            assertTrue(Files.exists(store.partFile(1)));
            assertFalse(Files.exists(store.partFile(2)));

            List<String> log = Files.readAllLines(store.logFile());
            assertTrue(log.get(log.size() - 1).contains("\"event\":\"abort\""));
        }

        @Test
        @DisplayName("A hard kill before the first batch should process nothing")
        void hardKillAtStart() throws IOException {
            Path input = writeInput(tempDir, nodes(10));

            MigrationResult result = engine(MigrationFixtures.governor(() -> 400))
                    .migrate(input, tempDir.resolve("work"), MigrationOptions.defaults(), null);

            assertTrue(result.isAborted());
            assertEquals(0, result.processed());
        }
    }

    @Nested
    @DisplayName("Validation and errors")
    class Errors {

        @Test
        @DisplayName("Invalid nodes should be skipped, logged and reported")
        void invalidNodesSkipped() throws IOException {
            List<Map<String, Object>> input = nodes(6);
            input.get(1).remove("id");
            input.get(3).put("connectsTo", List.of("node-3"));
            Path work = tempDir.resolve("work");

            MigrationResult result = engine(calmGovernor()).migrate(writeInput(tempDir, input), work,
                    MigrationOptions.defaults(), null);

            assertEquals(4, result.migrated());
            assertEquals(2, result.skipped());
            assertTrue(result.isComplete());

            ArgumentCaptor<ErrorEvent> events = ArgumentCaptor.forClass(ErrorEvent.class);
            verify(errorSink, times(2)).report(events.capture());
            assertEquals("validation", events.getAllValues().get(0).category());
            assertEquals("node-3", events.getAllValues().get(1).nodeId());

            long skipLines = Files.readAllLines(work.resolve(CheckpointStore.LOG_FILE)).stream()
                    .filter(line -> line.contains("\"event\":\"skip\""))
                    .count();
            assertEquals(2, skipLines);
        }

        @Test
        @DisplayName("A node with a mistyped field should be skipped, not abort the run")
        void mistypedFieldSkipped() throws IOException {
            List<Map<String, Object>> input = nodes(6);
            input.get(2).put("resonanceScore", "high");
            Path work = tempDir.resolve("work");

            MigrationResult result = engine(calmGovernor()).migrate(writeInput(tempDir, input), work,
                    MigrationOptions.defaults(), null);

            assertTrue(result.isComplete());
            assertEquals(6, result.processed());
            assertEquals(5, result.migrated());
            assertEquals(1, result.skipped());

            ArgumentCaptor<ErrorEvent> event = ArgumentCaptor.forClass(ErrorEvent.class);
            verify(errorSink).report(event.capture());
            assertEquals("validation", event.getValue().category());
            assertEquals("node-2", event.getValue().nodeId());
        }

        @Test
        @DisplayName("A dry run should write nothing")
        void dryRun() throws IOException {
            Path input = writeInput(tempDir, nodes(1500));
            Path work = tempDir.resolve("work");

            MigrationResult result = engine(calmGovernor()).migrate(input, work,
                    new MigrationOptions(true, 0, false), null);

            assertEquals(1500, result.migrated());
            assertTrue(result.isComplete());
            assertFalse(Files.exists(work));
        }

        @Test
        @DisplayName("A missing input should be fatal")
        void missingInput() {
            assertThrows(SourceUnavailableException.class, () -> engine(calmGovernor())
                    .migrate(tempDir.resolve("absent.json"), tempDir, MigrationOptions.defaults(), null));
        }

        @Test
        @DisplayName("Malformed input should be reported as corruption")
        void malformedInput() throws IOException {
            Path input = tempDir.resolve("broken.json");
            Files.writeString(input, "[{\"id\":\"a\"},{\"id\": nope}]");

            assertThrows(CorruptionDetectedException.class, () -> engine(calmGovernor())
                    .migrate(input, tempDir.resolve("work"), MigrationOptions.defaults(), null));
        }

        @Test
        @DisplayName("A checkpoint beyond the input should be reported as corruption and left untouched")
        void checkpointBeyondInput() throws IOException {
            Path input = writeInput(tempDir, nodes(10));
            Path work = tempDir.resolve("work");
            CheckpointStore store = new CheckpointStore(work, MAPPER);
            MigrationCheckpoint bogus = new MigrationCheckpoint(50, 50, 50, 0, null, "node-49", 1, false, null);
            store.save(bogus);

            assertThrows(CorruptionDetectedException.class, () -> engine(calmGovernor())
                    .migrate(input, work, MigrationOptions.defaults(), null));
            assertEquals(bogus, store.load().orElseThrow());
        }
    }
}
