package com.resonance.matrix.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonance.matrix.core.model.MigratedNode;
import com.resonance.matrix.core.model.MigrationCheckpoint;
import com.resonance.matrix.error.CorruptionDetectedException;
import com.resonance.matrix.error.SourceUnavailableException;
import com.resonance.matrix.io.AtomicFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Persists migration state and output parts under a work directory.
 *
 * <pre>
 * workDir/
 *   migration-state.json
 *   migration-log.jsonl
 *   migration-output/nodes-batch-0001.json
 * </pre>
 *
 * <p>Both the state file and every output part are written atomically. A part is always
 * written before the checkpoint that covers it.</p>
 */
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    public static final String STATE_FILE = "migration-state.json";
    public static final String LOG_FILE = "migration-log.jsonl";
    public static final String OUTPUT_DIR = "migration-output";

    private final Path workDir;
    private final ObjectMapper mapper;
    private final AtomicFileWriter writer;

    public CheckpointStore(Path workDir, ObjectMapper mapper) {
        this.workDir = workDir;
        this.mapper = mapper;
        this.writer = new AtomicFileWriter(mapper);
    }

    /**
     * Loads the persisted checkpoint, if any.
     *
     * @throws CorruptionDetectedException when the state file exists but cannot be parsed
     */
    public Optional<MigrationCheckpoint> load() {
        Path file = stateFile();
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            MigrationCheckpoint checkpoint = mapper.readValue(file.toFile(), MigrationCheckpoint.class);
            if (checkpoint.lastProcessedIndex() < 0 || checkpoint.checkpointCount() < 0) {
                throw new CorruptionDetectedException("Negative counters in checkpoint " + file);
            }
            return Optional.of(checkpoint);
        } catch (IOException e) {
            throw new CorruptionDetectedException("Unreadable checkpoint " + file, e);
        }
    }

    public void save(MigrationCheckpoint checkpoint) {
        try {
            writer.writeJson(stateFile(), checkpoint);
        } catch (IOException e) {
            throw new SourceUnavailableException(stateFile(), "Cannot write checkpoint", e);
        }
    }

    /**
     * Writes one output part. Parts are numbered from 1.
     */
    public Path writePart(int partNumber, List<MigratedNode> nodes) {
        Path part = partFile(partNumber);
        try {
            writer.writeJson(part, nodes);
        } catch (IOException e) {
            throw new SourceUnavailableException(part, "Cannot write output part", e);
        }
        log.debug("checkpoint.part.written part={} nodes={}", part.getFileName(), nodes.size());
        return part;
    }

    /**
     * Deletes the state file, the log and every output part.
     */
    public void reset() {
        try {
            Files.deleteIfExists(stateFile());
            Files.deleteIfExists(logFile());
            Path outputDir = workDir.resolve(OUTPUT_DIR);
            if (Files.isDirectory(outputDir)) {
                try (DirectoryStream<Path> parts = Files.newDirectoryStream(outputDir, "nodes-batch-*.json")) {
                    for (Path part : parts) {
                        Files.delete(part);
                    }
                }
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(workDir, "Cannot reset migration state", e);
        }
        log.info("checkpoint.reset workDir={}", workDir);
    }

    public Path stateFile() {
        return workDir.resolve(STATE_FILE);
    }

    public Path logFile() {
        return workDir.resolve(LOG_FILE);
    }

    public Path partFile(int partNumber) {
        return workDir.resolve(OUTPUT_DIR).resolve(String.format("nodes-batch-%04d.json", partNumber));
    }

    public Path getWorkDir() {
        return workDir;
    }
}
