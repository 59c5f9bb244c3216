package com.resonance.matrix.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonance.matrix.core.model.HeartbeatRecord;
import com.resonance.matrix.error.SourceUnavailableException;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only, line-delimited JSON log of heartbeats, skips, checkpoints and aborts.
 * Every record is flushed as soon as it is written.
 */
public class HeartbeatLog implements Closeable {

    private final Path file;
    private final ObjectMapper mapper;
    private BufferedWriter writer;

    public HeartbeatLog(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    public void append(HeartbeatRecord record) {
        try {
            if (writer == null) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            }
            writer.write(mapper.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new SourceUnavailableException(file, "Cannot append to heartbeat log", e);
        }
    }

    @Override
    public void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            throw new SourceUnavailableException(file, "Cannot close heartbeat log", e);
        } finally {
            writer = null;
        }
    }

    public Path getFile() {
        return file;
    }
}
