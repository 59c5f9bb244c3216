package com.resonance.matrix.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes JSON files so that readers never observe a partially written file:
 * the content goes to a sibling temp file which is then moved over the target.
 */
public class AtomicFileWriter {
    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    private final ObjectMapper mapper;

    public AtomicFileWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Serializes {@code value} to {@code target} atomically.
     *
     * @throws IOException when the temp file cannot be written or moved
     */
    public void writeJson(Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                mapper.writeValue(out, value);
            }
            move(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("atomic.move.unsupported target={} falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
