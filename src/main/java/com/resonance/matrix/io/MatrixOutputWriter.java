package com.resonance.matrix.io;

import com.resonance.matrix.core.model.LinkMapDocument;
import com.resonance.matrix.core.model.ProposalDocument;
import com.resonance.matrix.core.model.RegistryDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the registry build artifacts into an output directory.
 */
public class MatrixOutputWriter {
    private static final Logger log = LoggerFactory.getLogger(MatrixOutputWriter.class);

    public static final String REGISTRY_FILE = "registry.json";
    public static final String LINK_MAP_FILE = "link-map.json";
    public static final String PROPOSALS_FILE = "node-proposals.json";

    private final Path outputDir;
    private final AtomicFileWriter writer;

    public MatrixOutputWriter(Path outputDir) {
        this(outputDir, new AtomicFileWriter(MatrixJson.prettyMapper()));
    }

    public MatrixOutputWriter(Path outputDir, AtomicFileWriter writer) {
        this.outputDir = outputDir;
        this.writer = writer;
    }

    public void write(RegistryDocument registry, LinkMapDocument linkMap, ProposalDocument proposals)
            throws IOException {
        writer.writeJson(outputDir.resolve(REGISTRY_FILE), registry);
        writer.writeJson(outputDir.resolve(LINK_MAP_FILE), linkMap);
        writer.writeJson(outputDir.resolve(PROPOSALS_FILE), proposals);
        log.info("matrix.output.written dir={} nodes={} recommendations={} proposals={}",
                outputDir, registry.nodes().size(), linkMap.recommendations().size(),
                proposals.proposals().size());
    }

    public Path getOutputDir() {
        return outputDir;
    }
}
