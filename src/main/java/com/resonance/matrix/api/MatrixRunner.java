package com.resonance.matrix.api;

import com.resonance.matrix.config.MatrixConfig;
import com.resonance.matrix.config.MatrixConfigLoader;
import com.resonance.matrix.error.CorruptionDetectedException;
import com.resonance.matrix.error.MatrixException;
import com.resonance.matrix.error.SourceUnavailableException;
import com.resonance.matrix.io.MatrixOutputWriter;
import com.resonance.matrix.migration.MigrationOptions;
import com.resonance.matrix.migration.MigrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command line entry point.
 *
 * <p>Exit codes: 0 completed, 1 corruption or fatal I/O, 2 partial (aborted and
 * resumable from the checkpoint), 64 usage error.</p>
 */
public final class MatrixRunner {
    private static final Logger log = LoggerFactory.getLogger(MatrixRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_PARTIAL = 2;
    public static final int EXIT_USAGE = 64;

    private MatrixRunner() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        MatrixConfig config;
        try {
            config = new MatrixConfigLoader().load();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        return run(args, config, System.err);
    }

    static int run(String[] args, MatrixConfig baseConfig, PrintStream err) {
        CliArguments cli;
        try {
            cli = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }

        MatrixConfig config = baseConfig.withDirectories(
                cli.dataDir().orElse(baseConfig.dataDir()),
                cli.outputDir().orElse(baseConfig.outputDir()));

        try (MatrixPipeline pipeline = MatrixPipeline.builder().config(config).build()) {
            return switch (cli.command()) {
                case BUILD -> build(pipeline, cli);
                case MIGRATE -> migrate(pipeline, cli, config);
            };
        } catch (CorruptionDetectedException e) {
            log.error("matrix.run.corruption error={}", e.getMessage());
            err.println("Corruption detected: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (SourceUnavailableException e) {
            log.error("matrix.run.io_failure path={} error={}", e.getSource(), e.getMessage());
            err.println("I/O failure: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (MatrixException e) {
            log.error("matrix.run.failed error={}", e.getMessage(), e);
            err.println("Failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int build(MatrixPipeline pipeline, CliArguments cli) {
        BuildResult result = pipeline.build(cli.dryRun());
        log.info("matrix.run.build nodes={} recommendations={} proposals={} written={}",
                result.nodes().size(), result.recommendations().size(), result.proposals().size(),
                result.written());
        return EXIT_OK;
    }

    private static int migrate(MatrixPipeline pipeline, CliArguments cli, MatrixConfig config) {
        Path input = cli.input().orElse(config.outputDir().resolve(MatrixOutputWriter.REGISTRY_FILE));
        MigrationOptions options = new MigrationOptions(cli.dryRun(), cli.limit(), cli.fresh());
        MigrationResult result = pipeline.migrate(input, options,
                progress -> log.info("matrix.run.progress batch={} index={}/{} percent={}",
                        progress.batchNumber(), progress.processedIndex(), progress.inputSize(),
                        Math.round(progress.percentComplete())));
        if (result.isAborted()) {
            log.warn("matrix.run.partial processed={}/{} reason={} resumeFrom={}",
                    result.checkpoint().lastProcessedIndex(), result.inputSize(), result.abortReason(),
                    result.checkpoint().lastProcessedIndex());
            return EXIT_PARTIAL;
        }
        log.info("matrix.run.migrate processed={}/{} migrated={} skipped={} complete={}",
                result.checkpoint().totalProcessed(), result.inputSize(), result.migrated(), result.skipped(),
                result.isComplete());
        return EXIT_OK;
    }
}
