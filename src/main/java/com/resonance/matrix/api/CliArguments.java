package com.resonance.matrix.api;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Parsed command line of {@link MatrixRunner}.
 *
 * @param command   {@code build} or {@code migrate}
 * @param dryRun    compute everything but write nothing
 * @param limit     migrate at most this many nodes, 0 for all
 * @param fresh     discard persisted migration state first
 * @param dataDir   overrides {@code matrix.data-dir}
 * @param outputDir overrides {@code matrix.output-dir}
 * @param input     migration input, defaults to the registry in the output directory
 */
public record CliArguments(
        Command command,
        boolean dryRun,
        long limit,
        boolean fresh,
        Optional<Path> dataDir,
        Optional<Path> outputDir,
        Optional<Path> input
) {

    public enum Command { BUILD, MIGRATE }

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: matrix <build|migrate> [options]",
            "  --dry-run            compute without writing any file",
            "  --limit=N            migrate at most N nodes in this invocation",
            "  --fresh              discard migration state and start from the first node",
            "  --data-dir=PATH      content graph directory",
            "  --output-dir=PATH    artifact and migration work directory",
            "  --input=PATH         migration input (default: <output-dir>/registry.json)");

    /**
     * @throws IllegalArgumentException on an unknown command, an unknown flag or a malformed value
     */
    public static CliArguments parse(String... args) {
        Command command = null;
        boolean dryRun = false;
        boolean fresh = false;
        long limit = 0;
        Path dataDir = null;
        Path outputDir = null;
        Path input = null;

        for (String arg : args) {
            if (arg.equals("--dry-run")) {
                dryRun = true;
            } else if (arg.equals("--fresh")) {
                fresh = true;
            } else if (arg.startsWith("--limit=")) {
                limit = parseLimit(value(arg));
            } else if (arg.startsWith("--data-dir=")) {
                dataDir = Path.of(value(arg));
            } else if (arg.startsWith("--output-dir=")) {
                outputDir = Path.of(value(arg));
            } else if (arg.startsWith("--input=")) {
                input = Path.of(value(arg));
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else if (command == null) {
                command = parseCommand(arg);
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }
        if (command == null) {
            throw new IllegalArgumentException("Missing command");
        }
        return new CliArguments(command, dryRun, limit, fresh, Optional.ofNullable(dataDir),
                Optional.ofNullable(outputDir), Optional.ofNullable(input));
    }

    private static Command parseCommand(String arg) {
        return switch (arg) {
            case "build" -> Command.BUILD;
            case "migrate" -> Command.MIGRATE;
            default -> throw new IllegalArgumentException("Unknown command: " + arg);
        };
    }

    private static String value(String arg) {
        String value = arg.substring(arg.indexOf('=') + 1);
        if (value.isBlank()) {
            throw new IllegalArgumentException("Missing value for " + arg);
        }
        return value;
    }

    private static long parseLimit(String value) {
        try {
            long limit = Long.parseLong(value);
            if (limit <= 0) {
                throw new IllegalArgumentException("--limit must be positive: " + value);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--limit is not a number: " + value, e);
        }
    }
}
