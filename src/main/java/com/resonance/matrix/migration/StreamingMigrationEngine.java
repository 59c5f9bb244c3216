package com.resonance.matrix.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonance.matrix.error.ErrorSink;
import com.resonance.matrix.error.LoggingErrorSink;
import com.resonance.matrix.governor.GovernorConfig;
import com.resonance.matrix.governor.ResourceGovernor;
import com.resonance.matrix.io.MatrixJson;
import com.resonance.matrix.logging.LogContext;
import com.resonance.matrix.metrics.MetricsService;
import com.resonance.matrix.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Migrates a node collection of any size to the flat migration schema under bounded memory.
 *
 * <p>Nodes are streamed one at a time from the input, validated, transformed and buffered
 * until the next checkpoint boundary, where the buffer is written as an output part and
 * the checkpoint is persisted. A run interrupted by a crash, a hard kill or a cancellation
 * resumes from the last checkpoint.</p>
 *
 * <pre>
 * StreamingMigrationEngine engine = new StreamingMigrationEngine(MigrationConfig.defaults());
 * MigrationResult result = engine.migrate(input, workDir, MigrationOptions.defaults(), ProgressCallback.NOOP);
 * </pre>
 */
public class StreamingMigrationEngine {
    private static final Logger log = LoggerFactory.getLogger(StreamingMigrationEngine.class);

    private final MigrationConfig config;
    private final ResourceGovernor governor;
    private final MetricsService metrics;
    private final ErrorSink errorSink;
    private final Clock clock;
    private final ObjectMapper documentMapper = MatrixJson.prettyMapper();
    private final ObjectMapper logMapper = MatrixJson.compactMapper();

    public StreamingMigrationEngine(MigrationConfig config) {
        this(config, new ResourceGovernor(GovernorConfig.defaults()), new NoOpMetricsService(),
                new LoggingErrorSink(), Clock.systemUTC());
    }

    public StreamingMigrationEngine(MigrationConfig config, ResourceGovernor governor,
                                    MetricsService metrics, ErrorSink errorSink, Clock clock) {
        this.config = config;
        this.governor = governor;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.errorSink = errorSink != null ? errorSink : ErrorSink.NOOP;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Opens a run positioned at the resume index. The caller drives it batch by batch.
     *
     * @param input   JSON array of nodes, or an object with a {@code nodes} array
     * @param workDir directory holding the checkpoint, the log and the output parts
     * @throws com.resonance.matrix.error.SourceUnavailableException if the input does not exist
     * @throws com.resonance.matrix.error.CorruptionDetectedException if the input or checkpoint is unusable
     */
    public MigrationRun start(Path input, Path workDir, MigrationOptions options) {
        MigrationOptions opts = options != null ? options : MigrationOptions.defaults();
        CheckpointStore store = new CheckpointStore(workDir, documentMapper);
        HeartbeatLog heartbeatLog = opts.dryRun() ? null : new HeartbeatLog(store.logFile(), logMapper);
        MigrationRun run = new MigrationRun(config, opts, governor, metrics, errorSink, store,
                heartbeatLog, documentMapper, clock);
        try {
            run.open(input);
        } catch (RuntimeException e) {
            run.close();
            throw e;
        }
        return run;
    }

    /**
     * Runs a migration to its end, reporting every batch to the callback.
     */
    public MigrationResult migrate(Path input, Path workDir, MigrationOptions options, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forMigration(runId, input.toString());
             MigrationRun run = start(input, workDir, options)) {
            log.info("migration.started inputSize={} batchSize={} checkpointInterval={} dryRun={}",
                    run.getInputSize(), config.batchSize(), config.checkpointInterval(),
                    options != null && options.dryRun());
            while (run.hasNext()) {
                cb.onBatch(run.next());
            }
            MigrationResult result = run.getResult();
            log.info("migration.finished result={} peakHeapMB={}", result, governor.getPeakMemoryMb());
            return result;
        }
    }

    public MigrationConfig getConfig() {
        return config;
    }

    public ResourceGovernor getGovernor() {
        return governor;
    }
}
