package com.resonance.matrix.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.resonance.matrix.config.MatrixConfig;
import com.resonance.matrix.core.model.LinkMapDocument;
import com.resonance.matrix.core.model.LinkRecommendation;
import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.core.model.NodeProposal;
import com.resonance.matrix.core.model.ProposalDocument;
import com.resonance.matrix.core.model.RecommendationStatus;
import com.resonance.matrix.core.model.RegistryDocument;
import com.resonance.matrix.core.model.Signal;
import com.resonance.matrix.error.ErrorSink;
import com.resonance.matrix.error.LoggingErrorSink;
import com.resonance.matrix.error.SourceUnavailableException;
import com.resonance.matrix.governor.FailSafeExecutor;
import com.resonance.matrix.governor.HardwareMonitor;
import com.resonance.matrix.governor.JvmHardwareMonitor;
import com.resonance.matrix.governor.ResourceGovernor;
import com.resonance.matrix.governor.Sleeper;
import com.resonance.matrix.health.HealthStatus;
import com.resonance.matrix.health.ResourceHealthCheck;
import com.resonance.matrix.io.MatrixJson;
import com.resonance.matrix.io.MatrixOutputWriter;
import com.resonance.matrix.link.LinkRecommendationEngine;
import com.resonance.matrix.link.ProposalBuilder;
import com.resonance.matrix.loader.ContentGraphLoader;
import com.resonance.matrix.loader.SignalLoader;
import com.resonance.matrix.logging.LogContext;
import com.resonance.matrix.metrics.MetricsService;
import com.resonance.matrix.metrics.NoOpMetricsService;
import com.resonance.matrix.migration.MigrationOptions;
import com.resonance.matrix.migration.MigrationResult;
import com.resonance.matrix.migration.ProgressCallback;
import com.resonance.matrix.migration.StreamingMigrationEngine;
import com.resonance.matrix.route.RouteDiscoveryEngine;
import com.resonance.matrix.scoring.ResonanceScorer;
import com.resonance.matrix.scoring.ScoringReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main entry point of the library. Wires loaders, scorer, link engine, migration engine,
 * route discovery and the resource governor from one {@link MatrixConfig}.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (MatrixPipeline pipeline = MatrixPipeline.builder()
 *         .config(new MatrixConfigLoader().load())
 *         .metricsService(new MicrometerMetricsService(registry))
 *         .build()) {
 *
 *     BuildResult build = pipeline.build(false);
 *     MigrationResult migration = pipeline.migrate(input, MigrationOptions.defaults(), ProgressCallback.NOOP);
 *     ResilientRouter router = pipeline.router(build.recommendations());
 * }
 * </pre>
 */
public class MatrixPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MatrixPipeline.class);

    public static final String DOCUMENT_VERSION = "1.0";
    public static final String SIGNALS_DIR = "signals";

    private final MatrixConfig config;
    private final MetricsService metricsService;
    private final ErrorSink errorSink;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ResourceGovernor governor;
    private final ResourceHealthCheck healthCheck;
    private final ExecutorService failoverExecutor;

    private MatrixPipeline(Builder builder) {
        this.config = builder.config != null ? builder.config : MatrixConfig.defaults();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.errorSink = builder.errorSink != null ? builder.errorSink : new LoggingErrorSink();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.mapper = MatrixJson.prettyMapper();

        HardwareMonitor monitor = builder.hardwareMonitor != null ? builder.hardwareMonitor : new JvmHardwareMonitor();
        Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.governor = new ResourceGovernor(config.governor(), monitor, sleeper, metricsService);
        this.healthCheck = new ResourceHealthCheck(governor);
        this.failoverExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "matrix-failover");
            thread.setDaemon(true);
            return thread;
        });

        log.info("matrix.pipeline.initialized dataDir={} outputDir={} batchSize={}",
                config.dataDir(), config.outputDir(), config.migration().batchSize());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the content graph and signals, scores the nodes, derives link recommendations
     * and proposals, and writes {@code registry.json}, {@code link-map.json} and
     * {@code node-proposals.json} unless {@code dryRun} is set.
     *
     * @throws SourceUnavailableException when the artifacts cannot be written
     */
    public BuildResult build(boolean dryRun) {
        try (LogContext ctx = LogContext.forBuild(LogContext.generateRunId())) {
            List<Node> nodes = new ContentGraphLoader(config.dataDir(), mapper).load();
            List<Signal> signals = new SignalLoader(config.dataDir().resolve(SIGNALS_DIR), mapper).load();

            ScoringReport report = new ResonanceScorer(config.scoring(), clock, metricsService).score(nodes, signals);
            List<LinkRecommendation> recommendations = new LinkRecommendationEngine(config.link()).recommend(nodes);
            List<NodeProposal> proposals = new ProposalBuilder(config.link()).build(nodes);

            if (!dryRun) {
                write(nodes, recommendations, proposals);
            }
            BuildResult result = new BuildResult(nodes, recommendations, proposals, report, !dryRun,
                    config.outputDir());
            log.info("matrix.build.completed result={}", result);
            return result;
        }
    }

    /**
     * Migrates {@code input} into the output directory, resuming from its checkpoint.
     */
    public MigrationResult migrate(Path input, MigrationOptions options, ProgressCallback callback) {
        StreamingMigrationEngine engine = new StreamingMigrationEngine(config.migration(), governor,
                metricsService, errorSink, clock);
        return engine.migrate(input, config.outputDir(), options, callback);
    }

    /**
     * Route lookups over the given recommendations, guarded by the fail-safe executor.
     */
    public ResilientRouter router(List<LinkRecommendation> recommendations) {
        RouteDiscoveryEngine engine = new RouteDiscoveryEngine(recommendations, config.route(),
                Ticker.systemTicker(), metricsService);
        FailSafeExecutor executor = new FailSafeExecutor(failoverExecutor, config.governor().failoverTimeout(),
                clock, metricsService);
        return new ResilientRouter(engine, executor, recommendations, config.route().maxRoutes());
    }

    public HealthStatus health() {
        return healthCheck.check();
    }

    public MatrixConfig getConfig() {
        return config;
    }

    public ResourceGovernor getGovernor() {
        return governor;
    }

    @Override
    public void close() {
        failoverExecutor.shutdownNow();
        log.info("matrix.pipeline.closed peakHeapMB={} throttles={}",
                governor.getPeakMemoryMb(), governor.getThrottleCount());
    }

    private void write(List<Node> nodes, List<LinkRecommendation> recommendations, List<NodeProposal> proposals) {
        Instant generated = clock.instant();
        MatrixOutputWriter writer = new MatrixOutputWriter(config.outputDir());
        try {
            writer.write(
                    new RegistryDocument(DOCUMENT_VERSION, generated, nodes),
                    new LinkMapDocument(DOCUMENT_VERSION, generated, recommendations),
                    new ProposalDocument(DOCUMENT_VERSION, generated, RecommendationStatus.DRAFT, proposals));
        } catch (IOException e) {
            throw new SourceUnavailableException(config.outputDir(), "Cannot write build artifacts", e);
        }
    }

    /**
     * Builder for MatrixPipeline.
     */
    public static class Builder {
        private MatrixConfig config;
        private MetricsService metricsService;
        private ErrorSink errorSink;
        private Clock clock;
        private HardwareMonitor hardwareMonitor;
        private Sleeper sleeper;

        public Builder config(MatrixConfig config) {
            this.config = config;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder errorSink(ErrorSink errorSink) {
            this.errorSink = errorSink;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder hardwareMonitor(HardwareMonitor hardwareMonitor) {
            this.hardwareMonitor = hardwareMonitor;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public MatrixPipeline build() {
            return new MatrixPipeline(this);
        }
    }
}
