package com.resonance.matrix.config;

import com.resonance.matrix.governor.GovernorConfig;
import com.resonance.matrix.link.LinkConfig;
import com.resonance.matrix.migration.MigrationConfig;
import com.resonance.matrix.route.RouteConfig;
import com.resonance.matrix.scoring.ScoringWeights;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds a {@link MatrixConfig} from MicroProfile Config.
 *
 * <p>Every key is optional and falls back to the defaults of the corresponding record.
 * With the SmallRye implementation, values can come from
 * {@code META-INF/microprofile-config.properties}, system properties, or environment
 * variables ({@code matrix.migration.batch-size} maps to {@code MATRIX_MIGRATION_BATCH_SIZE}).</p>
 *
 * <pre>
 * matrix.data-dir=public/data
 * matrix.output-dir=public/data/matrix
 * matrix.migration.batch-size=500
 * matrix.migration.heartbeat-interval=1000
 * matrix.migration.checkpoint-interval=5000
 * matrix.governor.hard-kill-mb=1024
 * matrix.route.time-budget-ms=50
 * </pre>
 */
public class MatrixConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(MatrixConfigLoader.class);

    private static final String PREFIX = "matrix.";

    private final Config config;

    public MatrixConfigLoader() {
        this(ConfigProvider.getConfig());
    }

    public MatrixConfigLoader(Config config) {
        this.config = config;
    }

    public MatrixConfig load() {
        MatrixConfig defaults = MatrixConfig.defaults();
        MatrixConfig loaded = new MatrixConfig(
                Path.of(string("data-dir", defaults.dataDir().toString())),
                Path.of(string("output-dir", defaults.outputDir().toString())),
                loadScoring(),
                loadLink(),
                loadMigration(),
                loadRoute(),
                loadGovernor());
        log.debug("matrix.config.loaded dataDir={} outputDir={} migration={} governor={}",
                loaded.dataDir(), loaded.outputDir(), loaded.migration(), loaded.governor());
        return loaded;
    }

    ScoringWeights loadScoring() {
        ScoringWeights d = ScoringWeights.defaults();
        return new ScoringWeights(
                dbl("scoring.resonance-floor", d.resonanceFloor()),
                dbl("scoring.ctr-cap", d.ctrCap()),
                dbl("scoring.ctr-weight", d.ctrWeight()),
                dbl("scoring.dwell-cap-minutes", d.dwellCapMinutes()),
                dbl("scoring.dwell-weight", d.dwellWeight()),
                dbl("scoring.depth-cap", d.depthCap()),
                dbl("scoring.depth-weight", d.depthWeight()),
                dbl("scoring.return-cap", d.returnCap()),
                dbl("scoring.return-weight", d.returnWeight()),
                dbl("scoring.unobserved-decay-step", d.unobservedDecayStep()),
                dbl("scoring.unobserved-decay-cap", d.unobservedDecayCap()),
                dbl("scoring.age-decay-per-day", d.ageDecayPerDay()),
                dbl("scoring.age-decay-cap", d.ageDecayCap()));
    }

    LinkConfig loadLink() {
        LinkConfig d = LinkConfig.defaults();
        return new LinkConfig(
                integer("link.top-k", d.topK()),
                dbl("link.proposal-threshold", d.proposalThreshold()));
    }

    MigrationConfig loadMigration() {
        MigrationConfig d = MigrationConfig.defaults();
        Set<String> anchors = config.getOptionalValues(PREFIX + "migration.anchors", String.class)
                .<Set<String>>map(LinkedHashSet::new)
                .orElse(d.anchors());
        return new MigrationConfig(
                integer("migration.batch-size", d.batchSize()),
                integer("migration.heartbeat-interval", d.heartbeatInterval()),
                integer("migration.checkpoint-interval", d.checkpointInterval()),
                anchors);
    }

    RouteConfig loadRoute() {
        RouteConfig d = RouteConfig.defaults();
        return new RouteConfig(
                integer("route.max-depth", d.maxDepth()),
                integer("route.max-routes", d.maxRoutes()),
                Duration.ofMillis(lng("route.time-budget-ms", d.timeBudget().toMillis())),
                integer("route.cache-size", d.cacheSize()));
    }

    GovernorConfig loadGovernor() {
        GovernorConfig d = GovernorConfig.defaults();
        return new GovernorConfig(
                lng("governor.memory-target-mb", d.memoryTargetMb()),
                lng("governor.throttle-mb", d.throttleMb()),
                lng("governor.hard-kill-mb", d.hardKillMb()),
                dbl("governor.throttle-celsius", d.throttleCelsius()),
                dbl("governor.hard-kill-celsius", d.hardKillCelsius()),
                Duration.ofMillis(lng("governor.throttle-delay-ms", d.throttleDelay().toMillis())),
                Duration.ofMillis(lng("governor.failover-timeout-ms", d.failoverTimeout().toMillis())));
    }

    private String string(String key, String fallback) {
        return config.getOptionalValue(PREFIX + key, String.class).orElse(fallback);
    }

    private int integer(String key, int fallback) {
        return config.getOptionalValue(PREFIX + key, Integer.class).orElse(fallback);
    }

    private long lng(String key, long fallback) {
        return config.getOptionalValue(PREFIX + key, Long.class).orElse(fallback);
    }

    private double dbl(String key, double fallback) {
        return config.getOptionalValue(PREFIX + key, Double.class).orElse(fallback);
    }
}
