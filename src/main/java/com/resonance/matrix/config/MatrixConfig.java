package com.resonance.matrix.config;

import com.resonance.matrix.governor.GovernorConfig;
import com.resonance.matrix.link.LinkConfig;
import com.resonance.matrix.migration.MigrationConfig;
import com.resonance.matrix.route.RouteConfig;
import com.resonance.matrix.scoring.ScoringWeights;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Aggregate configuration of the library.
 */
public record MatrixConfig(
        Path dataDir,
        Path outputDir,
        ScoringWeights scoring,
        LinkConfig link,
        MigrationConfig migration,
        RouteConfig route,
        GovernorConfig governor
) {
    public MatrixConfig {
        Objects.requireNonNull(dataDir, "dataDir is required");
        Objects.requireNonNull(outputDir, "outputDir is required");
        scoring = scoring != null ? scoring : ScoringWeights.defaults();
        link = link != null ? link : LinkConfig.defaults();
        migration = migration != null ? migration : MigrationConfig.defaults();
        route = route != null ? route : RouteConfig.defaults();
        governor = governor != null ? governor : GovernorConfig.defaults();
    }

    /**
     * Defaults rooted at {@code public/data} and {@code public/data/matrix}.
     */
    public static MatrixConfig defaults() {
        return new MatrixConfig(Path.of("public", "data"), Path.of("public", "data", "matrix"),
                null, null, null, null, null);
    }

    public MatrixConfig withDirectories(Path dataDir, Path outputDir) {
        return new MatrixConfig(dataDir, outputDir, scoring, link, migration, route, governor);
    }
}
