package com.resonance.matrix.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonance.matrix.core.model.Signal;
import com.resonance.matrix.io.MatrixJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads aggregate usage signals from a signals directory.
 *
 * <ul>
 *   <li>{@code signals.json}: an array of signal objects</li>
 *   <li>{@code signals.jsonl}: one signal object per line; malformed lines are skipped</li>
 *   <li>{@code ga4-aggregate.json}: analytics rows keyed by path, where
 *       {@code avgEngagementTime} stands for dwell time</li>
 * </ul>
 *
 * <p>Every source is optional and degrades to an empty list.</p>
 */
public class SignalLoader {
    private static final Logger log = LoggerFactory.getLogger(SignalLoader.class);

    public static final String SIGNALS_JSON = "signals.json";
    public static final String SIGNALS_JSONL = "signals.jsonl";
    public static final String GA4_AGGREGATE = "ga4-aggregate.json";
    public static final String GA4_SOURCE = "ga4-aggregate";

    private final Path signalsDir;
    private final ObjectMapper mapper;

    public SignalLoader(Path signalsDir) {
        this(signalsDir, MatrixJson.compactMapper());
    }

    public SignalLoader(Path signalsDir, ObjectMapper mapper) {
        this.signalsDir = signalsDir;
        this.mapper = mapper;
    }

    public List<Signal> load() {
        List<Signal> signals = new ArrayList<>();
        signals.addAll(loadJsonArray());
        signals.addAll(loadJsonLines());
        signals.addAll(loadGa4Aggregate());
        log.info("signals.loaded dir={} count={}", signalsDir, signals.size());
        return signals;
    }

    List<Signal> loadJsonArray() {
        Path file = signalsDir.resolve(SIGNALS_JSON);
        List<Signal> signals = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            return signals;
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("signals.unreadable file={} error={}", file, e.getMessage());
            return signals;
        }
        if (root == null || !root.isArray()) {
            return signals;
        }
        for (JsonNode item : root) {
            try {
                signals.add(mapper.treeToValue(item, Signal.class));
            } catch (JsonProcessingException e) {
                log.warn("signals.entry.malformed file={} error={}", file, e.getOriginalMessage());
            }
        }
        return signals;
    }

    List<Signal> loadJsonLines() {
        Path file = signalsDir.resolve(SIGNALS_JSONL);
        List<Signal> signals = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            return signals;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                try {
                    signals.add(mapper.readValue(line, Signal.class));
                } catch (JsonProcessingException e) {
                    log.warn("signals.line.invalid file={} line={}", file, lineNumber);
                }
            }
        } catch (IOException e) {
            log.warn("signals.unreadable file={} error={}", file, e.getMessage());
        }
        return signals;
    }

    List<Signal> loadGa4Aggregate() {
        Path file = signalsDir.resolve(GA4_AGGREGATE);
        List<Signal> signals = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            return signals;
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("signals.unreadable file={} error={}", file, e.getMessage());
            return signals;
        }
        if (root == null || !root.isArray()) {
            return signals;
        }
        for (JsonNode row : root) {
            String path = row.path("path").asText(null);
            if (Keys.isBlank(path)) {
                continue;
            }
            double dwell = row.hasNonNull("avgEngagementTime")
                    ? row.get("avgEngagementTime").asDouble()
                    : row.path("dwellSeconds").asDouble(0);
            signals.add(Signal.builder()
                    .path(path)
                    .impressions(row.path("impressions").asDouble(0))
                    .clicks(row.path("clicks").asDouble(0))
                    .ctr(row.hasNonNull("ctr") ? row.get("ctr").asDouble() : null)
                    .dwellSeconds(dwell)
                    .timestamp(parseInstant(row.path("timestamp").asText(null)))
                    .source(GA4_SOURCE)
                    .build());
        }
        return signals;
    }

    private static Instant parseInstant(String value) {
        if (Keys.isBlank(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("signals.timestamp.invalid value={}", value);
            return null;
        }
    }
}
