package com.resonance.matrix.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.core.model.NodeType;
import com.resonance.matrix.io.MatrixJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the raw content collections of a data directory and normalizes them into nodes.
 *
 * <p>Expected files, all optional:</p>
 * <pre>
 * gates.json            {"gates": [{"id": "...", "title": "..."}]}  or a bare array
 * pain-points.json      {"painPoints": {"gateId": [{"id": "...", "title": "..."}]}}
 * tools-canonical.json  {"tools": [...]}   preferred source
 * tools.json            {"tools": [...]}   fallback source
 * insights.json         {"insights": [{"slug": "...", "title": "..."}]}
 * </pre>
 *
 * <p>A missing or malformed file yields an empty collection and a warning, never a failure.</p>
 */
public class ContentGraphLoader {
    private static final Logger log = LoggerFactory.getLogger(ContentGraphLoader.class);

    public static final String GATES_FILE = "gates.json";
    public static final String PAIN_POINTS_FILE = "pain-points.json";
    public static final String TOOLS_CANONICAL_FILE = "tools-canonical.json";
    public static final String TOOLS_FILE = "tools.json";
    public static final String INSIGHTS_FILE = "insights.json";

    private final Path dataDir;
    private final ObjectMapper mapper;

    public ContentGraphLoader(Path dataDir) {
        this(dataDir, MatrixJson.prettyMapper());
    }

    public ContentGraphLoader(Path dataDir, ObjectMapper mapper) {
        this.dataDir = dataDir;
        this.mapper = mapper;
    }

    /**
     * Loads every collection and builds the node registry.
     */
    public List<Node> load() {
        List<Node> nodes = buildRegistry(loadGates(), loadPainPoints(), loadTools(), loadInsights());
        log.info("loader.registry.built dataDir={} nodes={}", dataDir, nodes.size());
        return nodes;
    }

    public List<GateRecord> loadGates() {
        JsonNode root = readTree(GATES_FILE);
        JsonNode array = root != null && root.isObject() ? root.get("gates") : root;
        List<GateRecord> gates = new ArrayList<>();
        forEachObject(array, GATES_FILE, item -> {
            GateRecord gate = mapper.treeToValue(item, GateRecord.class);
            if (!Keys.isBlank(gate.id())) {
                gates.add(gate);
            }
        });
        return gates;
    }

    public Map<String, List<PainPointRecord>> loadPainPoints() {
        JsonNode root = readTree(PAIN_POINTS_FILE);
        Map<String, List<PainPointRecord>> byGate = new LinkedHashMap<>();
        JsonNode painPoints = root != null ? root.get("painPoints") : null;
        if (painPoints == null || !painPoints.isObject()) {
            return byGate;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = painPoints.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            List<PainPointRecord> list = new ArrayList<>();
            forEachObject(entry.getValue(), PAIN_POINTS_FILE, item -> {
                PainPointRecord pp = mapper.treeToValue(item, PainPointRecord.class);
                if (!Keys.isBlank(pp.id())) {
                    list.add(pp);
                }
            });
            byGate.put(entry.getKey(), list);
        }
        return byGate;
    }

    /**
     * Loads tools from the canonical and the fallback source and merges duplicates by
     * normalized slug. Records from the canonical source come first, so their non-empty
     * fields win.
     */
    public List<ToolRecord> loadTools() {
        List<ToolRecord> raw = new ArrayList<>();
        raw.addAll(readTools(TOOLS_CANONICAL_FILE, "tools-canonical"));
        raw.addAll(readTools(TOOLS_FILE, "tools"));

        Map<String, ToolRecord> merged = new LinkedHashMap<>();
        for (ToolRecord tool : raw) {
            String key = tool.mergeKey();
            if (key.isEmpty()) {
                continue;
            }
            merged.merge(key, tool, ToolRecord::mergeWith);
        }
        if (merged.size() < raw.size()) {
            log.debug("loader.tools.merged raw={} unique={}", raw.size(), merged.size());
        }
        return new ArrayList<>(merged.values());
    }

    public List<InsightRecord> loadInsights() {
        JsonNode root = readTree(INSIGHTS_FILE);
        JsonNode array = root != null && root.isObject() ? root.get("insights") : root;
        List<InsightRecord> insights = new ArrayList<>();
        forEachObject(array, INSIGHTS_FILE, item -> {
            InsightRecord insight = mapper.treeToValue(item, InsightRecord.class);
            if (!insight.key().isEmpty()) {
                insights.add(insight);
            }
        });
        return insights;
    }

    /**
     * Builds nodes from resolved collections, in the order gates, pain points, tools, insights.
     */
    public List<Node> buildRegistry(List<GateRecord> gates,
                                    Map<String, List<PainPointRecord>> painPoints,
                                    List<ToolRecord> tools,
                                    List<InsightRecord> insights) {
        List<Node> nodes = new ArrayList<>();

        for (GateRecord gate : gates) {
            nodes.add(Node.builder()
                    .id("gate::" + gate.id())
                    .type(NodeType.GATE)
                    .path("/gates/" + gate.id())
                    .title(gate.title())
                    .tags(List.of(gate.id()))
                    .cluster(gate.id())
                    .build());
        }

        painPoints.forEach((gateId, list) -> {
            for (PainPointRecord pp : list) {
                nodes.add(Node.builder()
                        .id("pain::" + gateId + "::" + pp.id())
                        .type(NodeType.PAIN_POINT)
                        .path("/gates/" + gateId + "/" + pp.id())
                        .title(pp.title())
                        .tags(List.of(gateId, pp.id()))
                        .cluster(gateId)
                        .build());
            }
        });

        for (ToolRecord tool : tools) {
            nodes.add(Node.builder()
                    .id("tool::" + tool.id())
                    .type(NodeType.TOOL)
                    .path("/tools/" + tool.slug())
                    .title(tool.title())
                    .tags(tool.gateIds().isEmpty() ? List.of("tools") : tool.gateIds())
                    .cluster(tool.gateIds().isEmpty() ? "tools" : tool.gateIds().get(0))
                    .build());
        }

        for (InsightRecord insight : insights) {
            String key = insight.key();
            nodes.add(Node.builder()
                    .id("insight::" + key)
                    .type(NodeType.INSIGHT)
                    .path("/insights/" + key)
                    .title(insight.title() != null ? insight.title() : insight.slug())
                    .tags(List.of("insights"))
                    .cluster("insights")
                    .build());
        }

        return dropDuplicateIds(nodes);
    }

    // First occurrence of an id wins.
    private static List<Node> dropDuplicateIds(List<Node> nodes) {
        Map<String, Node> unique = new LinkedHashMap<>();
        for (Node node : nodes) {
            Node existing = unique.putIfAbsent(node.getId(), node);
            if (existing != null) {
                log.warn("loader.node.duplicate id={} keptPath={} droppedPath={}",
                        node.getId(), existing.getPath(), node.getPath());
            }
        }
        return new ArrayList<>(unique.values());
    }

    private List<ToolRecord> readTools(String fileName, String source) {
        JsonNode root = readTree(fileName);
        JsonNode array = root != null && root.isObject() ? root.get("tools") : root;
        List<ToolRecord> tools = new ArrayList<>();
        forEachObject(array, fileName, item -> {
            ToolRecord tool = ToolRecord.from(item, source);
            if (tool != null) {
                tools.add(tool);
            }
        });
        return tools;
    }

    private JsonNode readTree(String fileName) {
        Path file = dataDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            log.debug("loader.source.missing file={}", file);
            return null;
        }
        try {
            return mapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("loader.source.unreadable file={} error={}", file, e.getMessage());
            return null;
        }
    }

    private void forEachObject(JsonNode array, String fileName, ItemHandler handler) {
        if (array == null || !array.isArray()) {
            return;
        }
        for (JsonNode item : array) {
            if (!item.isObject()) {
                continue;
            }
            try {
                handler.accept(item);
            } catch (JsonProcessingException e) {
                log.warn("loader.record.malformed file={} error={}", fileName, e.getOriginalMessage());
            }
        }
    }

    @FunctionalInterface
    private interface ItemHandler {
        void accept(JsonNode item) throws JsonProcessingException;
    }
}
