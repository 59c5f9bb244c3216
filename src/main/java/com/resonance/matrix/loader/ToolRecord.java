package com.resonance.matrix.loader;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A tool after field resolution.
 *
 * <p>Raw tool objects come from two sources with slightly different shapes. Each field is
 * resolved by an ordered list of candidate properties:</p>
 * <ul>
 *   <li>{@code id}: id, slug, normalized title, normalized name</li>
 *   <li>{@code slug}: slug, resolved id</li>
 *   <li>{@code title}: title, name, resolved id</li>
 *   <li>{@code description}: description, summary, empty string</li>
 *   <li>{@code gateIds}, {@code painPointIds}, {@code keywords}: the array, or empty</li>
 * </ul>
 */
public record ToolRecord(
        String id,
        String slug,
        String title,
        String description,
        List<String> gateIds,
        List<String> painPointIds,
        List<String> keywords,
        String source
) {

    public ToolRecord {
        description = description != null ? description : "";
        gateIds = gateIds != null ? List.copyOf(gateIds) : List.of();
        painPointIds = painPointIds != null ? List.copyOf(painPointIds) : List.of();
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    /**
     * Resolves a raw tool object, returning null when no identity can be derived.
     */
    public static ToolRecord from(JsonNode raw, String source) {
        if (raw == null || !raw.isObject()) {
            return null;
        }
        String id = firstNonBlank(text(raw, "id"), text(raw, "slug"),
                Keys.normalizeKey(text(raw, "title")), Keys.normalizeKey(text(raw, "name")));
        if (Keys.isBlank(id)) {
            return null;
        }
        return new ToolRecord(
                id,
                firstNonBlank(text(raw, "slug"), id),
                firstNonBlank(text(raw, "title"), text(raw, "name"), id),
                firstNonBlank(text(raw, "description"), text(raw, "summary"), ""),
                strings(raw, "gateIds"),
                strings(raw, "painPointIds"),
                strings(raw, "keywords"),
                source);
    }

    /**
     * The key used to detect duplicates across sources.
     */
    public String mergeKey() {
        return Keys.normalizeKey(firstNonBlank(slug, id, title));
    }

    /**
     * Merges a duplicate record into this one. Fields of this record win unless they
     * are empty (null, blank, or an empty list), in which case the other record's value
     * is taken.
     */
    public ToolRecord mergeWith(ToolRecord other) {
        if (other == null) {
            return this;
        }
        return new ToolRecord(
                pick(id, other.id),
                pick(slug, other.slug),
                pick(title, other.title),
                pick(description, other.description),
                gateIds.isEmpty() ? other.gateIds : gateIds,
                painPointIds.isEmpty() ? other.painPointIds : painPointIds,
                keywords.isEmpty() ? other.keywords : keywords,
                pick(source, other.source));
    }

    private static String pick(String preferred, String fallback) {
        return Keys.isBlank(preferred) ? fallback : preferred;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (!Keys.isBlank(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static String text(JsonNode raw, String field) {
        JsonNode value = raw.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static List<String> strings(JsonNode raw, String field) {
        JsonNode value = raw.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> result = new ArrayList<>(value.size());
        value.forEach(item -> {
            if (item.isValueNode() && !item.isNull()) {
                result.add(item.asText());
            }
        });
        return result;
    }
}
