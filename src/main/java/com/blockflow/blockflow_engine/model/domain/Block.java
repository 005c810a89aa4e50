package com.blockflow.blockflow_engine.model.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A node of typed work in a workflow graph. Immutable for the duration of a run.
 *
 * Config keys understood by the engine (all optional):
 * {
 *   "tool":       "http_request",          // tool name for generic tool blocks
 *   "params":     { ... },                 // static tool parameters
 *   "bestEffort": true,                    // failure does not abort the run
 *   "retry":      { "maxRetries": 2 },     // see RetryConfig
 *   "loopType":   "forEach" | "for",       // loop blocks only
 *   "iterations": 3,                       // loop blocks, count mode
 *   "body":       ["blockA", "blockB"]     // loop blocks only
 * }
 */
@Value
@Builder
public class Block {

    String id;

    String kind;

    String name;

    @Builder.Default
    Map<String, Object> config = Map.of();

    // Declared input name -> unresolved expression (literal, <block.field> or {{ENV}})
    @Builder.Default
    Map<String, Object> inputs = Map.of();

    @Builder.Default
    boolean enabled = true;

    public BlockType getType() {
        return BlockType.fromKind(kind);
    }

    public Object configValue(String key) {
        return config != null ? config.get(key) : null;
    }

    public String configString(String key) {
        Object value = configValue(key);
        return value != null ? value.toString() : null;
    }

    public boolean isBestEffort() {
        Object value = configValue("bestEffort");
        return Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(String.valueOf(value));
    }

    /** Tool this block calls: config.tool when present, otherwise the kind itself. */
    public String toolName() {
        String tool = configString("tool");
        return tool != null && !tool.isBlank() ? tool.trim() : kind;
    }

    public List<String> loopBody() {
        Object body = configValue("body");
        if (body instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    /** Key usable in references instead of the id, derived from the block name. */
    public String labelKey() {
        return name != null && !name.isBlank() ? toLabelKey(name) : null;
    }

    /**
     * Converts a block name to a camelCase key (e.g. "Fetch Users" → "fetchUsers").
     */
    public static String toLabelKey(String label) {
        if (label == null || label.isBlank()) return "block";
        String[] words = label.trim().replaceAll("[^a-zA-Z0-9 ]", "").split("\\s+");
        if (words.length == 0 || words[0].isBlank()) return "block";
        StringBuilder key = new StringBuilder(words[0].toLowerCase());
        for (int i = 1; i < words.length; i++) {
            if (!words[i].isBlank()) {
                key.append(Character.toUpperCase(words[i].charAt(0)));
                key.append(words[i].substring(1).toLowerCase());
            }
        }
        return key.toString();
    }
}
