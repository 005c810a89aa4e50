package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.exception.MissingEnvironmentVariableException;
import com.blockflow.blockflow_engine.exception.UnresolvedReferenceException;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.context.LoopState;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a block's declared inputs into concrete values.
 *
 * Supported references:
 *   <blockId.field.path>    output of an upstream block, by id or label key ("Fetch Users" → fetchUsers)
 *   <loop.index>            0-based index of the current iteration of the enclosing loop
 *   <loop.currentItem>      value bound to the current iteration
 *   <loop.items>            the full collection being iterated
 *   <loop.iteration>        1-based iteration count
 *   {{NAME}}                environment variable, {{NAME:fallback}} with a default
 *
 * A string that is exactly one reference resolves to the raw value (map, list, number...);
 * references inside longer text are interpolated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputResolver {

    public static final String CODE_INPUT = "code";

    private static final Pattern BLOCK_REF_PATTERN = Pattern.compile("<([A-Za-z0-9_-]+(?:\\.[A-Za-z0-9_-]+)+)>");
    private static final Pattern ENV_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");
    private static final Pattern ANY_REF_PATTERN = Pattern.compile(
            BLOCK_REF_PATTERN.pattern() + "|" + ENV_PATTERN.pattern());

    private static final String LOOP_PREFIX = "loop";

    private final ObjectMapper objectMapper;

    /** Resolves every declared input of the block. Insertion order of the declaration is kept. */
    public Map<String, Object> resolveInputs(Block block, ExecutionContext ctx) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        if (block.getInputs() == null) return resolved;

        block.getInputs().forEach((name, expression) -> {
            Object value = resolveValue(block.getId(), expression, ctx);
            if (CODE_INPUT.equals(name) && value instanceof List<?> fragments) {
                value = joinCodeFragments(fragments);
            }
            resolved.put(name, value);
        });
        return resolved;
    }

    /** Resolves one expression; maps and lists are walked recursively. */
    public Object resolveValue(String blockId, Object expression, ExecutionContext ctx) {
        if (expression instanceof String s) {
            return resolveString(blockId, s, ctx);
        }
        if (expression instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), resolveValue(blockId, v, ctx)));
            return out;
        }
        if (expression instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(resolveValue(blockId, item, ctx)));
            return out;
        }
        return expression;
    }

    /**
     * Joins code given as ordered fragments ({@code [{content:"a"},{content:"b"}]} or plain strings)
     * into one source string separated by newlines.
     */
    public static String joinCodeFragments(List<?> fragments) {
        List<String> parts = new ArrayList<>(fragments.size());
        for (Object fragment : fragments) {
            if (fragment instanceof Map<?, ?> map) {
                Object content = map.get("content");
                parts.add(content != null ? content.toString() : "");
            } else {
                parts.add(fragment != null ? fragment.toString() : "");
            }
        }
        return String.join("\n", parts);
    }

    // ── Strings ───────────────────────────────────────────────────────────────

    private Object resolveString(String blockId, String template, ExecutionContext ctx) {
        if (!template.contains("<") && !template.contains("{{")) return template;

        String trimmed = template.trim();
        Matcher whole = BLOCK_REF_PATTERN.matcher(trimmed);
        if (whole.matches()) {
            return resolveBlockReference(blockId, whole.group(1), ctx);
        }
        Matcher wholeEnv = ENV_PATTERN.matcher(trimmed);
        if (wholeEnv.matches()) {
            return resolveEnvironmentReference(blockId, wholeEnv.group(1), ctx);
        }

        return interpolate(blockId, template, ctx);
    }

    // Single scan over the declared text: substituted values are never read as references again
    private String interpolate(String blockId, String template, ExecutionContext ctx) {
        Matcher matcher = ANY_REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Object value = matcher.group(1) != null
                    ? resolveBlockReference(blockId, matcher.group(1), ctx)
                    : resolveEnvironmentReference(blockId, matcher.group(2), ctx);
            matcher.appendReplacement(result, Matcher.quoteReplacement(stringify(value)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.toString();
    }

    // ── References ────────────────────────────────────────────────────────────

    private Object resolveBlockReference(String blockId, String reference, ExecutionContext ctx) {
        int dot = reference.indexOf('.');
        String key = reference.substring(0, dot);
        String path = reference.substring(dot + 1);

        if (LOOP_PREFIX.equals(key) && ctx.getGraph().resolveBlockKey(key) == null) {
            return resolveLoopReference(blockId, reference, path, ctx);
        }

        WorkflowGraph graph = ctx.getGraph();
        String targetId = graph.resolveBlockKey(key);
        if (targetId == null) {
            throw new UnresolvedReferenceException(blockId, reference, "no block with id or name \"" + key + "\"");
        }
        Map<String, Object> output = ctx.getBlockOutput(targetId);
        if (output == null) {
            throw new UnresolvedReferenceException(blockId, reference);
        }
        Object value = resolveNestedPath(output, path);
        if (value == null) {
            log.debug("Reference <{}> in block {} resolved to null", reference, blockId);
        }
        return value;
    }

    private Object resolveLoopReference(String blockId, String reference, String field, ExecutionContext ctx) {
        String loopId = ctx.getGraph().enclosingLoop(blockId);
        if (loopId == null) {
            throw new UnresolvedReferenceException(blockId, reference, "block is not inside a loop body");
        }
        LoopState state = ctx.getLoopStates().get(loopId);
        if (state == null || state.getIteration() == 0) {
            throw new UnresolvedReferenceException(blockId, reference, "loop " + loopId + " has not started");
        }
        return switch (field) {
            case "index"       -> state.index();
            case "currentItem" -> ctx.getLoopItems().get(loopId);
            case "items"       -> state.getItems() != null ? state.getItems() : List.of();
            case "iteration"   -> ctx.getLoopIterations().get(loopId);
            default -> throw new UnresolvedReferenceException(blockId, reference, "unknown loop field \"" + field + "\"");
        };
    }

    private Object resolveEnvironmentReference(String blockId, String reference, ExecutionContext ctx) {
        String name = reference.trim();
        String fallback = null;
        int colon = name.indexOf(':');
        if (colon >= 0) {
            fallback = name.substring(colon + 1);
            name = name.substring(0, colon).trim();
        }
        String value = ctx.getEnvironmentVariable(name);
        if (value != null) return value;
        if (fallback != null) return fallback;
        throw new MissingEnvironmentVariableException(blockId, name);
    }

    /** Walk a map/list tree by dot path (e.g. "response.users.0.id"). Returns null if any step is missing. */
    @SuppressWarnings("unchecked")
    private Object resolveNestedPath(Object root, String path) {
        if (root == null || path == null || path.isBlank()) return null;
        Object current = root;
        for (String seg : path.split("\\.")) {
            if (current == null) return null;
            if (current instanceof Map<?, ?> map) {
                current = ((Map<String, Object>) map).get(seg);
            } else if (current instanceof List<?> list && seg.matches("\\d+")) {
                int idx = Integer.parseInt(seg);
                if (idx >= list.size()) return null;
                current = list.get(idx);
            } else {
                return null;
            }
        }
        return current;
    }
}
