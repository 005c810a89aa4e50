package com.blockflow.blockflow_engine.engine;

import com.blockflow.blockflow_engine.config.EngineProperties;
import com.blockflow.blockflow_engine.exception.WorkflowExecutionException;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.context.IterationKey;
import com.blockflow.blockflow_engine.model.context.LoopState;
import com.blockflow.blockflow_engine.model.context.LoopStatus;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Iteration lifecycle of loop blocks: PENDING → ITERATING → COMPLETED.
 *
 * Config:
 * {
 *   "loopType":   "forEach",          // or "for"
 *   "iterations": 3,                  // "for" only; default from blockflow.engine.default-loop-iterations
 *   "body":       ["fetch", "store"]
 * }
 * Inputs: { "items": "<starter.input.users>" }   // forEach: list, map (entries) or JSON string
 *
 * Each pass runs the body once. The result of a pass is the output of the body block that
 * finished last; the loop's output is { results, iterations, completed }.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoopController {

    public static final String FOR_EACH = "forEach";
    public static final String FOR = "for";

    private final EngineProperties properties;
    private final PathResolver pathResolver;
    private final ObjectMapper objectMapper;

    /** Prepares the loop's state. A loop with nothing to iterate is COMPLETED straight away. */
    public LoopState start(Block loop, Map<String, Object> inputs, ExecutionContext ctx) {
        LoopState state = ctx.loopState(loop.getId());
        state.setIteration(0);
        state.setResults(new ArrayList<>());
        state.setLastBodyOutput(null);
        state.getDoneThisIteration().clear();

        int max = properties.getMaxLoopIterations();
        if (isForEach(loop, inputs)) {
            Object raw = inputs.containsKey("items") ? inputs.get("items") : loop.configValue("items");
            List<Object> items = toItems(loop.getId(), raw);
            state.setItems(items);
            if (items.size() > max) {
                log.warn("Loop {} has {} items; only the first {} are iterated", loop.getId(), items.size(), max);
            }
            state.setTotalIterations(Math.min(items.size(), max));
        } else {
            state.setItems(null);
            state.setTotalIterations(Math.max(0, Math.min(iterationCount(loop, inputs), max)));
        }

        state.setStatus(state.getTotalIterations() > 0 ? LoopStatus.ITERATING : LoopStatus.COMPLETED);
        log.debug("Loop {} starting with {} iteration(s)", loop.getId(), state.getTotalIterations());
        return state;
    }

    /** Binds the next item, clears body decisions and completion marks, and re-activates the body. */
    public void enterIteration(String loopId, ExecutionContext ctx) {
        LoopState state = ctx.loopState(loopId);
        state.setIteration(state.getIteration() + 1);
        state.getDoneThisIteration().clear();
        state.setLastBodyOutput(null);

        ctx.bindLoopIteration(loopId, state.getIteration(), state.currentItem());
        List<String> body = ctx.getGraph().loopBody(loopId);
        body.forEach(ctx::clearDecision);
        pathResolver.reactivateLoopBody(loopId, ctx);

        log.debug("Loop {} entering iteration {}/{}", loopId, state.getIteration(), state.getTotalIterations());
    }

    public void recordBodyCompletion(String loopId, String blockId, Map<String, Object> output, ExecutionContext ctx) {
        LoopState state = ctx.loopState(loopId);
        state.getDoneThisIteration().add(blockId);
        state.setLastBodyOutput(output);
        ctx.setIterationOutput(new IterationKey(blockId, state.getIteration()), output);
    }

    public boolean isDoneThisIteration(String loopId, String blockId, ExecutionContext ctx) {
        return ctx.loopState(loopId).getDoneThisIteration().contains(blockId);
    }

    /**
     * Collects the result of the pass that just ended.
     *
     * @return true when the loop is now COMPLETED, false when another iteration should start
     */
    public boolean finishPass(String loopId, ExecutionContext ctx) {
        LoopState state = ctx.loopState(loopId);
        state.getResults().add(state.getLastBodyOutput());
        if (state.hasMoreIterations()) {
            return false;
        }
        state.setStatus(LoopStatus.COMPLETED);
        log.debug("Loop {} completed after {} iteration(s)", loopId, state.getIteration());
        return true;
    }

    public Map<String, Object> aggregateOutput(LoopState state) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("results", new ArrayList<>(state.getResults()));
        output.put("iterations", state.getIteration());
        output.put("completed", true);
        return output;
    }

    private boolean isForEach(Block loop, Map<String, Object> inputs) {
        String type = loop.configString("loopType");
        if (type == null || type.isBlank()) {
            return inputs.containsKey("items") || loop.configValue("items") != null;
        }
        return FOR_EACH.equalsIgnoreCase(type.trim());
    }

    private int iterationCount(Block loop, Map<String, Object> inputs) {
        Object raw = inputs.containsKey("iterations") ? inputs.get("iterations") : loop.configValue("iterations");
        if (raw instanceof Number n) return n.intValue();
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new WorkflowExecutionException(loop.getId(),
                        "Loop " + loop.getId() + " has a non-numeric iteration count: " + s);
            }
        }
        return properties.getDefaultLoopIterations();
    }

    private List<Object> toItems(String loopId, Object raw) {
        if (raw == null) return new ArrayList<>();
        if (raw instanceof List<?> list) return new ArrayList<>(list);
        if (raw instanceof Map<?, ?> map) {
            List<Object> entries = new ArrayList<>(map.size());
            map.forEach((k, v) -> {
                List<Object> entry = new ArrayList<>(2);
                entry.add(k);
                entry.add(v);
                entries.add(entry);
            });
            return entries;
        }
        if (raw instanceof String s) {
            if (s.isBlank()) return new ArrayList<>();
            try {
                return toItems(loopId, objectMapper.readValue(s, Object.class));
            } catch (JsonProcessingException e) {
                throw new WorkflowExecutionException(loopId,
                        "Loop " + loopId + " items are neither a collection nor valid JSON: " + e.getOriginalMessage(), e);
            }
        }
        throw new WorkflowExecutionException(loopId,
                "Loop " + loopId + " cannot iterate over a value of type " + raw.getClass().getSimpleName());
    }
}
