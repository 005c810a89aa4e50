package com.blockflow.blockflow_engine.model.context;

import com.blockflow.blockflow_engine.model.domain.BlockType;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-scoped state shared by every block execution of one workflow run.
 *
 * Scheduling decisions and all writes are made by the executor's coordinator thread; the
 * collections are concurrent so handlers and external inspectors can read them while the
 * run is in progress without observing partially written values.
 */
@Getter
public class ExecutionContext {

    private final String workflowId;
    private final String executionId;
    private final Instant startedAt;

    @JsonIgnore
    private final WorkflowGraph graph;

    /** Payload the run was triggered with; exposed to starter blocks. */
    private final Map<String, Object> runInput;

    private final Map<String, String> environmentVariables;

    // Latest output per block; loop-body history lives in iterationOutputs
    private final Map<String, Map<String, Object>> blockStates = new ConcurrentHashMap<>();

    private final List<BlockLog> blockLogs = Collections.synchronizedList(new ArrayList<>());

    private final Decisions decisions = new Decisions();

    private final Map<String, Integer> loopIterations = new ConcurrentHashMap<>();

    // Items may be null, so this one cannot be a ConcurrentHashMap
    private final Map<String, Object> loopItems = Collections.synchronizedMap(new LinkedHashMap<>());

    private final Set<String> executedBlocks = ConcurrentHashMap.newKeySet();

    private final Set<String> activeExecutionPath = ConcurrentHashMap.newKeySet();

    private final Map<IterationKey, Map<String, Object>> iterationOutputs = new ConcurrentHashMap<>();

    private final Map<String, LoopState> loopStates = new ConcurrentHashMap<>();

    @JsonIgnore
    private final AtomicLong logSequence = new AtomicLong();

    private ExecutionContext(String workflowId, String executionId, WorkflowGraph graph,
                             Map<String, String> environmentVariables, Map<String, Object> runInput,
                             Instant startedAt) {
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.graph = graph;
        this.environmentVariables = Collections.unmodifiableMap(
                environmentVariables != null ? new LinkedHashMap<>(environmentVariables) : new LinkedHashMap<>());
        this.runInput = runInput != null ? new LinkedHashMap<>(runInput) : new LinkedHashMap<>();
        this.startedAt = startedAt;
    }

    // Factory Method
    public static ExecutionContext create(String workflowId, String executionId, WorkflowGraph graph,
                                          Map<String, String> environmentVariables, Map<String, Object> runInput) {
        return new ExecutionContext(workflowId, executionId, graph, environmentVariables, runInput, Instant.now());
    }

    public static ExecutionContext create(String workflowId, String executionId, WorkflowGraph graph,
                                          Map<String, String> environmentVariables, Map<String, Object> runInput,
                                          Instant startedAt) {
        return new ExecutionContext(workflowId, executionId, graph, environmentVariables, runInput, startedAt);
    }

    // ── Block outputs ─────────────────────────────────────────────────────────

    public void setBlockOutput(String blockId, Map<String, Object> output) {
        blockStates.put(blockId, output != null ? output : Map.of());
    }

    public Map<String, Object> getBlockOutput(String blockId) {
        return blockStates.get(blockId);
    }

    public void setIterationOutput(IterationKey key, Map<String, Object> output) {
        iterationOutputs.put(key, output != null ? output : Map.of());
    }

    public void markExecuted(String blockId) {
        executedBlocks.add(blockId);
    }

    public boolean isExecuted(String blockId) {
        return executedBlocks.contains(blockId);
    }

    public String getEnvironmentVariable(String name) {
        return environmentVariables.get(name);
    }

    // ── Logs ──────────────────────────────────────────────────────────────────

    /** Appends an entry, stamping it with the next sequence number. */
    public BlockLog appendLog(BlockLog entry) {
        synchronized (blockLogs) {
            entry.setSequence(logSequence.incrementAndGet());
            blockLogs.add(entry);
        }
        return entry;
    }

    public List<BlockLog> blockLogsSnapshot() {
        synchronized (blockLogs) {
            return List.copyOf(blockLogs);
        }
    }

    public Map<String, Map<String, Object>> blockStatesSnapshot() {
        return new LinkedHashMap<>(blockStates);
    }

    // ── Active path and decisions ─────────────────────────────────────────────

    public boolean isActive(String blockId) {
        return activeExecutionPath.contains(blockId);
    }

    public synchronized void activate(Collection<String> blockIds) {
        activeExecutionPath.addAll(blockIds);
    }

    /**
     * Records a router/condition outcome and removes the blocks it made unreachable, as one
     * step. A block decides at most once; loop re-entry clears body decisions first.
     */
    public synchronized void applyDecision(String blockId, BlockType type, String branch, Collection<String> pruned) {
        Map<String, String> target = decisions.forType(type);
        if (target.containsKey(blockId)) {
            throw new IllegalStateException("Decision for block " + blockId + " was already recorded");
        }
        target.put(blockId, branch);
        activeExecutionPath.removeAll(pruned);
    }

    public synchronized void clearDecision(String blockId) {
        decisions.clear(blockId);
    }

    // ── Loops ─────────────────────────────────────────────────────────────────

    public LoopState loopState(String loopId) {
        return loopStates.computeIfAbsent(loopId, LoopState::new);
    }

    public void bindLoopIteration(String loopId, int iteration, Object item) {
        loopIterations.put(loopId, iteration);
        loopItems.put(loopId, item);
    }
}
