package com.blockflow.blockflow_engine.engine;

import com.blockflow.blockflow_engine.config.EngineProperties;
import com.blockflow.blockflow_engine.exception.WorkflowExecutionException;
import com.blockflow.blockflow_engine.handler.BlockHandler;
import com.blockflow.blockflow_engine.handler.BlockHandlerRegistry;
import com.blockflow.blockflow_engine.handler.DecisionBlockHandler;
import com.blockflow.blockflow_engine.handler.InputResolver;
import com.blockflow.blockflow_engine.model.context.BlockLog;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.context.ExecutionStatus;
import com.blockflow.blockflow_engine.model.context.LoopState;
import com.blockflow.blockflow_engine.model.context.LoopStatus;
import com.blockflow.blockflow_engine.model.context.RetryConfig;
import com.blockflow.blockflow_engine.model.context.WorkflowRunResult;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.BlockType;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Runs one workflow over its {@link ExecutionContext}.
 *
 * Each run has a single coordinator (the calling thread). It dispatches every ready block,
 * then waits for handler futures to report back through a queue; every write to the
 * context, decision recording and loop bookkeeping happens on the coordinator, so readiness
 * checks never interleave with pruning. Independent blocks run concurrently on the threads
 * their handlers complete on.
 */
@Slf4j
@Service
public class WorkflowExecutor {

    private final BlockHandlerRegistry    handlerRegistry;
    private final InputResolver           inputResolver;
    private final PathResolver            pathResolver;
    private final LoopController          loopController;
    private final ExecutionEventPublisher eventPublisher;
    private final EngineProperties        properties;
    private final ObjectMapper            objectMapper;
    private final Clock                   clock;

    public WorkflowExecutor(BlockHandlerRegistry handlerRegistry,
                            InputResolver inputResolver,
                            PathResolver pathResolver,
                            LoopController loopController,
                            ExecutionEventPublisher eventPublisher,
                            EngineProperties properties,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.handlerRegistry = handlerRegistry;
        this.inputResolver = inputResolver;
        this.pathResolver = pathResolver;
        this.loopController = loopController;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public WorkflowRunResult execute(ExecutionContext ctx) {
        return execute(ctx, new RunCancellationToken());
    }

    /** Runs to completion, failure or cancellation; never throws for block-level errors. */
    public WorkflowRunResult execute(ExecutionContext ctx, RunCancellationToken token) {
        log.info("Run {} of workflow {} started ({} blocks)",
                ctx.getExecutionId(), ctx.getWorkflowId(), ctx.getGraph().size());

        WorkflowRunResult result = new Run(ctx, token).run();

        switch (result.getStatus()) {
            case SUCCESS   -> log.info("Run {} finished in {} ms", ctx.getExecutionId(), result.getDurationMs());
            case CANCELLED -> log.warn("Run {} cancelled after {} block log(s)", ctx.getExecutionId(), result.getBlockLogs().size());
            default        -> log.error("Run {} failed at block {}: {}", ctx.getExecutionId(), result.getFailedBlockId(), result.getError());
        }
        eventPublisher.runFinished(ctx.getExecutionId(), result.getStatus(), result.getError());
        return result;
    }

    // ── Per-run coordinator ───────────────────────────────────────────────────

    /** One handler invocation (including its retries) of one block. */
    private static final class Dispatch {
        final Block block;
        final BlockHandler handler;
        final Map<String, Object> inputs;
        final Instant startedAt;
        final String loopId;
        final Integer iteration;
        final RetryConfig retry;

        int attempt = 1;
        CompletableFuture<Map<String, Object>> future;
        volatile CompletableFuture<Map<String, Object>> handlerFuture;

        Dispatch(Block block, BlockHandler handler, Map<String, Object> inputs, Instant startedAt,
                 String loopId, Integer iteration, RetryConfig retry) {
            this.block = block;
            this.handler = handler;
            this.inputs = inputs;
            this.startedAt = startedAt;
            this.loopId = loopId;
            this.iteration = iteration;
            this.retry = retry;
        }

        String id() {
            return block.getId();
        }

        void cancel() {
            if (future != null) future.cancel(true);
            CompletableFuture<Map<String, Object>> current = handlerFuture;
            if (current != null) current.cancel(true);
        }
    }

    private record Completion(Dispatch dispatch, CompletableFuture<Map<String, Object>> future,
                              Map<String, Object> output, Throwable error) {}

    private static final Completion WAKE_UP = new Completion(null, null, null, null);

    private final class Run {

        private final ExecutionContext ctx;
        private final RunCancellationToken token;
        private final WorkflowGraph graph;

        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final Map<String, Dispatch> inFlight = new LinkedHashMap<>();

        // Loops whose handler finished and whose iterations are under way
        private final Map<String, Dispatch> iteratingLoops = new LinkedHashMap<>();

        private int dispatches = 0;
        private WorkflowExecutionException failure;
        private String failedBlockId;

        Run(ExecutionContext ctx, RunCancellationToken token) {
            this.ctx = ctx;
            this.token = token;
            this.graph = ctx.getGraph();
        }

        WorkflowRunResult run() {
            token.onCancel(() -> completions.offer(WAKE_UP));
            pathResolver.initialize(ctx);

            while (true) {
                if (token.isCancelled()) return cancelled();
                if (failure == null) schedule();
                if (failure != null) return failed();
                if (token.isCancelled()) return cancelled();
                if (inFlight.isEmpty()) return finished();

                Completion next;
                try {
                    next = completions.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel();
                    continue;
                }
                if (next != WAKE_UP) {
                    handle(next);
                }
            }
        }

        // ── Scheduling ────────────────────────────────────────────────────────

        private void schedule() {
            boolean changed;
            do {
                changed = false;
                for (String id : graph.topologicalOrder()) {
                    if (failure != null || token.isCancelled()) return;
                    if (isReady(id)) {
                        dispatch(id);
                        changed = true;
                    }
                }
                if (failure != null) return;
                changed |= advanceLoops();
            } while (changed && failure == null && !token.isCancelled());
        }

        private boolean isReady(String id) {
            if (!ctx.isActive(id) || inFlight.containsKey(id) || iteratingLoops.containsKey(id)) {
                return false;
            }
            String loopId = graph.enclosingLoop(id);
            if (loopId != null) {
                LoopState loop = ctx.getLoopStates().get(loopId);
                if (loop == null || loop.getStatus() != LoopStatus.ITERATING
                        || loopController.isDoneThisIteration(loopId, id, ctx)) {
                    return false;
                }
            } else if (ctx.isExecuted(id)) {
                return false;
            }
            for (String dependency : graph.dependencies(id)) {
                if (!isSatisfied(dependency, loopId)) return false;
            }
            return true;
        }

        private boolean isSatisfied(String dependency, String loopOfDependent) {
            // pruned branches do not hold back blocks that are still reachable another way
            if (!ctx.isActive(dependency)) return true;

            if (graph.block(dependency).getType() == BlockType.LOOP) {
                if (dependency.equals(loopOfDependent)) return true;
                LoopState loop = ctx.getLoopStates().get(dependency);
                return loop != null && loop.getStatus() == LoopStatus.COMPLETED && ctx.isExecuted(dependency);
            }
            String loopOfDependency = graph.enclosingLoop(dependency);
            if (loopOfDependency != null && loopOfDependency.equals(loopOfDependent)) {
                return loopController.isDoneThisIteration(loopOfDependent, dependency, ctx);
            }
            return ctx.isExecuted(dependency);
        }

        private void dispatch(String id) {
            if (token.isCancelled()) return;
            Block block = graph.block(id);

            // Safety: hard cap so a runaway loop ends the run cleanly
            if (++dispatches > properties.getMaxBlockExecutions()) {
                log.warn("Run {} stopped: max block executions ({}) exceeded", ctx.getExecutionId(),
                        properties.getMaxBlockExecutions());
                fail(id, new WorkflowExecutionException(id, "Execution stopped: max block executions ("
                        + properties.getMaxBlockExecutions() + ") exceeded. Check loop bounds."));
                return;
            }

            String loopId = graph.enclosingLoop(id);
            Integer iteration = loopId != null ? ctx.loopState(loopId).getIteration() : null;
            Instant startedAt = clock.instant();

            Map<String, Object> inputs;
            BlockHandler handler;
            try {
                inputs = inputResolver.resolveInputs(block, ctx);
                handler = handlerRegistry.resolve(block);
            } catch (WorkflowExecutionException e) {
                appendLog(block, iteration, startedAt, block.getInputs(), false, null, e.getMessage());
                eventPublisher.blockFailed(ctx.getExecutionId(), id, e.getMessage());
                fail(id, e);
                return;
            }

            Dispatch dispatch = new Dispatch(block, handler, inputs, startedAt, loopId, iteration, extractRetryConfig(block));
            inFlight.put(id, dispatch);
            log.debug("Run {}: dispatching block {} ({}){}", ctx.getExecutionId(), id, block.getKind(),
                    iteration != null ? " iteration " + iteration : "");
            eventPublisher.blockStarted(ctx.getExecutionId(), id);
            listen(dispatch, invoke(dispatch));
        }

        private CompletableFuture<Map<String, Object>> invoke(Dispatch dispatch) {
            CompletableFuture<Map<String, Object>> future;
            try {
                future = dispatch.handler.execute(dispatch.block, dispatch.inputs, ctx);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            dispatch.handlerFuture = future;
            return future;
        }

        private void listen(Dispatch dispatch, CompletableFuture<Map<String, Object>> future) {
            dispatch.future = future;
            future.whenComplete((output, error) -> completions.offer(new Completion(dispatch, future, output, error)));
        }

        /** Ends passes of loops whose body has nothing left to do, starting the next one or completing the loop. */
        private boolean advanceLoops() {
            boolean changed = false;
            for (Dispatch loop : new ArrayList<>(iteratingLoops.values())) {
                String loopId = loop.id();
                boolean bodyBusy = graph.loopBody(loopId).stream().anyMatch(inFlight::containsKey);
                if (bodyBusy) continue;

                if (loopController.finishPass(loopId, ctx)) {
                    iteratingLoops.remove(loopId);
                    completeLoop(loop);
                } else {
                    loopController.enterIteration(loopId, ctx);
                }
                changed = true;
            }
            return changed;
        }

        // ── Completions ───────────────────────────────────────────────────────

        private void handle(Completion completion) {
            Dispatch dispatch = completion.dispatch();
            String id = dispatch.id();
            if (inFlight.get(id) != dispatch || completion.future() != dispatch.future) {
                return;
            }

            if (completion.error() != null) {
                handleFailure(dispatch, unwrap(completion.error()));
                return;
            }

            inFlight.remove(id);
            Map<String, Object> output = completion.output() != null
                    ? new LinkedHashMap<>(completion.output())
                    : new LinkedHashMap<>();

            if (dispatch.block.getType() == BlockType.LOOP) {
                LoopState loop = ctx.loopState(id);
                if (loop.getStatus() == LoopStatus.COMPLETED) {
                    completeLoop(dispatch);
                } else {
                    iteratingLoops.put(id, dispatch);
                    loopController.enterIteration(id, ctx);
                }
                return;
            }

            Object branch = null;
            if (dispatch.block.getType().isDecision()) {
                branch = output.get(DecisionBlockHandler.SELECTED_BRANCH);
                if (branch == null) {
                    String message = "Decision block " + id + " did not select a branch";
                    appendLog(dispatch.block, dispatch.iteration, dispatch.startedAt, dispatch.inputs, false, output, message);
                    eventPublisher.blockFailed(ctx.getExecutionId(), id, message);
                    fail(id, new WorkflowExecutionException(id, message));
                    return;
                }
            }

            recordOutput(dispatch, output);
            appendLog(dispatch.block, dispatch.iteration, dispatch.startedAt, dispatch.inputs, true, output, null);
            eventPublisher.blockCompleted(ctx.getExecutionId(), id);

            if (branch != null) {
                pathResolver.applyDecision(dispatch.block, branch.toString(), ctx);
            }
        }

        private void handleFailure(Dispatch dispatch, Throwable cause) {
            String id = dispatch.id();
            if (cause instanceof CancellationException && token.isCancelled()) {
                inFlight.remove(id);
                return;
            }

            int maxRetries = dispatch.retry.getMaxRetries();
            if (dispatch.attempt <= maxRetries && !token.isCancelled()) {
                long delayMs = dispatch.retry.delayBeforeRetry(dispatch.attempt);
                log.warn("Block {} failed on attempt {}/{}. Retrying in {} ms",
                        id, dispatch.attempt, maxRetries + 1, delayMs);
                eventPublisher.blockRetrying(ctx.getExecutionId(), id);
                dispatch.attempt++;

                Executor delayed = CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS);
                listen(dispatch, CompletableFuture.runAsync(() -> { }, delayed).thenCompose(v -> invoke(dispatch)));
                return;
            }

            inFlight.remove(id);
            String message = messageOf(cause);
            appendLog(dispatch.block, dispatch.iteration, dispatch.startedAt, dispatch.inputs, false, null, message);
            eventPublisher.blockFailed(ctx.getExecutionId(), id, message);

            if (dispatch.block.isBestEffort()) {
                log.warn("Best-effort block {} failed, continuing: {}", id, message);
                Map<String, Object> output = new LinkedHashMap<>();
                output.put("error", message);
                recordOutput(dispatch, output);
                return;
            }
            fail(id, cause instanceof WorkflowExecutionException wee
                    ? wee
                    : new WorkflowExecutionException(id, message, cause));
        }

        private void recordOutput(Dispatch dispatch, Map<String, Object> output) {
            String id = dispatch.id();
            ctx.setBlockOutput(id, output);
            ctx.markExecuted(id);
            if (dispatch.loopId != null) {
                loopController.recordBodyCompletion(dispatch.loopId, id, output, ctx);
            }
        }

        private void completeLoop(Dispatch loop) {
            String id = loop.id();
            Map<String, Object> output = loopController.aggregateOutput(ctx.loopState(id));
            ctx.setBlockOutput(id, output);
            ctx.markExecuted(id);
            appendLog(loop.block, null, loop.startedAt, loop.inputs, true, output, null);
            eventPublisher.blockCompleted(ctx.getExecutionId(), id);
        }

        private void fail(String blockId, WorkflowExecutionException error) {
            if (failure == null) {
                failure = error;
                failedBlockId = blockId;
            }
        }

        // ── Terminal states ───────────────────────────────────────────────────

        private WorkflowRunResult finished() {
            List<String> pending = new ArrayList<>();
            for (Block block : graph.blocks()) {
                String id = block.getId();
                if (ctx.isActive(id) && graph.enclosingLoop(id) == null && !ctx.isExecuted(id)) {
                    pending.add(id);
                }
            }
            if (!pending.isEmpty()) {
                log.warn("Run {} stalled with pending blocks {}", ctx.getExecutionId(), pending);
                return result(ExecutionStatus.FAILURE,
                        "Workflow stalled: blocks " + pending + " never became ready", pending.get(0));
            }
            return result(ExecutionStatus.SUCCESS, null, null);
        }

        private WorkflowRunResult failed() {
            abandonInFlight();
            return result(ExecutionStatus.FAILURE, failure.getMessage(), failedBlockId);
        }

        private WorkflowRunResult cancelled() {
            abandonInFlight();
            return result(ExecutionStatus.CANCELLED, "Execution cancelled", null);
        }

        private void abandonInFlight() {
            inFlight.values().forEach(Dispatch::cancel);
            inFlight.clear();
        }

        private WorkflowRunResult result(ExecutionStatus status, String error, String blockId) {
            return WorkflowRunResult.builder()
                    .executionId(ctx.getExecutionId())
                    .workflowId(ctx.getWorkflowId())
                    .status(status)
                    .error(error)
                    .failedBlockId(blockId)
                    .blockLogs(ctx.blockLogsSnapshot())
                    .blockStates(ctx.blockStatesSnapshot())
                    .startedAt(ctx.getStartedAt())
                    .completedAt(clock.instant())
                    .build();
        }

        private void appendLog(Block block, Integer iteration, Instant startedAt, Map<String, Object> input,
                               boolean success, Map<String, Object> output, String error) {
            Instant endedAt = clock.instant();
            ctx.appendLog(BlockLog.builder()
                    .blockId(block.getId())
                    .blockKind(block.getKind())
                    .blockName(block.getName())
                    .iteration(iteration)
                    .success(success)
                    .startedAt(startedAt)
                    .endedAt(endedAt)
                    .durationMs(Duration.between(startedAt, endedAt).toMillis())
                    .input(input != null ? new LinkedHashMap<>(input) : null)
                    .output(output)
                    .error(error)
                    .build());
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private RetryConfig extractRetryConfig(Block block) {
        Object raw = block.configValue("retry");
        if (raw == null) {
            return new RetryConfig();
        }
        try {
            RetryConfig retry = objectMapper.convertValue(raw, RetryConfig.class);
            // Bounds so bad config cannot stall a run
            retry.setMaxRetries(Math.max(0, Math.min(10, retry.getMaxRetries())));
            if (retry.getBackoffMs() < 0L) {
                retry.setBackoffMs(1000L);
            }
            if (retry.getBackoffMultiplier() <= 0d) {
                retry.setBackoffMultiplier(1.0d);
            }
            return retry;
        } catch (IllegalArgumentException ex) {
            log.warn("Failed to parse retry config for block {}: {}", block.getId(), ex.getMessage());
            return new RetryConfig();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
