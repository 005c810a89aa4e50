package com.blockflow.blockflow_engine.service;

import com.blockflow.blockflow_engine.config.EngineConfig;
import com.blockflow.blockflow_engine.config.EngineProperties;
import com.blockflow.blockflow_engine.engine.RunCancellationToken;
import com.blockflow.blockflow_engine.engine.WorkflowExecutor;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.context.ExecutionStatus;
import com.blockflow.blockflow_engine.model.context.WorkflowRunResult;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.Edge;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import com.blockflow.blockflow_engine.model.dto.BlockDto;
import com.blockflow.blockflow_engine.model.dto.EdgeDto;
import com.blockflow.blockflow_engine.model.dto.RunRequestDto;
import com.blockflow.blockflow_engine.repository.ExecutionRepository;
import com.blockflow.blockflow_engine.validation.WorkflowGraphValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for running workflows: validates the submitted graph, builds the run context,
 * hands it to the executor and keeps the run record.
 */
@Slf4j
@Service
public class WorkflowRunService {

    private final WorkflowExecutor       executor;
    private final WorkflowGraphValidator validator;
    private final ExecutionRepository    executionRepository;
    private final EngineProperties       properties;
    private final TaskExecutor           runExecutor;
    private final Clock                  clock;

    // Cancellation handles of runs still in progress, by execution id
    private final Map<String, RunCancellationToken> activeRuns = new ConcurrentHashMap<>();

    public WorkflowRunService(WorkflowExecutor executor,
                              WorkflowGraphValidator validator,
                              ExecutionRepository executionRepository,
                              EngineProperties properties,
                              @Qualifier(EngineConfig.RUN_EXECUTOR) TaskExecutor runExecutor,
                              Clock clock) {
        this.executor = executor;
        this.validator = validator;
        this.executionRepository = executionRepository;
        this.properties = properties;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    private record PreparedRun(ExecutionContext ctx, RunCancellationToken token) {}

    /** Runs the workflow and blocks until it finishes. */
    public WorkflowRunResult runSync(String workflowId, RunRequestDto request) {
        return execute(prepare(workflowId, request));
    }

    /**
     * Validates and registers the run, then executes it in the background. Returns the RUNNING
     * record so the caller can subscribe to live events before they are sent.
     */
    public WorkflowRunResult runAsync(String workflowId, RunRequestDto request) {
        PreparedRun run = prepare(workflowId, request);
        String executionId = run.ctx().getExecutionId();
        try {
            runExecutor.execute(() -> execute(run));
        } catch (TaskRejectedException ex) {
            activeRuns.remove(executionId);
            log.warn("Run {} rejected: run pool is saturated", executionId);
            WorkflowRunResult rejected = finishedWithError(run.ctx(), "Run rejected: too many runs in progress");
            executionRepository.save(rejected);
            return rejected;
        }
        return executionRepository.findById(executionId)
                .orElseThrow(() -> new IllegalStateException("Execution not found after start: " + executionId));
    }

    /** @return false when no run with this id is in progress */
    public boolean cancel(String executionId) {
        RunCancellationToken token = activeRuns.get(executionId);
        if (token == null) {
            return false;
        }
        if (token.cancel()) {
            log.info("Cancellation requested for run {}", executionId);
        }
        return true;
    }

    private PreparedRun prepare(String workflowId, RunRequestDto request) {
        List<Block> blocks = request.blocks().stream().map(BlockDto::toBlock).toList();
        List<Edge> edges = request.edges().stream().map(EdgeDto::toEdge).toList();
        WorkflowGraph graph = validator.validate(blocks, edges);

        // Run-supplied variables override the configured seed values
        Map<String, String> environment = new LinkedHashMap<>(properties.getEnvironment());
        environment.putAll(request.environmentVariables());

        String executionId = UUID.randomUUID().toString();
        ExecutionContext ctx = ExecutionContext.create(workflowId, executionId, graph, environment,
                request.input(), clock.instant());

        RunCancellationToken token = new RunCancellationToken();
        activeRuns.put(executionId, token);
        executionRepository.save(WorkflowRunResult.running(executionId, workflowId, ctx.getStartedAt()));
        return new PreparedRun(ctx, token);
    }

    private WorkflowRunResult execute(PreparedRun run) {
        ExecutionContext ctx = run.ctx();
        WorkflowRunResult result;
        try {
            result = executor.execute(ctx, run.token());
        } catch (RuntimeException ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Workflow {} run {} crashed: {}", ctx.getWorkflowId(), ctx.getExecutionId(), msg, ex);
            result = finishedWithError(ctx, msg);
        } finally {
            activeRuns.remove(ctx.getExecutionId());
        }
        executionRepository.save(result);
        return result;
    }

    // Keeps whatever logs the run produced so the record still shows how far it got
    private WorkflowRunResult finishedWithError(ExecutionContext ctx, String error) {
        return WorkflowRunResult.builder()
                .executionId(ctx.getExecutionId())
                .workflowId(ctx.getWorkflowId())
                .status(ExecutionStatus.FAILURE)
                .error(error)
                .blockLogs(ctx.blockLogsSnapshot())
                .blockStates(ctx.blockStatesSnapshot())
                .startedAt(ctx.getStartedAt())
                .completedAt(clock.instant())
                .build();
    }
}
