package com.blockflow.blockflow_engine.repository;

import com.blockflow.blockflow_engine.config.EngineProperties;
import com.blockflow.blockflow_engine.model.context.ExecutionStatus;
import com.blockflow.blockflow_engine.model.context.WorkflowRunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps run records in memory. Records are replaced as a run moves from RUNNING to its final
 * status; once more than {@code blockflow.engine.max-retained-runs} finished runs are held, the
 * oldest of them are evicted.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ExecutionRepository {

    private static final Comparator<WorkflowRunResult> NEWEST_FIRST = Comparator
            .comparing(WorkflowRunResult::getStartedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final EngineProperties properties;

    private final Map<String, WorkflowRunResult> executions = new ConcurrentHashMap<>();

    public WorkflowRunResult save(WorkflowRunResult execution) {
        executions.put(execution.getExecutionId(), execution);
        if (execution.getStatus() != ExecutionStatus.RUNNING) {
            evictFinished();
        }
        return execution;
    }

    public Optional<WorkflowRunResult> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    // All executions newest-first
    public List<WorkflowRunResult> findAllByOrderByStartedAtDesc() {
        return executions.values().stream().sorted(NEWEST_FIRST).toList();
    }

    public List<WorkflowRunResult> findByWorkflowIdOrderByStartedAtDesc(String workflowId) {
        return executions.values().stream()
                .filter(e -> workflowId.equals(e.getWorkflowId()))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    private synchronized void evictFinished() {
        int limit = Math.max(0, properties.getMaxRetainedRuns());
        List<WorkflowRunResult> finished = executions.values().stream()
                .filter(e -> e.getStatus() != ExecutionStatus.RUNNING)
                .sorted(NEWEST_FIRST)
                .toList();
        if (finished.size() <= limit) return;

        List<WorkflowRunResult> evicted = finished.subList(limit, finished.size());
        evicted.forEach(e -> executions.remove(e.getExecutionId(), e));
        log.debug("Evicted {} finished run(s); retaining {}", evicted.size(), limit);
    }
}
