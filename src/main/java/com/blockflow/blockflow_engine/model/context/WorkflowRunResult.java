package com.blockflow.blockflow_engine.model.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one workflow run: the ordered logs and the final block states, plus the error
 * that ended the run when it did not succeed. Logs are partial for failed and cancelled runs.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowRunResult {

    private String executionId;
    private String workflowId;
    private ExecutionStatus status;

    private String error;
    private String failedBlockId;

    @Builder.Default
    private List<BlockLog> blockLogs = List.of();

    @Builder.Default
    private Map<String, Map<String, Object>> blockStates = Map.of();

    private Instant startedAt;
    private Instant completedAt;

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public long getDurationMs() {
        return (startedAt != null && completedAt != null)
                ? Duration.between(startedAt, completedAt).toMillis()
                : -1;
    }

    public static WorkflowRunResult running(String executionId, String workflowId, Instant startedAt) {
        return WorkflowRunResult.builder()
                .executionId(executionId)
                .workflowId(workflowId)
                .status(ExecutionStatus.RUNNING)
                .startedAt(startedAt)
                .build();
    }
}
