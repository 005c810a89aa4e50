package com.blockflow.blockflow_engine.controller;

import com.blockflow.blockflow_engine.model.context.ExecutionStatus;
import com.blockflow.blockflow_engine.model.context.WorkflowRunResult;
import com.blockflow.blockflow_engine.model.dto.RunRequestDto;
import com.blockflow.blockflow_engine.repository.ExecutionRepository;
import com.blockflow.blockflow_engine.service.WorkflowRunService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowRunService  runService;
    private final ExecutionRepository executionRepository;

    // POST /api/workflows/{workflowId}/execute: runs the submitted graph.
    // Sync: 200 with the result, 422 with the result when the run failed or was cancelled.
    // Async (?async=true): 202 with the execution id; follow /topic/execution/{id} or GET /api/executions/{id}.
    @PostMapping("/{workflowId}/execute")
    public ResponseEntity<?> execute(@PathVariable String workflowId,
                                     @RequestParam(defaultValue = "false") boolean async,
                                     @Valid @RequestBody RunRequestDto request) {
        if (async) {
            WorkflowRunResult started = runService.runAsync(workflowId, request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                    "executionId", started.getExecutionId(),
                    "status", started.getStatus().name()
            ));
        }
        WorkflowRunResult result = runService.runSync(workflowId, request);
        return ResponseEntity
                .status(result.isSuccess() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }

    // GET /api/workflows/{workflowId}/logs: one entry per run, newest first
    @GetMapping("/{workflowId}/logs")
    public ResponseEntity<?> logs(@PathVariable String workflowId) {
        List<WorkflowRunResult> runs = executionRepository.findByWorkflowIdOrderByStartedAtDesc(workflowId);
        if (runs.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("No runs recorded for workflow: " + workflowId));
        }
        return ResponseEntity.ok(Map.of("logs", runs.stream().map(WorkflowLogEntry::of).toList()));
    }

    public record WorkflowLogEntry(
            String  workflowId,
            String  executionId,
            String  status,
            boolean success,
            String  level,
            String  message,
            long    durationMs,
            String  createdAt
    ) {
        static WorkflowLogEntry of(WorkflowRunResult run) {
            boolean success = run.isSuccess();
            String message = switch (run.getStatus()) {
                case SUCCESS   -> "Workflow executed successfully";
                case RUNNING   -> "Workflow is running";
                case CANCELLED -> "Workflow execution cancelled";
                case FAILURE   -> run.getError() != null ? run.getError() : "Workflow execution failed";
            };
            return new WorkflowLogEntry(
                    run.getWorkflowId(),
                    run.getExecutionId(),
                    run.getStatus().name(),
                    success,
                    run.getStatus() == ExecutionStatus.FAILURE ? "error" : "info",
                    message,
                    run.getDurationMs(),
                    run.getStartedAt() != null ? run.getStartedAt().toString() : null
            );
        }
    }
}
