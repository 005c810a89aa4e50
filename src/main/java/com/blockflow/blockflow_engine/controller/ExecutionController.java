package com.blockflow.blockflow_engine.controller;

import com.blockflow.blockflow_engine.model.context.WorkflowRunResult;
import com.blockflow.blockflow_engine.repository.ExecutionRepository;
import com.blockflow.blockflow_engine.service.WorkflowRunService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionRepository executionRepository;
    private final WorkflowRunService  runService;

    // GET /api/executions: full history across all workflows, newest first
    @GetMapping
    public List<ExecutionSummary> listAll() {
        return executionRepository.findAllByOrderByStartedAtDesc().stream()
                .map(this::toSummary)
                .toList();
    }

    // GET /api/executions/{id}: full detail including block logs and final block states
    @GetMapping("/{id}")
    public ResponseEntity<WorkflowRunResult> getById(@PathVariable String id) {
        return executionRepository.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // POST /api/executions/{id}/cancel: 202 while the run winds down, 409 once it has finished
    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String id) {
        if (runService.cancel(id)) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("executionId", id, "cancelRequested", true));
        }
        return executionRepository.findById(id)
                .<ResponseEntity<?>>map(e -> ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(new ErrorResponse("Execution " + id + " already finished with status " + e.getStatus())))
                .orElse(ResponseEntity.notFound().build());
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    private ExecutionSummary toSummary(WorkflowRunResult e) {
        return new ExecutionSummary(
                e.getExecutionId(),
                e.getWorkflowId(),
                e.getStatus().name(),
                e.getError(),
                e.getBlockLogs().size(),
                e.getStartedAt() != null ? e.getStartedAt().toString() : null,
                e.getCompletedAt() != null ? e.getCompletedAt().toString() : null,
                e.getDurationMs()
        );
    }

    public record ExecutionSummary(
            String id,
            String workflowId,
            String status,
            String error,
            int    blockCount,
            String startedAt,
            String completedAt,
            long   durationMs
    ) {}
}
