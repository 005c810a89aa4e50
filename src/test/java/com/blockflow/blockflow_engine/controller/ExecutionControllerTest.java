package com.blockflow.blockflow_engine.controller;

import com.blockflow.blockflow_engine.model.context.BlockLog;
import com.blockflow.blockflow_engine.model.context.ExecutionStatus;
import com.blockflow.blockflow_engine.model.context.WorkflowRunResult;
import com.blockflow.blockflow_engine.repository.ExecutionRepository;
import com.blockflow.blockflow_engine.service.WorkflowRunService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExecutionController.class)
@DisplayName("ExecutionController")
class ExecutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExecutionRepository executionRepository;

    @MockBean
    private WorkflowRunService runService;

    private static WorkflowRunResult finished() {
        Instant started = Instant.parse("2026-01-01T10:00:00Z");
        return WorkflowRunResult.builder()
                .executionId("exec-1")
                .workflowId("wf-1")
                .status(ExecutionStatus.SUCCESS)
                .blockLogs(List.of(BlockLog.builder().sequence(1).blockId("start").blockKind("starter").success(true).build()))
                .blockStates(Map.of("start", Map.of("input", Map.of())))
                .startedAt(started)
                .completedAt(started.plusSeconds(1))
                .build();
    }

    @Test
    @DisplayName("GET /api/executions lists run summaries")
    void listAll() throws Exception {
        when(executionRepository.findAllByOrderByStartedAtDesc()).thenReturn(List.of(finished()));

        mockMvc.perform(get("/api/executions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("exec-1"))
                .andExpect(jsonPath("$[0].status").value("SUCCESS"))
                .andExpect(jsonPath("$[0].blockCount").value(1))
                .andExpect(jsonPath("$[0].durationMs").value(1000));
    }

    @Test
    @DisplayName("GET /api/executions/{id} returns logs and block states")
    void detail() throws Exception {
        when(executionRepository.findById("exec-1")).thenReturn(Optional.of(finished()));

        mockMvc.perform(get("/api/executions/exec-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blockLogs[0].blockId").value("start"))
                .andExpect(jsonPath("$.blockStates.start").exists());
    }

    @Test
    @DisplayName("GET /api/executions/{id} returns 404 for unknown runs")
    void detailNotFound() throws Exception {
        when(executionRepository.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/executions/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /api/executions/{id}/cancel accepts cancellation of an active run")
    void cancelActive() throws Exception {
        when(runService.cancel("exec-1")).thenReturn(true);

        mockMvc.perform(post("/api/executions/exec-1/cancel"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cancelRequested").value(true));
    }

    @Test
    @DisplayName("POST /api/executions/{id}/cancel returns 409 for a finished run")
    void cancelFinished() throws Exception {
        when(runService.cancel("exec-1")).thenReturn(false);
        when(executionRepository.findById("exec-1")).thenReturn(Optional.of(finished()));

        mockMvc.perform(post("/api/executions/exec-1/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Execution exec-1 already finished with status SUCCESS"));
    }

    @Test
    @DisplayName("POST /api/executions/{id}/cancel returns 404 for unknown runs")
    void cancelUnknown() throws Exception {
        when(runService.cancel("nope")).thenReturn(false);
        when(executionRepository.findById("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/executions/nope/cancel"))
                .andExpect(status().isNotFound());
    }
}
