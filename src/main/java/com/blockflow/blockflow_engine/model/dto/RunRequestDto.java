package com.blockflow.blockflow_engine.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/workflows/{workflowId}/execute.
 * Null-safe: null lists and maps are treated as empty.
 */
public record RunRequestDto(
    @NotEmpty(message = "at least one block is required") List<@Valid BlockDto> blocks,
    List<@Valid EdgeDto> edges,
    Map<String, String> environmentVariables,
    Map<String, Object> input
) {
    public List<BlockDto> blocks() {
        return blocks != null ? blocks : Collections.emptyList();
    }

    public List<EdgeDto> edges() {
        return edges != null ? edges : Collections.emptyList();
    }

    public Map<String, String> environmentVariables() {
        return environmentVariables != null ? environmentVariables : Collections.emptyMap();
    }

    public Map<String, Object> input() {
        return input != null ? input : Collections.emptyMap();
    }
}
