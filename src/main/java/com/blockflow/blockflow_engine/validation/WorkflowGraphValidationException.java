package com.blockflow.blockflow_engine.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a submitted workflow graph is malformed. Carries every error found, not just
 * the first; mapped to HTTP 400 by the controller advice.
 */
@Getter
public class WorkflowGraphValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowGraphValidationException(List<ValidationError> errors) {
        super("Workflow graph validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
