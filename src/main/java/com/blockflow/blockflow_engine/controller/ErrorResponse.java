package com.blockflow.blockflow_engine.controller;

import com.blockflow.blockflow_engine.validation.ValidationError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Standard error response body (4xx/5xx): message and optional field errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<ValidationError> errors) {

    public ErrorResponse(String message) {
        this(message, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null);
    }
}
