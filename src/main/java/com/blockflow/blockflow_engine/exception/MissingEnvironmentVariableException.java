package com.blockflow.blockflow_engine.exception;

import lombok.Getter;

@Getter
public class MissingEnvironmentVariableException extends WorkflowExecutionException {

    private final String variableName;

    public MissingEnvironmentVariableException(String blockId, String variableName) {
        super(blockId, "Environment variable \"" + variableName + "\" is not set (referenced by block " + blockId + ")");
        this.variableName = variableName;
    }
}
