package com.blockflow.blockflow_engine.exception;

import lombok.Getter;

@Getter
public class HandlerNotFoundException extends WorkflowExecutionException {

    private final String kind;

    public HandlerNotFoundException(String blockId, String kind) {
        super(blockId, "No handler registered for block kind: " + kind);
        this.kind = kind;
    }
}
