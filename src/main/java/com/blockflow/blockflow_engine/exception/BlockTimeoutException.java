package com.blockflow.blockflow_engine.exception;

import lombok.Getter;

@Getter
public class BlockTimeoutException extends WorkflowExecutionException {

    private final long timeoutMs;

    public BlockTimeoutException(String blockId, String toolName, long timeoutMs) {
        super(blockId, toolName + " timed out after " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }
}
