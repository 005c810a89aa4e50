package com.blockflow.blockflow_engine.exception;

/**
 * Base type of every error the engine raises while resolving or running a block.
 */
public class WorkflowExecutionException extends RuntimeException {

    private final String blockId;

    public WorkflowExecutionException(String message) {
        this(null, message, null);
    }

    public WorkflowExecutionException(String blockId, String message) {
        this(blockId, message, null);
    }

    public WorkflowExecutionException(String blockId, String message, Throwable cause) {
        super(message, cause);
        this.blockId = blockId;
    }

    /** Block the error originated from, or null when it is not tied to one block. */
    public String getBlockId() {
        return blockId;
    }
}
