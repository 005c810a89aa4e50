package com.blockflow.blockflow_engine.exception;

import lombok.Getter;

/**
 * A tool answered with {@code success: false}. The message is the tool's own error text, or a
 * fixed fallback when the tool supplied none.
 */
@Getter
public class ToolInvocationException extends WorkflowExecutionException {

    private final String toolName;

    public ToolInvocationException(String blockId, String toolName, String message) {
        super(blockId, message);
        this.toolName = toolName;
    }
}
