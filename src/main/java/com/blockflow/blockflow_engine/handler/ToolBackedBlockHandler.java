package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.config.EngineProperties;
import com.blockflow.blockflow_engine.exception.BlockTimeoutException;
import com.blockflow.blockflow_engine.exception.ToolInvocationException;
import com.blockflow.blockflow_engine.exception.WorkflowExecutionException;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.tool.ToolInvoker;
import com.blockflow.blockflow_engine.tool.ToolResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared plumbing for handlers whose work is one tool call: timeout enforcement, envelope
 * mapping to {@code { response: output }}, and cancellation of the underlying call.
 */
@Slf4j
public abstract class ToolBackedBlockHandler implements BlockHandler {

    public static final String RESPONSE = "response";
    public static final String CONTEXT_PARAM = "_context";

    protected final ToolInvoker toolInvoker;
    protected final EngineProperties properties;

    protected ToolBackedBlockHandler(ToolInvoker toolInvoker, EngineProperties properties) {
        this.toolInvoker = toolInvoker;
        this.properties = properties;
    }

    /**
     * Calls the tool and maps its envelope. The call is abandoned locally once
     * {@code timeoutMs} plus the configured grace period has passed.
     *
     * @param fallbackError message used when the tool reports failure without an error text
     */
    protected CompletableFuture<Map<String, Object>> invokeTool(Block block, String toolName,
                                                                Map<String, Object> params,
                                                                long timeoutMs, String fallbackError) {
        log.debug("Block {} calling tool {}", block.getId(), toolName);
        CompletableFuture<ToolResponse> call = toolInvoker.invoke(toolName, params);

        CompletableFuture<Map<String, Object>> result = call
                .orTimeout(timeoutMs + properties.getTimeoutGraceMs(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        throw translate(block, toolName, timeoutMs, error);
                    }
                    if (response == null || !response.success()) {
                        String message = response != null && response.error() != null && !response.error().isBlank()
                                ? response.error()
                                : fallbackError;
                        throw new ToolInvocationException(block.getId(), toolName, message);
                    }
                    Map<String, Object> output = new LinkedHashMap<>();
                    output.put(RESPONSE, response.output());
                    return output;
                });

        result.whenComplete((output, error) -> {
            if (error instanceof CancellationException) {
                call.cancel(true);
            }
        });
        return result;
    }

    protected Map<String, Object> contextParam(ExecutionContext ctx) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("workflowId", ctx.getWorkflowId());
        return context;
    }

    /** Interprets a timeout input: numbers and numeric strings are honoured, anything else uses the default. */
    protected static long timeoutMillis(Object value, long defaultMs) {
        if (value instanceof Number n) return n.longValue();
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return defaultMs;
            }
        }
        return defaultMs;
    }

    private RuntimeException translate(Block block, String toolName, long timeoutMs, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return new BlockTimeoutException(block.getId(), toolName, timeoutMs);
        }
        if (cause instanceof WorkflowExecutionException wee) {
            return wee;
        }
        if (cause instanceof CancellationException ce) {
            return ce;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new WorkflowExecutionException(block.getId(), "Tool " + toolName + " call failed: " + message, cause);
    }
}
