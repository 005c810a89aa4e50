package com.blockflow.blockflow_engine.tool;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Boundary to external tools. The engine only interprets the returned envelope; it never
 * looks at how a tool does its work.
 *
 * Implementations should complete the future with a {@code success=false} envelope for
 * tool-level failures and reserve exceptional completion for failures of the call itself.
 * Cancelling the returned future is a request to abandon the call.
 */
public interface ToolInvoker {

    String FUNCTION_EXECUTE = "function_execute";

    CompletableFuture<ToolResponse> invoke(String toolName, Map<String, Object> params);
}
