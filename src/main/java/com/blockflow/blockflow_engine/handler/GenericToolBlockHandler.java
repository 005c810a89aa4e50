package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.config.EngineProperties;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.BlockType;
import com.blockflow.blockflow_engine.tool.ToolInvoker;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs blocks whose kind names an external tool.
 *
 * A block is accepted when its kind is listed under {@code blockflow.engine.tools}, or when it
 * is not a built-in kind and names its tool explicitly:
 * {
 *   "kind":   "http_request",
 *   "config": { "tool": "http_request", "params": { "method": "GET" }, "timeoutMs": 10000 },
 *   "inputs": { "url": "https://api.example.com/users/<starter.input.userId>" }
 * }
 *
 * Tool params are config.params overlaid with the resolved inputs.
 */
@Component
@Order(50)
public class GenericToolBlockHandler extends ToolBackedBlockHandler {

    public GenericToolBlockHandler(ToolInvoker toolInvoker, EngineProperties properties) {
        super(toolInvoker, properties);
    }

    @Override
    public boolean canHandle(Block block) {
        if (block.getKind() == null || BlockType.isBuiltIn(block.getKind())) {
            return false;
        }
        boolean configured = properties.getTools().stream()
                .anyMatch(tool -> tool.equalsIgnoreCase(block.getKind().trim()));
        String explicitTool = block.configString("tool");
        return configured || (explicitTool != null && !explicitTool.isBlank());
    }

    @Override
    public CompletableFuture<Map<String, Object>> execute(Block block, Map<String, Object> inputs, ExecutionContext ctx) {
        String toolName = block.toolName();

        Map<String, Object> params = new LinkedHashMap<>();
        if (block.configValue("params") instanceof Map<?, ?> staticParams) {
            staticParams.forEach((k, v) -> params.put(String.valueOf(k), v));
        }
        params.putAll(inputs);
        params.put(CONTEXT_PARAM, contextParam(ctx));

        Object timeout = inputs.get("timeout");
        if (timeout == null) {
            timeout = block.configValue("timeoutMs");
        }
        long timeoutMs = timeoutMillis(timeout, properties.getDefaultToolTimeoutMs());

        return invokeTool(block, toolName, params, timeoutMs, toolName + " execution failed");
    }
}
