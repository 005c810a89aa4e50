package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.config.EngineProperties;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.BlockType;
import com.blockflow.blockflow_engine.tool.ToolInvoker;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes function blocks by handing their code to the {@code function_execute} tool.
 *
 * Inputs:
 * {
 *   "code":    "return 1 + 1;"  or  [{ "content": "const x = 5;" }, { "content": "return x * 2;" }],
 *   "timeout": 10000            // optional, ms
 * }
 *
 * Output: { "response": <tool output> }
 */
@Component
@Order(10)
public class FunctionBlockHandler extends ToolBackedBlockHandler {

    static final String FALLBACK_ERROR = "Function execution failed";

    public FunctionBlockHandler(ToolInvoker toolInvoker, EngineProperties properties) {
        super(toolInvoker, properties);
    }

    @Override
    public boolean canHandle(Block block) {
        return block.getType() == BlockType.FUNCTION;
    }

    @Override
    public CompletableFuture<Map<String, Object>> execute(Block block, Map<String, Object> inputs, ExecutionContext ctx) {
        Object code = inputs.get(InputResolver.CODE_INPUT);
        if (code instanceof List<?> fragments) {
            code = InputResolver.joinCodeFragments(fragments);
        }

        // An explicit timeout is handed to the tool exactly as given
        Object timeout = inputs.get("timeout");
        if (timeout == null) {
            timeout = properties.getFunctionTimeoutMs();
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("code", code);
        params.put("timeout", timeout);
        params.put(CONTEXT_PARAM, contextParam(ctx));

        long timeoutMs = timeoutMillis(timeout, properties.getFunctionTimeoutMs());
        return invokeTool(block, ToolInvoker.FUNCTION_EXECUTE, params, timeoutMs, FALLBACK_ERROR);
    }
}
