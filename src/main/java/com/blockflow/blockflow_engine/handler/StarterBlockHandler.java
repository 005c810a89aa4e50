package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.BlockType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of a run. Exposes the run's trigger payload as {@code <starter.input.*>}.
 */
@Component
@Order(0)
public class StarterBlockHandler implements BlockHandler {

    @Override
    public boolean canHandle(Block block) {
        return block.getType() == BlockType.STARTER;
    }

    @Override
    public CompletableFuture<Map<String, Object>> execute(Block block, Map<String, Object> inputs, ExecutionContext ctx) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("input", ctx.getRunInput());
        return CompletableFuture.completedFuture(output);
    }
}
