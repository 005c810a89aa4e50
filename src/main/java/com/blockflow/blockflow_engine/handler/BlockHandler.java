package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface BlockHandler {

    // Pure predicate on the block's kind and config
    boolean canHandle(Block block);

    // Runs the block with already-resolved inputs; the executor records the output in the context
    CompletableFuture<Map<String, Object>> execute(Block block, Map<String, Object> inputs, ExecutionContext ctx);
}
