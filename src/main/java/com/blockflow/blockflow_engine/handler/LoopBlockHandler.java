package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.engine.LoopController;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.context.LoopState;
import com.blockflow.blockflow_engine.model.context.LoopStatus;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.BlockType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Starts loop blocks. The iterations themselves are driven by the executor through the
 * {@link LoopController}; this handler only prepares the loop state.
 *
 * Output: the final aggregate when there is nothing to iterate, otherwise
 * { iterations: <planned>, completed: false } until the executor completes the loop.
 */
@Component
@Order(40)
@RequiredArgsConstructor
public class LoopBlockHandler implements BlockHandler {

    private final LoopController loopController;

    @Override
    public boolean canHandle(Block block) {
        return block.getType() == BlockType.LOOP;
    }

    @Override
    public CompletableFuture<Map<String, Object>> execute(Block block, Map<String, Object> inputs, ExecutionContext ctx) {
        LoopState state = loopController.start(block, inputs, ctx);
        if (state.getStatus() == LoopStatus.COMPLETED) {
            return CompletableFuture.completedFuture(loopController.aggregateOutput(state));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("iterations", state.getTotalIterations());
        output.put("completed", false);
        return CompletableFuture.completedFuture(output);
    }
}
