package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.exception.WorkflowExecutionException;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.BlockType;
import com.blockflow.blockflow_engine.model.domain.Edge;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes router blocks: picks one outgoing branch by name.
 *
 * Inputs:  { "route": "<classify.response.category>" }   // a branch label or a target block id
 * Config:  { "defaultRoute": "other" }                   // used when route resolves to blank
 *
 * Output:  { selectedBranch, selectedBlockId, route, selectedPath: { blockId, blockKind, blockName } }
 */
@Component
@Order(20)
public class RouterBlockHandler extends DecisionBlockHandler {

    @Override
    public boolean canHandle(Block block) {
        return block.getType() == BlockType.ROUTER;
    }

    @Override
    public CompletableFuture<Map<String, Object>> execute(Block block, Map<String, Object> inputs, ExecutionContext ctx) {
        Object rawRoute = inputs.get("route");
        String route = rawRoute != null ? rawRoute.toString().trim() : "";
        if (route.isEmpty()) {
            String fallback = block.configString("defaultRoute");
            route = fallback != null ? fallback.trim() : "";
        }
        if (route.isEmpty()) {
            return CompletableFuture.failedFuture(new WorkflowExecutionException(block.getId(),
                    "Router " + block.getId() + " resolved an empty route and has no defaultRoute"));
        }

        Edge edge = findEdge(block, route, ctx);
        if (edge == null) {
            return CompletableFuture.failedFuture(new WorkflowExecutionException(block.getId(),
                    "Router " + block.getId() + " selected route \"" + route + "\" but no outgoing edge matches it"));
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put(SELECTED_BRANCH, route);
        output.put("selectedBlockId", edge.getTarget());
        output.put("route", rawRoute);
        output.put("selectedPath", selectedPath(edge, ctx));
        return CompletableFuture.completedFuture(output);
    }
}
