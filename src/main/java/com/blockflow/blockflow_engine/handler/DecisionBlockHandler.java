package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.Edge;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of router and condition handlers. Their output carries the selected branch under
 * {@link #SELECTED_BRANCH}; the executor records it and prunes the branches not taken.
 */
public abstract class DecisionBlockHandler implements BlockHandler {

    public static final String SELECTED_BRANCH = "selectedBranch";

    /** First outgoing edge of the block that follows {@code branch}, or null. */
    protected Edge findEdge(Block block, String branch, ExecutionContext ctx) {
        return ctx.getGraph().outgoing(block.getId()).stream()
                .filter(edge -> edge.matches(branch))
                .findFirst()
                .orElse(null);
    }

    protected Map<String, Object> selectedPath(Edge edge, ExecutionContext ctx) {
        if (edge == null) return null;
        Block target = ctx.getGraph().block(edge.getTarget());
        Map<String, Object> path = new LinkedHashMap<>();
        path.put("blockId", edge.getTarget());
        path.put("blockKind", target != null ? target.getKind() : null);
        path.put("blockName", target != null ? target.getName() : null);
        return path;
    }
}
