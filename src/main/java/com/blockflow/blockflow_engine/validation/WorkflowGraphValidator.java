package com.blockflow.blockflow_engine.validation;

import com.blockflow.blockflow_engine.engine.LoopController;
import com.blockflow.blockflow_engine.handler.BlockHandlerRegistry;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.BlockType;
import com.blockflow.blockflow_engine.model.domain.Edge;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a workflow graph before a run: ids, kinds, edge endpoints, loop bodies and
 * acyclicity. Collects every error and throws them together.
 */
@Component
@RequiredArgsConstructor
public class WorkflowGraphValidator {

    private final BlockHandlerRegistry handlerRegistry;

    /**
     * @return the runnable graph (disabled blocks removed)
     * @throws WorkflowGraphValidationException with all errors if the graph is invalid
     */
    public WorkflowGraph validate(List<Block> blocks, List<Edge> edges) {
        List<ValidationError> errors = new ArrayList<>();

        if (blocks == null || blocks.isEmpty()) {
            errors.add(new ValidationError("blocks", "at least one block is required"));
            throw new WorkflowGraphValidationException(errors);
        }
        List<Edge> edgeList = edges != null ? edges : List.of();

        Map<String, Block> byId = new HashMap<>();
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (block.getId() == null || block.getId().isBlank()) {
                errors.add(new ValidationError("blocks[" + i + "].id", "block id is required"));
                continue;
            }
            if (byId.putIfAbsent(block.getId(), block) != null) {
                errors.add(new ValidationError("blocks[" + block.getId() + "].id", "duplicate block id: " + block.getId()));
            }
        }

        for (Block block : byId.values()) {
            validateBlock(block, byId, errors);
        }
        validateLoopMembership(byId, errors);

        for (int i = 0; i < edgeList.size(); i++) {
            Edge edge = edgeList.get(i);
            String prefix = "edges[" + (edge.getId() != null ? edge.getId() : i) + "]";
            if (edge.getSource() == null || !byId.containsKey(edge.getSource())) {
                errors.add(new ValidationError(prefix + ".source", "source must reference an existing block id: " + edge.getSource()));
            }
            if (edge.getTarget() == null || !byId.containsKey(edge.getTarget())) {
                errors.add(new ValidationError(prefix + ".target", "target must reference an existing block id: " + edge.getTarget()));
            }
        }

        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }

        WorkflowGraph graph = WorkflowGraph.of(blocks, edgeList);
        validateLoopEdges(graph, errors);
        if (graph.hasCycle()) {
            errors.add(new ValidationError("edges", "workflow graph contains a cycle through blocks " + graph.blocksOnCycles()
                    + "; use a loop block to repeat work"));
        }
        if (!errors.isEmpty()) {
            throw new WorkflowGraphValidationException(errors);
        }
        return graph;
    }

    private void validateBlock(Block block, Map<String, Block> byId, List<ValidationError> errors) {
        String prefix = "blocks[" + block.getId() + "]";

        if (block.getKind() == null || block.getKind().isBlank()) {
            errors.add(new ValidationError(prefix + ".kind", "block kind is required"));
            return;
        }
        if (block.isEnabled() && !handlerRegistry.supports(block)) {
            errors.add(new ValidationError(prefix + ".kind", "no handler registered for block kind: " + block.getKind()));
        }

        BlockType type = block.getType();
        if (block.isBestEffort() && (type.isDecision() || type == BlockType.LOOP)) {
            errors.add(new ValidationError(prefix + ".config.bestEffort", type.kind() + " blocks cannot be best-effort"));
        }

        if (type == BlockType.LOOP) {
            String loopType = block.configString("loopType");
            if (loopType != null && !LoopController.FOR_EACH.equalsIgnoreCase(loopType)
                    && !LoopController.FOR.equalsIgnoreCase(loopType)) {
                errors.add(new ValidationError(prefix + ".config.loopType", "loopType must be 'forEach' or 'for'"));
            }
            List<String> body = block.loopBody();
            if (body.isEmpty()) {
                errors.add(new ValidationError(prefix + ".config.body", "loop body must list at least one block id"));
            }
            for (String member : body) {
                if (member.equals(block.getId())) {
                    errors.add(new ValidationError(prefix + ".config.body", "a loop cannot contain itself"));
                } else if (!byId.containsKey(member)) {
                    errors.add(new ValidationError(prefix + ".config.body", "body must reference existing block ids: " + member));
                }
            }
        }
    }

    private void validateLoopMembership(Map<String, Block> byId, List<ValidationError> errors) {
        Map<String, String> owner = new HashMap<>();
        for (Block loop : byId.values()) {
            if (loop.getType() != BlockType.LOOP) continue;
            for (String member : loop.loopBody()) {
                String previous = owner.putIfAbsent(member, loop.getId());
                if (previous != null && !previous.equals(loop.getId())) {
                    errors.add(new ValidationError("blocks[" + member + "]",
                            "block belongs to the bodies of both " + previous + " and " + loop.getId()));
                }
                Block memberBlock = byId.get(member);
                if (memberBlock != null && memberBlock.getType() == BlockType.LOOP && !member.equals(loop.getId())) {
                    errors.add(new ValidationError("blocks[" + loop.getId() + "].config.body",
                            "nested loops are not supported: " + member));
                }
            }
        }
    }

    // Body blocks may only feed other blocks of the same body; downstream work hangs off the loop itself
    private void validateLoopEdges(WorkflowGraph graph, List<ValidationError> errors) {
        Set<String> reported = new HashSet<>();
        for (Edge edge : graph.edges()) {
            String sourceLoop = graph.enclosingLoop(edge.getSource());
            if (sourceLoop == null) continue;
            String targetLoop = graph.enclosingLoop(edge.getTarget());
            if (!sourceLoop.equals(targetLoop) && reported.add(edge.getSource() + "->" + edge.getTarget())) {
                errors.add(new ValidationError("edges[" + (edge.getId() != null ? edge.getId() : edge.getSource() + "->" + edge.getTarget()) + "]",
                        "edge leaves the body of loop " + sourceLoop + "; connect downstream blocks to the loop block instead"));
            }
        }
    }
}
