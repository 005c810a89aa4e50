package com.blockflow.blockflow_engine.engine;

import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.Edge;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps {@code activeExecutionPath} in step with the decisions made so far.
 *
 * After a router/condition decides, only the blocks downstream of it are re-examined, in
 * topological order: a block stays active iff at least one of its incoming edges comes from
 * a still-active block and is followed. An edge out of a decided block is followed when it
 * matches the selected branch; edges out of any other block are always followed. Blocks that
 * reconverge from a taken branch therefore stay active.
 */
@Slf4j
@Component
public class PathResolver {

    /** Activates every block reachable from the start blocks. */
    public void initialize(ExecutionContext ctx) {
        WorkflowGraph graph = ctx.getGraph();
        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(graph.startBlockIds());
        while (!pending.isEmpty()) {
            String id = pending.poll();
            if (reachable.add(id)) {
                graph.outgoing(id).forEach(e -> pending.add(e.getTarget()));
            }
        }
        ctx.activate(reachable);
        log.debug("Run {}: {} of {} blocks reachable from {}", ctx.getExecutionId(),
                reachable.size(), graph.size(), graph.startBlockIds());
    }

    /**
     * Records the decision of {@code decider} and prunes what it made unreachable, as one step
     * on the context.
     *
     * @return ids removed from the active path
     */
    public Set<String> applyDecision(Block decider, String selectedBranch, ExecutionContext ctx) {
        WorkflowGraph graph = ctx.getGraph();

        List<String> candidates = new ArrayList<>(graph.downstreamOf(decider.getId()));
        candidates.removeIf(id -> !ctx.isActive(id));
        candidates.sort(graph.topologicalComparator());

        Set<String> pruned = new LinkedHashSet<>();
        for (String candidate : candidates) {
            boolean reachable = false;
            for (Edge edge : graph.incoming(candidate)) {
                String source = edge.getSource();
                if (!ctx.isActive(source) || pruned.contains(source)) continue;
                if (isFollowed(edge, decider.getId(), selectedBranch, ctx)) {
                    reachable = true;
                    break;
                }
            }
            if (!reachable) {
                pruned.add(candidate);
            }
        }

        ctx.applyDecision(decider.getId(), decider.getType(), selectedBranch, pruned);
        if (!pruned.isEmpty()) {
            log.debug("Run {}: block {} selected '{}', pruned {}", ctx.getExecutionId(),
                    decider.getId(), selectedBranch, pruned);
        }
        return pruned;
    }

    /** Makes the body of a loop runnable again at the start of an iteration. */
    public void reactivateLoopBody(String loopId, ExecutionContext ctx) {
        ctx.activate(ctx.getGraph().loopBody(loopId));
    }

    private boolean isFollowed(Edge edge, String deciderId, String selectedBranch, ExecutionContext ctx) {
        String source = edge.getSource();
        if (source.equals(deciderId)) {
            return edge.matches(selectedBranch);
        }
        String decided = ctx.getDecisions().selectedBranch(source);
        return decided == null || edge.matches(decided);
    }
}
