package com.blockflow.blockflow_engine.model.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of the enabled blocks and edges of one workflow, with the indexes the
 * executor needs: adjacency, topological order, start blocks and loop-body membership.
 *
 * Disabled blocks are dropped together with every edge touching them.
 */
public final class WorkflowGraph {

    private final Map<String, Block> blocks = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, List<Edge>> outgoing = new HashMap<>();
    private final Map<String, List<Edge>> incoming = new HashMap<>();
    private final Map<String, String> labelIndex = new HashMap<>();
    private final Map<String, String> enclosingLoop = new HashMap<>();
    private final Map<String, Integer> topoIndex = new HashMap<>();
    private final List<String> topologicalOrder = new ArrayList<>();
    private final List<String> startBlockIds = new ArrayList<>();

    private WorkflowGraph(List<Block> allBlocks, List<Edge> allEdges) {
        for (Block block : allBlocks) {
            if (block.isEnabled()) {
                blocks.put(block.getId(), block);
            }
        }
        for (Edge edge : allEdges) {
            if (blocks.containsKey(edge.getSource()) && blocks.containsKey(edge.getTarget())) {
                edges.add(edge);
                outgoing.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
                incoming.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge);
            }
        }
        for (Block block : blocks.values()) {
            String key = block.labelKey();
            if (key != null) {
                labelIndex.putIfAbsent(key, block.getId());
            }
            if (block.getType() == BlockType.LOOP) {
                for (String member : block.loopBody()) {
                    if (blocks.containsKey(member)) {
                        enclosingLoop.put(member, block.getId());
                    }
                }
            }
        }
        computeTopologicalOrder();
        computeStartBlocks();
    }

    public static WorkflowGraph of(List<Block> blocks, List<Edge> edges) {
        return new WorkflowGraph(blocks, edges);
    }

    // Kahn's algorithm; blocks on a cycle never reach in-degree zero and are left out
    private void computeTopologicalOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        blocks.keySet().forEach(id -> inDegree.put(id, incoming(id).size()));

        Deque<String> queue = new ArrayDeque<>();
        blocks.keySet().stream().filter(id -> inDegree.get(id) == 0).forEach(queue::add);

        while (!queue.isEmpty()) {
            String id = queue.poll();
            topoIndex.put(id, topologicalOrder.size());
            topologicalOrder.add(id);
            for (Edge edge : outgoing(id)) {
                int remaining = inDegree.merge(edge.getTarget(), -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(edge.getTarget());
                }
            }
        }
    }

    private void computeStartBlocks() {
        blocks.values().stream()
                .filter(b -> b.getType() == BlockType.STARTER)
                .map(Block::getId)
                .forEach(startBlockIds::add);
        if (startBlockIds.isEmpty()) {
            // body blocks only run when their loop enters an iteration
            blocks.keySet().stream()
                    .filter(id -> incoming(id).isEmpty() && !enclosingLoop.containsKey(id))
                    .forEach(startBlockIds::add);
        }
    }

    public boolean hasCycle() {
        return topologicalOrder.size() != blocks.size();
    }

    /** Blocks that could not be placed in topological order, i.e. blocks on or behind a cycle. */
    public Set<String> blocksOnCycles() {
        Set<String> remaining = new LinkedHashSet<>(blocks.keySet());
        topologicalOrder.forEach(remaining::remove);
        return remaining;
    }

    public Block block(String id) {
        return blocks.get(id);
    }

    public boolean contains(String id) {
        return blocks.containsKey(id);
    }

    public Collection<Block> blocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Edge> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<Edge> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    /** Distinct source ids of the incoming edges: the block's declared dependencies. */
    public Set<String> dependencies(String id) {
        Set<String> deps = new LinkedHashSet<>();
        incoming(id).forEach(e -> deps.add(e.getSource()));
        return deps;
    }

    public List<String> topologicalOrder() {
        return Collections.unmodifiableList(topologicalOrder);
    }

    public int topoIndex(String id) {
        return topoIndex.getOrDefault(id, Integer.MAX_VALUE);
    }

    public Comparator<String> topologicalComparator() {
        return Comparator.comparingInt(this::topoIndex);
    }

    public List<String> startBlockIds() {
        return Collections.unmodifiableList(startBlockIds);
    }

    /** Resolves a reference key (block id first, then label key) to a block id, or null. */
    public String resolveBlockKey(String key) {
        if (blocks.containsKey(key)) return key;
        return labelIndex.get(key);
    }

    /** Id of the loop whose body contains this block, or null. */
    public String enclosingLoop(String id) {
        return enclosingLoop.get(id);
    }

    public List<String> loopBody(String loopId) {
        Block loop = blocks.get(loopId);
        if (loop == null) return List.of();
        return loop.loopBody().stream().filter(blocks::containsKey).toList();
    }

    /** Every block reachable from {@code id} over outgoing edges, excluding {@code id} itself. */
    public Set<String> downstreamOf(String id) {
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        outgoing(id).forEach(e -> pending.add(e.getTarget()));
        while (!pending.isEmpty()) {
            String next = pending.poll();
            if (seen.add(next)) {
                outgoing(next).forEach(e -> pending.add(e.getTarget()));
            }
        }
        seen.remove(id);
        return seen;
    }

    public int size() {
        return blocks.size();
    }
}
