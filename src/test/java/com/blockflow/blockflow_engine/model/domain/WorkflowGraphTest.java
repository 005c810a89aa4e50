package com.blockflow.blockflow_engine.model.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WorkflowGraph")
class WorkflowGraphTest {

    private static Block block(String id, String kind) {
        return Block.builder().id(id).kind(kind).build();
    }

    private static Edge edge(String source, String target) {
        return Edge.builder().source(source).target(target).build();
    }

    @Test
    @DisplayName("orders blocks topologically and indexes dependencies")
    void topology() {
        WorkflowGraph graph = WorkflowGraph.of(
                List.of(block("C", "function"), block("start", "starter"), block("A", "function"), block("B", "function")),
                List.of(edge("start", "A"), edge("start", "B"), edge("A", "C"), edge("B", "C")));

        assertThat(graph.topologicalOrder()).startsWith("start").endsWith("C");
        assertThat(graph.dependencies("C")).containsExactly("A", "B");
        assertThat(graph.downstreamOf("start")).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(graph.hasCycle()).isFalse();
    }

    @Test
    @DisplayName("starter blocks are the start blocks when present")
    void starterStartBlocks() {
        WorkflowGraph graph = WorkflowGraph.of(
                List.of(block("start", "starter"), block("orphan", "function")), List.of());

        assertThat(graph.startBlockIds()).containsExactly("start");
    }

    @Test
    @DisplayName("without a starter, blocks without incoming edges start, except loop bodies")
    void fallbackStartBlocks() {
        Block loop = Block.builder().id("each").kind("loop").config(Map.of("body", List.of("body"))).build();
        WorkflowGraph graph = WorkflowGraph.of(
                List.of(block("A", "function"), loop, block("body", "function"), block("B", "function")),
                List.of(edge("A", "B")));

        assertThat(graph.startBlockIds()).containsExactly("A", "each");
        assertThat(graph.enclosingLoop("body")).isEqualTo("each");
        assertThat(graph.loopBody("each")).containsExactly("body");
    }

    @Test
    @DisplayName("resolves references by id first, then by name key")
    void blockKeys() {
        Block named = Block.builder().id("b-1").kind("function").name("Fetch Users!").build();
        WorkflowGraph graph = WorkflowGraph.of(List.of(named), List.of());

        assertThat(graph.resolveBlockKey("b-1")).isEqualTo("b-1");
        assertThat(graph.resolveBlockKey("fetchUsers")).isEqualTo("b-1");
        assertThat(graph.resolveBlockKey("nope")).isNull();
        assertThat(Block.toLabelKey("  send   welcome EMAIL ")).isEqualTo("sendWelcomeEmail");
    }

    @Test
    @DisplayName("reports blocks on cycles")
    void cycles() {
        WorkflowGraph graph = WorkflowGraph.of(
                List.of(block("A", "function"), block("B", "function"), block("C", "function")),
                List.of(edge("A", "B"), edge("B", "C"), edge("C", "B")));

        assertThat(graph.hasCycle()).isTrue();
        assertThat(graph.blocksOnCycles()).containsExactly("B", "C");
    }

    @Test
    @DisplayName("edges match a selected branch by label or by target id")
    void edgeMatching() {
        Edge labelled = Edge.builder().source("r").target("t").branch("yes").build();

        assertThat(labelled.matches("yes")).isTrue();
        assertThat(labelled.matches("t")).isTrue();
        assertThat(labelled.matches("no")).isFalse();
        assertThat(labelled.matches(null)).isFalse();
    }
}
