package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.exception.WorkflowExecutionException;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.Edge;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConditionBlockHandler")
class ConditionBlockHandlerTest {

    private final ConditionBlockHandler handler = new ConditionBlockHandler(new ConditionEvaluator(), new ObjectMapper());
    private Block condition;
    private ExecutionContext ctx;

    @BeforeEach
    void setUp() {
        condition = Block.builder().id("check").kind("condition").build();
        Block vip = Block.builder().id("vip-path").kind("function").build();
        Block regular = Block.builder().id("regular-path").kind("function").build();
        WorkflowGraph graph = WorkflowGraph.of(List.of(condition, vip, regular), List.of(
                Edge.builder().source("check").target("vip-path").branch("vip").build(),
                Edge.builder().source("check").target("regular-path").branch("else").build()));
        ctx = ExecutionContext.create("wf", "exec", graph, Map.of(), Map.of());
    }

    private static Map<String, Object> conditions(String vipExpression) {
        return Map.of("conditions", List.of(
                Map.of("id", "vip", "expression", vipExpression),
                Map.of("id", "else")));
    }

    @Test
    @DisplayName("the first holding expression selects its branch")
    void firstMatch() {
        Map<String, Object> output = handler.execute(condition, conditions("750 > 500"), ctx).join();

        assertThat(output)
                .containsEntry("selectedBranch", "vip")
                .containsEntry("selectedConditionId", "vip")
                .containsEntry("conditionResult", true);
        @SuppressWarnings("unchecked")
        Map<String, Object> selectedPath = (Map<String, Object>) output.get("selectedPath");
        assertThat(selectedPath)
                .containsEntry("blockId", "vip-path")
                .containsEntry("blockKind", "function")
                .containsEntry("blockName", null);
    }

    @Test
    @DisplayName("the else branch is taken when nothing holds")
    void elseBranch() {
        Map<String, Object> output = handler.execute(condition, conditions("100 > 500"), ctx).join();

        assertThat(output)
                .containsEntry("selectedBranch", "else")
                .containsEntry("conditionResult", false);
    }

    @Test
    @DisplayName("conditions may arrive as a JSON string")
    void jsonConditions() {
        String json = "[{\"id\":\"vip\",\"expression\":\"gold == gold\"},{\"id\":\"else\"}]";

        Map<String, Object> output = handler.execute(condition, Map.of("conditions", json), ctx).join();

        assertThat(output.get("selectedBranch")).isEqualTo("vip");
    }

    @Test
    @DisplayName("fails when nothing holds and there is no else branch")
    void noElse() {
        Map<String, Object> inputs = Map.of("conditions", List.of(Map.of("id", "vip", "expression", "1 > 2")));

        assertThatThrownBy(() -> handler.execute(condition, inputs, ctx).join())
                .hasCauseInstanceOf(WorkflowExecutionException.class)
                .hasRootCauseMessage("No condition of block check matched and it has no else branch");
    }

    @Test
    @DisplayName("malformed conditions fail the block")
    void malformed() {
        assertThatThrownBy(() -> handler.execute(condition, Map.of("conditions", "{not json"), ctx).join())
                .hasCauseInstanceOf(WorkflowExecutionException.class)
                .cause()
                .hasMessageStartingWith("Condition block check has malformed conditions");
    }
}
