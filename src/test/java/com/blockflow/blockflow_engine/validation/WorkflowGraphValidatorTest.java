package com.blockflow.blockflow_engine.validation;

import com.blockflow.blockflow_engine.config.EngineProperties;
import com.blockflow.blockflow_engine.engine.LoopController;
import com.blockflow.blockflow_engine.engine.PathResolver;
import com.blockflow.blockflow_engine.handler.BlockHandlerRegistry;
import com.blockflow.blockflow_engine.handler.ConditionBlockHandler;
import com.blockflow.blockflow_engine.handler.ConditionEvaluator;
import com.blockflow.blockflow_engine.handler.FunctionBlockHandler;
import com.blockflow.blockflow_engine.handler.GenericToolBlockHandler;
import com.blockflow.blockflow_engine.handler.LoopBlockHandler;
import com.blockflow.blockflow_engine.handler.RouterBlockHandler;
import com.blockflow.blockflow_engine.handler.StarterBlockHandler;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.Edge;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import com.blockflow.blockflow_engine.tool.ToolInvoker;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;

@DisplayName("WorkflowGraphValidator")
class WorkflowGraphValidatorTest {

    private WorkflowGraphValidator validator;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        EngineProperties properties = new EngineProperties();
        properties.setTools(List.of("http_request"));
        ToolInvoker toolInvoker = mock(ToolInvoker.class);
        BlockHandlerRegistry registry = new BlockHandlerRegistry(List.of(
                new StarterBlockHandler(),
                new FunctionBlockHandler(toolInvoker, properties),
                new RouterBlockHandler(),
                new ConditionBlockHandler(new ConditionEvaluator(), objectMapper),
                new LoopBlockHandler(new LoopController(properties, new PathResolver(), objectMapper)),
                new GenericToolBlockHandler(toolInvoker, properties)));
        registry.init();
        validator = new WorkflowGraphValidator(registry);
    }

    private static Block block(String id, String kind) {
        return Block.builder().id(id).kind(kind).build();
    }

    private static Block loop(String id, List<String> body) {
        return Block.builder().id(id).kind("loop").config(Map.of("loopType", "forEach", "body", body)).build();
    }

    private static Edge edge(String source, String target) {
        return Edge.builder().source(source).target(target).build();
    }

    private List<ValidationError> errorsOf(List<Block> blocks, List<Edge> edges) {
        WorkflowGraphValidationException ex = catchThrowableOfType(
                () -> validator.validate(blocks, edges), WorkflowGraphValidationException.class);
        assertThat(ex).isNotNull();
        return ex.getErrors();
    }

    @Nested
    @DisplayName("valid graph")
    class ValidGraph {

        @Test
        @DisplayName("returns the graph without disabled blocks")
        void dropsDisabled() {
            Block disabled = Block.builder().id("off").kind("function").enabled(false).build();

            WorkflowGraph graph = validator.validate(
                    List.of(block("start", "starter"), block("A", "function"), disabled),
                    List.of(edge("start", "A"), edge("A", "off")));

            assertThat(graph.contains("off")).isFalse();
            assertThat(graph.outgoing("A")).isEmpty();
            assertThat(graph.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("accepts a loop whose body is fed by the loop")
        void loopGraph() {
            WorkflowGraph graph = validator.validate(
                    List.of(block("start", "starter"), loop("each", List.of("body")), block("body", "function"),
                            block("after", "http_request")),
                    List.of(edge("start", "each"), edge("each", "body"), edge("each", "after")));

            assertThat(graph.enclosingLoop("body")).isEqualTo("each");
        }

        @Test
        @DisplayName("does not check the kind of disabled blocks")
        void disabledUnknownKind() {
            Block disabled = Block.builder().id("off").kind("mystery").enabled(false).build();

            WorkflowGraph graph = validator.validate(List.of(block("start", "starter"), disabled), List.of());

            assertThat(graph.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("invalid graph")
    class InvalidGraph {

        @Test
        @DisplayName("fails when there are no blocks")
        void noBlocks() {
            assertThatThrownBy(() -> validator.validate(List.of(), List.of()))
                    .isInstanceOf(WorkflowGraphValidationException.class)
                    .hasMessage("Workflow graph validation failed: 1 error(s)");
        }

        @Test
        @DisplayName("reports duplicate ids and unsupported kinds together")
        void collectsErrors() {
            List<ValidationError> errors = errorsOf(
                    List.of(block("A", "function"), block("A", "function"), block("B", "mystery")),
                    List.of());

            assertThat(errors).extracting(ValidationError::field)
                    .containsExactlyInAnyOrder("blocks[A].id", "blocks[B].kind");
        }

        @Test
        @DisplayName("fails when an edge points at an unknown block")
        void danglingEdge() {
            List<ValidationError> errors = errorsOf(
                    List.of(block("start", "starter")),
                    List.of(Edge.builder().id("e1").source("start").target("ghost").build()));

            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.field()).isEqualTo("edges[e1].target");
                assertThat(e.message()).contains("ghost");
            });
        }

        @Test
        @DisplayName("fails on cycles")
        void cycle() {
            List<ValidationError> errors = errorsOf(
                    List.of(block("start", "starter"), block("A", "function"), block("B", "function")),
                    List.of(edge("start", "A"), edge("A", "B"), edge("B", "A")));

            assertThat(errors).singleElement().satisfies(e -> assertThat(e.message()).contains("cycle", "[A, B]"));
        }

        @Test
        @DisplayName("rejects best-effort decision blocks")
        void bestEffortRouter() {
            Block router = Block.builder().id("r").kind("router").config(Map.of("bestEffort", true)).build();

            List<ValidationError> errors = errorsOf(List.of(router), List.of());

            assertThat(errors).extracting(ValidationError::field).containsExactly("blocks[r].config.bestEffort");
        }

        @Test
        @DisplayName("rejects malformed loops")
        void malformedLoops() {
            Block badType = Block.builder().id("l1").kind("loop")
                    .config(Map.of("loopType", "while", "body", List.of("x"))).build();
            Block emptyBody = Block.builder().id("l2").kind("loop").config(Map.of()).build();

            List<ValidationError> errors = errorsOf(List.of(badType, emptyBody, block("x", "function")), List.of());

            assertThat(errors).extracting(ValidationError::field)
                    .containsExactlyInAnyOrder("blocks[l1].config.loopType", "blocks[l2].config.body");
        }

        @Test
        @DisplayName("rejects nested loops and blocks shared between bodies")
        void nestedLoops() {
            List<ValidationError> errors = errorsOf(
                    List.of(loop("outer", List.of("inner", "x")), loop("inner", List.of("x")), block("x", "function")),
                    List.of());

            assertThat(errors).extracting(ValidationError::message)
                    .anyMatch(m -> m.startsWith("nested loops are not supported"))
                    .anyMatch(m -> m.startsWith("block belongs to the bodies of both"));
        }

        @Test
        @DisplayName("rejects edges leaving a loop body")
        void edgeLeavesBody() {
            List<ValidationError> errors = errorsOf(
                    List.of(block("start", "starter"), loop("each", List.of("body")), block("body", "function"),
                            block("after", "function")),
                    List.of(edge("start", "each"), edge("each", "body"), edge("body", "after")));

            assertThat(errors).singleElement()
                    .satisfies(e -> assertThat(e.message()).startsWith("edge leaves the body of loop each"));
        }
    }
}
