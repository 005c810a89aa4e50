package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.exception.MissingEnvironmentVariableException;
import com.blockflow.blockflow_engine.exception.UnresolvedReferenceException;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.context.LoopState;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.Edge;
import com.blockflow.blockflow_engine.model.domain.WorkflowGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InputResolver")
class InputResolverTest {

    private InputResolver resolver;
    private ExecutionContext ctx;

    @BeforeEach
    void setUp() {
        resolver = new InputResolver(new ObjectMapper());

        Block fetch = Block.builder().id("fetch-1").kind("function").name("Fetch Users").build();
        Block loop = Block.builder().id("loop-1").kind("loop")
                .config(Map.of("loopType", "forEach", "body", List.of("inner"))).build();
        Block inner = Block.builder().id("inner").kind("function").build();
        Block consumer = Block.builder().id("consumer").kind("function").build();

        WorkflowGraph graph = WorkflowGraph.of(List.of(fetch, loop, inner, consumer), List.of(
                Edge.builder().source("fetch-1").target("loop-1").build(),
                Edge.builder().source("loop-1").target("inner").build(),
                Edge.builder().source("fetch-1").target("consumer").build()));

        ctx = ExecutionContext.create("wf", "exec", graph, Map.of("API_KEY", "secret"), Map.of());
        ctx.setBlockOutput("fetch-1", Map.of("response", Map.of(
                "users", List.of(Map.of("id", 7), Map.of("id", 8)),
                "count", 2)));
    }

    private Block consumerWith(Map<String, Object> inputs) {
        return Block.builder().id("consumer").kind("function").inputs(inputs).build();
    }

    @Nested
    @DisplayName("block references")
    class BlockReferences {

        @Test
        @DisplayName("a whole-string reference keeps the raw value")
        void rawValue() {
            Map<String, Object> resolved = resolver.resolveInputs(
                    consumerWith(Map.of("users", "<fetch-1.response.users>")), ctx);

            assertThat(resolved.get("users")).isEqualTo(List.of(Map.of("id", 7), Map.of("id", 8)));
        }

        @Test
        @DisplayName("references inside text are interpolated")
        void interpolation() {
            Map<String, Object> resolved = resolver.resolveInputs(
                    consumerWith(Map.of("msg", "found <fetch-1.response.count> users, first <fetch-1.response.users.0.id>")), ctx);

            assertThat(resolved.get("msg")).isEqualTo("found 2 users, first 7");
        }

        @Test
        @DisplayName("maps and lists are JSON-encoded when interpolated")
        void jsonInterpolation() {
            Map<String, Object> resolved = resolver.resolveInputs(
                    consumerWith(Map.of("msg", "users=<fetch-1.response.users>")), ctx);

            assertThat(resolved.get("msg")).isEqualTo("users=[{\"id\":7},{\"id\":8}]");
        }

        @Test
        @DisplayName("blocks can be referenced by their name key")
        void labelKey() {
            Map<String, Object> resolved = resolver.resolveInputs(
                    consumerWith(Map.of("count", "<fetchUsers.response.count>")), ctx);

            assertThat(resolved.get("count")).isEqualTo(2);
        }

        @Test
        @DisplayName("nested maps and lists are walked")
        void nested() {
            Map<String, Object> inputs = new LinkedHashMap<>();
            inputs.put("body", Map.of("ids", List.of("<fetch-1.response.users.1.id>")));
            Map<String, Object> resolved = resolver.resolveInputs(consumerWith(inputs), ctx);

            assertThat(resolved.get("body")).isEqualTo(Map.of("ids", List.of(8)));
        }

        @Test
        @DisplayName("a missing field resolves to null")
        void missingField() {
            Map<String, Object> resolved = resolver.resolveInputs(
                    consumerWith(Map.of("x", "<fetch-1.response.nothing>")), ctx);

            assertThat(resolved).containsEntry("x", null);
        }

        @Test
        @DisplayName("a block without output fails resolution")
        void noOutput() {
            assertThatThrownBy(() -> resolver.resolveInputs(consumerWith(Map.of("x", "<inner.response>")), ctx))
                    .isInstanceOf(UnresolvedReferenceException.class)
                    .hasMessageContaining("<inner.response>");
        }

        @Test
        @DisplayName("an unknown block key fails resolution")
        void unknownBlock() {
            assertThatThrownBy(() -> resolver.resolveInputs(consumerWith(Map.of("x", "<ghost.value>")), ctx))
                    .isInstanceOf(UnresolvedReferenceException.class)
                    .hasMessageContaining("no block with id or name \"ghost\"");
        }

        @Test
        @DisplayName("text without reference markers is left alone")
        void plainText() {
            Map<String, Object> resolved = resolver.resolveInputs(consumerWith(Map.of("x", "a < b", "n", 3)), ctx);

            assertThat(resolved).containsEntry("x", "a < b").containsEntry("n", 3);
        }
    }

    @Nested
    @DisplayName("environment variables")
    class EnvironmentVariables {

        @Test
        @DisplayName("are substituted")
        void substituted() {
            Map<String, Object> resolved = resolver.resolveInputs(
                    consumerWith(Map.of("auth", "Bearer {{API_KEY}}")), ctx);

            assertThat(resolved.get("auth")).isEqualTo("Bearer secret");
        }

        @Test
        @DisplayName("use the default when unset")
        void defaulted() {
            Map<String, Object> resolved = resolver.resolveInputs(
                    consumerWith(Map.of("region", "{{REGION:eu-west-1}}")), ctx);

            assertThat(resolved.get("region")).isEqualTo("eu-west-1");
        }

        @Test
        @DisplayName("fail when unset and without default")
        void missing() {
            assertThatThrownBy(() -> resolver.resolveInputs(consumerWith(Map.of("x", "{{MISSING}}")), ctx))
                    .isInstanceOf(MissingEnvironmentVariableException.class)
                    .hasMessageContaining("MISSING");
        }

        @Test
        @DisplayName("markers inside upstream output are kept as data")
        void upstreamOutputIsNotRescanned() {
            ctx.setBlockOutput("fetch-1", Map.of("text", "Hello {{name}}", "token", "{{API_KEY}}"));

            Map<String, Object> resolved = resolver.resolveInputs(consumerWith(Map.of(
                    "msg", "msg: <fetch-1.text>",
                    "leak", "key=<fetch-1.token> auth={{API_KEY}}")), ctx);

            assertThat(resolved.get("msg")).isEqualTo("msg: Hello {{name}}");
            assertThat(resolved.get("leak")).isEqualTo("key={{API_KEY}} auth=secret");
        }
    }

    @Nested
    @DisplayName("loop references")
    class LoopReferences {

        @Test
        @DisplayName("resolve against the enclosing loop")
        void insideLoop() {
            LoopState state = ctx.loopState("loop-1");
            state.setItems(List.of("a", "b", "c"));
            state.setTotalIterations(3);
            state.setIteration(2);
            ctx.bindLoopIteration("loop-1", 2, "b");

            Block inner = Block.builder().id("inner").kind("function").inputs(Map.of(
                    "item", "<loop.currentItem>",
                    "index", "<loop.index>",
                    "iteration", "<loop.iteration>",
                    "all", "<loop.items>")).build();
            Map<String, Object> resolved = resolver.resolveInputs(inner, ctx);

            assertThat(resolved)
                    .containsEntry("item", "b")
                    .containsEntry("index", 1)
                    .containsEntry("iteration", 2)
                    .containsEntry("all", List.of("a", "b", "c"));
        }

        @Test
        @DisplayName("fail outside a loop body")
        void outsideLoop() {
            assertThatThrownBy(() -> resolver.resolveInputs(consumerWith(Map.of("x", "<loop.index>")), ctx))
                    .isInstanceOf(UnresolvedReferenceException.class)
                    .hasMessageContaining("not inside a loop body");
        }
    }

    @Test
    @DisplayName("code fragments are joined")
    void codeFragments() {
        Map<String, Object> resolved = resolver.resolveInputs(consumerWith(Map.of("code",
                List.of(Map.of("content", "const n = <fetch-1.response.count>;"), "return n;"))), ctx);

        assertThat(resolved.get("code")).isEqualTo("const n = 2;\nreturn n;");
    }
}
