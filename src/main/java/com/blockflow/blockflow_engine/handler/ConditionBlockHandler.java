package com.blockflow.blockflow_engine.handler;

import com.blockflow.blockflow_engine.exception.WorkflowExecutionException;
import com.blockflow.blockflow_engine.model.context.ExecutionContext;
import com.blockflow.blockflow_engine.model.domain.Block;
import com.blockflow.blockflow_engine.model.domain.BlockType;
import com.blockflow.blockflow_engine.model.domain.Edge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes condition blocks: the first condition whose expression holds selects its branch.
 *
 * Inputs:
 * {
 *   "conditions": [
 *     { "id": "vip",     "expression": "<starter.input.total> > 500" },
 *     { "id": "regular", "expression": "<starter.input.total> > 0" },
 *     { "id": "else" }                                   // no expression: taken when nothing matched
 *   ]
 * }
 * The list may also arrive as a JSON string. Outgoing edges carry the condition id as branch.
 *
 * Output: { selectedBranch, conditionResult, selectedConditionId, selectedPath }
 */
@Slf4j
@Component
@Order(30)
@RequiredArgsConstructor
public class ConditionBlockHandler extends DecisionBlockHandler {

    private final ConditionEvaluator evaluator;
    private final ObjectMapper objectMapper;

    @Override
    public boolean canHandle(Block block) {
        return block.getType() == BlockType.CONDITION;
    }

    @Override
    public CompletableFuture<Map<String, Object>> execute(Block block, Map<String, Object> inputs, ExecutionContext ctx) {
        List<Map<String, Object>> conditions;
        try {
            conditions = readConditions(inputs.get("conditions"));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new WorkflowExecutionException(block.getId(),
                    "Condition block " + block.getId() + " has malformed conditions: " + e.getMessage(), e));
        }

        String selected = null;
        boolean matched = false;
        String elseBranch = null;

        for (Map<String, Object> condition : conditions) {
            String id = condition.get("id") != null ? condition.get("id").toString() : null;
            Object expression = condition.get("expression");
            if (id == null) continue;

            if (expression == null || expression.toString().isBlank()) {
                if (elseBranch == null) elseBranch = id;
                continue;
            }
            boolean holds = expression instanceof Boolean b ? b : evaluator.evaluate(expression.toString());
            log.debug("Condition {} of block {}: '{}' -> {}", id, block.getId(), expression, holds);
            if (holds) {
                selected = id;
                matched = true;
                break;
            }
        }

        if (selected == null) selected = elseBranch;
        if (selected == null) {
            return CompletableFuture.failedFuture(new WorkflowExecutionException(block.getId(),
                    "No condition of block " + block.getId() + " matched and it has no else branch"));
        }

        Edge edge = findEdge(block, selected, ctx);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put(SELECTED_BRANCH, selected);
        output.put("conditionResult", matched);
        output.put("selectedConditionId", selected);
        output.put("selectedPath", selectedPath(edge, ctx));
        return CompletableFuture.completedFuture(output);
    }

    private List<Map<String, Object>> readConditions(Object raw) throws JsonProcessingException {
        if (raw == null) return List.of();
        if (raw instanceof String s) {
            if (s.isBlank()) return List.of();
            return objectMapper.readValue(s, new TypeReference<List<Map<String, Object>>>() {});
        }
        return objectMapper.convertValue(raw, new TypeReference<List<Map<String, Object>>>() {});
    }
}
