package com.taskgraph.core.expression;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Values visible to an expression: the execution input, results of resolved tasks,
 * and the current with-items element.
 */
public record ExpressionScope(
    JsonNode input,
    Map<String, JsonNode> taskResults,
    JsonNode item,
    Integer index
) {
    public ExpressionScope {
        taskResults = taskResults != null ? Map.copyOf(taskResults) : Map.of();
    }

    public static ExpressionScope of(JsonNode input, Map<String, JsonNode> taskResults) {
        return new ExpressionScope(input, taskResults, null, null);
    }

    public ExpressionScope withItem(JsonNode currentItem, int currentIndex) {
        return new ExpressionScope(input, taskResults, currentItem, currentIndex);
    }
}
