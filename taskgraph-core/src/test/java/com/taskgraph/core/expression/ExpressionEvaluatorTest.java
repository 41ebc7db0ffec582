package com.taskgraph.core.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.taskgraph.core.exception.ExpressionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private ExpressionScope scope;

    @BeforeEach
    void setUp() throws Exception {
        JsonNode input = mapper.readTree("{\"orderId\": 42, \"items\": [\"a\", \"b\"]}");
        JsonNode fetched = mapper.readTree("{\"body\": {\"total\": 10}}");
        scope = ExpressionScope.of(input, Map.of("fetch", fetched));
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void resolve_nullTemplate_shouldPassExecutionInput() {
        assertThat(evaluator.resolve(null, scope)).isEqualTo(scope.input());
    }

    @Test
    void resolve_nestedTemplate_shouldReplaceReferences() throws Exception {
        JsonNode resolved = evaluator.resolve(
            json("{\"id\": \"$input/orderId\", \"total\": \"$task.fetch/body/total\", \"tags\": [\"$input/items/1\", 7]}"),
            scope);

        assertThat(resolved).isEqualTo(json("{\"id\": 42, \"total\": 10, \"tags\": [\"b\", 7]}"));
    }

    @Test
    void resolve_literalsAndEscapes_shouldStayText() throws Exception {
        JsonNode resolved = evaluator.resolve(json("{\"plain\": \"hello\", \"price\": \"$$5\"}"), scope);

        assertThat(resolved.get("plain").asText()).isEqualTo("hello");
        assertThat(resolved.get("price").asText()).isEqualTo("$5");
    }

    @Test
    void resolve_missingPath_shouldResolveToNull() throws Exception {
        JsonNode resolved = evaluator.resolve(json("{\"x\": \"$input/nothing/here\"}"), scope);

        assertThat(resolved.get("x").isNull()).isTrue();
    }

    @Test
    void resolve_itemAndIndex_shouldUseWithItemsScope() throws Exception {
        ExpressionScope itemScope = scope.withItem(json("{\"id\": \"x1\"}"), 3);

        JsonNode resolved = evaluator.resolve(json("{\"id\": \"$item/id\", \"position\": \"$index\"}"), itemScope);

        assertThat(resolved).isEqualTo(json("{\"id\": \"x1\", \"position\": 3}"));
    }

    @Test
    void resolve_itemOutsideWithItems_shouldFail() throws Exception {
        JsonNode template = json("\"$item\"");

        assertThatThrownBy(() -> evaluator.resolve(template, scope))
            .isInstanceOf(ExpressionException.class)
            .hasMessageContaining("with-items");
    }

    @Test
    void resolve_unresolvedTask_shouldFail() throws Exception {
        JsonNode template = json("\"$task.store\"");

        assertThatThrownBy(() -> evaluator.resolve(template, scope))
            .isInstanceOf(ExpressionException.class)
            .hasMessageContaining("store");
    }

    @Test
    void resolve_unknownRoot_shouldFail() throws Exception {
        JsonNode template = json("\"$env/HOME\"");

        assertThatThrownBy(() -> evaluator.resolve(template, scope))
            .isInstanceOf(ExpressionException.class)
            .hasMessageContaining("unknown reference");
    }

    @Test
    void resolveItems_shouldReturnArray() {
        ArrayNode items = evaluator.resolveItems("$input/items", scope);

        assertThat(items).hasSize(2);
        assertThat(items.get(0).asText()).isEqualTo("a");
    }

    @Test
    void resolveItems_nonArray_shouldFail() {
        assertThatThrownBy(() -> evaluator.resolveItems("$input/orderId", scope))
            .isInstanceOf(ExpressionException.class)
            .hasMessageContaining("array");
    }
}
