package com.taskgraph.core.expression;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.taskgraph.core.exception.ExpressionException;

import java.util.Iterator;
import java.util.Map;

/**
 * Resolves task input templates and with-items expressions.
 *
 * A template is any JSON value. String values starting with {@code $} are references:
 * <ul>
 *   <li>{@code $input} or {@code $input/a/b}: the execution input</li>
 *   <li>{@code $task.fetch} or {@code $task.fetch/body}: result of a resolved task</li>
 *   <li>{@code $item}, {@code $item/id}: the current with-items element</li>
 *   <li>{@code $index}: the current with-items index</li>
 * </ul>
 * {@code $$} at the start escapes a literal dollar sign. Paths are JSON pointers;
 * a missing path resolves to null. A null template resolves to the execution input.
 */
public class ExpressionEvaluator {

    private static final String INPUT = "input";
    private static final String TASK_PREFIX = "task.";
    private static final String ITEM = "item";
    private static final String INDEX = "index";

    /**
     * Resolve every reference inside the template.
     *
     * @throws ExpressionException if a reference is unknown or not available in the scope
     */
    public JsonNode resolve(JsonNode template, ExpressionScope scope) {
        if (template == null || template.isNull() || template.isMissingNode()) {
            return orNull(scope.input());
        }
        return resolveNode(template, scope);
    }

    /**
     * Resolve a with-items expression; the result must be an array.
     */
    public ArrayNode resolveItems(String expression, ExpressionScope scope) {
        JsonNode items = resolveReference(expression.trim(), scope);
        if (!items.isArray()) {
            throw new ExpressionException(expression,
                "with-items must resolve to an array, got " + items.getNodeType());
        }
        return (ArrayNode) items;
    }

    // ========== Internal Methods ==========

    private JsonNode resolveNode(JsonNode node, ExpressionScope scope) {
        if (node.isTextual()) {
            return resolveText(node.textValue(), scope);
        }
        if (node.isObject()) {
            ObjectNode resolved = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                resolved.set(field.getKey(), resolveNode(field.getValue(), scope));
            }
            return resolved;
        }
        if (node.isArray()) {
            ArrayNode resolved = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                resolved.add(resolveNode(element, scope));
            }
            return resolved;
        }
        return node;
    }

    private JsonNode resolveText(String text, ExpressionScope scope) {
        if (text.startsWith("$$")) {
            return TextNode.valueOf(text.substring(1));
        }
        if (text.startsWith("$")) {
            return resolveReference(text, scope);
        }
        return TextNode.valueOf(text);
    }

    private JsonNode resolveReference(String expression, ExpressionScope scope) {
        if (!expression.startsWith("$") || expression.length() < 2) {
            throw new ExpressionException(expression, "expected a reference starting with '$'");
        }
        String body = expression.substring(1);
        int slash = body.indexOf('/');
        String root = slash < 0 ? body : body.substring(0, slash);
        String pointer = slash < 0 ? "" : body.substring(slash);

        JsonNode base;
        if (INPUT.equals(root)) {
            base = orNull(scope.input());
        } else if (root.startsWith(TASK_PREFIX)) {
            String taskName = root.substring(TASK_PREFIX.length());
            base = scope.taskResults().get(taskName);
            if (base == null) {
                throw new ExpressionException(expression, "task '" + taskName + "' has no result yet");
            }
        } else if (ITEM.equals(root)) {
            if (scope.index() == null) {
                throw new ExpressionException(expression, "$item is only available in with-items tasks");
            }
            base = orNull(scope.item());
        } else if (INDEX.equals(root)) {
            if (scope.index() == null) {
                throw new ExpressionException(expression, "$index is only available in with-items tasks");
            }
            base = IntNode.valueOf(scope.index());
        } else {
            throw new ExpressionException(expression, "unknown reference '" + root + "'");
        }
        return at(base, pointer, expression);
    }

    private JsonNode at(JsonNode base, String pointer, String expression) {
        if (pointer.isEmpty()) {
            return base;
        }
        try {
            JsonNode found = base.at(JsonPointer.compile(pointer));
            return found.isMissingNode() ? NullNode.getInstance() : found;
        } catch (IllegalArgumentException e) {
            throw new ExpressionException(expression, "invalid path '" + pointer + "'");
        }
    }

    private static JsonNode orNull(JsonNode node) {
        return node != null ? node : NullNode.getInstance();
    }
}
