package com.taskgraph.core.exception;

/**
 * Thrown when a task input or with-items expression cannot be resolved.
 */
public class ExpressionException extends TaskGraphException {

    public static final String ERROR_CODE = "EXPRESSION_ERROR";

    public ExpressionException(String expression, String reason) {
        super(ERROR_CODE, String.format("Cannot resolve '%s': %s", expression, reason));
    }
}
