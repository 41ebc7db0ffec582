package com.taskgraph.core.exception;

/**
 * Thrown when a workflow definition is rejected at registration.
 */
public class DefinitionException extends TaskGraphException {

    public static final String ERROR_CODE = "INVALID_DEFINITION";

    public DefinitionException(String message) {
        super(ERROR_CODE, message);
    }

    public DefinitionException(String workflow, String reason) {
        super(ERROR_CODE, String.format("Invalid workflow definition %s: %s", workflow, reason));
    }
}
