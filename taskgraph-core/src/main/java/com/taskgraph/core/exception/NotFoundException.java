package com.taskgraph.core.exception;

/**
 * Thrown when a definition, execution or task execution does not exist.
 */
public class NotFoundException extends TaskGraphException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, Object entityId) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, entityId));
    }
}
