package com.taskgraph.core.exception;

/**
 * Thrown when a commit loses the optimistic version check.
 * The loser re-reads the execution and recomputes its decision.
 */
public class ConflictException extends TaskGraphException {

    public static final String ERROR_CODE = "VERSION_CONFLICT";

    public ConflictException(String entityType, String entityId, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Version conflict on %s[%s]: expected version %d, actual version %d",
            entityType, entityId, expectedVersion, actualVersion
        ));
    }
}
