package com.taskgraph.core.exception;

import java.util.UUID;

/**
 * Thrown when an event no longer matches the state it refers to
 * (duplicate delivery, superseded attempt, already resolved task).
 */
public class StaleEventException extends TaskGraphException {

    public static final String ERROR_CODE = "STALE_EVENT";

    public StaleEventException(UUID taskExecutionId, String reason) {
        super(ERROR_CODE, String.format("Stale event for task execution %s: %s", taskExecutionId, reason));
    }
}
