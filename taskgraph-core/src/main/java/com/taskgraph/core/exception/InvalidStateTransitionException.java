package com.taskgraph.core.exception;

import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.TaskStatus;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends TaskGraphException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(ExecutionStatus currentStatus, ExecutionStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition execution from %s to %s",
            currentStatus, targetStatus
        ));
    }

    public InvalidStateTransitionException(TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition task execution from %s to %s",
            currentStatus, targetStatus
        ));
    }

    public InvalidStateTransitionException(String message) {
        super(ERROR_CODE, message);
    }
}
