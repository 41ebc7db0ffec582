package com.taskgraph.core.model;

/**
 * Lifecycle states for a workflow execution.
 */
public enum ExecutionStatus {
    /**
     * Tasks are being scheduled and dispatched.
     * Transitions: -> PAUSED, SUCCESS, ERROR, CANCELLED
     */
    RUNNING,

    /**
     * Results are still applied, but newly runnable tasks are held back.
     * Transitions: -> RUNNING, SUCCESS, ERROR, CANCELLED
     */
    PAUSED,

    /**
     * Every leaf task succeeded. Terminal state.
     */
    SUCCESS,

    /**
     * An unhandled task error propagated to the execution. Terminal state.
     */
    ERROR,

    /**
     * Cancelled on request. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == CANCELLED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case RUNNING -> target == PAUSED || target == SUCCESS || target == ERROR || target == CANCELLED;
            case PAUSED -> target == RUNNING || target == SUCCESS || target == ERROR || target == CANCELLED;
            case SUCCESS, ERROR, CANCELLED -> false;
        };
    }
}
