package com.taskgraph.core.model;

/**
 * Condition under which a transition fires.
 */
public enum Outcome {
    ON_SUCCESS,
    ON_ERROR,
    ON_COMPLETE;

    /**
     * Check if a transition with this condition fires for a resolved task status.
     */
    public boolean matches(TaskStatus status) {
        return switch (this) {
            case ON_SUCCESS -> status == TaskStatus.SUCCESS;
            case ON_ERROR -> status == TaskStatus.ERROR;
            case ON_COMPLETE -> status.isTerminal();
        };
    }
}
