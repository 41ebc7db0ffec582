package com.taskgraph.core.model;

/**
 * Lifecycle states for a task execution.
 *
 * Status is monotonic. The only revisit is RUNNING -> DELAYED -> RUNNING while retrying.
 */
public enum TaskStatus {
    /**
     * Created, but the join is not satisfied yet (or the execution is paused).
     * Transitions: -> RUNNING, SUCCESS (empty fan-out), ERROR
     */
    WAITING,

    /**
     * Dispatched to an action executor, awaiting its result.
     * Transitions: -> DELAYED, SUCCESS, ERROR
     */
    RUNNING,

    /**
     * Failed with attempts remaining; waiting for the retry timer.
     * Transitions: -> RUNNING, ERROR
     */
    DELAYED,

    /**
     * Completed successfully. Terminal state.
     */
    SUCCESS,

    /**
     * Failed permanently, timed out, cancelled or never joined. Terminal state.
     */
    ERROR;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR;
    }

    /**
     * Check if the task still occupies the execution (blocks completion).
     */
    public boolean isActive() {
        return this == RUNNING || this == DELAYED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case WAITING -> target == RUNNING || target == SUCCESS || target == ERROR;
            case RUNNING -> target == DELAYED || target == SUCCESS || target == ERROR;
            case DELAYED -> target == RUNNING || target == ERROR;
            case SUCCESS, ERROR -> false;
        };
    }
}
