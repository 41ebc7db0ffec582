package com.taskgraph.core.model;

/**
 * Directed edge between two tasks, taken when the source resolves with a matching outcome.
 */
public record TransitionSpec(String from, String to, Outcome on) {

    public TransitionSpec {
        on = on != null ? on : Outcome.ON_SUCCESS;
    }

    public static TransitionSpec onSuccess(String from, String to) {
        return new TransitionSpec(from, to, Outcome.ON_SUCCESS);
    }

    public static TransitionSpec onError(String from, String to) {
        return new TransitionSpec(from, to, Outcome.ON_ERROR);
    }

    public static TransitionSpec onComplete(String from, String to) {
        return new TransitionSpec(from, to, Outcome.ON_COMPLETE);
    }
}
