package com.taskgraph.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A unit of work that task executions invoke by name.
 * Implementations must tolerate being invoked more than once for the same attempt.
 */
public interface Action {

    /**
     * Name that task specs refer to in their {@code action} field.
     */
    String name();

    /**
     * Run the action.
     *
     * @param context input and identity of the attempt
     * @return the task result
     * @throws ActionException if the action failed
     */
    JsonNode invoke(ActionContext context) throws ActionException;
}
