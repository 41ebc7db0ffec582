package com.taskgraph.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Returns its input unchanged. Useful for wiring checks and passing data between tasks.
 */
public class EchoAction implements Action {

    public static final String NAME = "echo";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JsonNode invoke(ActionContext context) {
        return context.getInput();
    }
}
