package com.taskgraph.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.message.RunRequest;

import java.util.UUID;

/**
 * Context provided to actions during one attempt.
 */
public class ActionContext {

    private final RunRequest request;
    private final ObjectMapper objectMapper;

    public ActionContext(RunRequest request, ObjectMapper objectMapper) {
        this.request = request;
        this.objectMapper = objectMapper;
    }

    public JsonNode getInput() {
        return request.input();
    }

    /**
     * Get the input bound to a specific type.
     */
    public <T> T getInput(Class<T> type) {
        return objectMapper.convertValue(request.input(), type);
    }

    public UUID getExecutionId() {
        return request.executionId();
    }

    public String getTaskName() {
        return request.taskName();
    }

    public int getAttempt() {
        return request.attempt();
    }

    /**
     * Key that stays the same when this attempt is redelivered.
     * Pass it to external systems to make side effects idempotent.
     */
    public String getIdempotencyKey() {
        return request.taskExecutionId() + ":" + request.nonce();
    }

    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}
