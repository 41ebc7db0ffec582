package com.taskgraph.core.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Result of one attempt, reported by an action executor.
 */
public record TaskCompletionMessage(
    UUID taskExecutionId,
    UUID executionId,
    int attempt,
    UUID nonce,
    Status status,
    JsonNode result,
    String errorCode,
    String error,
    boolean retryable
) implements ChannelMessage {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    public static TaskCompletionMessage success(RunRequest request, JsonNode result) {
        return new TaskCompletionMessage(
            request.taskExecutionId(), request.executionId(), request.attempt(), request.nonce(),
            Status.SUCCESS, result, null, null, false
        );
    }

    public static TaskCompletionMessage failure(RunRequest request, String errorCode, String error, boolean retryable) {
        return new TaskCompletionMessage(
            request.taskExecutionId(), request.executionId(), request.attempt(), request.nonce(),
            Status.FAILURE, null, errorCode, error, retryable
        );
    }
}
