package com.taskgraph.core.message;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Request to an action executor to run one attempt of a task execution.
 * The nonce identifies the attempt; redeliveries carry the same nonce.
 */
public record RunRequest(
    UUID taskExecutionId,
    UUID executionId,
    String taskName,
    String action,
    JsonNode input,
    int attempt,
    UUID nonce
) {
}
