package com.taskgraph.engine.scheduler;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Input to the {@link Scheduler}. Every change to an execution is caused by exactly one event.
 */
public interface EngineEvent {

    /**
     * Activate the entry tasks of a freshly created execution.
     */
    record Start() implements EngineEvent {
    }

    record TaskCompleted(UUID taskExecutionId, int attempt, JsonNode result) implements EngineEvent {
    }

    record TaskFailed(
        UUID taskExecutionId,
        int attempt,
        String errorCode,
        String message,
        boolean retryable
    ) implements EngineEvent {
    }

    record RetryTimerFired(UUID taskExecutionId, int attempt) implements EngineEvent {
    }

    record CancelRequested(String reason) implements EngineEvent {
    }

    record PauseRequested(String reason) implements EngineEvent {
    }

    record ResumeRequested() implements EngineEvent {
    }
}
