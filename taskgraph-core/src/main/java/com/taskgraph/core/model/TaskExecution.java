package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * One task of an execution, per (task, iteration, with-items index).
 * Retries reuse the same row with an incremented attempt.
 *
 * Primary Key: id
 *
 * Invariants:
 * - status transitions follow {@link TaskStatus#canTransitionTo}
 * - retryAt is set iff status == DELAYED
 * - result is set iff status == SUCCESS
 * - with-items siblings share groupId and iteration, itemIndex is 0..n-1
 * - dispatchNonce changes with every attempt, never within one
 */
public record TaskExecution(
    UUID id,
    UUID executionId,
    String taskName,

    // Position in the graph
    int iteration,
    Integer itemIndex,
    UUID groupId,

    // State
    TaskStatus status,
    int attempt,

    // Data
    JsonNode input,
    JsonNode result,
    String errorCode,
    String errorMessage,

    // Retry
    Instant retryAt,

    // Dispatch bookkeeping
    UUID dispatchNonce,
    Instant dispatchedAt,
    Instant dispatchConfirmedAt,
    int dispatchCount,
    Instant timeoutAt,

    // Join bookkeeping
    Set<String> satisfiedInbound,
    boolean ready,
    boolean transitionsFired,

    Instant createdAt,
    Instant updatedAt
) {
    public TaskExecution {
        satisfiedInbound = satisfiedInbound != null ? Set.copyOf(satisfiedInbound) : Set.of();
    }

    /**
     * Create a new task execution in WAITING state, starting its own sibling group.
     */
    public static TaskExecution waiting(UUID executionId, String taskName, int iteration, Instant now) {
        return new TaskExecution(
            UUID.randomUUID(),
            executionId,
            taskName,
            iteration,
            null,
            UUID.randomUUID(),
            TaskStatus.WAITING,
            0,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            0,
            null,
            Set.of(),
            false,
            false,
            now,
            now
        );
    }

    /**
     * Create a with-items sibling of the given group head.
     */
    public static TaskExecution sibling(TaskExecution head, int itemIndex, Instant now) {
        return new Builder(head)
            .id(UUID.randomUUID())
            .itemIndex(itemIndex)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isDispatchConfirmed() {
        return dispatchConfirmedAt != null;
    }

    /**
     * Check that a result for the given attempt still applies to this row.
     */
    public boolean acceptsResult(int resultAttempt) {
        return status == TaskStatus.RUNNING && attempt == resultAttempt;
    }

    // ========== Transitions ==========

    public TaskExecution withInbound(String predecessor) {
        if (predecessor == null || satisfiedInbound.contains(predecessor)) {
            return this;
        }
        Set<String> inbound = new HashSet<>(satisfiedInbound);
        inbound.add(predecessor);
        return toBuilder().satisfiedInbound(inbound).build();
    }

    public TaskExecution withReady(Instant now) {
        return toBuilder().ready(true).updatedAt(now).build();
    }

    /**
     * Move to RUNNING for the given attempt with a fresh dispatch nonce.
     */
    public TaskExecution toRunning(JsonNode taskInput, int newAttempt, Instant now, Instant deadline) {
        checkTransition(TaskStatus.RUNNING);
        return toBuilder()
            .status(TaskStatus.RUNNING)
            .attempt(newAttempt)
            .input(taskInput)
            .retryAt(null)
            .dispatchNonce(UUID.randomUUID())
            .dispatchedAt(now)
            .dispatchConfirmedAt(null)
            .dispatchCount(1)
            .timeoutAt(deadline)
            .ready(false)
            .updatedAt(now)
            .build();
    }

    public TaskExecution toSuccess(JsonNode taskResult, Instant now) {
        checkTransition(TaskStatus.SUCCESS);
        return toBuilder()
            .status(TaskStatus.SUCCESS)
            .result(taskResult)
            .errorCode(null)
            .errorMessage(null)
            .retryAt(null)
            .timeoutAt(null)
            .updatedAt(now)
            .build();
    }

    public TaskExecution toDelayed(String code, String message, Instant retryTime, Instant now) {
        checkTransition(TaskStatus.DELAYED);
        return toBuilder()
            .status(TaskStatus.DELAYED)
            .errorCode(code)
            .errorMessage(message)
            .retryAt(retryTime)
            .timeoutAt(null)
            .updatedAt(now)
            .build();
    }

    public TaskExecution toError(String code, String message, Instant now) {
        checkTransition(TaskStatus.ERROR);
        return toBuilder()
            .status(TaskStatus.ERROR)
            .errorCode(code)
            .errorMessage(message)
            .retryAt(null)
            .timeoutAt(null)
            .ready(false)
            .updatedAt(now)
            .build();
    }

    public TaskExecution withTransitionsFired(Instant now) {
        return toBuilder().transitionsFired(true).updatedAt(now).build();
    }

    private void checkTransition(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(status, target);
        }
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID id;
        private final UUID executionId;
        private final String taskName;
        private final int iteration;
        private Integer itemIndex;
        private final UUID groupId;
        private TaskStatus status;
        private int attempt;
        private JsonNode input;
        private JsonNode result;
        private String errorCode;
        private String errorMessage;
        private Instant retryAt;
        private UUID dispatchNonce;
        private Instant dispatchedAt;
        private Instant dispatchConfirmedAt;
        private int dispatchCount;
        private Instant timeoutAt;
        private Set<String> satisfiedInbound;
        private boolean ready;
        private boolean transitionsFired;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder(TaskExecution task) {
            this.id = task.id();
            this.executionId = task.executionId();
            this.taskName = task.taskName();
            this.iteration = task.iteration();
            this.itemIndex = task.itemIndex();
            this.groupId = task.groupId();
            this.status = task.status();
            this.attempt = task.attempt();
            this.input = task.input();
            this.result = task.result();
            this.errorCode = task.errorCode();
            this.errorMessage = task.errorMessage();
            this.retryAt = task.retryAt();
            this.dispatchNonce = task.dispatchNonce();
            this.dispatchedAt = task.dispatchedAt();
            this.dispatchConfirmedAt = task.dispatchConfirmedAt();
            this.dispatchCount = task.dispatchCount();
            this.timeoutAt = task.timeoutAt();
            this.satisfiedInbound = task.satisfiedInbound();
            this.ready = task.ready();
            this.transitionsFired = task.transitionsFired();
            this.createdAt = task.createdAt();
            this.updatedAt = task.updatedAt();
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder itemIndex(Integer itemIndex) {
            this.itemIndex = itemIndex;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder input(JsonNode input) {
            this.input = input;
            return this;
        }

        public Builder result(JsonNode result) {
            this.result = result;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder retryAt(Instant retryAt) {
            this.retryAt = retryAt;
            return this;
        }

        public Builder dispatchNonce(UUID dispatchNonce) {
            this.dispatchNonce = dispatchNonce;
            return this;
        }

        public Builder dispatchedAt(Instant dispatchedAt) {
            this.dispatchedAt = dispatchedAt;
            return this;
        }

        public Builder dispatchConfirmedAt(Instant dispatchConfirmedAt) {
            this.dispatchConfirmedAt = dispatchConfirmedAt;
            return this;
        }

        public Builder dispatchCount(int dispatchCount) {
            this.dispatchCount = dispatchCount;
            return this;
        }

        public Builder timeoutAt(Instant timeoutAt) {
            this.timeoutAt = timeoutAt;
            return this;
        }

        public Builder satisfiedInbound(Set<String> satisfiedInbound) {
            this.satisfiedInbound = satisfiedInbound;
            return this;
        }

        public Builder ready(boolean ready) {
            this.ready = ready;
            return this;
        }

        public Builder transitionsFired(boolean transitionsFired) {
            this.transitionsFired = transitionsFired;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TaskExecution build() {
            return new TaskExecution(
                id, executionId, taskName, iteration, itemIndex, groupId,
                status, attempt, input, result, errorCode, errorMessage,
                retryAt, dispatchNonce, dispatchedAt, dispatchConfirmedAt, dispatchCount, timeoutAt,
                satisfiedInbound, ready, transitionsFired, createdAt, updatedAt
            );
        }
    }
}
