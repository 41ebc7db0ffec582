package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * A single run of a WorkflowDefinition.
 * Primary source of truth for execution state.
 *
 * Primary Key: id
 *
 * Invariants:
 * - status transitions follow {@link ExecutionStatus#canTransitionTo}
 * - version increases by exactly one per committed decision
 * - output is set iff status is terminal
 * - errorTask is the first unhandled task error, never overwritten
 */
public record Execution(
    UUID id,

    // Definition
    String definitionName,
    int definitionVersion,

    // Data
    JsonNode input,
    ExecutionStatus status,
    JsonNode output,

    // Originating unhandled error
    String errorTask,
    String errorCode,
    String errorMessage,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant updatedAt,
    Instant completedAt,

    // Optimistic locking
    long version
) {
    /**
     * Create a new execution, RUNNING but not started yet.
     */
    public static Execution create(DefinitionId definitionId, JsonNode input, Instant now) {
        return new Execution(
            UUID.randomUUID(),
            definitionId.name(),
            definitionId.version(),
            input,
            ExecutionStatus.RUNNING,
            null,
            null,
            null,
            null,
            now,
            null,
            now,
            null,
            0L
        );
    }

    public DefinitionId definitionId() {
        return new DefinitionId(definitionName, definitionVersion);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isStarted() {
        return startedAt != null;
    }

    public boolean hasUnhandledError() {
        return errorTask != null;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final UUID id;
        private final String definitionName;
        private final int definitionVersion;
        private final JsonNode input;
        private ExecutionStatus status;
        private JsonNode output;
        private String errorTask;
        private String errorCode;
        private String errorMessage;
        private final Instant createdAt;
        private Instant startedAt;
        private Instant updatedAt;
        private Instant completedAt;
        private long version;

        public Builder(Execution execution) {
            this.id = execution.id();
            this.definitionName = execution.definitionName();
            this.definitionVersion = execution.definitionVersion();
            this.input = execution.input();
            this.status = execution.status();
            this.output = execution.output();
            this.errorTask = execution.errorTask();
            this.errorCode = execution.errorCode();
            this.errorMessage = execution.errorMessage();
            this.createdAt = execution.createdAt();
            this.startedAt = execution.startedAt();
            this.updatedAt = execution.updatedAt();
            this.completedAt = execution.completedAt();
            this.version = execution.version();
        }

        public ExecutionStatus status() {
            return status;
        }

        public String errorTask() {
            return errorTask;
        }

        public Instant startedAt() {
            return startedAt;
        }

        public String errorCode() {
            return errorCode;
        }

        public String errorMessage() {
            return errorMessage;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder output(JsonNode output) {
            this.output = output;
            return this;
        }

        public Builder error(String task, String code, String message) {
            this.errorTask = task;
            this.errorCode = code;
            this.errorMessage = message;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder incrementVersion() {
            this.version++;
            return this;
        }

        public Execution build() {
            return new Execution(
                id, definitionName, definitionVersion, input, status, output,
                errorTask, errorCode, errorMessage,
                createdAt, startedAt, updatedAt, completedAt, version
            );
        }
    }
}
