package com.taskgraph.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable definition of a workflow type.
 * Versioned so that running executions keep the graph they started with.
 *
 * Primary Key: (name, version)
 *
 * Invariants (checked on registration):
 * - every transition references tasks in this definition
 * - every cycle passes through a task with maxIterations > 1
 * - the start set is non-empty
 */
public record WorkflowDefinition(
    String name,
    int version,
    List<TaskSpec> tasks,
    List<TransitionSpec> transitions,
    RetryPolicy defaultRetryPolicy,
    String description,
    Instant createdAt
) {
    public WorkflowDefinition {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
        defaultRetryPolicy = defaultRetryPolicy != null ? defaultRetryPolicy : RetryPolicy.defaultPolicy();
    }

    public DefinitionId id() {
        return new DefinitionId(name, version);
    }

    public Optional<TaskSpec> findTask(String taskName) {
        return tasks.stream()
            .filter(t -> t.name().equals(taskName))
            .findFirst();
    }

    /**
     * Copy with the version assigned at registration.
     */
    public WorkflowDefinition withVersion(int newVersion, Instant registeredAt) {
        return new WorkflowDefinition(
            name, newVersion, tasks, transitions, defaultRetryPolicy, description, registeredAt
        );
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public static class Builder {
        private String name;
        private int version = 1;
        private final List<TaskSpec> tasks = new ArrayList<>();
        private final List<TransitionSpec> transitions = new ArrayList<>();
        private RetryPolicy defaultRetryPolicy = RetryPolicy.defaultPolicy();
        private String description;
        private Instant createdAt = Instant.now();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder task(TaskSpec task) {
            this.tasks.add(task);
            return this;
        }

        public Builder transition(TransitionSpec transition) {
            this.transitions.add(transition);
            return this;
        }

        public Builder onSuccess(String from, String to) {
            return transition(TransitionSpec.onSuccess(from, to));
        }

        public Builder onError(String from, String to) {
            return transition(TransitionSpec.onError(from, to));
        }

        public Builder onComplete(String from, String to) {
            return transition(TransitionSpec.onComplete(from, to));
        }

        public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
            this.defaultRetryPolicy = defaultRetryPolicy;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(
                name, version, tasks, transitions, defaultRetryPolicy, description, createdAt
            );
        }
    }
}
