package com.taskgraph.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Definition of a task within a workflow: what to run and how its inputs join.
 * Describes the graph node, not instance-specific data.
 *
 * Invariants:
 * - name is non-empty and unique within the workflow
 * - maxIterations >= 1
 * - itemsJoin is only meaningful together with withItems
 */
public record TaskSpec(
    String name,
    String action,

    // JSON template, '$' references resolved against the execution
    JsonNode input,
    RetryPolicy retryPolicy,

    // Incoming edges
    JoinPolicy join,

    // Fan-out
    String withItems,
    JoinPolicy itemsJoin,

    // Bounded re-entry
    int maxIterations,

    // Dispatch-to-result deadline, null for none
    Duration timeout,

    boolean entryPoint
) {
    public TaskSpec {
        join = join != null ? join : JoinPolicy.none();
        maxIterations = Math.max(1, maxIterations);
    }

    /**
     * The with-items sibling policy, ALL unless given.
     */
    public JoinPolicy effectiveItemsJoin() {
        return itemsJoin != null ? itemsJoin : JoinPolicy.all();
    }

    /**
     * Task-specific retry policy, or the workflow default.
     */
    public RetryPolicy effectiveRetryPolicy(RetryPolicy workflowDefault) {
        return retryPolicy != null ? retryPolicy : workflowDefault;
    }

    public boolean fansOut() {
        return withItems != null && !withItems.isBlank();
    }

    public boolean loops() {
        return maxIterations > 1;
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public static class Builder {
        private String name;
        private String action;
        private JsonNode input;
        private RetryPolicy retryPolicy;
        private JoinPolicy join = JoinPolicy.none();
        private String withItems;
        private JoinPolicy itemsJoin;
        private int maxIterations = 1;
        private Duration timeout;
        private boolean entryPoint;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder input(JsonNode input) {
            this.input = input;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder join(JoinPolicy join) {
            this.join = join;
            return this;
        }

        public Builder withItems(String withItems) {
            this.withItems = withItems;
            return this;
        }

        public Builder itemsJoin(JoinPolicy itemsJoin) {
            this.itemsJoin = itemsJoin;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder entryPoint(boolean entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public TaskSpec build() {
            return new TaskSpec(
                name, action, input, retryPolicy, join,
                withItems, itemsJoin, maxIterations, timeout, entryPoint
            );
        }
    }
}
