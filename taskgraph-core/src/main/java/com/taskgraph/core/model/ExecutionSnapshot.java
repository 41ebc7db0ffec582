package com.taskgraph.core.model;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Consistent read of one execution and all of its task executions,
 * taken for a read-modify-write cycle.
 */
public record ExecutionSnapshot(Execution execution, List<TaskExecution> taskExecutions) {

    public ExecutionSnapshot {
        taskExecutions = taskExecutions != null ? List.copyOf(taskExecutions) : List.of();
    }

    public Optional<TaskExecution> findTask(UUID taskExecutionId) {
        return taskExecutions.stream()
            .filter(t -> t.id().equals(taskExecutionId))
            .findFirst();
    }
}
