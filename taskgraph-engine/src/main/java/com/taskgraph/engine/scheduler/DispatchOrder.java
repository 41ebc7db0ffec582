package com.taskgraph.engine.scheduler;

import com.taskgraph.core.model.TaskExecution;

/**
 * A RUNNING task execution to hand to the dispatcher once its decision is committed.
 */
public record DispatchOrder(TaskExecution taskExecution, String action) {
}
