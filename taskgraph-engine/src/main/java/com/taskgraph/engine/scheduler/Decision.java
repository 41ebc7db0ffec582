package com.taskgraph.engine.scheduler;

import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.TaskExecution;

import java.util.List;

/**
 * Outcome of applying one event to an execution snapshot.
 *
 * @param execution the execution with its version already incremented
 * @param changed task executions to write in the same commit
 * @param dispatches run requests to send after the commit succeeded, in dispatch order
 * @param staleReason set when the event no longer applies; nothing is committed then
 */
public record Decision(
    Execution execution,
    List<TaskExecution> changed,
    List<DispatchOrder> dispatches,
    String staleReason
) {
    public Decision {
        changed = changed != null ? List.copyOf(changed) : List.of();
        dispatches = dispatches != null ? List.copyOf(dispatches) : List.of();
    }

    public static Decision stale(Execution execution, String reason) {
        return new Decision(execution, List.of(), List.of(), reason);
    }

    public boolean isStale() {
        return staleReason != null;
    }
}
