package com.taskgraph.core.graph;

import com.taskgraph.core.model.Outcome;
import com.taskgraph.core.model.RetryPolicy;
import com.taskgraph.core.model.TaskSpec;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated, index-backed view of a workflow definition.
 * Immutable and safe to share between threads; built by {@link GraphCompiler}.
 */
public final class CompiledGraph {

    private final WorkflowDefinition definition;
    private final Map<String, TaskSpec> tasks;
    private final Map<String, Integer> order;
    private final Map<String, Map<Outcome, List<String>>> outgoing;
    private final Map<String, Set<String>> predecessors;
    private final List<String> entryTasks;

    CompiledGraph(
            WorkflowDefinition definition,
            Map<String, TaskSpec> tasks,
            Map<String, Integer> order,
            Map<String, Map<Outcome, List<String>>> outgoing,
            Map<String, Set<String>> predecessors,
            List<String> entryTasks) {
        this.definition = definition;
        this.tasks = tasks;
        this.order = order;
        this.outgoing = outgoing;
        this.predecessors = predecessors;
        this.entryTasks = entryTasks;
    }

    public WorkflowDefinition definition() {
        return definition;
    }

    public TaskSpec task(String taskName) {
        TaskSpec spec = tasks.get(taskName);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown task: " + taskName);
        }
        return spec;
    }

    public Collection<TaskSpec> tasks() {
        return tasks.values();
    }

    /**
     * Tasks started when an execution starts, in definition order.
     */
    public List<String> entryTasks() {
        return entryTasks;
    }

    /**
     * Position of the task in the definition; used as the scheduling tie-break.
     */
    public int order(String taskName) {
        Integer position = order.get(taskName);
        return position != null ? position : Integer.MAX_VALUE;
    }

    /**
     * Distinct tasks with a transition into the given task.
     */
    public Set<String> predecessors(String taskName) {
        return predecessors.getOrDefault(taskName, Set.of());
    }

    /**
     * Targets of the given task for exactly this outcome, deduplicated, in definition order.
     */
    public List<String> successors(String taskName, Outcome outcome) {
        return outgoing.getOrDefault(taskName, Map.of()).getOrDefault(outcome, List.of());
    }

    /**
     * Tasks to activate once the given task resolves with the given status:
     * the outcome-specific successors plus the on-complete ones.
     */
    public List<String> next(String taskName, TaskStatus status) {
        Set<String> targets = new LinkedHashSet<>();
        if (status == TaskStatus.SUCCESS) {
            targets.addAll(successors(taskName, Outcome.ON_SUCCESS));
        } else if (status == TaskStatus.ERROR) {
            targets.addAll(successors(taskName, Outcome.ON_ERROR));
        }
        if (status.isTerminal()) {
            targets.addAll(successors(taskName, Outcome.ON_COMPLETE));
        }
        List<String> ordered = new ArrayList<>(targets);
        ordered.sort(Comparator.comparingInt(this::order));
        return ordered;
    }

    /**
     * True when an error of the task is routed somewhere instead of failing the execution.
     */
    public boolean hasErrorHandler(String taskName) {
        return !successors(taskName, Outcome.ON_ERROR).isEmpty();
    }

    public RetryPolicy retryPolicy(String taskName) {
        return task(taskName).effectiveRetryPolicy(definition.defaultRetryPolicy());
    }
}
