package com.taskgraph.core.graph;

import com.taskgraph.core.exception.DefinitionException;
import com.taskgraph.core.model.JoinPolicy;
import com.taskgraph.core.model.Outcome;
import com.taskgraph.core.model.TaskSpec;
import com.taskgraph.core.model.TransitionSpec;
import com.taskgraph.core.model.WorkflowDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Validates a workflow definition and builds its {@link CompiledGraph}.
 *
 * Rejects:
 * - blank or duplicate task names, tasks without an action
 * - transitions to or from unknown tasks
 * - cycles that pass through no looping task (maxIterations > 1)
 * - joins that can never be satisfied
 * - an empty start set
 */
public class GraphCompiler {

    public CompiledGraph load(WorkflowDefinition definition) {
        if (definition == null || definition.name() == null || definition.name().isBlank()) {
            throw new DefinitionException("Workflow definition must have a name");
        }
        String workflow = definition.name();
        if (definition.tasks().isEmpty()) {
            throw new DefinitionException(workflow, "no tasks defined");
        }

        Map<String, TaskSpec> tasks = indexTasks(workflow, definition.tasks());
        Map<String, Integer> order = new HashMap<>();
        int position = 0;
        for (String name : tasks.keySet()) {
            order.put(name, position++);
        }

        Map<String, Map<Outcome, List<String>>> outgoing = new HashMap<>();
        Map<String, Set<String>> predecessors = new HashMap<>();
        for (TransitionSpec transition : definition.transitions()) {
            checkTaskExists(workflow, tasks, transition.from(), "transition source");
            checkTaskExists(workflow, tasks, transition.to(), "transition target");

            List<String> targets = outgoing
                .computeIfAbsent(transition.from(), k -> new EnumMap<>(Outcome.class))
                .computeIfAbsent(transition.on(), k -> new ArrayList<>());
            if (!targets.contains(transition.to())) {
                targets.add(transition.to());
            }
            predecessors.computeIfAbsent(transition.to(), k -> new LinkedHashSet<>()).add(transition.from());
        }

        // Freeze successor lists in definition order
        Map<String, Map<Outcome, List<String>>> frozenOutgoing = new HashMap<>();
        outgoing.forEach((from, byOutcome) -> {
            Map<Outcome, List<String>> frozen = new EnumMap<>(Outcome.class);
            byOutcome.forEach((outcome, targets) -> {
                List<String> sorted = new ArrayList<>(targets);
                sorted.sort(Comparator.comparingInt(order::get));
                frozen.put(outcome, List.copyOf(sorted));
            });
            frozenOutgoing.put(from, Collections.unmodifiableMap(frozen));
        });
        Map<String, Set<String>> frozenPredecessors = new HashMap<>();
        predecessors.forEach((to, from) -> frozenPredecessors.put(to, Collections.unmodifiableSet(from)));

        checkCycles(workflow, tasks, definition.transitions());
        for (TaskSpec task : tasks.values()) {
            checkJoin(workflow, task, frozenPredecessors.getOrDefault(task.name(), Set.of()));
        }

        List<String> entryTasks = findEntryTasks(tasks, frozenPredecessors);
        if (entryTasks.isEmpty()) {
            throw new DefinitionException(workflow, "no start task: every task has an incoming transition");
        }

        return new CompiledGraph(
            definition,
            Collections.unmodifiableMap(tasks),
            Collections.unmodifiableMap(order),
            Collections.unmodifiableMap(frozenOutgoing),
            Collections.unmodifiableMap(frozenPredecessors),
            List.copyOf(entryTasks)
        );
    }

    // ========== Validation ==========

    private Map<String, TaskSpec> indexTasks(String workflow, List<TaskSpec> specs) {
        Map<String, TaskSpec> tasks = new LinkedHashMap<>();
        for (TaskSpec spec : specs) {
            if (spec.name() == null || spec.name().isBlank()) {
                throw new DefinitionException(workflow, "task with blank name");
            }
            if (spec.action() == null || spec.action().isBlank()) {
                throw new DefinitionException(workflow, "task '" + spec.name() + "' has no action");
            }
            if (tasks.putIfAbsent(spec.name(), spec) != null) {
                throw new DefinitionException(workflow, "duplicate task '" + spec.name() + "'");
            }
        }
        return tasks;
    }

    private void checkTaskExists(String workflow, Map<String, TaskSpec> tasks, String name, String role) {
        if (name == null || !tasks.containsKey(name)) {
            throw new DefinitionException(workflow, role + " references unknown task '" + name + "'");
        }
    }

    /**
     * Kahn's algorithm over the graph without the edges into looping tasks.
     * Whatever cannot be sorted sits on a cycle no loop bound protects.
     */
    private void checkCycles(String workflow, Map<String, TaskSpec> tasks, List<TransitionSpec> transitions) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, Set<String>> edges = new HashMap<>();
        tasks.keySet().forEach(name -> inDegree.put(name, 0));

        for (TransitionSpec transition : transitions) {
            if (tasks.get(transition.to()).loops()) {
                continue;
            }
            if (edges.computeIfAbsent(transition.from(), k -> new LinkedHashSet<>()).add(transition.to())) {
                inDegree.merge(transition.to(), 1, Integer::sum);
            }
        }

        Queue<String> queue = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                queue.offer(name);
            }
        });

        int sorted = 0;
        while (!queue.isEmpty()) {
            String current = queue.poll();
            sorted++;
            for (String dependent : edges.getOrDefault(current, Set.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.offer(dependent);
                }
            }
        }

        if (sorted != tasks.size()) {
            List<String> remaining = new ArrayList<>();
            inDegree.forEach((name, degree) -> {
                if (degree > 0) {
                    remaining.add(name);
                }
            });
            throw new DefinitionException(workflow,
                "cycle without a loop bound among tasks " + remaining);
        }
    }

    private void checkJoin(String workflow, TaskSpec task, Set<String> predecessors) {
        JoinPolicy join = task.join();
        switch (join.kind()) {
            case ALL -> {
                if (predecessors.isEmpty()) {
                    throw new DefinitionException(workflow,
                        "task '" + task.name() + "' joins all inputs but has no incoming transition");
                }
            }
            case COUNT -> {
                if (join.count() < 1 || join.count() > predecessors.size()) {
                    throw new DefinitionException(workflow, String.format(
                        "task '%s' joins %d inputs but has %d incoming tasks",
                        task.name(), join.count(), predecessors.size()));
                }
            }
            case NONE, ONE -> { }
        }

        if (task.itemsJoin() != null && !task.fansOut()) {
            throw new DefinitionException(workflow,
                "task '" + task.name() + "' has an items join but no with-items expression");
        }
        JoinPolicy itemsJoin = task.effectiveItemsJoin();
        if (itemsJoin.kind() == JoinPolicy.Kind.COUNT && itemsJoin.count() < 1) {
            throw new DefinitionException(workflow,
                "task '" + task.name() + "' has an items join count below 1");
        }
    }

    private List<String> findEntryTasks(Map<String, TaskSpec> tasks, Map<String, Set<String>> predecessors) {
        List<String> flagged = tasks.values().stream()
            .filter(TaskSpec::entryPoint)
            .map(TaskSpec::name)
            .toList();
        if (!flagged.isEmpty()) {
            return flagged;
        }
        return tasks.keySet().stream()
            .filter(name -> predecessors.getOrDefault(name, Set.of()).isEmpty())
            .toList();
    }
}
