package com.taskgraph.engine.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.exception.ExpressionException;
import com.taskgraph.core.expression.ExpressionEvaluator;
import com.taskgraph.core.expression.ExpressionScope;
import com.taskgraph.core.graph.CompiledGraph;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionSnapshot;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.JoinPolicy;
import com.taskgraph.core.model.RetryPolicy;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.TaskSpec;
import com.taskgraph.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The execution state machine.
 *
 * Pure logic: given a snapshot, the compiled graph, one event and the current time, it
 * computes the next committed state and the run requests to send afterwards. It never
 * touches the store or the channel, so the same inputs always lead to the same decision
 * (up to generated ids and nonces).
 *
 * Rules:
 * - results only apply to a RUNNING task execution with the same attempt
 * - a failed attempt is retried (DELAYED) while the retry policy allows it
 * - a with-items group resolves according to its items join and fires its transitions once
 * - a successor starts once its join over incoming edges is satisfied
 * - an ERROR without an ON_ERROR transition is an unhandled error of the execution
 * - the execution ends when nothing is WAITING, RUNNING or DELAYED any more
 */
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    public static final String JOIN_UNSATISFIABLE = "JOIN_UNSATISFIABLE";
    public static final String LOOP_LIMIT_EXCEEDED = "LOOP_LIMIT_EXCEEDED";
    public static final String CANCELLED = "CANCELLED";
    public static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";

    private final ExpressionEvaluator evaluator;

    public Scheduler() {
        this(new ExpressionEvaluator());
    }

    public Scheduler(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public Decision apply(ExecutionSnapshot snapshot, CompiledGraph graph, EngineEvent event, Instant now) {
        Execution execution = snapshot.execution();
        if (execution.isTerminal()) {
            return Decision.stale(execution, "execution is " + execution.status());
        }

        Transaction tx = new Transaction(snapshot, graph, now);

        if (event instanceof EngineEvent.Start) {
            if (execution.isStarted()) {
                return Decision.stale(execution, "execution already started");
            }
            tx.start();
        } else if (event instanceof EngineEvent.TaskCompleted completed) {
            TaskExecution task = tx.find(completed.taskExecutionId());
            if (task == null || !task.acceptsResult(completed.attempt())) {
                return Decision.stale(execution, describeMismatch(task, completed.attempt()));
            }
            tx.complete(task, completed.result());
        } else if (event instanceof EngineEvent.TaskFailed failed) {
            TaskExecution task = tx.find(failed.taskExecutionId());
            if (task == null || !task.acceptsResult(failed.attempt())) {
                return Decision.stale(execution, describeMismatch(task, failed.attempt()));
            }
            tx.fail(task, failed.errorCode(), failed.message(), failed.retryable());
        } else if (event instanceof EngineEvent.RetryTimerFired timer) {
            TaskExecution task = tx.find(timer.taskExecutionId());
            if (task == null || task.status() != TaskStatus.DELAYED || task.attempt() != timer.attempt()) {
                return Decision.stale(execution, "no DELAYED task execution for attempt " + timer.attempt());
            }
            if (execution.status() == ExecutionStatus.PAUSED) {
                return Decision.stale(execution, "execution is paused");
            }
            tx.retry(task);
        } else if (event instanceof EngineEvent.CancelRequested cancel) {
            tx.cancel(cancel.reason());
            return tx.decision();
        } else if (event instanceof EngineEvent.PauseRequested) {
            if (execution.status() != ExecutionStatus.RUNNING) {
                return Decision.stale(execution, "cannot pause a " + execution.status() + " execution");
            }
            tx.pause();
        } else if (event instanceof EngineEvent.ResumeRequested) {
            if (execution.status() != ExecutionStatus.PAUSED) {
                return Decision.stale(execution, "cannot resume a " + execution.status() + " execution");
            }
            tx.resume();
        } else {
            throw new IllegalArgumentException("Unsupported event: " + event);
        }

        tx.finish();
        return tx.decision();
    }

    private static String describeMismatch(TaskExecution task, int attempt) {
        if (task == null) {
            return "unknown task execution";
        }
        return String.format("task execution is %s at attempt %d, result is for attempt %d",
            task.status(), task.attempt(), attempt);
    }

    // ========== Transaction ==========

    /**
     * Mutable working copy of one snapshot while an event is applied.
     */
    private final class Transaction {

        private final CompiledGraph graph;
        private final Instant now;
        private final Execution.Builder execution;
        private final UUID executionId;
        private final JsonNode executionInput;

        // Creation order is kept so that sweeps and tie-breaks are stable
        private final Map<UUID, TaskExecution> tasks = new LinkedHashMap<>();
        private final Set<UUID> changed = new LinkedHashSet<>();
        private final Set<UUID> toDispatch = new LinkedHashSet<>();

        Transaction(ExecutionSnapshot snapshot, CompiledGraph graph, Instant now) {
            this.graph = graph;
            this.now = now;
            this.execution = snapshot.execution().toBuilder();
            this.executionId = snapshot.execution().id();
            this.executionInput = snapshot.execution().input();
            for (TaskExecution task : snapshot.taskExecutions()) {
                tasks.put(task.id(), task);
            }
        }

        TaskExecution find(UUID taskExecutionId) {
            return taskExecutionId != null ? tasks.get(taskExecutionId) : null;
        }

        private void put(TaskExecution task) {
            tasks.put(task.id(), task);
            changed.add(task.id());
        }

        // ========== Events ==========

        void start() {
            execution.startedAt(now);
            for (String entry : graph.entryTasks()) {
                activate(entry, null);
            }
        }

        void complete(TaskExecution task, JsonNode result) {
            TaskExecution done = task.toSuccess(result != null ? result : NullNode.getInstance(), now);
            put(done);
            log.debug("Task {} attempt {} succeeded", task.taskName(), task.attempt());
            tryResolve(done);
        }

        void fail(TaskExecution task, String errorCode, String message, boolean retryable) {
            RetryPolicy policy = graph.retryPolicy(task.taskName());
            if (retryable && policy.allowsRetry(errorCode, task.attempt())) {
                Duration delay = policy.computeDelay(task.attempt());
                put(task.toDelayed(errorCode, message, now.plus(delay), now));
                log.debug("Task {} attempt {} failed with {}, retrying in {}",
                    task.taskName(), task.attempt(), errorCode, delay);
                return;
            }
            TaskExecution failed = task.toError(errorCode, message, now);
            put(failed);
            log.debug("Task {} attempt {} failed with {}, no retry", task.taskName(), task.attempt(), errorCode);
            tryResolve(failed);
        }

        void retry(TaskExecution task) {
            RetryPolicy policy = graph.retryPolicy(task.taskName());
            if (!policy.hasMoreAttempts(task.attempt())) {
                TaskExecution failed = task.toError(
                    task.errorCode() != null ? task.errorCode() : RETRIES_EXHAUSTED, task.errorMessage(), now);
                put(failed);
                tryResolve(failed);
                return;
            }
            run(task, task.input(), task.attempt() + 1);
        }

        void cancel(String reason) {
            for (TaskExecution task : List.copyOf(tasks.values())) {
                if (!task.isTerminal()) {
                    put(task.toError(CANCELLED, reason, now));
                }
            }
            ObjectNode output = JsonNodeFactory.instance.objectNode();
            output.put("errorCode", CANCELLED);
            output.put("error", reason);
            execution.status(ExecutionStatus.CANCELLED)
                .error(null, CANCELLED, reason)
                .output(output)
                .completedAt(now);
        }

        void pause() {
            execution.status(ExecutionStatus.PAUSED);
        }

        void resume() {
            execution.status(ExecutionStatus.RUNNING);
            List<TaskExecution> held = tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.WAITING && t.ready())
                .sorted(Comparator.comparingInt(t -> graph.order(t.taskName())))
                .toList();
            for (TaskExecution task : held) {
                startGroup(task);
            }
        }

        // ========== Activation ==========

        /**
         * Traverse an edge into the task, or start it as an entry task when {@code from} is null.
         */
        private void activate(String taskName, String from) {
            TaskSpec spec = graph.task(taskName);
            List<TaskExecution> group = latestGroup(taskName);

            if (group.isEmpty()) {
                TaskExecution created = TaskExecution.waiting(executionId, taskName, 0, now).withInbound(from);
                put(created);
                maybeStart(created, from == null);
                return;
            }

            TaskExecution head = group.get(0);
            if (!head.transitionsFired()) {
                if (head.status() == TaskStatus.WAITING && !head.ready()) {
                    TaskExecution updated = head.withInbound(from);
                    if (updated != head) {
                        put(updated);
                    }
                    maybeStart(updated, from == null);
                } else {
                    log.debug("Task {} already active, ignoring activation from {}", taskName, from);
                }
                return;
            }

            if (!spec.loops()) {
                log.debug("Task {} already resolved, ignoring activation from {}", taskName, from);
                return;
            }
            int nextIteration = head.iteration() + 1;
            if (nextIteration >= spec.maxIterations()) {
                recordUnhandled(taskName, LOOP_LIMIT_EXCEEDED, String.format(
                    "task '%s' exceeded %d iterations", taskName, spec.maxIterations()));
                return;
            }
            TaskExecution created = TaskExecution.waiting(executionId, taskName, nextIteration, now).withInbound(from);
            put(created);
            maybeStart(created, false);
        }

        private void maybeStart(TaskExecution task, boolean entry) {
            if (!entry && !joinSatisfied(task)) {
                return;
            }
            if (execution.status() == ExecutionStatus.PAUSED) {
                put(task.withReady(now));
                return;
            }
            startGroup(task);
        }

        private boolean joinSatisfied(TaskExecution task) {
            TaskSpec spec = graph.task(task.taskName());
            int total = graph.predecessors(task.taskName()).size();
            return task.satisfiedInbound().size() >= spec.join().required(total);
        }

        /**
         * Move a WAITING task execution to RUNNING, expanding it into its with-items group first.
         */
        private void startGroup(TaskExecution head) {
            TaskSpec spec = graph.task(head.taskName());
            ExpressionScope scope = scope();

            if (!spec.fansOut()) {
                JsonNode input;
                try {
                    input = evaluator.resolve(spec.input(), scope);
                } catch (ExpressionException e) {
                    rejectInput(head, e);
                    return;
                }
                run(head, input, 1);
                return;
            }

            ArrayNode items;
            try {
                items = evaluator.resolveItems(spec.withItems(), scope);
            } catch (ExpressionException e) {
                rejectInput(head, e);
                return;
            }
            if (items.isEmpty()) {
                JoinPolicy join = spec.effectiveItemsJoin();
                TaskExecution done = join.kind() == JoinPolicy.Kind.COUNT
                    ? head.toError(JOIN_UNSATISFIABLE, String.format(
                        "task '%s' needs %d successful items, got an empty list", spec.name(), join.count()), now)
                    : head.toSuccess(JsonNodeFactory.instance.arrayNode(), now);
                put(done);
                tryResolve(done);
                return;
            }

            TaskExecution last = null;
            for (int index = 0; index < items.size(); index++) {
                TaskExecution member = index == 0
                    ? head.toBuilder().itemIndex(0).build()
                    : TaskExecution.sibling(head, index, now);
                try {
                    JsonNode input = evaluator.resolve(spec.input(), scope.withItem(items.get(index), index));
                    run(member, input, 1);
                    last = tasks.get(member.id());
                } catch (ExpressionException e) {
                    last = member.toError(ExpressionException.ERROR_CODE, e.getMessage(), now);
                    put(last);
                }
            }
            tryResolve(last);
        }

        private void rejectInput(TaskExecution task, ExpressionException e) {
            TaskExecution failed = task.toError(ExpressionException.ERROR_CODE, e.getMessage(), now);
            put(failed);
            tryResolve(failed);
        }

        private void run(TaskExecution task, JsonNode input, int attempt) {
            TaskSpec spec = graph.task(task.taskName());
            Instant deadline = spec.timeout() != null ? now.plus(spec.timeout()) : null;
            TaskExecution running = task.toRunning(input, attempt, now, deadline);
            put(running);
            toDispatch.add(running.id());
        }

        // ========== Resolution ==========

        /**
         * Fire the transitions of the task's group once its items join is decided.
         */
        private void tryResolve(TaskExecution task) {
            List<TaskExecution> group = members(task.groupId());
            if (group.get(0).transitionsFired()) {
                return;
            }
            TaskSpec spec = graph.task(task.taskName());
            Optional<TaskStatus> outcome = evaluateGroup(spec, group);
            if (outcome.isEmpty()) {
                return;
            }
            for (TaskExecution member : group) {
                put(member.withTransitionsFired(now));
            }

            TaskStatus status = outcome.get();
            if (status == TaskStatus.ERROR && !graph.hasErrorHandler(spec.name())) {
                Optional<TaskExecution> cause = group.stream()
                    .filter(t -> t.status() == TaskStatus.ERROR)
                    .findFirst();
                if (cause.isPresent()) {
                    recordUnhandled(spec.name(), cause.get().errorCode(), cause.get().errorMessage());
                } else {
                    recordUnhandled(spec.name(), JOIN_UNSATISFIABLE, String.format(
                        "task '%s' needs %s over %d items", spec.name(), spec.effectiveItemsJoin(), group.size()));
                }
            }
            for (String successor : graph.next(spec.name(), status)) {
                activate(successor, spec.name());
            }
        }

        private Optional<TaskStatus> evaluateGroup(TaskSpec spec, List<TaskExecution> group) {
            int succeeded = 0;
            int pending = 0;
            for (TaskExecution member : group) {
                if (member.status() == TaskStatus.SUCCESS) {
                    succeeded++;
                } else if (!member.isTerminal()) {
                    pending++;
                }
            }
            JoinPolicy join = spec.effectiveItemsJoin();
            int size = group.size();
            switch (join.kind()) {
                case ONE:
                    if (succeeded > 0) {
                        return Optional.of(TaskStatus.SUCCESS);
                    }
                    return pending == 0 ? Optional.of(TaskStatus.ERROR) : Optional.empty();
                case COUNT:
                    // Not capped at the group size: fewer items than the count can never succeed
                    if (succeeded >= join.count()) {
                        return Optional.of(TaskStatus.SUCCESS);
                    }
                    return succeeded + pending < join.count() ? Optional.of(TaskStatus.ERROR) : Optional.empty();
                default:
                    if (pending > 0) {
                        return Optional.empty();
                    }
                    return Optional.of(succeeded == size ? TaskStatus.SUCCESS : TaskStatus.ERROR);
            }
        }

        private void recordUnhandled(String taskName, String errorCode, String message) {
            if (execution.errorTask() == null) {
                execution.error(taskName, errorCode, message);
                log.debug("Unhandled error in task {}: {} {}", taskName, errorCode, message);
            }
        }

        // ========== Completion ==========

        void finish() {
            if (execution.startedAt() == null) {
                return;
            }
            while (true) {
                boolean busy = tasks.values().stream()
                    .anyMatch(t -> t.isActive() || (t.status() == TaskStatus.WAITING && t.ready()));
                if (busy) {
                    break;
                }
                List<TaskExecution> dead = tasks.values().stream()
                    .filter(t -> t.status() == TaskStatus.WAITING)
                    .toList();
                if (dead.isEmpty()) {
                    complete();
                    return;
                }
                for (TaskExecution task : dead) {
                    TaskExecution failed = task.toError(JOIN_UNSATISFIABLE, String.format(
                        "task '%s' got %d of its inputs and cannot get more",
                        task.taskName(), task.satisfiedInbound().size()), now);
                    put(failed);
                    tryResolve(failed);
                }
            }
        }

        private void complete() {
            if (execution.errorTask() != null) {
                ObjectNode output = JsonNodeFactory.instance.objectNode();
                output.put("task", execution.errorTask());
                output.put("errorCode", execution.errorCode());
                output.put("error", execution.errorMessage());
                execution.status(ExecutionStatus.ERROR).output(output).completedAt(now);
                return;
            }

            Map<String, JsonNode> leaves = new LinkedHashMap<>();
            for (TaskSpec spec : graph.definition().tasks()) {
                List<TaskExecution> group = latestGroup(spec.name());
                if (group.isEmpty() || !group.get(0).transitionsFired()) {
                    continue;
                }
                if (evaluateGroup(spec, group).orElse(TaskStatus.ERROR) != TaskStatus.SUCCESS) {
                    continue;
                }
                if (graph.next(spec.name(), TaskStatus.SUCCESS).isEmpty()) {
                    leaves.put(spec.name(), groupResult(group));
                }
            }

            JsonNode output;
            if (leaves.size() == 1) {
                output = leaves.values().iterator().next();
            } else {
                ObjectNode keyed = JsonNodeFactory.instance.objectNode();
                leaves.forEach(keyed::set);
                output = keyed;
            }
            execution.status(ExecutionStatus.SUCCESS).output(output).completedAt(now);
        }

        // ========== Lookups ==========

        /**
         * Members of the task's latest group, head first, then by item index.
         */
        private List<TaskExecution> latestGroup(String taskName) {
            TaskExecution latest = null;
            for (TaskExecution task : tasks.values()) {
                if (task.taskName().equals(taskName) && (latest == null || task.iteration() > latest.iteration())) {
                    latest = task;
                }
            }
            return latest != null ? members(latest.groupId()) : List.of();
        }

        private List<TaskExecution> members(UUID groupId) {
            List<TaskExecution> group = new ArrayList<>();
            for (TaskExecution task : tasks.values()) {
                if (task.groupId().equals(groupId)) {
                    group.add(task);
                }
            }
            group.sort(Comparator.comparingInt(t -> t.itemIndex() != null ? t.itemIndex() : -1));
            return group;
        }

        private JsonNode groupResult(List<TaskExecution> group) {
            TaskExecution head = group.get(0);
            if (head.itemIndex() == null) {
                return head.result() != null ? head.result() : NullNode.getInstance();
            }
            ArrayNode results = JsonNodeFactory.instance.arrayNode();
            for (TaskExecution member : group) {
                results.add(member.status() == TaskStatus.SUCCESS && member.result() != null
                    ? member.result()
                    : NullNode.getInstance());
            }
            return results;
        }

        /**
         * Results of the latest successfully resolved group of each task.
         */
        private ExpressionScope scope() {
            Map<String, JsonNode> results = new HashMap<>();
            for (TaskSpec spec : graph.tasks()) {
                List<TaskExecution> group = latestGroup(spec.name());
                if (group.isEmpty() || !group.get(0).transitionsFired()) {
                    continue;
                }
                if (evaluateGroup(spec, group).orElse(TaskStatus.ERROR) == TaskStatus.SUCCESS) {
                    results.put(spec.name(), groupResult(group));
                }
            }
            return ExpressionScope.of(executionInput, results);
        }

        // ========== Result ==========

        Decision decision() {
            execution.incrementVersion().updatedAt(now);

            List<TaskExecution> changedTasks = new ArrayList<>();
            for (UUID id : changed) {
                changedTasks.add(tasks.get(id));
            }

            List<DispatchOrder> dispatches = new ArrayList<>();
            for (UUID id : toDispatch) {
                TaskExecution task = tasks.get(id);
                if (task.status() == TaskStatus.RUNNING) {
                    dispatches.add(new DispatchOrder(task, graph.task(task.taskName()).action()));
                }
            }
            dispatches.sort(Comparator
                .comparingInt((DispatchOrder o) -> graph.order(o.taskExecution().taskName()))
                .thenComparingInt(o -> o.taskExecution().itemIndex() != null ? o.taskExecution().itemIndex() : -1));

            return new Decision(execution.build(), changedTasks, dispatches, null);
        }
    }
}
