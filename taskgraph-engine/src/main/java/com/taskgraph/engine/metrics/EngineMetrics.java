package com.taskgraph.engine.metrics;

import com.taskgraph.core.model.ExecutionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the engine.
 *
 * Metrics exposed:
 * - Execution counts by status (gauges, synced from the store)
 * - Executions started and finished
 * - Dispatches, dispatch failures and recovery re-dispatches
 * - Task outcomes and retries
 * - Commit conflicts, stale and malformed messages
 * - Event processing latency
 */
public class EngineMetrics implements MeterBinder {

    // Metric names
    public static final String EXECUTION_COUNT = "taskgraph.executions";
    public static final String EXECUTIONS_STARTED = "taskgraph.executions.started";
    public static final String EXECUTIONS_FINISHED = "taskgraph.executions.finished";

    public static final String TASKS_DISPATCHED = "taskgraph.tasks.dispatched";
    public static final String DISPATCH_FAILURES = "taskgraph.dispatch.failures";
    public static final String TASK_RESULTS = "taskgraph.task.results";
    public static final String TASK_RETRIES = "taskgraph.task.retries";

    public static final String COMMIT_CONFLICTS = "taskgraph.commit.conflicts";
    public static final String STALE_EVENTS = "taskgraph.events.stale";
    public static final String MALFORMED_MESSAGES = "taskgraph.messages.malformed";
    public static final String EVENT_DURATION = "taskgraph.event.duration";

    public static final String RECOVERY_ACTIONS = "taskgraph.recovery.actions";

    // Unbound until the container calls bindTo
    private MeterRegistry registry = new SimpleMeterRegistry();

    private final Map<ExecutionStatus, AtomicInteger> executionStatusGauges = new ConcurrentHashMap<>();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (ExecutionStatus status : ExecutionStatus.values()) {
            AtomicInteger gauge = executionStatusGauges.computeIfAbsent(status, s -> new AtomicInteger(0));
            Gauge.builder(EXECUTION_COUNT, gauge, AtomicInteger::get)
                .tag("status", status.name())
                .description("Number of executions in " + status + " status")
                .register(registry);
        }
    }

    // ========== Execution Metrics ==========

    public void executionStarted(String workflow) {
        Counter.builder(EXECUTIONS_STARTED)
            .tag("workflow", workflow)
            .description("Total executions started")
            .register(registry)
            .increment();
    }

    public void executionFinished(String workflow, ExecutionStatus status, Duration duration) {
        Counter.builder(EXECUTIONS_FINISHED)
            .tag("workflow", workflow)
            .tag("status", status.name())
            .description("Total executions that reached a terminal status")
            .register(registry)
            .increment();

        if (duration != null) {
            Timer.builder("taskgraph.execution.duration")
                .tag("workflow", workflow)
                .tag("status", status.name())
                .description("Execution duration from creation to terminal status")
                .register(registry)
                .record(duration);
        }
    }

    /**
     * Overwrite the status gauges with counts read from the store.
     */
    public void syncExecutionCounts(Map<ExecutionStatus, Long> counts) {
        for (ExecutionStatus status : ExecutionStatus.values()) {
            executionStatusGauges
                .computeIfAbsent(status, s -> new AtomicInteger(0))
                .set(counts.getOrDefault(status, 0L).intValue());
        }
    }

    public int executionCount(ExecutionStatus status) {
        AtomicInteger gauge = executionStatusGauges.get(status);
        return gauge != null ? gauge.get() : 0;
    }

    // ========== Task Metrics ==========

    public void taskDispatched(String action) {
        Counter.builder(TASKS_DISPATCHED)
            .tag("action", action)
            .description("Run requests handed to the channel")
            .register(registry)
            .increment();
    }

    public void dispatchFailed(String action) {
        Counter.builder(DISPATCH_FAILURES)
            .tag("action", action)
            .description("Run requests the channel did not accept after all attempts")
            .register(registry)
            .increment();
    }

    public void taskResult(String outcome) {
        Counter.builder(TASK_RESULTS)
            .tag("outcome", outcome)
            .description("Task results applied to executions")
            .register(registry)
            .increment();
    }

    public void taskRetried(String taskName) {
        Counter.builder(TASK_RETRIES)
            .tag("task", taskName)
            .description("Retry attempts started")
            .register(registry)
            .increment();
    }

    // ========== Reconciliation Metrics ==========

    public void commitConflict() {
        Counter.builder(COMMIT_CONFLICTS)
            .description("Commits that lost the optimistic version check")
            .register(registry)
            .increment();
    }

    public void staleEvent(String eventType) {
        Counter.builder(STALE_EVENTS)
            .tag("event", eventType)
            .description("Events dropped because they no longer applied")
            .register(registry)
            .increment();
    }

    public void malformedMessage() {
        Counter.builder(MALFORMED_MESSAGES)
            .description("Channel payloads that could not be decoded")
            .register(registry)
            .increment();
    }

    public void recordEventDuration(String eventType, Duration duration) {
        Timer.builder(EVENT_DURATION)
            .tag("event", eventType)
            .description("Time to load, decide and commit one event")
            .register(registry)
            .record(duration);
    }

    public void recoveryAction(String action) {
        Counter.builder(RECOVERY_ACTIONS)
            .tag("action", action)
            .description("Corrective actions taken by recovery sweeps")
            .register(registry)
            .increment();
    }

    public double counterValue(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0.0;
    }
}
