package com.taskgraph.engine.coordinator;

import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.DispatchException;
import com.taskgraph.core.graph.CompiledGraph;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionSnapshot;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.dispatch.Dispatcher;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.scheduler.Decision;
import com.taskgraph.engine.scheduler.DispatchOrder;
import com.taskgraph.engine.scheduler.EngineEvent;
import com.taskgraph.engine.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Applies events to executions: load, decide, commit, then dispatch.
 *
 * The commit is guarded by the execution version. When another worker committed first
 * the whole cycle is repeated on fresh state, so a decision is never based on a stale
 * snapshot. Run requests are only sent after the commit that created them succeeded.
 */
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private static final long CONFLICT_BACKOFF_MAX_MS = 20;

    private final ExecutionStore executionStore;
    private final GraphCache graphCache;
    private final Scheduler scheduler;
    private final Dispatcher dispatcher;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final int maxConflictRetries;

    public ExecutionCoordinator(
            ExecutionStore executionStore,
            GraphCache graphCache,
            Scheduler scheduler,
            Dispatcher dispatcher,
            EngineMetrics metrics,
            Clock clock,
            int maxConflictRetries) {
        this.executionStore = executionStore;
        this.graphCache = graphCache;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
        this.maxConflictRetries = maxConflictRetries;
    }

    /**
     * Apply one event to an execution.
     *
     * @return the committed decision, or a stale decision if the event no longer applied
     * @throws com.taskgraph.core.exception.NotFoundException if the execution does not exist
     * @throws ConflictException if every retry lost against a concurrent commit
     */
    public Decision process(UUID executionId, EngineEvent event) {
        String eventType = event.getClass().getSimpleName();
        Instant started = clock.instant();

        try (var ctx = LoggingContext.forExecution(executionId)) {
            for (int attempt = 0; ; attempt++) {
                ExecutionSnapshot snapshot = executionStore.loadForUpdate(executionId);
                CompiledGraph graph = graphCache.get(snapshot.execution().definitionId());
                Decision decision = scheduler.apply(snapshot, graph, event, clock.instant());

                if (decision.isStale()) {
                    log.debug("Ignoring {}: {}", eventType, decision.staleReason());
                    metrics.staleEvent(eventType);
                    return decision;
                }

                try {
                    executionStore.commit(decision.execution(), decision.changed());
                } catch (ConflictException e) {
                    metrics.commitConflict();
                    if (attempt >= maxConflictRetries) {
                        log.warn("Giving up on {} after {} conflicting commits", eventType, attempt + 1);
                        throw e;
                    }
                    log.debug("Commit conflict on {}, retrying: {}", eventType, e.getMessage());
                    backoff();
                    continue;
                }

                afterCommit(snapshot.execution(), decision, event);
                metrics.recordEventDuration(eventType, Duration.between(started, clock.instant()));
                dispatchAll(decision);
                return decision;
            }
        }
    }

    // ========== Internal Methods ==========

    private void afterCommit(Execution before, Decision decision, EngineEvent event) {
        Execution after = decision.execution();

        if (event instanceof EngineEvent.Start) {
            metrics.executionStarted(after.definitionName());
            log.info("Started execution of {} v{}", after.definitionName(), after.definitionVersion());
        }
        if (event instanceof EngineEvent.TaskCompleted completed) {
            metrics.taskResult("success");
            log.debug("Applied result of task execution {}", completed.taskExecutionId());
        }
        if (event instanceof EngineEvent.TaskFailed failed) {
            for (TaskExecution task : decision.changed()) {
                if (!task.id().equals(failed.taskExecutionId())) {
                    continue;
                }
                if (task.status() == TaskStatus.DELAYED) {
                    metrics.taskRetried(task.taskName());
                    log.info("Task {} attempt {} failed with {}, retry at {}",
                        task.taskName(), task.attempt(), failed.errorCode(), task.retryAt());
                } else {
                    metrics.taskResult("error");
                    log.info("Task {} failed with {}: {}", task.taskName(), failed.errorCode(), failed.message());
                }
            }
        }

        if (!before.isTerminal() && after.isTerminal()) {
            Instant from = after.startedAt() != null ? after.startedAt() : after.createdAt();
            Instant to = after.completedAt() != null ? after.completedAt() : clock.instant();
            metrics.executionFinished(after.definitionName(), after.status(), Duration.between(from, to));
            log.info("Execution finished with status {}", after.status());
        }
    }

    private void dispatchAll(Decision decision) {
        for (DispatchOrder order : decision.dispatches()) {
            try {
                dispatcher.dispatch(order.taskExecution(), order.action());
            } catch (DispatchException e) {
                log.warn("Dispatch of task {} failed, leaving it to recovery: {}",
                    order.taskExecution().taskName(), e.getMessage());
            }
        }
    }

    private static void backoff() {
        try {
            Thread.sleep(ThreadLocalRandom.current().nextLong(1, CONFLICT_BACKOFF_MAX_MS + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
