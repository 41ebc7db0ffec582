package com.taskgraph.recovery;

import com.taskgraph.core.exception.DispatchException;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.coordinator.ExecutionCoordinator;
import com.taskgraph.engine.coordinator.GraphCache;
import com.taskgraph.engine.dispatch.Dispatcher;
import com.taskgraph.engine.lifecycle.BackgroundWorker;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.scheduler.EngineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery Engine responsible for repairing executions that stopped making progress.
 *
 * Responsibilities:
 * - Re-dispatch RUNNING tasks whose run request was never confirmed
 * - Fail tasks whose dispatch kept failing
 * - Fail tasks that exceeded their timeout
 * - Start executions whose Start event was never committed
 *
 * Every repair goes through the {@link ExecutionCoordinator} like any other event, so a
 * sweep racing with a late result is resolved by the version check.
 */
public class RecoveryEngine implements BackgroundWorker {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    public static final String TIMEOUT = "TIMEOUT";

    private final ExecutionStore executionStore;
    private final ExecutionCoordinator executionCoordinator;
    private final GraphCache graphCache;
    private final Dispatcher dispatcher;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final RecoverySettings settings;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(
            ExecutionStore executionStore,
            ExecutionCoordinator executionCoordinator,
            GraphCache graphCache,
            Dispatcher dispatcher,
            EngineMetrics metrics,
            Clock clock,
            RecoverySettings settings) {
        this.executionStore = executionStore;
        this.executionCoordinator = executionCoordinator;
        this.graphCache = graphCache;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "recovery";
    }

    /**
     * Start the recovery engine.
     */
    @Override
    public synchronized void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }
        running = true;
        log.info("Starting recovery engine, sweeping every {}", settings.interval());

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "recovery");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(
            this::sweepSafely,
            settings.interval().toMillis(),
            settings.interval().toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the recovery engine.
     */
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Run every sweep once.
     */
    public SweepResult sweep() {
        Instant now = clock.instant();
        SweepResult result = new SweepResult();
        recoverUnconfirmedDispatches(now, result);
        failTimedOutTasks(now, result);
        startUnstartedExecutions(now, result);
        if (result.total() > 0) {
            log.info("Recovery sweep: {}", result);
        }
        return result;
    }

    private void sweepSafely() {
        if (!running) {
            return;
        }
        try {
            sweep();
        } catch (Exception e) {
            log.error("Error in recovery sweep", e);
        }
    }

    // ========== Sweeps ==========

    /**
     * Run requests that were committed but never accepted by the channel.
     * The dispatcher process may have crashed, or the channel kept failing.
     */
    private void recoverUnconfirmedDispatches(Instant now, SweepResult result) {
        List<TaskExecution> unconfirmed = executionStore.findUnconfirmedDispatches(
            now.minus(settings.dispatchConfirmTimeout()), settings.batchSize());

        for (TaskExecution task : unconfirmed) {
            try (var ctx = LoggingContext.forTask(task.executionId(), task.taskName(), task.id(), task.attempt())) {
                if (task.dispatchCount() >= settings.maxDispatchAttempts()) {
                    log.warn("Dispatch not confirmed after {} attempts, failing task", task.dispatchCount());
                    executionCoordinator.process(task.executionId(), new EngineEvent.TaskFailed(
                        task.id(),
                        task.attempt(),
                        DispatchException.ERROR_CODE,
                        "Run request not confirmed after " + task.dispatchCount() + " dispatches",
                        false
                    ));
                    metrics.recoveryAction("dispatch_abandoned");
                    result.abandoned++;
                } else {
                    redispatch(task, now, result);
                }
            } catch (Exception e) {
                log.error("Failed to recover dispatch of task execution {}", task.id(), e);
            }
        }
    }

    private void redispatch(TaskExecution task, Instant now, SweepResult result) {
        Execution execution = executionStore.findExecution(task.executionId()).orElse(null);
        if (execution == null || execution.isTerminal()) {
            return;
        }
        // Claims this re-dispatch; loses if the attempt moved on since the query
        if (!executionStore.recordDispatchAttempt(task.id(), task.dispatchNonce(), now)) {
            log.debug("Task execution changed since the sweep query, skipping");
            return;
        }
        String action = graphCache.get(execution.definitionId()).task(task.taskName()).action();
        log.info("Re-dispatching unconfirmed run request, dispatch {}", task.dispatchCount() + 1);
        metrics.recoveryAction("redispatch");
        result.redispatched++;
        try {
            dispatcher.dispatch(task, action);
        } catch (DispatchException e) {
            log.warn("Re-dispatch failed, will retry next sweep: {}", e.getMessage());
        }
    }

    /**
     * RUNNING tasks past their deadline. The result may still arrive; it is dropped as stale.
     */
    private void failTimedOutTasks(Instant now, SweepResult result) {
        for (TaskExecution task : executionStore.findTimedOutTasks(now, settings.batchSize())) {
            try (var ctx = LoggingContext.forTask(task.executionId(), task.taskName(), task.id(), task.attempt())) {
                log.warn("Task timed out at {}", task.timeoutAt());
                executionCoordinator.process(task.executionId(), new EngineEvent.TaskFailed(
                    task.id(),
                    task.attempt(),
                    TIMEOUT,
                    "No result before " + task.timeoutAt(),
                    true
                ));
                metrics.recoveryAction("timeout");
                result.timedOut++;
            } catch (Exception e) {
                log.error("Failed to time out task execution {}", task.id(), e);
            }
        }
    }

    /**
     * Executions created without a committed Start, e.g. after a crash inside startExecution.
     */
    private void startUnstartedExecutions(Instant now, SweepResult result) {
        List<Execution> unstarted = executionStore.findUnstartedExecutions(
            now.minus(settings.unstartedThreshold()), settings.batchSize());

        for (Execution execution : unstarted) {
            try (var ctx = LoggingContext.forExecution(execution.id())) {
                log.info("Starting execution left unstarted since {}", execution.createdAt());
                if (!executionCoordinator.process(execution.id(), new EngineEvent.Start()).isStale()) {
                    metrics.recoveryAction("start");
                    result.started++;
                }
            } catch (Exception e) {
                log.error("Failed to start execution {}", execution.id(), e);
            }
        }
    }

    /**
     * Thresholds for the sweeps.
     */
    public record RecoverySettings(
        Duration interval,
        Duration dispatchConfirmTimeout,
        int maxDispatchAttempts,
        Duration unstartedThreshold,
        int batchSize
    ) {
    }

    /**
     * Actions taken by one sweep.
     */
    public static final class SweepResult {
        private int redispatched;
        private int abandoned;
        private int timedOut;
        private int started;

        public int redispatched() {
            return redispatched;
        }

        public int abandoned() {
            return abandoned;
        }

        public int timedOut() {
            return timedOut;
        }

        public int started() {
            return started;
        }

        public int total() {
            return redispatched + abandoned + timedOut + started;
        }

        @Override
        public String toString() {
            return "redispatched=" + redispatched + ", abandoned=" + abandoned
                + ", timedOut=" + timedOut + ", started=" + started;
        }
    }
}
