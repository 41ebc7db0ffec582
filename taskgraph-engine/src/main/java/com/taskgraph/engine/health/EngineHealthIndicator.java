package com.taskgraph.engine.health;

import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.reconciler.ReconcilerWorkerPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Reports engine health based on:
 * - store reachability and execution counts
 * - reconciler workers running, with every thread alive
 * - run requests stuck unconfirmed
 */
public class EngineHealthIndicator implements HealthIndicator {

    private static final int STUCK_SAMPLE = 100;

    private final ExecutionStore executionStore;
    private final ReconcilerWorkerPool workerPool;
    private final Clock clock;
    private final Duration stuckThreshold;

    public EngineHealthIndicator(
            ExecutionStore executionStore,
            ReconcilerWorkerPool workerPool,
            Clock clock,
            Duration stuckThreshold) {
        this.executionStore = executionStore;
        this.workerPool = workerPool;
        this.clock = clock;
        this.stuckThreshold = stuckThreshold;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            Map<ExecutionStatus, Long> counts = executionStore.countByStatus();
            Map<String, Long> executions = new HashMap<>();
            counts.forEach((status, count) -> executions.put(status.name(), count));
            details.put("executions", executions);
        } catch (Exception e) {
            details.put("storeError", e.getMessage());
            return Health.down()
                .withDetails(details)
                .build();
        }

        details.put("reconcilerRunning", workerPool.isRunning());
        details.put("reconcilerThreads", workerPool.getLiveThreads() + "/" + workerPool.getThreads());
        details.put("reconcilerFailures", workerPool.getFailureCount());
        details.put("processedMessages", workerPool.getProcessedCount());

        int stuck = executionStore
            .findUnconfirmedDispatches(clock.instant().minus(stuckThreshold), STUCK_SAMPLE)
            .size();
        details.put("unconfirmedDispatches", stuck);
        if (stuck >= STUCK_SAMPLE) {
            details.put("dispatchWarning", "Many run requests unconfirmed - check the message channel");
        }

        if (!workerPool.isRunning()) {
            return Health.outOfService()
                .withDetails(details)
                .build();
        }
        if (workerPool.getLiveThreads() < workerPool.getThreads()) {
            return Health.down()
                .withDetail("reason", "Reconciler threads died")
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetails(details)
            .build();
    }
}
