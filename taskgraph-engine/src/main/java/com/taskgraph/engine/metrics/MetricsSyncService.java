package com.taskgraph.engine.metrics;

import com.taskgraph.core.repository.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically syncs gauge metrics from the store.
 * Keeps the gauges accurate after restarts and across cluster nodes.
 */
@Component
public class MetricsSyncService {

    private static final Logger log = LoggerFactory.getLogger(MetricsSyncService.class);

    private final ExecutionStore executionStore;
    private final EngineMetrics engineMetrics;

    public MetricsSyncService(ExecutionStore executionStore, EngineMetrics engineMetrics) {
        this.executionStore = executionStore;
        this.engineMetrics = engineMetrics;
    }

    @Scheduled(fixedRateString = "${taskgraph.metrics.sync-interval-ms:30000}", initialDelay = 5000)
    public void syncExecutionGauges() {
        try {
            engineMetrics.syncExecutionCounts(executionStore.countByStatus());
            log.debug("Synced execution status gauges");
        } catch (Exception e) {
            log.warn("Failed to sync execution status gauges: {}", e.getMessage());
        }
    }
}
