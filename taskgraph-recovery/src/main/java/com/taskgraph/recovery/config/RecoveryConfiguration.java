package com.taskgraph.recovery.config;

import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.config.EngineProperties;
import com.taskgraph.engine.coordinator.ExecutionCoordinator;
import com.taskgraph.engine.coordinator.GraphCache;
import com.taskgraph.engine.dispatch.Dispatcher;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.recovery.RecoveryEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RecoveryConfiguration {

    @Bean
    public RecoveryEngine recoveryEngine(
            ExecutionStore executionStore,
            ExecutionCoordinator executionCoordinator,
            GraphCache graphCache,
            Dispatcher dispatcher,
            EngineMetrics engineMetrics,
            Clock clock,
            EngineProperties properties) {
        EngineProperties.Recovery recovery = properties.getRecovery();
        return new RecoveryEngine(
            executionStore,
            executionCoordinator,
            graphCache,
            dispatcher,
            engineMetrics,
            clock,
            new RecoveryEngine.RecoverySettings(
                recovery.getInterval(),
                recovery.getDispatchConfirmTimeout(),
                recovery.getMaxDispatchAttempts(),
                recovery.getUnstartedThreshold(),
                recovery.getBatchSize()
            )
        );
    }
}
