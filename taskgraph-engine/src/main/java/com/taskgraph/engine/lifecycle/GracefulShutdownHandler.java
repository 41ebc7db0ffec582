package com.taskgraph.engine.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the background workers once the application is ready and stops them on shutdown.
 *
 * On shutdown:
 * 1. Stops consuming new messages and sweeping
 * 2. Lets in-flight events finish their commit
 * 3. Logs shutdown status
 *
 * Anything not committed when a worker stops is redelivered or swept after restart.
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final List<BackgroundWorker> workers;
    private final boolean autoStart;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(
            List<BackgroundWorker> workers,
            @Value("${taskgraph.workers.auto-start:true}") boolean autoStart) {
        this.workers = List.copyOf(workers);
        this.autoStart = autoStart;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!autoStart) {
            log.info("Background workers not started, auto-start disabled");
            return;
        }
        for (BackgroundWorker worker : workers) {
            worker.start();
        }
        log.info("Started {} background workers", workers.size());
    }

    /**
     * Runs before the Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown of {} background workers", workers.size());

        List<BackgroundWorker> reversed = new ArrayList<>(workers);
        Collections.reverse(reversed);
        int failed = 0;
        for (BackgroundWorker worker : reversed) {
            if (!worker.isRunning()) {
                continue;
            }
            try {
                worker.stop();
            } catch (Exception e) {
                log.error("Failed to stop {}: {}", worker.name(), e.getMessage(), e);
                failed++;
            }
        }

        log.info("Graceful shutdown complete ({} failed)", failed);
    }
}
