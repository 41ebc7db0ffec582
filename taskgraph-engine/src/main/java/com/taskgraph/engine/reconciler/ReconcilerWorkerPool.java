package com.taskgraph.engine.reconciler;

import com.taskgraph.core.channel.ChannelConsumer;
import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.engine.lifecycle.BackgroundWorker;
import com.taskgraph.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads consuming the result topic and feeding the {@link EventReconciler}.
 *
 * Each thread owns one consumer. A batch is acknowledged once every message in it was
 * handled. When handling throws, the batch is left unacknowledged and the consumer is
 * reopened, so the messages come back; the ones already applied are then dropped as
 * stale. A failing poll or commit is handled the same way: the thread logs it, reopens its
 * consumer after a pause and keeps going. Only an {@link Error} ends a thread, which
 * {@link #getLiveThreads()} then reports.
 */
public class ReconcilerWorkerPool implements BackgroundWorker {

    private static final Logger log = LoggerFactory.getLogger(ReconcilerWorkerPool.class);

    private static final Duration FAILURE_PAUSE = Duration.ofMillis(500);

    private final MessageChannel channel;
    private final EventReconciler reconciler;
    private final String resultTopic;
    private final int threads;
    private final Duration pollTimeout;

    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicInteger liveThreads = new AtomicInteger();
    private ExecutorService executor;
    private volatile boolean running = false;

    public ReconcilerWorkerPool(
            MessageChannel channel,
            EventReconciler reconciler,
            String resultTopic,
            int threads,
            Duration pollTimeout) {
        this.channel = channel;
        this.reconciler = reconciler;
        this.resultTopic = resultTopic;
        this.threads = threads;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public String name() {
        return "reconciler";
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("Reconciler workers already running");
            return;
        }
        running = true;
        AtomicInteger index = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "reconciler-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < threads; i++) {
            liveThreads.incrementAndGet();
            executor.submit(this::runLoop);
        }
        log.info("Started {} reconciler workers on topic {}", threads, resultTopic);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Reconciler workers stopped after {} messages", processed.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public int getProcessedCount() {
        return processed.get();
    }

    /**
     * Loop failures recovered by reopening the consumer.
     */
    public int getFailureCount() {
        return failures.get();
    }

    public int getLiveThreads() {
        return liveThreads.get();
    }

    public int getThreads() {
        return threads;
    }

    // ========== Internal Methods ==========

    private void runLoop() {
        LoggingContext.forWorker(Thread.currentThread().getName());
        ChannelConsumer consumer = null;
        try {
            while (running) {
                try {
                    if (consumer == null) {
                        consumer = channel.openConsumer(resultTopic);
                    }
                    List<String> batch = consumer.poll(pollTimeout);
                    if (batch.isEmpty()) {
                        continue;
                    }
                    if (handleBatch(batch)) {
                        consumer.commit();
                    } else {
                        consumer = close(consumer);
                        pause();
                    }
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                    log.error("Reconciler worker failed, reopening consumer: {}", e.getMessage(), e);
                    consumer = close(consumer);
                    pause();
                }
            }
        } catch (Error e) {
            log.error("Reconciler worker terminated: {}", e.getMessage(), e);
            throw e;
        } finally {
            close(consumer);
            liveThreads.decrementAndGet();
            LoggingContext.clearAll();
        }
    }

    private boolean handleBatch(List<String> batch) {
        for (String payload : batch) {
            try {
                reconciler.onMessage(payload);
                processed.incrementAndGet();
            } catch (Exception e) {
                log.error("Failed to handle message, batch will be redelivered: {}", e.getMessage(), e);
                return false;
            }
        }
        return true;
    }

    private ChannelConsumer close(ChannelConsumer consumer) {
        if (consumer == null) {
            return null;
        }
        try {
            consumer.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close result consumer: {}", e.getMessage());
        }
        return null;
    }

    private void pause() {
        try {
            Thread.sleep(FAILURE_PAUSE.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
