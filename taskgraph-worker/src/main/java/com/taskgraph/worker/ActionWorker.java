package com.taskgraph.worker;

import com.taskgraph.core.channel.ChannelConsumer;
import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.core.exception.MessageFormatException;
import com.taskgraph.core.message.MessageCodec;
import com.taskgraph.core.message.RunRequest;
import com.taskgraph.core.message.TaskCompletionMessage;
import com.taskgraph.engine.lifecycle.BackgroundWorker;
import com.taskgraph.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Action executor: consumes run requests, invokes the named action and publishes the
 * completion on the result topic.
 *
 * Usage:
 * <pre>
 * ActionRegistry registry = new ActionRegistry();
 * registry.register(new EchoAction());
 * new ActionWorker(channel, registry, codec, runTopic, resultTopic, 4, Duration.ofMillis(500)).start();
 * </pre>
 *
 * A run request is acknowledged only after its completion was published. Redelivered
 * requests run the action again; the engine drops the duplicate completion. A failing poll
 * or commit makes the thread reopen its consumer after a pause.
 */
public class ActionWorker implements BackgroundWorker {

    private static final Logger log = LoggerFactory.getLogger(ActionWorker.class);

    public static final String UNKNOWN_ACTION = "UNKNOWN_ACTION";
    public static final String ACTION_FAILED = "ACTION_FAILED";

    private static final Duration FAILURE_PAUSE = Duration.ofMillis(500);

    private final MessageChannel channel;
    private final ActionRegistry registry;
    private final MessageCodec codec;
    private final String runRequestTopic;
    private final String resultTopic;
    private final int threads;
    private final Duration pollTimeout;

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicInteger liveThreads = new AtomicInteger();
    private ExecutorService executor;
    private volatile boolean running = false;

    public ActionWorker(
            MessageChannel channel,
            ActionRegistry registry,
            MessageCodec codec,
            String runRequestTopic,
            String resultTopic,
            int threads,
            Duration pollTimeout) {
        this.channel = channel;
        this.registry = registry;
        this.codec = codec;
        this.runRequestTopic = runRequestTopic;
        this.resultTopic = resultTopic;
        this.threads = threads;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public String name() {
        return "action-worker";
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("Action worker already running");
            return;
        }
        running = true;
        AtomicInteger index = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "action-worker-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < threads; i++) {
            liveThreads.incrementAndGet();
            executor.submit(this::runLoop);
        }
        log.info("Started {} action worker threads with actions {}", threads, registry.names());
    }

    /**
     * Stop the worker gracefully.
     */
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
        log.info("Action worker stopped after {} completions", completed.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public int getCompletedCount() {
        return completed.get();
    }

    public int getFailureCount() {
        return failures.get();
    }

    public int getLiveThreads() {
        return liveThreads.get();
    }

    /**
     * Run one request and build its completion. Never throws for action failures.
     */
    public TaskCompletionMessage execute(RunRequest request) {
        try (var ctx = LoggingContext.forTask(
                request.executionId(), request.taskName(), request.taskExecutionId(), request.attempt())) {
            Optional<Action> action = registry.find(request.action());
            if (action.isEmpty()) {
                log.error("No action registered for {}", request.action());
                return TaskCompletionMessage.failure(request, UNKNOWN_ACTION,
                    "No action registered for " + request.action(), false);
            }

            log.info("Invoking action {} (attempt {})", request.action(), request.attempt());
            try {
                TaskCompletionMessage success = TaskCompletionMessage.success(
                    request, action.get().invoke(new ActionContext(request, codec.objectMapper())));
                log.info("Action {} succeeded", request.action());
                return success;
            } catch (ActionException e) {
                log.warn("Action {} failed: {} - {}", request.action(), e.getErrorCode(), e.getMessage());
                return TaskCompletionMessage.failure(request, e.getErrorCode(), e.getMessage(), e.isRetryable());
            } catch (RuntimeException e) {
                log.error("Action {} failed with unexpected error", request.action(), e);
                return TaskCompletionMessage.failure(request, ACTION_FAILED, String.valueOf(e.getMessage()), true);
            }
        }
    }

    // ========== Internal Methods ==========

    private void runLoop() {
        LoggingContext.forWorker(Thread.currentThread().getName());
        ChannelConsumer consumer = null;
        try {
            while (running) {
                try {
                    if (consumer == null) {
                        consumer = channel.openConsumer(runRequestTopic);
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
                    log.error("Action worker failed, reopening consumer: {}", e.getMessage(), e);
                    consumer = close(consumer);
                    pause();
                }
            }
        } catch (Error e) {
            log.error("Action worker terminated: {}", e.getMessage(), e);
            throw e;
        } finally {
            close(consumer);
            liveThreads.decrementAndGet();
            LoggingContext.clearAll();
        }
    }

    private boolean handleBatch(List<String> batch) {
        for (String payload : batch) {
            RunRequest request;
            try {
                request = codec.decodeRunRequest(payload);
            } catch (MessageFormatException e) {
                log.warn("Dropping malformed run request: {}", e.getMessage());
                continue;
            }
            try {
                TaskCompletionMessage completion = execute(request);
                channel.publish(resultTopic, request.executionId().toString(), codec.encode(completion));
                completed.incrementAndGet();
            } catch (Exception e) {
                log.error("Failed to publish completion, batch will be redelivered: {}", e.getMessage(), e);
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
            log.warn("Failed to close run request consumer: {}", e.getMessage());
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
