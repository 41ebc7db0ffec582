package com.taskgraph.scheduler;

import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.core.exception.DispatchException;
import com.taskgraph.core.message.MessageCodec;
import com.taskgraph.core.message.RetryTimerMessage;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.lifecycle.BackgroundWorker;
import com.taskgraph.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fires retry timers of DELAYED task executions.
 *
 * Timers are not kept anywhere but in the store: every poll reads the DELAYED task
 * executions whose retry time has passed and publishes a {@link RetryTimerMessage}
 * to the result topic, where the reconciler turns it into the next attempt. A timer
 * that is still due after {@code refireAfter} is published again, so a lost message
 * or a crash between poll and publish only delays the retry.
 */
public class RetryTimerScheduler implements BackgroundWorker {

    private static final Logger log = LoggerFactory.getLogger(RetryTimerScheduler.class);

    private final ExecutionStore executionStore;
    private final MessageChannel channel;
    private final MessageCodec codec;
    private final Clock clock;
    private final String resultTopic;
    private final Duration pollInterval;
    private final int batchSize;
    private final Duration refireAfter;

    // Timers published and not yet picked up, by task execution
    private final Map<UUID, FiredTimer> inFlight = new ConcurrentHashMap<>();

    private ScheduledExecutorService executor;
    private volatile boolean running = false;

    public RetryTimerScheduler(
            ExecutionStore executionStore,
            MessageChannel channel,
            MessageCodec codec,
            Clock clock,
            String resultTopic,
            Duration pollInterval,
            int batchSize,
            Duration refireAfter) {
        this.executionStore = executionStore;
        this.channel = channel;
        this.codec = codec;
        this.clock = clock;
        this.resultTopic = resultTopic;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.refireAfter = refireAfter;
    }

    @Override
    public String name() {
        return "retry-timers";
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("Retry timer scheduler already running");
            return;
        }
        running = true;
        log.info("Starting retry timer scheduler, polling every {}", pollInterval);

        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "retry-timers");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(
            this::pollSafely,
            pollInterval.toMillis(),
            pollInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );
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
        log.info("Retry timer scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Publish timer messages for every retry that is due.
     *
     * @return number of timer messages published
     */
    public int pollOnce() {
        Instant now = clock.instant();
        List<TaskExecution> due = executionStore.findDueRetries(now, batchSize);

        Set<UUID> stillDue = new HashSet<>();
        int published = 0;
        for (TaskExecution task : due) {
            stillDue.add(task.id());
            FiredTimer previous = inFlight.get(task.id());
            if (previous != null && previous.attempt() == task.attempt()
                    && previous.firedAt().plus(refireAfter).isAfter(now)) {
                continue;
            }
            try (var ctx = LoggingContext.forTask(task.executionId(), task.taskName(), task.id(), task.attempt())) {
                fire(task);
                inFlight.put(task.id(), new FiredTimer(task.attempt(), now));
                published++;
            } catch (DispatchException e) {
                log.warn("Could not publish retry timer, trying again next poll: {}", e.getMessage());
            }
        }
        // Timers no longer due were consumed or their execution moved on
        inFlight.keySet().retainAll(stillDue);
        return published;
    }

    private void fire(TaskExecution task) {
        RetryTimerMessage timer = new RetryTimerMessage(task.id(), task.executionId(), task.attempt());
        channel.publish(resultTopic, task.executionId().toString(), codec.encode(timer));
        log.debug("Fired retry timer due at {}", task.retryAt());
    }

    private void pollSafely() {
        if (!running) {
            return;
        }
        try {
            int published = pollOnce();
            if (published > 0) {
                log.info("Fired {} retry timers", published);
            }
        } catch (Exception e) {
            log.error("Error polling retry timers", e);
        }
    }

    private record FiredTimer(int attempt, Instant firedAt) {
    }
}
