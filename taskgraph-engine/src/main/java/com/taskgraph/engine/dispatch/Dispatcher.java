package com.taskgraph.engine.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.channel.MessageChannel;
import com.taskgraph.core.exception.DispatchException;
import com.taskgraph.core.message.MessageCodec;
import com.taskgraph.core.message.RunRequest;
import com.taskgraph.core.model.RetryPolicy;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Sends run requests for committed RUNNING task executions.
 *
 * Transport failures are retried in-process with exponential backoff. Once the
 * channel accepted the request the dispatch is confirmed in the store; a request
 * that never got through stays unconfirmed and is picked up by recovery.
 *
 * Delivery is at-least-once: the nonce lets consumers detect duplicates.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final MessageChannel channel;
    private final ExecutionStore executionStore;
    private final MessageCodec codec;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final String runRequestTopic;
    private final RetryPolicy publishRetry;

    public Dispatcher(
            MessageChannel channel,
            ExecutionStore executionStore,
            MessageCodec codec,
            EngineMetrics metrics,
            Clock clock,
            String runRequestTopic,
            RetryPolicy publishRetry) {
        this.channel = channel;
        this.executionStore = executionStore;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
        this.runRequestTopic = runRequestTopic;
        this.publishRetry = publishRetry;
    }

    /**
     * Dispatch the current attempt of a RUNNING task execution.
     *
     * @throws DispatchException if the channel rejected every publish attempt
     */
    public DispatchToken dispatch(TaskExecution task, String action) {
        return dispatch(task, action, task.input());
    }

    public DispatchToken dispatch(TaskExecution task, String action, JsonNode input) {
        RunRequest request = new RunRequest(
            task.id(),
            task.executionId(),
            task.taskName(),
            action,
            input,
            task.attempt(),
            task.dispatchNonce()
        );
        String payload = codec.encode(request);

        try (var ctx = LoggingContext.forTask(task.executionId(), task.taskName(), task.id(), task.attempt())) {
            publishWithRetry(task.executionId().toString(), payload, action);

            if (!executionStore.markDispatched(task.id(), task.dispatchNonce(), clock.instant())) {
                log.debug("Dispatch confirmation skipped, attempt {} was superseded", task.attempt());
            }
            metrics.taskDispatched(action);
            log.info("Dispatched action {} attempt {}", action, task.attempt());
        }
        return new DispatchToken(task.id(), task.attempt(), task.dispatchNonce());
    }

    private void publishWithRetry(String key, String payload, String action) {
        DispatchException lastFailure = null;
        for (int attempt = 1; attempt <= publishRetry.maxAttempts(); attempt++) {
            try {
                channel.publish(runRequestTopic, key, payload);
                return;
            } catch (DispatchException e) {
                lastFailure = e;
                if (!publishRetry.hasMoreAttempts(attempt)) {
                    break;
                }
                Duration backoff = publishRetry.computeDelay(attempt);
                log.warn("Publish attempt {} failed: {}, retrying in {}", attempt, e.getMessage(), backoff);
                if (!sleep(backoff)) {
                    break;
                }
            }
        }
        metrics.dispatchFailed(action);
        throw new DispatchException(
            "Run request not accepted after " + publishRetry.maxAttempts() + " attempts", lastFailure);
    }

    private static boolean sleep(Duration backoff) {
        if (backoff.isZero()) {
            return true;
        }
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
