package com.taskgraph.engine.reconciler;

import com.taskgraph.core.exception.MessageFormatException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.StaleEventException;
import com.taskgraph.core.message.ChannelMessage;
import com.taskgraph.core.message.MessageCodec;
import com.taskgraph.core.message.RetryTimerMessage;
import com.taskgraph.core.message.TaskCompletionMessage;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.coordinator.ExecutionCoordinator;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.scheduler.EngineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns messages from the result topic into engine events.
 *
 * Delivery is at-least-once, so every message is checked against committed state
 * first: the task execution must exist, be in the expected status and match the
 * attempt and dispatch nonce. Anything else is a duplicate or superseded message and
 * is dropped. Malformed payloads are dropped as well; redelivering them cannot help.
 */
public class EventReconciler {

    private static final Logger log = LoggerFactory.getLogger(EventReconciler.class);

    private final ExecutionStore executionStore;
    private final ExecutionCoordinator executionCoordinator;
    private final MessageCodec codec;
    private final EngineMetrics metrics;

    public EventReconciler(
            ExecutionStore executionStore,
            ExecutionCoordinator executionCoordinator,
            MessageCodec codec,
            EngineMetrics metrics) {
        this.executionStore = executionStore;
        this.executionCoordinator = executionCoordinator;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Handle one raw message.
     *
     * @return the event that was applied, empty if the message was dropped
     */
    public Optional<EngineEvent> onMessage(String payload) {
        ChannelMessage message;
        try {
            message = codec.decodeChannelMessage(payload);
        } catch (MessageFormatException e) {
            log.warn("Dropping malformed message: {}", e.getMessage());
            metrics.malformedMessage();
            return Optional.empty();
        }

        try (var ctx = LoggingContext.forExecution(message.executionId())) {
            EngineEvent event = toEvent(message);
            executionCoordinator.process(message.executionId(), event);
            return Optional.of(event);
        } catch (StaleEventException e) {
            log.debug("Dropping message: {}", e.getMessage());
            metrics.staleEvent(message.getClass().getSimpleName());
            return Optional.empty();
        } catch (NotFoundException e) {
            log.debug("Dropping message for deleted execution: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ========== Internal Methods ==========

    private EngineEvent toEvent(ChannelMessage message) {
        TaskExecution task = executionStore.findTaskExecution(message.taskExecutionId())
            .orElseThrow(() -> new StaleEventException(message.taskExecutionId(), "unknown task execution"));

        if (!task.executionId().equals(message.executionId())) {
            throw new StaleEventException(task.id(), "belongs to execution " + task.executionId());
        }
        if (task.attempt() != message.attempt()) {
            throw new StaleEventException(task.id(),
                "attempt " + message.attempt() + " superseded by " + task.attempt());
        }

        if (message instanceof TaskCompletionMessage completion) {
            return completionEvent(task, completion);
        }
        if (message instanceof RetryTimerMessage timer) {
            if (task.status() != TaskStatus.DELAYED) {
                throw new StaleEventException(task.id(), "retry timer for task in status " + task.status());
            }
            return new EngineEvent.RetryTimerFired(task.id(), timer.attempt());
        }
        throw new StaleEventException(task.id(), "unsupported message " + message.getClass().getSimpleName());
    }

    private EngineEvent completionEvent(TaskExecution task, TaskCompletionMessage completion) {
        if (task.status() != TaskStatus.RUNNING) {
            throw new StaleEventException(task.id(), "result for task in status " + task.status());
        }
        if (completion.nonce() == null || !completion.nonce().equals(task.dispatchNonce())) {
            throw new StaleEventException(task.id(), "dispatch nonce does not match");
        }
        if (completion.status() == TaskCompletionMessage.Status.SUCCESS) {
            return new EngineEvent.TaskCompleted(task.id(), completion.attempt(), completion.result());
        }
        return new EngineEvent.TaskFailed(
            task.id(),
            completion.attempt(),
            completion.errorCode(),
            completion.error(),
            completion.retryable()
        );
    }
}
