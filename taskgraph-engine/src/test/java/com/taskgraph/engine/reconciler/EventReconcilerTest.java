package com.taskgraph.engine.reconciler;

import com.taskgraph.core.message.RetryTimerMessage;
import com.taskgraph.core.message.RunRequest;
import com.taskgraph.core.message.TaskCompletionMessage;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.RetryPolicy;
import com.taskgraph.core.model.TaskSpec;
import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.scheduler.EngineEvent;
import com.taskgraph.engine.test.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static com.taskgraph.engine.test.EngineHarness.json;
import static org.assertj.core.api.Assertions.assertThat;

public class EventReconcilerTest {

    private EngineHarness engine;
    private UUID executionId;
    private RunRequest request;

    @BeforeEach
    void setUp() {
        engine = new EngineHarness();
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("single")
            .task(TaskSpec.builder("call").action("http")
                .retryPolicy(RetryPolicy.builder()
                    .maxAttempts(2)
                    .initialDelay(Duration.ofSeconds(1))
                    .jitter(0.0)
                    .build())
                .build())
            .build());
        executionId = engine.service.startExecution(id, json("{}"));
        request = engine.takeRunRequests().get(0);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("A matching success should become TaskCompleted")
    void testSuccessApplied() {
        Optional<EngineEvent> event = engine.reconciler.onMessage(
            engine.codec.encode(TaskCompletionMessage.success(request, json("{\"status\":200}"))));

        assertThat(event).containsInstanceOf(EngineEvent.TaskCompleted.class);
        assertThat(engine.service.getExecution(executionId).output()).isEqualTo(json("{\"status\":200}"));
    }

    @Test
    @DisplayName("A failure should carry error code, message and retryable flag")
    void testFailureApplied() {
        Optional<EngineEvent> event = engine.reconciler.onMessage(
            engine.codec.encode(TaskCompletionMessage.failure(request, "HTTP_500", "server error", false)));

        assertThat(event).get().isEqualTo(
            new EngineEvent.TaskFailed(request.taskExecutionId(), 1, "HTTP_500", "server error", false));
    }

    @Test
    @DisplayName("A result claiming another execution should be dropped")
    void testWrongExecutionDropped() {
        TaskCompletionMessage foreign = new TaskCompletionMessage(
            request.taskExecutionId(), UUID.randomUUID(), 1, request.nonce(),
            TaskCompletionMessage.Status.SUCCESS, json("1"), null, null, false);

        assertThat(engine.reconciler.onMessage(engine.codec.encode(foreign))).isEmpty();
        assertThat(engine.metrics.counterValue(EngineMetrics.STALE_EVENTS, "event", "TaskCompletionMessage"))
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("A result for an earlier attempt should be dropped")
    void testOldAttemptDropped() {
        engine.fail(request, "FLAKY", "first try");
        engine.deliverResults();
        engine.clock.advanceSeconds(2);
        engine.fireDueRetries();
        engine.deliverResults();
        RunRequest retry = engine.takeRunRequests().get(0);
        assertThat(retry.attempt()).isEqualTo(2);
        assertThat(retry.nonce()).isNotEqualTo(request.nonce());

        assertThat(engine.reconciler.onMessage(
            engine.codec.encode(TaskCompletionMessage.success(request, json("\"late\""))))).isEmpty();

        assertThat(engine.reconciler.onMessage(
            engine.codec.encode(TaskCompletionMessage.success(retry, json("\"fresh\""))))).isPresent();
        assertThat(engine.service.getExecution(executionId).output()).isEqualTo(json("\"fresh\""));
    }

    @Test
    @DisplayName("A retry timer for a task that is not DELAYED should be dropped")
    void testTimerForRunningTaskDropped() {
        RetryTimerMessage timer = new RetryTimerMessage(request.taskExecutionId(), executionId, 1);

        assertThat(engine.reconciler.onMessage(engine.codec.encode(timer))).isEmpty();
        assertThat(engine.metrics.counterValue(EngineMetrics.STALE_EVENTS, "event", "RetryTimerMessage"))
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Messages for unknown task executions should be dropped")
    void testUnknownTaskDropped() {
        RetryTimerMessage timer = new RetryTimerMessage(UUID.randomUUID(), executionId, 1);

        assertThat(engine.reconciler.onMessage(engine.codec.encode(timer))).isEmpty();
    }

    @Test
    @DisplayName("Undecodable payloads should be dropped and counted")
    void testMalformedDropped() {
        assertThat(engine.reconciler.onMessage("")).isEmpty();
        assertThat(engine.reconciler.onMessage("[1,2")).isEmpty();

        assertThat(engine.metrics.counterValue(EngineMetrics.MALFORMED_MESSAGES)).isEqualTo(2.0);
    }
}
