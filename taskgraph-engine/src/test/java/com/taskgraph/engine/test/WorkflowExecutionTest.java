package com.taskgraph.engine.test;

import com.taskgraph.core.message.RunRequest;
import com.taskgraph.core.message.TaskCompletionMessage;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.RetryPolicy;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.TaskSpec;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.engine.metrics.EngineMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static com.taskgraph.engine.test.EngineHarness.json;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end runs through service, coordinator, dispatcher, channel and reconciler.
 */
public class WorkflowExecutionTest {

    private final EngineHarness engine = new EngineHarness();

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("fetch -> process -> store should end SUCCESS with the store result")
    void testLinearWorkflowCompletes() {
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("etl")
            .task(task("fetch"))
            .task(task("process"))
            .task(task("store"))
            .onSuccess("fetch", "process")
            .onSuccess("process", "store")
            .build());

        UUID executionId = engine.service.startExecution(id, json("{\"url\":\"x\"}"));

        engine.runUntilIdle(request -> {
            switch (request.taskName()) {
                case "fetch":
                    assertThat(request.input()).isEqualTo(json("{\"url\":\"x\"}"));
                    return TaskCompletionMessage.success(request, json("{\"body\":\"page\"}"));
                case "process":
                    return TaskCompletionMessage.success(request, json("{\"rows\":1}"));
                default:
                    return TaskCompletionMessage.success(request, json("{\"ok\":true}"));
            }
        });

        Execution execution = engine.service.getExecution(executionId);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(execution.output()).isEqualTo(json("{\"ok\":true}"));
        assertThat(engine.service.listTaskExecutions(executionId))
            .extracting(TaskExecution::taskName)
            .containsExactly("fetch", "process", "store");
        assertThat(engine.metrics.counterValue(EngineMetrics.EXECUTIONS_FINISHED, "status", "SUCCESS"))
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("A task failing on every attempt should end the execution in ERROR")
    void testRetriesExhausted() {
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("flaky")
            .task(TaskSpec.builder("fetch").action("http")
                .retryPolicy(RetryPolicy.builder()
                    .maxAttempts(3)
                    .initialDelay(Duration.ofSeconds(1))
                    .multiplier(2.0)
                    .jitter(0.0)
                    .build())
                .build())
            .task(task("process"))
            .onSuccess("fetch", "process")
            .build());

        UUID executionId = engine.service.startExecution(id, json("{}"));

        for (int attempt = 1; attempt <= 3; attempt++) {
            List<RunRequest> requests = engine.takeRunRequests();
            assertThat(requests).hasSize(1);
            assertThat(requests.get(0).attempt()).isEqualTo(attempt);
            engine.fail(requests.get(0), "HTTP_503", "unavailable #" + attempt);
            engine.deliverResults();

            // Timers only fire once due
            assertThat(engine.fireDueRetries()).isZero();
            engine.clock.advanceSeconds(5);
            engine.fireDueRetries();
            engine.deliverResults();
        }

        Execution execution = engine.service.getExecution(executionId);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(execution.errorTask()).isEqualTo("fetch");
        assertThat(execution.errorCode()).isEqualTo("HTTP_503");
        assertThat(execution.errorMessage()).isEqualTo("unavailable #3");
        assertThat(engine.takeRunRequests()).isEmpty();
    }

    @Test
    @DisplayName("With-items ALL should fan out and run the next task once every item succeeded")
    void testWithItemsAll() {
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("batch")
            .task(TaskSpec.builder("resize").action("image")
                .withItems("$input/images")
                .input(json("{\"image\":\"$item\"}"))
                .build())
            .task(TaskSpec.builder("publish").action("cdn").input(json("{\"images\":\"$task.resize\"}")).build())
            .onSuccess("resize", "publish")
            .build());

        UUID executionId = engine.service.startExecution(id, json("{\"images\":[\"a.png\",\"b.png\",\"c.png\"]}"));

        List<RunRequest> items = engine.takeRunRequests();
        assertThat(items).extracting(r -> r.input().get("image").asText())
            .containsExactly("a.png", "b.png", "c.png");

        engine.succeed(items.get(0), "\"A\"");
        engine.succeed(items.get(1), "\"B\"");
        engine.deliverResults();
        assertThat(engine.takeRunRequests()).isEmpty();

        engine.succeed(items.get(2), "\"C\"");
        engine.deliverResults();

        List<RunRequest> publish = engine.takeRunRequests();
        assertThat(publish).hasSize(1);
        assertThat(publish.get(0).input()).isEqualTo(json("{\"images\":[\"A\",\"B\",\"C\"]}"));

        engine.succeed(publish.get(0), "{\"published\":3}");
        engine.deliverResults();
        assertThat(engine.service.getExecution(executionId).status()).isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    @DisplayName("Delivering the same completion twice should not duplicate downstream work")
    void testDuplicateDelivery() {
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("dup")
            .task(task("first"))
            .task(task("second"))
            .onSuccess("first", "second")
            .build());
        UUID executionId = engine.service.startExecution(id, json("{}"));

        RunRequest first = engine.takeRunRequests().get(0);
        engine.succeed(first, "1");
        engine.succeed(first, "1");
        engine.deliverResults();

        assertThat(engine.takeRunRequests()).extracting(RunRequest::taskName).containsExactly("second");
        assertThat(engine.service.listTaskExecutions(executionId)).hasSize(2);
        assertThat(engine.metrics.counterValue(EngineMetrics.STALE_EVENTS)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A result carrying another dispatch nonce should be dropped")
    void testForeignNonceDropped() {
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("nonce")
            .task(task("only"))
            .build());
        UUID executionId = engine.service.startExecution(id, json("{}"));

        RunRequest request = engine.takeRunRequests().get(0);
        RunRequest forged = new RunRequest(request.taskExecutionId(), request.executionId(), request.taskName(),
            request.action(), request.input(), request.attempt(), UUID.randomUUID());
        engine.succeed(forged, "\"forged\"");
        engine.deliverResults();

        assertThat(engine.service.getExecution(executionId).status()).isEqualTo(ExecutionStatus.RUNNING);

        engine.succeed(request, "\"real\"");
        engine.deliverResults();
        assertThat(engine.service.getExecution(executionId).output()).isEqualTo(json("\"real\""));
    }

    @Test
    @DisplayName("Malformed messages should be dropped and counted")
    void testMalformedMessage() {
        engine.channel.publish(EngineHarness.RESULT_TOPIC, "k", "{not json");
        engine.channel.publish(EngineHarness.RESULT_TOPIC, "k", "{\"type\":\"mystery\"}");

        assertThat(engine.deliverResults()).isEqualTo(2);
        assertThat(engine.metrics.counterValue(EngineMetrics.MALFORMED_MESSAGES)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("An unhandled with-items failure should fail the execution")
    void testWithItemsFailure() {
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("batch")
            .task(TaskSpec.builder("resize").action("image").withItems("$input").input(json("\"$item\"")).build())
            .task(task("publish"))
            .onSuccess("resize", "publish")
            .defaultRetryPolicy(RetryPolicy.noRetry())
            .build());
        UUID executionId = engine.service.startExecution(id, json("[1,2]"));

        engine.runUntilIdle(request -> request.input().asInt() == 2
            ? TaskCompletionMessage.failure(request, "CORRUPT", "bad image", false)
            : TaskCompletionMessage.success(request, json("\"ok\"")));

        Execution execution = engine.service.getExecution(executionId);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(execution.errorCode()).isEqualTo("CORRUPT");
        assertThat(engine.service.listTaskExecutions(executionId))
            .noneMatch(t -> t.taskName().equals("publish"));
    }

    @Test
    @DisplayName("A loop should re-dispatch until the check passes")
    void testLoop() {
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("poll")
            .task(task("submit"))
            .task(TaskSpec.builder("check").action("status").maxIterations(5).build())
            .onSuccess("submit", "check")
            .onError("check", "check")
            .defaultRetryPolicy(RetryPolicy.noRetry())
            .build());
        UUID executionId = engine.service.startExecution(id, json("{}"));

        int[] checks = {0};
        engine.runUntilIdle(request -> {
            if (request.taskName().equals("check") && ++checks[0] < 3) {
                return TaskCompletionMessage.failure(request, "PENDING", "still running", true);
            }
            return TaskCompletionMessage.success(request, json("{\"done\":true}"));
        });

        assertThat(checks[0]).isEqualTo(3);
        Execution execution = engine.service.getExecution(executionId);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(engine.service.listTaskExecutions(executionId))
            .filteredOn(t -> t.taskName().equals("check"))
            .extracting(TaskExecution::iteration)
            .containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("A dispatch that never reached the channel should stay RUNNING and unconfirmed")
    void testUnconfirmedDispatch() {
        FlakyChannel flaky = new FlakyChannel();
        try (EngineHarness broken = new EngineHarness(engine.clock, flaky)) {
            DefinitionId id = broken.service.registerDefinition(WorkflowDefinition.builder("lost")
                .task(task("only"))
                .build());

            flaky.failNextPublishes(1);
            UUID executionId = broken.service.startExecution(id, json("{}"));

            TaskExecution task = broken.service.listTaskExecutions(executionId).get(0);
            assertThat(task.status()).isEqualTo(TaskStatus.RUNNING);
            assertThat(task.isDispatchConfirmed()).isFalse();
            assertThat(broken.takeRunRequests()).isEmpty();
            assertThat(broken.metrics.counterValue(EngineMetrics.DISPATCH_FAILURES, "action", "only"))
                .isEqualTo(1.0);

            broken.clock.advanceSeconds(60);
            assertThat(broken.store.findUnconfirmedDispatches(broken.clock.instant().minusSeconds(30), 10))
                .extracting(TaskExecution::id)
                .containsExactly(task.id());
        }
    }

    private static TaskSpec task(String name) {
        return TaskSpec.builder(name).action(name).build();
    }
}
