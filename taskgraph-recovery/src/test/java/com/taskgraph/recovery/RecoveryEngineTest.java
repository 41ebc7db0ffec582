package com.taskgraph.recovery;

import com.taskgraph.core.exception.DispatchException;
import com.taskgraph.core.graph.GraphCompiler;
import com.taskgraph.core.message.RunRequest;
import com.taskgraph.core.message.TaskCompletionMessage;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.RetryPolicy;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.TaskSpec;
import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.core.test.TimeController;
import com.taskgraph.engine.coordinator.GraphCache;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.test.EngineHarness;
import com.taskgraph.engine.test.FlakyChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static com.taskgraph.engine.test.EngineHarness.json;
import static org.assertj.core.api.Assertions.assertThat;

public class RecoveryEngineTest {

    private FlakyChannel channel;
    private EngineHarness engine;
    private RecoveryEngine recovery;
    private DefinitionId definitionId;

    @BeforeEach
    void setUp() {
        channel = new FlakyChannel();
        engine = new EngineHarness(TimeController.frozen(), channel);
        recovery = new RecoveryEngine(
            engine.store,
            engine.coordinator,
            new GraphCache(engine.definitions, new GraphCompiler()),
            engine.dispatcher,
            engine.metrics,
            engine.clock,
            new RecoveryEngine.RecoverySettings(
                Duration.ofSeconds(10),
                Duration.ofSeconds(30),
                3,
                Duration.ofSeconds(30),
                100
            )
        );

        definitionId = engine.service.registerDefinition(WorkflowDefinition.builder("sync")
            .task(TaskSpec.builder("fetch").action("http").timeout(Duration.ofMinutes(5)).build())
            .task(TaskSpec.builder("store").action("db").build())
            .onSuccess("fetch", "store")
            .defaultRetryPolicy(RetryPolicy.noRetry())
            .build());
    }

    @AfterEach
    void tearDown() {
        recovery.stop();
        engine.close();
    }

    @Test
    @DisplayName("A run request lost after commit should be re-dispatched with the same nonce")
    void testRedispatchesUnconfirmed() {
        channel.failNextPublishes(1);
        UUID executionId = engine.service.startExecution(definitionId, json("{}"));
        TaskExecution lost = engine.service.listTaskExecutions(executionId).get(0);
        assertThat(engine.takeRunRequests()).isEmpty();

        // Not stale yet
        engine.clock.advanceSeconds(10);
        assertThat(recovery.sweep().total()).isZero();

        engine.clock.advanceSeconds(25);
        RecoveryEngine.SweepResult result = recovery.sweep();

        assertThat(result.redispatched()).isEqualTo(1);
        List<RunRequest> requests = engine.takeRunRequests();
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).nonce()).isEqualTo(lost.dispatchNonce());
        assertThat(requests.get(0).attempt()).isEqualTo(1);

        TaskExecution recovered = engine.store.findTaskExecution(lost.id()).orElseThrow();
        assertThat(recovered.isDispatchConfirmed()).isTrue();
        assertThat(recovered.dispatchCount()).isEqualTo(2);
        assertThat(engine.metrics.counterValue(EngineMetrics.RECOVERY_ACTIONS, "action", "redispatch"))
            .isEqualTo(1.0);

        engine.runUntilIdle(request -> TaskCompletionMessage.success(request, json("{}")));
        assertThat(engine.service.getExecution(executionId).status()).isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    @DisplayName("A task whose dispatch never gets through should fail with DISPATCH_FAILED")
    void testAbandonsAfterMaxDispatches() {
        channel.failNextPublishes(Integer.MAX_VALUE);
        UUID executionId = engine.service.startExecution(definitionId, json("{}"));

        engine.clock.advanceSeconds(31);
        assertThat(recovery.sweep().redispatched()).isEqualTo(1);
        engine.clock.advanceSeconds(31);
        assertThat(recovery.sweep().redispatched()).isEqualTo(1);
        engine.clock.advanceSeconds(31);
        assertThat(recovery.sweep().abandoned()).isEqualTo(1);

        Execution execution = engine.service.getExecution(executionId);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(execution.errorTask()).isEqualTo("fetch");
        assertThat(execution.errorCode()).isEqualTo(DispatchException.ERROR_CODE);
    }

    @Test
    @DisplayName("A task past its timeout should fail with TIMEOUT and its late result be dropped")
    void testTimesOutTasks() {
        UUID executionId = engine.service.startExecution(definitionId, json("{}"));
        RunRequest fetch = engine.takeRunRequests().get(0);

        engine.clock.advanceMinutes(4);
        assertThat(recovery.sweep().timedOut()).isZero();

        engine.clock.advanceMinutes(1);
        assertThat(recovery.sweep().timedOut()).isEqualTo(1);

        Execution execution = engine.service.getExecution(executionId);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(execution.errorCode()).isEqualTo(RecoveryEngine.TIMEOUT);

        engine.succeed(fetch, "{}");
        engine.deliverResults();
        assertThat(engine.takeRunRequests()).isEmpty();
    }

    @Test
    @DisplayName("An execution created without a committed Start should be started")
    void testStartsUnstartedExecutions() {
        Execution orphan = engine.store.createExecution(definitionId, json("{\"id\":1}"));

        engine.clock.advanceSeconds(31);
        assertThat(recovery.sweep().started()).isEqualTo(1);

        assertThat(engine.takeRunRequests())
            .extracting(RunRequest::taskName)
            .containsExactly("fetch");
        assertThat(engine.service.getExecution(orphan.id()).isStarted()).isTrue();

        assertThat(recovery.sweep().started()).isZero();
    }
}
