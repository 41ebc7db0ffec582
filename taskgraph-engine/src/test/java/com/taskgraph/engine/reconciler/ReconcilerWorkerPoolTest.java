package com.taskgraph.engine.reconciler;

import com.taskgraph.core.message.RunRequest;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.TaskSpec;
import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.core.test.TimeController;
import com.taskgraph.engine.test.EngineHarness;
import com.taskgraph.engine.test.FlakyChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import static com.taskgraph.engine.test.EngineHarness.json;
import static org.assertj.core.api.Assertions.assertThat;

public class ReconcilerWorkerPoolTest {

    private final FlakyChannel channel = new FlakyChannel();
    private final EngineHarness engine = new EngineHarness(TimeController.frozen(), channel);
    private final ReconcilerWorkerPool pool = new ReconcilerWorkerPool(
        channel, engine.reconciler, EngineHarness.RESULT_TOPIC, 1, Duration.ofMillis(20));

    @AfterEach
    void tearDown() {
        pool.stop();
        engine.close();
    }

    @Test
    @DisplayName("A failed poll should reopen the consumer and keep reconciling")
    void testRecoversFromPollFailure() throws InterruptedException {
        channel.failNextPolls(1);
        pool.start();
        await(() -> pool.getFailureCount() == 1);

        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("single")
            .task(TaskSpec.builder("only").action("only").build())
            .build());
        UUID executionId = engine.service.startExecution(id, json("{}"));
        List<RunRequest> requests = engine.takeRunRequests();
        assertThat(requests).hasSize(1);
        engine.succeed(requests.get(0), "{\"ok\":true}");

        await(() -> engine.service.getExecution(executionId).isTerminal());

        assertThat(engine.service.getExecution(executionId).status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(pool.getProcessedCount()).isEqualTo(1);
        assertThat(pool.getLiveThreads()).isEqualTo(1);
        // Two harness consumers, the first pool consumer and its replacement
        assertThat(channel.openedConsumers()).isEqualTo(4);
    }

    @Test
    @DisplayName("Stopping should end every thread")
    void testStop() throws InterruptedException {
        pool.start();
        assertThat(pool.getLiveThreads()).isEqualTo(1);

        pool.stop();

        assertThat(pool.isRunning()).isFalse();
        await(() -> pool.getLiveThreads() == 0);
        assertThat(pool.getLiveThreads()).isZero();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
    }
}
