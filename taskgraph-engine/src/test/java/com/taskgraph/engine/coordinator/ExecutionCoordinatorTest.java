package com.taskgraph.engine.coordinator;

import com.taskgraph.core.message.RunRequest;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionSnapshot;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.TaskSpec;
import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.core.test.TimeController;
import com.taskgraph.engine.metrics.EngineMetrics;
import com.taskgraph.engine.persistence.InMemoryExecutionStore;
import com.taskgraph.engine.scheduler.Decision;
import com.taskgraph.engine.scheduler.EngineEvent;
import com.taskgraph.engine.test.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.taskgraph.engine.test.EngineHarness.json;
import static org.assertj.core.api.Assertions.assertThat;

public class ExecutionCoordinatorTest {

    private final EngineHarness engine = new EngineHarness();

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("A commit that loses the version race should be recomputed on fresh state")
    void testConflictRetry() {
        RacingStore racingStore = new RacingStore(engine.clock);
        ExecutionCoordinator coordinator = engine.coordinatorOn(racingStore);
        ExecutionCoordinator racer = engine.coordinatorOn(racingStore);

        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("parallel")
            .task(TaskSpec.builder("a").action("a").build())
            .task(TaskSpec.builder("b").action("b").build())
            .build());
        Execution execution = racingStore.createExecution(id, json("{}"));
        coordinator.process(execution.id(), new EngineEvent.Start());

        List<RunRequest> requests = engine.takeRunRequests().stream()
            .sorted(Comparator.comparing(RunRequest::taskName))
            .collect(Collectors.toList());
        RunRequest a = requests.get(0);
        RunRequest b = requests.get(1);

        // b's result commits between a's load and a's commit
        racingStore.beforeNextLoadReturns(() ->
            racer.process(execution.id(), new EngineEvent.TaskCompleted(b.taskExecutionId(), 1, json("\"B\""))));

        Decision decision = coordinator.process(execution.id(),
            new EngineEvent.TaskCompleted(a.taskExecutionId(), 1, json("\"A\"")));

        assertThat(decision.execution().status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(decision.execution().output()).isEqualTo(json("{\"a\":\"A\",\"b\":\"B\"}"));
        assertThat(engine.metrics.counterValue(EngineMetrics.COMMIT_CONFLICTS)).isEqualTo(1.0);

        Execution stored = racingStore.findExecution(execution.id()).orElseThrow();
        assertThat(stored.version()).isEqualTo(decision.execution().version());
    }

    @Test
    @DisplayName("A stale event should commit nothing")
    void testStaleEventCommitsNothing() {
        DefinitionId id = engine.service.registerDefinition(WorkflowDefinition.builder("single")
            .task(TaskSpec.builder("only").action("only").build())
            .build());
        UUID executionId = engine.service.startExecution(id, json("{}"));
        long version = engine.service.getExecution(executionId).version();

        Decision decision = engine.coordinator.process(executionId, new EngineEvent.Start());

        assertThat(decision.isStale()).isTrue();
        assertThat(engine.service.getExecution(executionId).version()).isEqualTo(version);
        assertThat(engine.metrics.counterValue(EngineMetrics.STALE_EVENTS, "event", "Start")).isEqualTo(1.0);
    }

    /**
     * Runs a hook once, after the snapshot was read and before it is returned.
     */
    private static class RacingStore extends InMemoryExecutionStore {

        private Runnable hook;

        RacingStore(TimeController clock) {
            super(clock);
        }

        void beforeNextLoadReturns(Runnable hook) {
            this.hook = hook;
        }

        @Override
        public ExecutionSnapshot loadForUpdate(UUID executionId) {
            ExecutionSnapshot snapshot = super.loadForUpdate(executionId);
            Runnable pending = hook;
            hook = null;
            if (pending != null) {
                pending.run();
            }
            return snapshot;
        }
    }
}
