package com.taskgraph.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionSnapshot;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.repository.ExecutionQuery;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behavior every {@link ExecutionStore} has to show.
 */
public abstract class AbstractExecutionStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DefinitionId DEFINITION = new DefinitionId("orders", 1);

    protected TimeController clock;
    protected ExecutionStore store;

    protected abstract ExecutionStore createStore(TimeController clock);

    @BeforeEach
    void setUpStore() {
        clock = TimeController.frozen();
        store = createStore(clock);
    }

    // ========== Commit ==========

    @Test
    @DisplayName("A new execution should load at version 0 without tasks")
    void testCreateAndLoad() {
        Execution created = store.createExecution(DEFINITION, json("{\"orderId\":7}"));

        ExecutionSnapshot snapshot = store.loadForUpdate(created.id());

        assertThat(snapshot.execution().version()).isZero();
        assertThat(snapshot.execution().status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(snapshot.execution().isStarted()).isFalse();
        assertThat(snapshot.execution().input()).isEqualTo(json("{\"orderId\":7}"));
        assertThat(snapshot.taskExecutions()).isEmpty();
    }

    @Test
    @DisplayName("A commit should write the execution and its task executions together")
    void testCommit() {
        Execution execution = store.createExecution(DEFINITION, json("{}"));
        TaskExecution task = running(execution.id(), "fetch");

        store.commit(started(execution), List.of(task));

        ExecutionSnapshot snapshot = store.loadForUpdate(execution.id());
        assertThat(snapshot.execution().version()).isEqualTo(1);
        assertThat(snapshot.execution().startedAt()).isEqualTo(clock.instant());
        assertThat(snapshot.taskExecutions()).hasSize(1);

        TaskExecution loaded = snapshot.taskExecutions().get(0);
        assertThat(loaded.id()).isEqualTo(task.id());
        assertThat(loaded.status()).isEqualTo(TaskStatus.RUNNING);
        assertThat(loaded.input()).isEqualTo(json("{\"url\":\"x\"}"));
        assertThat(loaded.dispatchNonce()).isEqualTo(task.dispatchNonce());
        assertThat(loaded.satisfiedInbound()).isEqualTo(task.satisfiedInbound());
        assertThat(store.findTaskExecution(task.id())).isPresent();
    }

    @Test
    @DisplayName("A commit based on an outdated version should conflict and change nothing")
    void testCommitConflict() {
        Execution execution = store.createExecution(DEFINITION, json("{}"));
        Execution first = started(execution);
        store.commit(first, List.of());

        TaskExecution lost = running(execution.id(), "lost");
        assertThatThrownBy(() -> store.commit(started(execution), List.of(lost)))
            .isInstanceOf(ConflictException.class);

        assertThat(store.findExecution(execution.id()).orElseThrow().version()).isEqualTo(1);
        assertThat(store.findTaskExecution(lost.id())).isEmpty();
    }

    @Test
    @DisplayName("Unknown executions should raise NotFoundException")
    void testUnknownExecution() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> store.loadForUpdate(unknown)).isInstanceOf(NotFoundException.class);
        assertThat(store.findExecution(unknown)).isEmpty();
        assertThat(store.listTaskExecutions(unknown)).isEmpty();
        assertThat(store.deleteExecution(unknown)).isFalse();
    }

    // ========== Dispatch bookkeeping ==========

    @Test
    @DisplayName("Dispatch confirmation should only apply to the current nonce and survive a later commit")
    void testMarkDispatched() {
        Execution execution = store.createExecution(DEFINITION, json("{}"));
        TaskExecution task = running(execution.id(), "fetch");
        Execution v1 = started(execution);
        store.commit(v1, List.of(task));

        assertThat(store.markDispatched(task.id(), UUID.randomUUID(), clock.instant())).isFalse();
        assertThat(store.markDispatched(task.id(), task.dispatchNonce(), clock.instant())).isTrue();

        // Written from a snapshot taken before the confirmation
        TaskExecution unchangedNonce = task.toBuilder().ready(false).updatedAt(clock.instant()).build();
        store.commit(v1.toBuilder().incrementVersion().build(), List.of(unchangedNonce));

        assertThat(store.findTaskExecution(task.id()).orElseThrow().isDispatchConfirmed()).isTrue();
    }

    @Test
    @DisplayName("Recording a re-dispatch should bump the count for a RUNNING task only")
    void testRecordDispatchAttempt() {
        Execution execution = store.createExecution(DEFINITION, json("{}"));
        TaskExecution task = running(execution.id(), "fetch");
        store.commit(started(execution), List.of(task));

        clock.advanceSeconds(30);
        assertThat(store.recordDispatchAttempt(task.id(), task.dispatchNonce(), clock.instant())).isTrue();
        assertThat(store.recordDispatchAttempt(task.id(), UUID.randomUUID(), clock.instant())).isFalse();

        TaskExecution stored = store.findTaskExecution(task.id()).orElseThrow();
        assertThat(stored.dispatchCount()).isEqualTo(2);
        assertThat(stored.dispatchedAt()).isEqualTo(clock.instant());
    }

    // ========== Sweeps ==========

    @Test
    @DisplayName("Sweep queries should find due retries, lost dispatches, timeouts and unstarted executions")
    void testSweeps() {
        Instant t0 = clock.instant();
        Execution unstarted = store.createExecution(DEFINITION, json("{}"));
        Execution execution = store.createExecution(DEFINITION, json("{}"));

        TaskExecution delayed = running(execution.id(), "delayed")
            .toDelayed("FLAKY", "try again", t0.plusSeconds(5), t0);
        TaskExecution unconfirmed = running(execution.id(), "unconfirmed");
        TaskExecution timed = TaskExecution.waiting(execution.id(), "timed", 0, t0)
            .toRunning(json("{}"), 1, t0, t0.plusSeconds(60));
        store.commit(started(execution), List.of(delayed, unconfirmed, timed));
        store.markDispatched(timed.id(), timed.dispatchNonce(), t0);

        assertThat(store.findDueRetries(t0, 10)).isEmpty();
        assertThat(store.findDueRetries(t0.plusSeconds(5), 10))
            .extracting(TaskExecution::id).containsExactly(delayed.id());

        assertThat(store.findUnconfirmedDispatches(t0, 10)).isEmpty();
        assertThat(store.findUnconfirmedDispatches(t0.plusSeconds(1), 10))
            .extracting(TaskExecution::id).containsExactly(unconfirmed.id());

        assertThat(store.findTimedOutTasks(t0.plusSeconds(59), 10)).isEmpty();
        assertThat(store.findTimedOutTasks(t0.plusSeconds(60), 10))
            .extracting(TaskExecution::id).containsExactly(timed.id());

        assertThat(store.findUnstartedExecutions(t0.plusSeconds(1), 10))
            .extracting(Execution::id).containsExactly(unstarted.id());
    }

    @Test
    @DisplayName("Retries of an execution that is no longer RUNNING should not be due")
    void testDueRetriesSkipPaused() {
        Instant t0 = clock.instant();
        Execution execution = store.createExecution(DEFINITION, json("{}"));
        TaskExecution delayed = running(execution.id(), "delayed")
            .toDelayed("FLAKY", "try again", t0, t0);
        Execution v1 = started(execution);
        store.commit(v1, List.of(delayed));
        store.commit(v1.toBuilder().status(ExecutionStatus.PAUSED).incrementVersion().build(), List.of());

        assertThat(store.findDueRetries(t0.plusSeconds(1), 10)).isEmpty();
    }

    // ========== Listing ==========

    @Test
    @DisplayName("Listing should filter, page by marker and count by status")
    void testListAndCount() {
        Execution a = store.createExecution(DEFINITION, json("{}"));
        clock.advanceSeconds(1);
        Execution b = store.createExecution(new DefinitionId("billing", 1), json("{}"));
        clock.advanceSeconds(1);
        Execution c = store.createExecution(DEFINITION, json("{}"));
        store.commit(c.toBuilder()
            .status(ExecutionStatus.CANCELLED)
            .completedAt(clock.instant())
            .incrementVersion()
            .build(), List.of());

        assertThat(store.listExecutions(new ExecutionQuery(null, null, null, 2)))
            .extracting(Execution::id).containsExactly(a.id(), b.id());
        assertThat(store.listExecutions(new ExecutionQuery(null, null, b.id(), 2)))
            .extracting(Execution::id).containsExactly(c.id());
        assertThat(store.listExecutions(new ExecutionQuery("orders", null, null, 10)))
            .extracting(Execution::id).containsExactly(a.id(), c.id());
        assertThat(store.listExecutions(new ExecutionQuery(null, ExecutionStatus.CANCELLED, null, 10)))
            .extracting(Execution::id).containsExactly(c.id());

        Map<ExecutionStatus, Long> counts = store.countByStatus();
        assertThat(counts).containsEntry(ExecutionStatus.RUNNING, 2L).containsEntry(ExecutionStatus.CANCELLED, 1L);
    }

    @Test
    @DisplayName("Listing should order by the requested timestamp and direction")
    void testListSorted() {
        Execution a = store.createExecution(DEFINITION, json("{}"));
        clock.advanceSeconds(1);
        Execution b = store.createExecution(DEFINITION, json("{}"));
        clock.advanceSeconds(1);
        Execution c = store.createExecution(DEFINITION, json("{}"));
        clock.advanceSeconds(1);
        store.commit(a.toBuilder()
            .updatedAt(clock.instant())
            .incrementVersion()
            .build(), List.of());

        ExecutionQuery newestFirst = new ExecutionQuery(null, null, null, 2)
            .sortedBy(ExecutionQuery.SortKey.CREATED_AT, ExecutionQuery.SortDirection.DESC);
        assertThat(store.listExecutions(newestFirst))
            .extracting(Execution::id).containsExactly(c.id(), b.id());
        assertThat(store.listExecutions(newestFirst.after(b.id())))
            .extracting(Execution::id).containsExactly(a.id());

        ExecutionQuery recentlyUpdated = ExecutionQuery.all()
            .sortedBy(ExecutionQuery.SortKey.UPDATED_AT, ExecutionQuery.SortDirection.DESC);
        assertThat(store.listExecutions(recentlyUpdated))
            .extracting(Execution::id).containsExactly(a.id(), c.id(), b.id());
    }

    @Test
    @DisplayName("Deleting should remove the execution and its task executions")
    void testDelete() {
        Execution execution = store.createExecution(DEFINITION, json("{}"));
        TaskExecution task = running(execution.id(), "fetch");
        store.commit(started(execution), List.of(task));

        assertThat(store.deleteExecution(execution.id())).isTrue();

        assertThat(store.findExecution(execution.id())).isEmpty();
        assertThat(store.findTaskExecution(task.id())).isEmpty();
        assertThat(store.listTaskExecutions(execution.id())).isEmpty();
    }

    // ========== Helpers ==========

    private Execution started(Execution execution) {
        return execution.toBuilder()
            .startedAt(clock.instant())
            .updatedAt(clock.instant())
            .incrementVersion()
            .build();
    }

    private TaskExecution running(UUID executionId, String taskName) {
        return TaskExecution.waiting(executionId, taskName, 0, clock.instant())
            .withInbound("start")
            .toRunning(json("{\"url\":\"x\"}"), 1, clock.instant(), null);
    }

    protected static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
