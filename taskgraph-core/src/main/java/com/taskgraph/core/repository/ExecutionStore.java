package com.taskgraph.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionSnapshot;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.TaskExecution;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable store of executions and their task executions.
 *
 * All mutation of an execution goes through {@link #loadForUpdate} followed by
 * {@link #commit}; the version check on the execution row is the only
 * serialization between concurrent workers.
 */
public interface ExecutionStore {

    /**
     * Create a new execution in RUNNING status, not yet started.
     */
    Execution createExecution(DefinitionId definitionId, JsonNode input);

    /**
     * Read an execution and all of its task executions for a read-modify-write cycle.
     *
     * @throws com.taskgraph.core.exception.NotFoundException if the execution does not exist
     */
    ExecutionSnapshot loadForUpdate(UUID executionId);

    /**
     * Atomically write the execution and the changed task executions.
     * The stored version must equal {@code execution.version() - 1}.
     *
     * @throws com.taskgraph.core.exception.ConflictException if another commit won
     */
    void commit(Execution execution, Collection<TaskExecution> changedTaskExecutions);

    // ========== Queries ==========

    Optional<Execution> findExecution(UUID executionId);

    Optional<TaskExecution> findTaskExecution(UUID taskExecutionId);

    /**
     * All task executions of an execution, in creation order.
     */
    List<TaskExecution> listTaskExecutions(UUID executionId);

    /**
     * @throws com.taskgraph.core.exception.NotFoundException if the marker does not exist
     */
    List<Execution> listExecutions(ExecutionQuery query);

    Map<ExecutionStatus, Long> countByStatus();

    // ========== Sweeps ==========

    /**
     * DELAYED task executions whose retry time has passed, for RUNNING executions only.
     */
    List<TaskExecution> findDueRetries(Instant now, int limit);

    /**
     * RUNNING task executions dispatched before the given time and never confirmed.
     */
    List<TaskExecution> findUnconfirmedDispatches(Instant dispatchedBefore, int limit);

    /**
     * RUNNING task executions past their timeout.
     */
    List<TaskExecution> findTimedOutTasks(Instant now, int limit);

    /**
     * Executions created before the given time whose start never committed.
     */
    List<Execution> findUnstartedExecutions(Instant createdBefore, int limit);

    // ========== Dispatch bookkeeping ==========

    /**
     * Record that the run request for the given attempt reached the transport.
     * Only applies while the nonce still matches.
     *
     * @return true if the task execution was updated
     */
    boolean markDispatched(UUID taskExecutionId, UUID nonce, Instant at);

    /**
     * Record another dispatch attempt of a still unconfirmed run request.
     * Only applies while the task execution is RUNNING with the same nonce.
     *
     * @return true if the task execution was updated
     */
    boolean recordDispatchAttempt(UUID taskExecutionId, UUID nonce, Instant at);

    /**
     * Remove an execution and its task executions.
     *
     * @return true if something was deleted
     */
    boolean deleteExecution(UUID executionId);
}
