package com.taskgraph.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.core.repository.ExecutionQuery;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for workflow orchestration: definition intake, execution lifecycle
 * and queries on committed state.
 */
public interface WorkflowService {

    /**
     * Validate and register a workflow definition under the next version of its name.
     *
     * @param definition The workflow definition; its version is ignored
     * @return The id the definition was stored under
     * @throws com.taskgraph.core.exception.DefinitionException if the graph is invalid
     */
    DefinitionId registerDefinition(WorkflowDefinition definition);

    /**
     * @throws com.taskgraph.core.exception.NotFoundException if the definition does not exist
     */
    WorkflowDefinition getDefinition(DefinitionId definitionId);

    /**
     * Start a new execution of the given definition.
     * Task failures surface later on the execution, never as an exception here.
     *
     * @param definitionId The definition to run
     * @param input The execution input
     * @return The execution id
     * @throws com.taskgraph.core.exception.NotFoundException if the definition does not exist
     */
    UUID startExecution(DefinitionId definitionId, JsonNode input);

    /**
     * Start a new execution of the latest version of the named workflow.
     */
    UUID startExecution(String workflowName, JsonNode input);

    /**
     * @throws com.taskgraph.core.exception.NotFoundException if the execution does not exist
     */
    Execution getExecution(UUID executionId);

    List<TaskExecution> listTaskExecutions(UUID executionId);

    List<Execution> listExecutions(ExecutionQuery query);

    /**
     * Cancel a non-terminal execution. Actions already running are not interrupted.
     *
     * @throws com.taskgraph.core.exception.InvalidStateTransitionException if the execution is terminal
     */
    void cancelExecution(UUID executionId, String reason);

    /**
     * Stop starting new tasks. Results of running tasks are still applied.
     */
    void pauseExecution(UUID executionId, String reason);

    void resumeExecution(UUID executionId);

    /**
     * Remove a terminal execution and its task executions.
     *
     * @throws com.taskgraph.core.exception.InvalidStateTransitionException if the execution is not terminal
     */
    void deleteExecution(UUID executionId);
}
