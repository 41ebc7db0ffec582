package com.taskgraph.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskgraph.core.exception.ConflictException;
import com.taskgraph.core.exception.InvalidStateTransitionException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.graph.GraphCompiler;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.model.Execution;
import com.taskgraph.core.model.ExecutionStatus;
import com.taskgraph.core.model.TaskExecution;
import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.core.repository.DefinitionRepository;
import com.taskgraph.core.repository.ExecutionQuery;
import com.taskgraph.core.repository.ExecutionStore;
import com.taskgraph.engine.logging.LoggingContext;
import com.taskgraph.engine.scheduler.EngineEvent;
import com.taskgraph.engine.service.WorkflowService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Default {@link WorkflowService}.
 *
 * State changes are turned into events and go through the {@link ExecutionCoordinator},
 * the same path worker results take. The status checks here only give callers a clear
 * error; a request that races with another change is dropped by the scheduler as stale.
 */
public class WorkflowCoordinator implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private static final int MAX_REGISTRATION_ATTEMPTS = 3;

    private final DefinitionRepository definitionRepository;
    private final ExecutionStore executionStore;
    private final ExecutionCoordinator executionCoordinator;
    private final GraphCompiler compiler;
    private final Clock clock;

    public WorkflowCoordinator(
            DefinitionRepository definitionRepository,
            ExecutionStore executionStore,
            ExecutionCoordinator executionCoordinator,
            GraphCompiler compiler,
            Clock clock) {
        this.definitionRepository = definitionRepository;
        this.executionStore = executionStore;
        this.executionCoordinator = executionCoordinator;
        this.compiler = compiler;
        this.clock = clock;
    }

    // ========== Definitions ==========

    @Override
    public DefinitionId registerDefinition(WorkflowDefinition definition) {
        compiler.load(definition);

        for (int attempt = 1; ; attempt++) {
            int version = definitionRepository.getNextVersion(definition.name());
            WorkflowDefinition versioned = definition.withVersion(version, clock.instant());
            try {
                definitionRepository.save(versioned);
                log.info("Registered workflow {} v{} with {} tasks",
                    versioned.name(), version, versioned.tasks().size());
                return versioned.id();
            } catch (IllegalArgumentException e) {
                // Concurrent registration took the version
                if (attempt >= MAX_REGISTRATION_ATTEMPTS) {
                    throw e;
                }
            }
        }
    }

    @Override
    public WorkflowDefinition getDefinition(DefinitionId definitionId) {
        return definitionRepository.find(definitionId.name(), definitionId.version())
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", definitionId));
    }

    // ========== Execution Lifecycle ==========

    @Override
    public UUID startExecution(DefinitionId definitionId, JsonNode input) {
        WorkflowDefinition definition = getDefinition(definitionId);
        return start(definition, input);
    }

    @Override
    public UUID startExecution(String workflowName, JsonNode input) {
        WorkflowDefinition definition = definitionRepository.findLatest(workflowName)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", workflowName));
        return start(definition, input);
    }

    @Override
    public void cancelExecution(UUID executionId, String reason) {
        Execution execution = getExecution(executionId);
        if (execution.isTerminal()) {
            throw new InvalidStateTransitionException(execution.status(), ExecutionStatus.CANCELLED);
        }
        try (var ctx = LoggingContext.forExecution(executionId)) {
            log.info("Cancelling execution: {}", reason);
        }
        executionCoordinator.process(executionId, new EngineEvent.CancelRequested(reason));
    }

    @Override
    public void pauseExecution(UUID executionId, String reason) {
        Execution execution = getExecution(executionId);
        if (execution.status() != ExecutionStatus.RUNNING) {
            throw new InvalidStateTransitionException(execution.status(), ExecutionStatus.PAUSED);
        }
        try (var ctx = LoggingContext.forExecution(executionId)) {
            log.info("Pausing execution: {}", reason);
        }
        executionCoordinator.process(executionId, new EngineEvent.PauseRequested(reason));
    }

    @Override
    public void resumeExecution(UUID executionId) {
        Execution execution = getExecution(executionId);
        if (execution.status() != ExecutionStatus.PAUSED) {
            throw new InvalidStateTransitionException(execution.status(), ExecutionStatus.RUNNING);
        }
        try (var ctx = LoggingContext.forExecution(executionId)) {
            log.info("Resuming execution");
        }
        executionCoordinator.process(executionId, new EngineEvent.ResumeRequested());
    }

    @Override
    public void deleteExecution(UUID executionId) {
        Execution execution = getExecution(executionId);
        if (!execution.isTerminal()) {
            throw new InvalidStateTransitionException(
                "Cannot delete execution " + executionId + " in status " + execution.status());
        }
        executionStore.deleteExecution(executionId);
        log.info("Deleted execution {}", executionId);
    }

    // ========== Queries ==========

    @Override
    public Execution getExecution(UUID executionId) {
        return executionStore.findExecution(executionId)
            .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }

    @Override
    public List<TaskExecution> listTaskExecutions(UUID executionId) {
        getExecution(executionId);
        return executionStore.listTaskExecutions(executionId);
    }

    @Override
    public List<Execution> listExecutions(ExecutionQuery query) {
        return executionStore.listExecutions(query);
    }

    // ========== Internal Methods ==========

    private UUID start(WorkflowDefinition definition, JsonNode input) {
        Execution execution = executionStore.createExecution(definition.id(), input);
        try (var ctx = LoggingContext.forExecution(execution.id())) {
            log.info("Created execution of {} v{}", definition.name(), definition.version());
        }
        try {
            executionCoordinator.process(execution.id(), new EngineEvent.Start());
        } catch (ConflictException e) {
            // The execution exists; recovery re-issues the start
            log.warn("Start of execution {} not committed, leaving it to recovery: {}",
                execution.id(), e.getMessage());
        }
        return execution.id();
    }
}
