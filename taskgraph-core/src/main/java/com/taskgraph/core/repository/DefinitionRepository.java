package com.taskgraph.core.repository;

import com.taskgraph.core.model.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for workflow definitions.
 * Definitions are immutable once stored.
 */
public interface DefinitionRepository {

    /**
     * Store a new workflow definition.
     *
     * @throws IllegalArgumentException if the same name and version already exist
     */
    void save(WorkflowDefinition definition);

    Optional<WorkflowDefinition> find(String name, int version);

    Optional<WorkflowDefinition> findLatest(String name);

    /**
     * All versions of a workflow, newest first.
     */
    List<WorkflowDefinition> listVersions(String name);

    /**
     * @return the next version number (1 if no versions exist)
     */
    int getNextVersion(String name);
}
