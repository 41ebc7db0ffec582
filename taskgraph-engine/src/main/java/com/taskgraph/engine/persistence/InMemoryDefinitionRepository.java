package com.taskgraph.engine.persistence;

import com.taskgraph.core.model.WorkflowDefinition;
import com.taskgraph.core.repository.DefinitionRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of DefinitionRepository.
 * For tests and single-node deployments.
 */
public class InMemoryDefinitionRepository implements DefinitionRepository {

    // Key: name:version
    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();

    private String buildKey(String name, int version) {
        return name + ":" + version;
    }

    @Override
    public void save(WorkflowDefinition definition) {
        String key = buildKey(definition.name(), definition.version());
        if (definitions.putIfAbsent(key, definition) != null) {
            throw new IllegalArgumentException("Workflow definition already exists: " + definition.id());
        }
    }

    @Override
    public Optional<WorkflowDefinition> find(String name, int version) {
        return Optional.ofNullable(definitions.get(buildKey(name, version)));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .max(Comparator.comparingInt(WorkflowDefinition::version));
    }

    @Override
    public List<WorkflowDefinition> listVersions(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .sorted(Comparator.comparingInt(WorkflowDefinition::version).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public int getNextVersion(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .mapToInt(WorkflowDefinition::version)
            .max()
            .orElse(0) + 1;
    }
}
