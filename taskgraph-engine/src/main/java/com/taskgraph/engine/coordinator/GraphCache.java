package com.taskgraph.engine.coordinator;

import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.graph.CompiledGraph;
import com.taskgraph.core.graph.GraphCompiler;
import com.taskgraph.core.model.DefinitionId;
import com.taskgraph.core.repository.DefinitionRepository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiled graphs by definition id. Definitions are immutable, so entries never go stale.
 */
public class GraphCache {

    private final DefinitionRepository definitionRepository;
    private final GraphCompiler compiler;
    private final Map<DefinitionId, CompiledGraph> graphs = new ConcurrentHashMap<>();

    public GraphCache(DefinitionRepository definitionRepository, GraphCompiler compiler) {
        this.definitionRepository = definitionRepository;
        this.compiler = compiler;
    }

    public CompiledGraph get(DefinitionId definitionId) {
        return graphs.computeIfAbsent(definitionId, id -> compiler.load(
            definitionRepository.find(id.name(), id.version())
                .orElseThrow(() -> new NotFoundException("WorkflowDefinition", id))));
    }
}
