package com.taskgraph.core.model;

/**
 * Identity of a registered workflow definition.
 */
public record DefinitionId(String name, int version) {

    @Override
    public String toString() {
        return name + ":" + version;
    }
}
