package com.taskgraph.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Actions available to this worker, by name.
 */
public class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, Action> actions = new ConcurrentHashMap<>();

    public ActionRegistry() {
    }

    public ActionRegistry(Collection<? extends Action> initial) {
        initial.forEach(this::register);
    }

    /**
     * @throws IllegalArgumentException if an action with the same name is already registered
     */
    public void register(Action action) {
        if (actions.putIfAbsent(action.name(), action) != null) {
            throw new IllegalArgumentException("Action already registered: " + action.name());
        }
        log.info("Registered action: {}", action.name());
    }

    public Optional<Action> find(String name) {
        return Optional.ofNullable(actions.get(name));
    }

    public Set<String> names() {
        return new TreeSet<>(actions.keySet());
    }
}
