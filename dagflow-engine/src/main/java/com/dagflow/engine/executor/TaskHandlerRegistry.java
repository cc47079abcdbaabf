package com.dagflow.engine.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves executable references to task handlers.
 */
public class TaskHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskHandlerRegistry.class);

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register a handler, replacing any handler already registered under the same reference.
     */
    public TaskHandlerRegistry register(String executableRef, TaskHandler handler) {
        if (executableRef == null || executableRef.isBlank()) {
            throw new IllegalArgumentException("executableRef cannot be empty");
        }
        if (handlers.put(executableRef, handler) != null) {
            log.warn("Replaced task handler for {}", executableRef);
        }
        return this;
    }

    public Optional<TaskHandler> find(String executableRef) {
        return Optional.ofNullable(handlers.get(executableRef));
    }

    public boolean contains(String executableRef) {
        return handlers.containsKey(executableRef);
    }

    public Set<String> registeredRefs() {
        return new TreeSet<>(handlers.keySet());
    }
}
