package com.workflow.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-to-handler lookup used to dispatch action and notification steps.
 * Thread-safe.
 */
public class StepHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final Map<String, StepHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register a handler, replacing any previous one of the same name.
     */
    public StepHandlerRegistry register(String name, StepHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Handler name cannot be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        StepHandler previous = handlers.put(name, handler);
        if (previous != null) {
            log.warn("Replaced step handler: {}", name);
        } else {
            log.info("Registered step handler: {}", name);
        }
        return this;
    }

    public Optional<StepHandler> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(handlers.get(name));
    }

    public boolean contains(String name) {
        return name != null && handlers.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(handlers.keySet());
    }
}
