package com.agentry.core.scheduler;

import java.util.List;

/**
 * No valid execution order exists for a recipe.
 */
public class CircularDependencyException extends RuntimeException {

    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public CircularDependencyException(String message, Throwable cause) {
        super(message, cause);
        this.cycle = List.of();
    }

    /**
     * Step identities along the cycle, the first repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
