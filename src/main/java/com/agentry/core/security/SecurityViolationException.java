package com.agentry.core.security;

import java.util.List;

/**
 * Thrown when a path or piece of content is rejected by the {@link SecurityGate}.
 */
public class SecurityViolationException extends RuntimeException {

    private final List<String> violations;

    public SecurityViolationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public SecurityViolationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public SecurityViolationException(String message, List<String> violations) {
        super(message + ": " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
