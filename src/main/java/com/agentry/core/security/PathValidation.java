package com.agentry.core.security;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link SecurityGate#validatePath}.
 *
 * @param valid        the path may be used for the requested operation
 * @param resolvedPath absolute normalized path; null when the input could not be resolved
 * @param violations   reasons the path was rejected, empty when valid
 * @param event        the audit event recorded for a rejection, null when valid
 */
public record PathValidation(
    boolean valid,
    Path resolvedPath,
    List<String> violations,
    SecurityEvent event
) {

    public PathValidation {
        violations = List.copyOf(violations);
    }

    static PathValidation accepted(Path resolvedPath) {
        return new PathValidation(true, resolvedPath, List.of(), null);
    }

    static PathValidation rejected(Path resolvedPath, String violation, SecurityEvent event) {
        return new PathValidation(false, resolvedPath, List.of(violation), event);
    }

    public String describeViolations() {
        return String.join(", ", violations);
    }
}
