package com.agentry.core.security;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of the security audit trail.
 *
 * @param timestamp    when the decision was made
 * @param kind         what was decided
 * @param severity     how serious the event is
 * @param operation    the I/O operation being validated
 * @param originalPath path as supplied by the caller (nullable for content events)
 * @param resolvedPath absolute normalized path (nullable)
 * @param detail       human-readable description of the violation or decision
 */
public record SecurityEvent(
    Instant timestamp,
    Kind kind,
    Severity severity,
    FileOperation operation,
    String originalPath,
    String resolvedPath,
    String detail
) implements Serializable {

    public enum Kind {
        PATH_TRAVERSAL_ATTEMPT,
        UNAUTHORIZED_PATH_ACCESS,
        RESTRICTED_PATH_ACCESS,
        INVALID_PATH,
        DEPTH_VIOLATION,
        SYMLINK_VIOLATION,
        EXTENSION_VIOLATION,
        FILE_SIZE_VIOLATION,
        INJECTION_ATTEMPT,
        ACCESS_GRANTED
    }

    public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }
}
