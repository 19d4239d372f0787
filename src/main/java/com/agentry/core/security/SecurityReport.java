package com.agentry.core.security;

import java.util.List;

/**
 * Snapshot of the audit trail for operators.
 */
public record SecurityReport(
    List<SecurityEvent> recentEvents,
    int totalEvents,
    long criticalEvents,
    long highSeverityEvents,
    long pathTraversalAttempts,
    long injectionAttempts
) {}
