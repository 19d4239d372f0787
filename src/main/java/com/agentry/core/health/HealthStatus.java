package com.agentry.core.health;

import java.util.List;
import java.util.Map;

/**
 * Result of one component check.
 *
 * @param component short component name ("runtime", "history", "cache", "security")
 * @param status    UP, DOWN or DEGRADED
 * @param detail    one-line human-readable explanation
 * @param metadata  figures backing the verdict, rendered as strings
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * The worst status in the list: DOWN over DEGRADED over UP. An empty list is UP.
     */
    public static Status overall(List<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status() == Status.DOWN) {
                return Status.DOWN;
            }
            if (check.status() == Status.DEGRADED) {
                worst = Status.DEGRADED;
            }
        }
        return worst;
    }
}
