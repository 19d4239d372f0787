package com.agentry.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Aggregate outcome of a batch. {@code results} follows the order in which tasks were submitted.
 */
public record BatchResult(
    int total,
    int successful,
    int failed,
    List<ExecutionResult> results,
    String summary
) implements Serializable {

    public BatchResult {
        results = List.copyOf(results);
    }
}
