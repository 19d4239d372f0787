package com.agentry.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered batches of step indices. Every step appears in exactly one batch, and no
 * batch holds two steps where one depends on the other.
 */
public record ExecutionPlan(List<List<Integer>> batches) implements Serializable {

    public ExecutionPlan {
        batches = batches.stream().map(List::copyOf).toList();
    }

    public int batchCount() {
        return batches.size();
    }

    public int stepCount() {
        return batches.stream().mapToInt(List::size).sum();
    }
}
