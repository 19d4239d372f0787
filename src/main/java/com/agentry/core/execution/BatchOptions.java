package com.agentry.core.execution;

import com.agentry.core.model.OutputFormat;

import java.time.Duration;
import java.util.Map;

/**
 * Settings shared by every task of a multi-agent batch.
 *
 * @param contextPath    context handed to every agent
 * @param outputPath     base output path; each agent writes {@code <dir>/<agent>_<file>}
 * @param format         output rendering
 * @param maxConcurrency admission slots, or 0 for the configured default
 * @param timeout        per-task deadline, or null for the configured default
 * @param variables      variables exposed to every agent
 */
public record BatchOptions(
    String contextPath,
    String outputPath,
    OutputFormat format,
    int maxConcurrency,
    Duration timeout,
    Map<String, Object> variables
) {

    public static BatchOptions defaults() {
        return new BatchOptions(null, null, OutputFormat.TEXT, 0, null, Map.of());
    }
}
