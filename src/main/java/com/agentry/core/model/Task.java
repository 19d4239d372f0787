package com.agentry.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One unit of work directed at the agent runtime. Immutable once submitted.
 *
 * @param agentName       identifier of the agent to run
 * @param taskDescription free-text instruction for the agent
 * @param contextPath     optional file or directory whose contents are handed to the agent
 * @param contextRefs     optional additional context files or directories
 * @param outputPath      optional destination for the agent output
 * @param outputFormat    how the output is rendered when written (defaults to TEXT)
 * @param timeout         optional per-task deadline; the configured default applies when null
 * @param variables       optional string-keyed values exposed to the agent
 */
public record Task(
    String agentName,
    String taskDescription,
    String contextPath,
    List<String> contextRefs,
    String outputPath,
    OutputFormat outputFormat,
    Duration timeout,
    Map<String, Object> variables
) implements Serializable {

    public Task {
        contextRefs = contextRefs == null ? List.of() : List.copyOf(contextRefs);
        outputFormat = outputFormat == null ? OutputFormat.TEXT : outputFormat;
        // Map.copyOf rejects null values, which recipe variables may legitimately carry
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static Task of(String agentName, String taskDescription) {
        return new Task(agentName, taskDescription, null, List.of(), null, OutputFormat.TEXT, null, Map.of());
    }

    public Task withContextPath(String path) {
        return new Task(agentName, taskDescription, path, contextRefs, outputPath, outputFormat, timeout, variables);
    }

    public Task withOutputPath(String path) {
        return new Task(agentName, taskDescription, contextPath, contextRefs, path, outputFormat, timeout, variables);
    }

    public Task withTimeout(Duration value) {
        return new Task(agentName, taskDescription, contextPath, contextRefs, outputPath, outputFormat, value, variables);
    }

    public Task withVariables(Map<String, Object> values) {
        return new Task(agentName, taskDescription, contextPath, contextRefs, outputPath, outputFormat, timeout, values);
    }
}
