package com.agentry.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One recipe entry: a template that is materialized into a {@link Task} at scheduling time.
 *
 * @param id                optional unique identifier; the agent name stands in when absent
 * @param agentName         agent that runs this step
 * @param taskTemplate      instruction text, may contain {@code {{variable}}} placeholders
 * @param contextRefs       extra context files or directories for this step
 * @param variableOverrides step-level variables layered over the recipe variables
 * @param dependsOn         identities of steps that must complete first
 * @param parallel          advisory hint from the recipe author
 * @param timeout           per-step deadline
 */
public record Step(
    String id,
    String agentName,
    String taskTemplate,
    List<String> contextRefs,
    Map<String, Object> variableOverrides,
    List<String> dependsOn,
    Boolean parallel,
    Duration timeout
) implements Serializable {

    public Step {
        contextRefs = contextRefs == null ? List.of() : List.copyOf(contextRefs);
        variableOverrides = variableOverrides == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variableOverrides));
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static Step of(String agentName, String taskTemplate, String... dependsOn) {
        return new Step(null, agentName, taskTemplate, List.of(), Map.of(), List.of(dependsOn), null, null);
    }

    public static Step withId(String id, String agentName, String taskTemplate, String... dependsOn) {
        return new Step(id, agentName, taskTemplate, List.of(), Map.of(), List.of(dependsOn), null, null);
    }

    /**
     * The name other steps use in {@code dependsOn} to refer to this step.
     */
    public String identity() {
        return id != null && !id.isBlank() ? id : agentName;
    }
}
