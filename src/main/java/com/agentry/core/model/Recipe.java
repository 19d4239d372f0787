package com.agentry.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named multi-step workflow. Read-only once loaded.
 */
public record Recipe(
    String name,
    String description,
    String version,
    List<String> tags,
    Map<String, VariableDefinition> variableDefs,
    List<Step> steps,
    List<Step> cleanup
) implements Serializable {

    public Recipe {
        version = version == null || version.isBlank() ? "1.0.0" : version;
        tags = tags == null ? List.of() : List.copyOf(tags);
        variableDefs = variableDefs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variableDefs));
        steps = steps == null ? List.of() : List.copyOf(steps);
        cleanup = cleanup == null ? List.of() : List.copyOf(cleanup);
    }

    public static Recipe of(String name, List<Step> steps) {
        return new Recipe(name, name + " recipe", "1.0.0", List.of(), Map.of(), steps, List.of());
    }
}
