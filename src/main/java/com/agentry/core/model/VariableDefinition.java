package com.agentry.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Declaration of one recipe-level variable.
 *
 * @param type         expected value type
 * @param description  what the variable controls
 * @param defaultValue value used when the caller provides none (may be null)
 * @param required     whether the recipe is rejected when neither a value nor a default exists
 */
public record VariableDefinition(
    VariableType type,
    String description,
    @JsonProperty("default") Object defaultValue,
    boolean required
) implements Serializable {

    public VariableDefinition {
        type = type == null ? VariableType.STRING : type;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
