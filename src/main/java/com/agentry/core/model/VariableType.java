package com.agentry.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Declared type of a recipe variable.
 */
public enum VariableType {
    STRING, NUMBER, BOOLEAN, ARRAY;

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
        };
    }

    /**
     * Converts a raw command-line value into this type.
     *
     * @throws IllegalArgumentException if the text is not a valid literal of this type
     */
    public Object coerce(String raw) {
        return switch (this) {
            case STRING -> raw;
            case NUMBER -> {
                try {
                    yield raw.contains(".") ? (Object) Double.parseDouble(raw) : (Object) Long.parseLong(raw);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not a number: " + raw, e);
                }
            }
            case BOOLEAN -> {
                if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
                    yield Boolean.parseBoolean(raw);
                }
                throw new IllegalArgumentException("Not a boolean: " + raw);
            }
            case ARRAY -> raw.isBlank()
                    ? List.of()
                    : Arrays.stream(raw.split(",")).map(String::trim).toList();
        };
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VariableType fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
