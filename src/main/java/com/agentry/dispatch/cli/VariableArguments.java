package com.agentry.dispatch.cli;

import com.agentry.core.model.VariableDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses repeated {@code --var name=value} options. Values of declared variables
 * are converted to the declared type; everything else stays a string.
 */
final class VariableArguments {

    private VariableArguments() {}

    static Map<String, Object> parse(List<String> assignments, Map<String, VariableDefinition> definitions) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (assignments == null) {
            return values;
        }
        for (String assignment : assignments) {
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected name=value but got: " + assignment);
            }
            String name = assignment.substring(0, eq).trim();
            String raw = assignment.substring(eq + 1);
            VariableDefinition definition = definitions != null ? definitions.get(name) : null;
            values.put(name, definition != null ? definition.type().coerce(raw) : raw);
        }
        return values;
    }
}
