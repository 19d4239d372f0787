package com.agentry.core.scheduler;

import com.agentry.core.model.FailurePolicy;
import com.agentry.core.model.OutputFormat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied settings for one recipe run.
 *
 * @param contextPath   context handed to every step, nullable
 * @param outputPath    base output path; each step writes its own derived file, nullable
 * @param variables     values for the recipe's declared variables
 * @param failurePolicy null for the configured default
 * @param maxParallel   admission slots per batch, 0 for the configured default
 * @param format        output rendering for every step
 */
public record RecipeRunOptions(
    String contextPath,
    String outputPath,
    Map<String, Object> variables,
    FailurePolicy failurePolicy,
    int maxParallel,
    OutputFormat format
) {

    public RecipeRunOptions {
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        format = format == null ? OutputFormat.TEXT : format;
    }

    public static RecipeRunOptions defaults() {
        return new RecipeRunOptions(null, null, Map.of(), null, 0, OutputFormat.TEXT);
    }

    public static RecipeRunOptions withVariables(Map<String, Object> variables) {
        return new RecipeRunOptions(null, null, variables, null, 0, OutputFormat.TEXT);
    }

    public RecipeRunOptions withFailurePolicy(FailurePolicy policy) {
        return new RecipeRunOptions(contextPath, outputPath, variables, policy, maxParallel, format);
    }
}
