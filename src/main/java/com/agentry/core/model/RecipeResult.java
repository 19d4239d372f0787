package com.agentry.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of a recipe run.
 *
 * @param success        true iff every executed step succeeded
 * @param recipeName     the recipe that ran
 * @param stepsCompleted number of steps that succeeded
 * @param stepsTotal     number of declared steps (cleanup excluded)
 * @param results        per-step results in plan order
 * @param durationMs     wall-clock duration of the whole run
 * @param summary        markdown report
 * @param errors         step errors, or the validation errors that prevented the run
 */
public record RecipeResult(
    boolean success,
    String recipeName,
    int stepsCompleted,
    int stepsTotal,
    List<ExecutionResult> results,
    long durationMs,
    String summary,
    List<String> errors
) implements Serializable {

    public RecipeResult {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
    }

    public static RecipeResult rejected(String recipeName, int stepsTotal, List<String> errors, long durationMs) {
        return new RecipeResult(false, recipeName, 0, stepsTotal, List.of(), durationMs,
                "Recipe execution failed: " + String.join(", ", errors), errors);
    }
}
