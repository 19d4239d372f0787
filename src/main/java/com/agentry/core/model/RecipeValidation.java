package com.agentry.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of checking a recipe before it runs.
 *
 * @param valid    no errors were found
 * @param errors   problems that prevent execution
 * @param warnings problems that do not
 * @param steps    one-line preview per step
 */
public record RecipeValidation(
    boolean valid,
    List<String> errors,
    List<String> warnings,
    List<String> steps
) implements Serializable {

    public RecipeValidation {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        steps = List.copyOf(steps);
    }
}
