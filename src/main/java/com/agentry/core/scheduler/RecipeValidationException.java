package com.agentry.core.scheduler;

import java.util.List;

public class RecipeValidationException extends RuntimeException {

    private final List<String> errors;

    public RecipeValidationException(List<String> errors) {
        super("Recipe validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public RecipeValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
