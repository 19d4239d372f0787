package com.agentry.core.scheduler;

import com.agentry.core.model.Recipe;
import com.agentry.core.model.RecipeValidation;
import com.agentry.core.model.Step;
import com.agentry.core.model.VariableDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a recipe's structure, dependencies and variables without running anything.
 */
@Component
public class RecipeValidator {

    private static final int PREVIEW_LENGTH = 50;

    private final ExecutionPlanner planner;

    public RecipeValidator(ExecutionPlanner planner) {
        this.planner = planner;
    }

    public RecipeValidation validate(Recipe recipe, Map<String, Object> provided) {
        Map<String, Object> supplied = provided != null ? provided : Map.of();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (recipe.name() == null || recipe.name().isBlank()) {
            errors.add("Recipe name is required");
        }
        if (recipe.steps().isEmpty()) {
            errors.add("Recipe has no steps");
        }
        checkSteps(recipe.steps(), "Step", errors);
        checkSteps(recipe.cleanup(), "Cleanup step", errors);

        List<String> structural = planner.structuralErrors(recipe.steps());
        errors.addAll(structural);
        if (structural.isEmpty() && !recipe.steps().isEmpty()) {
            try {
                planner.plan(recipe.steps());
            } catch (CircularDependencyException e) {
                errors.add(e.getMessage());
            }
        }

        for (var entry : recipe.variableDefs().entrySet()) {
            String name = entry.getKey();
            VariableDefinition definition = entry.getValue();
            Object value = supplied.containsKey(name) ? supplied.get(name) : definition.defaultValue();
            if (value == null) {
                if (definition.required()) {
                    errors.add("Required variable '" + name + "' is missing");
                }
            } else if (!definition.type().accepts(value)) {
                errors.add("Variable '" + name + "' must be of type " + definition.type().code());
            }
        }
        for (String name : supplied.keySet()) {
            if (!recipe.variableDefs().containsKey(name)) {
                warnings.add("Variable '" + name + "' is not declared by the recipe");
            }
        }

        Map<String, Object> resolved = resolveVariables(recipe, supplied);
        List<String> previews = new ArrayList<>();
        for (int i = 0; i < recipe.steps().size(); i++) {
            Step step = recipe.steps().get(i);
            Map<String, Object> stepVariables = new LinkedHashMap<>(resolved);
            stepVariables.putAll(step.variableOverrides());
            for (String placeholder : TemplateRenderer.placeholders(step.taskTemplate())) {
                if (!stepVariables.containsKey(placeholder)) {
                    warnings.add("Step " + (i + 1) + " references undefined variable '" + placeholder + "'");
                }
            }
            previews.add(preview(step));
        }

        return new RecipeValidation(errors.isEmpty(), errors, warnings, previews);
    }

    /**
     * Declared defaults overlaid with the supplied values. Undeclared supplied values are kept.
     */
    public Map<String, Object> resolveVariables(Recipe recipe, Map<String, Object> provided) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (var entry : recipe.variableDefs().entrySet()) {
            if (entry.getValue().hasDefault()) {
                resolved.put(entry.getKey(), entry.getValue().defaultValue());
            }
        }
        if (provided != null) {
            resolved.putAll(provided);
        }
        return resolved;
    }

    static String preview(Step step) {
        String template = step.taskTemplate() == null ? "" : step.taskTemplate().strip();
        String head = template.length() > PREVIEW_LENGTH ? template.substring(0, PREVIEW_LENGTH) + "..." : template;
        return step.agentName() + ": " + head;
    }

    private static void checkSteps(List<Step> steps, String label, List<String> errors) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.agentName() == null || step.agentName().isBlank()) {
                errors.add(label + " " + (i + 1) + " has no agent");
            }
            if (step.taskTemplate() == null || step.taskTemplate().isBlank()) {
                errors.add(label + " " + (i + 1) + " has no task");
            }
        }
    }
}
