package com.agentry.core.scheduler;

import com.agentry.core.model.Recipe;
import com.agentry.core.model.RecipeValidation;
import com.agentry.core.model.Step;
import com.agentry.core.model.VariableDefinition;
import com.agentry.core.model.VariableType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecipeValidatorTest {

    private final RecipeValidator validator = new RecipeValidator(new ExecutionPlanner());

    private static Recipe recipe(Map<String, VariableDefinition> variables, Step... steps) {
        return new Recipe("review", "Code review", "1.0.0", List.of(), variables, List.of(steps), List.of());
    }

    @Test
    @DisplayName("a well-formed recipe is valid and previews each step")
    void valid() {
        RecipeValidation validation = validator.validate(recipe(Map.of(),
                Step.of("planner", "Plan the work"),
                Step.of("coder", "Implement the plan", "planner")), Map.of());

        assertTrue(validation.valid());
        assertTrue(validation.errors().isEmpty());
        assertEquals(List.of("planner: Plan the work", "coder: Implement the plan"), validation.steps());
    }

    @Test
    @DisplayName("reports missing name, steps, agents and tasks")
    void structuralErrors() {
        var noSteps = new Recipe(" ", null, null, null, null, List.of(), null);
        RecipeValidation empty = validator.validate(noSteps, Map.of());

        assertFalse(empty.valid());
        assertTrue(empty.errors().contains("Recipe name is required"));
        assertTrue(empty.errors().contains("Recipe has no steps"));

        RecipeValidation blank = validator.validate(recipe(Map.of(),
                Step.withId("first", null, "do it"),
                Step.withId("second", "coder", " ")), Map.of());
        assertTrue(blank.errors().contains("Step 1 has no agent"));
        assertTrue(blank.errors().contains("Step 2 has no task"));
    }

    @Test
    @DisplayName("a cycle is reported as an error rather than thrown")
    void cycle() {
        RecipeValidation validation = validator.validate(recipe(Map.of(),
                Step.of("A", "a", "B"),
                Step.of("B", "b", "A")), Map.of());

        assertFalse(validation.valid());
        assertTrue(validation.errors().get(0).startsWith("Circular dependency detected"));
    }

    @Test
    @DisplayName("a required variable without value or default is an error")
    void requiredVariable() {
        var defs = Map.of("target", new VariableDefinition(VariableType.STRING, "what to review", null, true));
        Recipe recipe = recipe(defs, Step.of("coder", "Review {{target}}"));

        assertTrue(validator.validate(recipe, Map.of()).errors().contains("Required variable 'target' is missing"));
        assertTrue(validator.validate(recipe, Map.of("target", "parser")).valid());
    }

    @Test
    @DisplayName("a default satisfies a required variable")
    void defaultSatisfiesRequired() {
        var defs = Map.of("target", new VariableDefinition(VariableType.STRING, null, "parser", true));

        assertTrue(validator.validate(recipe(defs, Step.of("coder", "Review {{target}}")), Map.of()).valid());
    }

    @Test
    @DisplayName("values must match the declared type")
    void typeMismatch() {
        var defs = Map.of("count", new VariableDefinition(VariableType.NUMBER, null, null, false));

        RecipeValidation validation = validator.validate(recipe(defs, Step.of("coder", "Do {{count}}")),
                Map.of("count", "three"));

        assertEquals(List.of("Variable 'count' must be of type number"), validation.errors());
    }

    @Test
    @DisplayName("undeclared and undefined variables are warnings only")
    void warnings() {
        RecipeValidation validation = validator.validate(recipe(Map.of(),
                Step.of("coder", "Fix {{ticket}}")), Map.of("extra", "x"));

        assertTrue(validation.valid());
        assertTrue(validation.warnings().contains("Variable 'extra' is not declared by the recipe"));
        assertTrue(validation.warnings().contains("Step 1 references undefined variable 'ticket'"));
    }

    @Test
    @DisplayName("previews are cut at fifty characters")
    void longPreview() {
        String preview = RecipeValidator.preview(Step.of("coder", "x".repeat(80)));

        assertEquals("coder: " + "x".repeat(50) + "...", preview);
    }

    @Test
    @DisplayName("provided values override declared defaults")
    void resolveVariables() {
        Map<String, VariableDefinition> defs = new LinkedHashMap<>();
        defs.put("target", new VariableDefinition(VariableType.STRING, null, "parser", false));
        defs.put("depth", new VariableDefinition(VariableType.NUMBER, null, 2, false));
        Recipe recipe = recipe(defs, Step.of("coder", "go"));

        Map<String, Object> resolved = validator.resolveVariables(recipe, Map.of("depth", 5));

        assertEquals(Map.of("target", "parser", "depth", 5), resolved);
    }
}
