package com.agentry.dispatch.cli;

import com.agentry.core.model.ExecutionPlan;
import com.agentry.core.model.Recipe;
import com.agentry.core.model.RecipeValidation;
import com.agentry.core.scheduler.JsonRecipeLoader;
import com.agentry.core.scheduler.RecipeScheduler;
import com.agentry.core.scheduler.RecipeValidationException;
import com.agentry.core.security.SecurityViolationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentry validate &lt;recipe.json&gt;
 * <p>
 * Checks a recipe and prints its execution plan without running anything.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a recipe and show its plan")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Recipe file (JSON)")
    private String recipePath;

    @Option(names = "--var", description = "Recipe variable as name=value (repeatable)")
    private List<String> variables;

    private final JsonRecipeLoader loader;
    private final RecipeScheduler scheduler;

    public ValidateCommand(JsonRecipeLoader loader, RecipeScheduler scheduler) {
        this.loader = loader;
        this.scheduler = scheduler;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Recipe recipe;
        Map<String, Object> vars;
        try {
            recipe = loader.load(recipePath);
            vars = VariableArguments.parse(variables, recipe.variableDefs());
        } catch (IOException | SecurityViolationException | RecipeValidationException e) {
            ConsoleOutput.error("Cannot load recipe: " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        RecipeValidation validation = scheduler.validateRecipe(recipe, vars);
        ConsoleOutput.info("Recipe " + recipe.name() + " v" + recipe.version());
        for (String step : validation.steps()) {
            System.out.println("  - " + step);
        }
        for (String warning : validation.warnings()) {
            ConsoleOutput.warn(warning);
        }
        if (!validation.valid()) {
            for (String error : validation.errors()) {
                ConsoleOutput.error(error);
            }
            return 1;
        }

        ExecutionPlan plan = scheduler.buildExecutionPlan(recipe);
        System.out.println(ConsoleOutput.RULE);
        for (int b = 0; b < plan.batchCount(); b++) {
            List<String> names = new ArrayList<>();
            for (int index : plan.batches().get(b)) {
                names.add(recipe.steps().get(index).identity());
            }
            System.out.println("  Batch " + (b + 1) + ": " + String.join(", ", names));
        }
        ConsoleOutput.success("Recipe is valid (" + plan.stepCount() + " steps in " + plan.batchCount() + " batches)");
        return 0;
    }
}
