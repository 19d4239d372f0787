package com.agentry.dispatch.cli;

import com.agentry.core.events.EventBus;
import com.agentry.core.model.FailurePolicy;
import com.agentry.core.model.OutputFormat;
import com.agentry.core.model.Recipe;
import com.agentry.core.model.RecipeResult;
import com.agentry.core.scheduler.JsonRecipeLoader;
import com.agentry.core.scheduler.RecipeRunOptions;
import com.agentry.core.scheduler.RecipeScheduler;
import com.agentry.core.scheduler.RecipeValidationException;
import com.agentry.core.security.SecurityViolationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentry recipe &lt;recipe.json&gt;
 */
@Command(name = "recipe", mixinStandardHelpOptions = true, description = "Execute a multi-step recipe")
@Component
public class RecipeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Recipe file (JSON)")
    private String recipePath;

    @Option(names = {"--context", "-c"}, description = "Context file or directory for every step")
    private String contextPath;

    @Option(names = {"--output", "-o"}, description = "Base output file; each step writes its own derived file")
    private String outputPath;

    @Option(names = {"--format", "-f"}, description = "Output format: text, json, markdown", defaultValue = "text")
    private String format;

    @Option(names = "--var", description = "Recipe variable as name=value (repeatable)")
    private List<String> variables;

    @Option(names = "--on-failure", description = "CONTINUE or SKIP_DEPENDENTS (default from configuration)")
    private String failurePolicy;

    @Option(names = {"--parallel", "-p"}, description = "Maximum concurrent steps per batch", defaultValue = "0")
    private int maxParallel;

    private final JsonRecipeLoader loader;
    private final RecipeScheduler scheduler;
    private final EventBus eventBus;

    public RecipeCommand(JsonRecipeLoader loader, RecipeScheduler scheduler, EventBus eventBus) {
        this.loader = loader;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Recipe recipe;
        Map<String, Object> vars;
        FailurePolicy policy;
        OutputFormat outputFormat;
        try {
            recipe = loader.load(recipePath);
            vars = VariableArguments.parse(variables, recipe.variableDefs());
            policy = failurePolicy != null ? FailurePolicy.valueOf(failurePolicy.toUpperCase(Locale.ROOT)) : null;
            outputFormat = OutputFormat.parse(format);
        } catch (IOException | SecurityViolationException | RecipeValidationException e) {
            ConsoleOutput.error("Cannot load recipe: " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        ConsoleOutput.info("Recipe " + recipe.name() + " v" + recipe.version() + " (" + recipe.steps().size() + " steps)");
        RecipeResult result;
        try (var progress = ProgressPrinter.attach(eventBus)) {
            result = scheduler.executeRecipe(recipe,
                    new RecipeRunOptions(contextPath, outputPath, vars, policy, maxParallel, outputFormat));
        }

        for (var r : result.results()) {
            ConsoleOutput.result(r);
        }
        ConsoleOutput.recipe(result);
        System.out.println();
        System.out.println(result.summary());
        return result.success() ? 0 : 1;
    }
}
