package com.agentry.core.scheduler;

import com.agentry.core.events.AgentryEvent;
import com.agentry.core.events.EventBus;
import com.agentry.core.execution.ExecutionProperties;
import com.agentry.core.execution.TaskCoordinator;
import com.agentry.core.logging.MdcContext;
import com.agentry.core.metrics.AgentryMetrics;
import com.agentry.core.model.BatchResult;
import com.agentry.core.model.ErrorKind;
import com.agentry.core.model.ExecutionMetrics;
import com.agentry.core.model.ExecutionPlan;
import com.agentry.core.model.ExecutionResult;
import com.agentry.core.model.FailurePolicy;
import com.agentry.core.model.Recipe;
import com.agentry.core.model.RecipeResult;
import com.agentry.core.model.RecipeValidation;
import com.agentry.core.model.Step;
import com.agentry.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Drives a {@link Recipe} to completion through the {@link TaskCoordinator}.
 * <p>
 * The plan is computed in full before anything runs; a recipe that fails
 * validation or has a dependency cycle is rejected without submitting a task.
 * Batches run strictly one after another. Under {@link FailurePolicy#CONTINUE}
 * a finished step unblocks its dependents whatever its outcome; under
 * {@link FailurePolicy#SKIP_DEPENDENTS} dependents of a failed step are
 * recorded as failed without being attempted.
 */
@Service
public class RecipeScheduler {

    private static final Logger log = LoggerFactory.getLogger(RecipeScheduler.class);

    private final TaskCoordinator coordinator;
    private final ExecutionPlanner planner;
    private final RecipeValidator validator;
    private final ExecutionProperties properties;
    private final EventBus eventBus;
    private final AgentryMetrics metrics;

    @Autowired
    public RecipeScheduler(TaskCoordinator coordinator, ExecutionPlanner planner, RecipeValidator validator,
                           ExecutionProperties properties, EventBus eventBus,
                           @Autowired(required = false) AgentryMetrics metrics) {
        this.coordinator = coordinator;
        this.planner = planner;
        this.validator = validator;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @throws CircularDependencyException if the steps cannot be ordered
     * @throws RecipeValidationException   for duplicate identities or unknown dependencies
     */
    public ExecutionPlan buildExecutionPlan(Recipe recipe) {
        return planner.plan(recipe.steps());
    }

    public RecipeValidation validateRecipe(Recipe recipe, Map<String, Object> variables) {
        return validator.validate(recipe, variables);
    }

    public RecipeResult executeRecipe(Recipe recipe, RecipeRunOptions options) {
        RecipeRunOptions opts = options != null ? options : RecipeRunOptions.defaults();
        long startMs = System.currentTimeMillis();
        String runId = "recipe-" + UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRecipe(recipe.name());
        try {
            log.info("Starting recipe {} ({} steps)", recipe.name(), recipe.steps().size());
            eventBus.publish(AgentryEvent.of("recipe.started", runId, null,
                    Map.of("recipe", String.valueOf(recipe.name()), "steps", recipe.steps().size())));

            RecipeValidation validation = validator.validate(recipe, opts.variables());
            if (!validation.valid()) {
                log.warn("Recipe {} rejected: {}", recipe.name(), validation.errors());
                recordOutcome("rejected");
                eventBus.publish(AgentryEvent.of("recipe.failed", runId, null,
                        Map.of("recipe", String.valueOf(recipe.name()), "errors", validation.errors())));
                return RecipeResult.rejected(recipe.name(), recipe.steps().size(), validation.errors(),
                        System.currentTimeMillis() - startMs);
            }

            ExecutionPlan plan = planner.plan(recipe.steps());
            Map<String, Object> variables = validator.resolveVariables(recipe, opts.variables());
            FailurePolicy policy = opts.failurePolicy() != null ? opts.failurePolicy() : properties.getFailurePolicy();
            int maxParallel = opts.maxParallel() > 0 ? opts.maxParallel() : properties.getMaxParallel();
            log.info("Recipe {} planned into {} batches (policy {})", recipe.name(), plan.batchCount(), policy);

            List<Step> orderedSteps = new ArrayList<>();
            List<ExecutionResult> orderedResults = new ArrayList<>();
            Set<String> failed = new HashSet<>();

            for (int b = 0; b < plan.batchCount(); b++) {
                MdcContext.setBatch(recipe.name(), b + 1);
                List<Integer> batch = plan.batches().get(b);
                Map<Integer, ExecutionResult> batchResults = new LinkedHashMap<>();
                List<Integer> submitted = new ArrayList<>();
                List<Task> tasks = new ArrayList<>();

                for (int index : batch) {
                    Step step = recipe.steps().get(index);
                    Optional<String> failedDependency = policy == FailurePolicy.SKIP_DEPENDENTS
                            ? step.dependsOn().stream().filter(failed::contains).findFirst()
                            : Optional.empty();
                    if (failedDependency.isPresent()) {
                        log.info("Skipping step {}: dependency {} failed", step.identity(), failedDependency.get());
                        batchResults.put(index, ExecutionResult.failed(step.agentName(), ErrorKind.VALIDATION_ERROR,
                                "skipped: dependency " + failedDependency.get() + " failed", ExecutionMetrics.of(0)));
                    } else {
                        submitted.add(index);
                        tasks.add(materialize(step, variables, opts));
                    }
                }

                if (!tasks.isEmpty()) {
                    BatchResult result = coordinator.executeBatch(tasks, maxParallel);
                    for (int i = 0; i < submitted.size(); i++) {
                        batchResults.put(submitted.get(i), result.results().get(i));
                    }
                }

                for (int index : batch) {
                    Step step = recipe.steps().get(index);
                    ExecutionResult result = batchResults.get(index);
                    if (!result.success()) {
                        failed.add(step.identity());
                    }
                    orderedSteps.add(step);
                    orderedResults.add(result);
                }
                eventBus.publish(AgentryEvent.of("recipe.batch", runId, null,
                        Map.of("recipe", recipe.name(), "batch", b + 1, "steps", batch.size())));
            }
            MdcContext.setRecipe(recipe.name());

            runCleanup(recipe, variables, opts, maxParallel);

            long durationMs = System.currentTimeMillis() - startMs;
            long succeeded = orderedResults.stream().filter(ExecutionResult::success).count();
            boolean success = succeeded == orderedResults.size();
            List<String> errors = new ArrayList<>();
            for (int i = 0; i < orderedResults.size(); i++) {
                if (!orderedResults.get(i).success()) {
                    errors.add(orderedSteps.get(i).identity() + ": " + orderedResults.get(i).error());
                }
            }
            String summary = RecipeReports.summary(recipe, orderedSteps, orderedResults, durationMs);

            recordOutcome(success ? "success" : "failure");
            log.info("Recipe {} finished: {}/{} steps succeeded in {}ms",
                    recipe.name(), succeeded, recipe.steps().size(), durationMs);
            eventBus.publish(AgentryEvent.of(success ? "recipe.completed" : "recipe.failed", runId, null,
                    Map.of("recipe", recipe.name(), "stepsCompleted", succeeded, "durationMs", durationMs)));
            return new RecipeResult(success, recipe.name(), (int) succeeded, recipe.steps().size(),
                    orderedResults, durationMs, summary, errors);
        } finally {
            MdcContext.clear();
        }
    }

    private Task materialize(Step step, Map<String, Object> recipeVariables, RecipeRunOptions opts) {
        Map<String, Object> variables = new LinkedHashMap<>(recipeVariables);
        variables.putAll(step.variableOverrides());
        String description = TemplateRenderer.render(step.taskTemplate(), variables);
        String outputPath = opts.outputPath() != null
                ? TaskCoordinator.perAgentOutputPath(opts.outputPath(), step.identity())
                : null;
        return new Task(step.agentName(), description, opts.contextPath(), step.contextRefs(),
                outputPath, opts.format(), step.timeout(), variables);
    }

    /**
     * Cleanup failures are logged and never change the recipe outcome.
     */
    private void runCleanup(Recipe recipe, Map<String, Object> variables, RecipeRunOptions opts, int maxParallel) {
        if (recipe.cleanup().isEmpty()) {
            return;
        }
        log.info("Running {} cleanup step(s) for recipe {}", recipe.cleanup().size(), recipe.name());
        List<Task> tasks = new ArrayList<>();
        for (Step step : recipe.cleanup()) {
            Map<String, Object> stepVariables = new LinkedHashMap<>(variables);
            stepVariables.putAll(step.variableOverrides());
            tasks.add(new Task(step.agentName(), TemplateRenderer.render(step.taskTemplate(), stepVariables),
                    opts.contextPath(), step.contextRefs(), null, opts.format(), step.timeout(), stepVariables));
        }
        try {
            BatchResult result = coordinator.executeBatch(tasks, maxParallel);
            for (ExecutionResult r : result.results()) {
                if (!r.success()) {
                    log.warn("Cleanup step {} failed: {}", r.agentName(), r.error());
                }
            }
        } catch (RuntimeException e) {
            log.warn("Cleanup for recipe {} failed: {}", recipe.name(), e.getMessage(), e);
        }
    }

    private void recordOutcome(String status) {
        if (metrics != null) {
            metrics.recordRecipeResult(status);
        }
    }
}
