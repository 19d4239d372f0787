package com.agentry.core.scheduler;

import com.agentry.core.events.AgentryEvent;
import com.agentry.core.events.EventBus;
import com.agentry.core.execution.AgentResponse;
import com.agentry.core.execution.CoordinatorFixture;
import com.agentry.core.execution.ExecutionProperties;
import com.agentry.core.execution.FakeAgentRuntime;
import com.agentry.core.execution.TaskCoordinator;
import com.agentry.core.metrics.AgentryMetrics;
import com.agentry.core.model.ErrorKind;
import com.agentry.core.model.FailurePolicy;
import com.agentry.core.model.OutputFormat;
import com.agentry.core.model.Recipe;
import com.agentry.core.model.RecipeResult;
import com.agentry.core.model.Step;
import com.agentry.core.model.VariableDefinition;
import com.agentry.core.model.VariableType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link RecipeScheduler}: rejection before execution with a mocked
 * coordinator, and dependency ordering end to end with a scripted runtime.
 */
class RecipeSchedulerTest {

    @TempDir
    Path tempDir;

    private static Recipe abc() {
        return Recipe.of("abc", List.of(
                Step.of("A", "first"),
                Step.of("B", "second"),
                Step.of("C", "combine", "A", "B")));
    }

    // =====================================================================
    //  Rejection
    // =====================================================================

    @Nested
    @DisplayName("Rejected recipes")
    class Rejected {

        private TaskCoordinator coordinator;
        private RecipeScheduler scheduler;
        private SimpleMeterRegistry registry;

        @BeforeEach
        void setUp() {
            coordinator = mock(TaskCoordinator.class);
            registry = new SimpleMeterRegistry();
            var planner = new ExecutionPlanner();
            scheduler = new RecipeScheduler(coordinator, planner, new RecipeValidator(planner),
                    new ExecutionProperties(), new EventBus(), new AgentryMetrics(registry));
        }

        @Test
        @DisplayName("a cycle fails the recipe without submitting any task")
        void cycleNeverExecutes() {
            Recipe recipe = Recipe.of("loop", List.of(
                    Step.of("A", "a", "B"),
                    Step.of("B", "b", "A")));

            RecipeResult result = scheduler.executeRecipe(recipe, RecipeRunOptions.defaults());

            assertFalse(result.success());
            assertEquals(0, result.stepsCompleted());
            assertEquals(2, result.stepsTotal());
            assertTrue(result.errors().get(0).startsWith("Circular dependency detected"));
            assertTrue(result.summary().startsWith("Recipe execution failed"));
            verifyNoInteractions(coordinator);
            assertEquals(1.0, registry.get("agentry.recipe.executions").tag("status", "rejected").counter().count());
        }

        @Test
        @DisplayName("a missing required variable fails the recipe without submitting any task")
        void missingVariableNeverExecutes() {
            Recipe recipe = new Recipe("needs-target", null, null, List.of(),
                    Map.of("target", new VariableDefinition(VariableType.STRING, null, null, true)),
                    List.of(Step.of("coder", "Review {{target}}")), List.of());

            RecipeResult result = scheduler.executeRecipe(recipe, RecipeRunOptions.defaults());

            assertFalse(result.success());
            assertEquals(List.of("Required variable 'target' is missing"), result.errors());
            verifyNoInteractions(coordinator);
        }

        @Test
        @DisplayName("buildExecutionPlan throws for a cycle")
        void planThrows() {
            Recipe recipe = Recipe.of("loop", List.of(Step.of("A", "a", "A")));

            assertThrows(CircularDependencyException.class, () -> scheduler.buildExecutionPlan(recipe));
        }
    }

    // =====================================================================
    //  Execution
    // =====================================================================

    @Nested
    @DisplayName("Executed recipes")
    class Executed {

        private FakeAgentRuntime runtime;
        private CoordinatorFixture fixture;
        private RecipeScheduler scheduler;

        @BeforeEach
        void setUp() throws IOException {
            runtime = new FakeAgentRuntime();
            fixture = CoordinatorFixture.create(tempDir, runtime);
            var planner = new ExecutionPlanner();
            scheduler = new RecipeScheduler(fixture.coordinator(), planner, new RecipeValidator(planner),
                    fixture.properties(), fixture.eventBus(), null);
        }

        @Test
        @DisplayName("runs dependents only after their dependencies")
        void dependencyOrder() {
            RecipeResult result = scheduler.executeRecipe(abc(), RecipeRunOptions.defaults());

            assertTrue(result.success());
            assertEquals(3, result.stepsCompleted());
            assertEquals("C", runtime.invokedAgents().get(2));
            assertEquals(List.of("A", "B", "C"), result.results().stream().map(r -> r.agentName()).toList());
            assertTrue(result.summary().contains("**Steps Completed:** 3/3"));
            assertTrue(result.summary().contains("3. C: OK"));
        }

        @Test
        @DisplayName("under CONTINUE a failed dependency still unblocks its dependents")
        void continuePolicy() {
            runtime.on("A", FakeAgentRuntime.failing("A broke"));

            RecipeResult result = scheduler.executeRecipe(abc(),
                    RecipeRunOptions.defaults().withFailurePolicy(FailurePolicy.CONTINUE));

            assertFalse(result.success());
            assertEquals(2, result.stepsCompleted());
            assertTrue(runtime.invokedAgents().contains("C"));
            assertEquals(List.of("A: A broke"), result.errors());
        }

        @Test
        @DisplayName("under SKIP_DEPENDENTS dependents of a failed step are not attempted")
        void skipDependentsPolicy() {
            runtime.on("A", FakeAgentRuntime.failing("A broke"));

            RecipeResult result = scheduler.executeRecipe(abc(),
                    RecipeRunOptions.defaults().withFailurePolicy(FailurePolicy.SKIP_DEPENDENTS));

            assertFalse(result.success());
            assertEquals(1, result.stepsCompleted());
            assertFalse(runtime.invokedAgents().contains("C"));
            var skipped = result.results().get(2);
            assertEquals(ErrorKind.VALIDATION_ERROR, skipped.errorKind());
            assertEquals("skipped: dependency A failed", skipped.error());
        }

        @Test
        @DisplayName("step templates are rendered with recipe and step variables")
        void rendersTemplates() {
            Recipe recipe = new Recipe("vars", null, null, List.of(),
                    Map.of("target", new VariableDefinition(VariableType.STRING, null, "parser", false)),
                    List.of(
                            Step.of("coder", "Refactor {{target}}"),
                            new Step("review", "reviewer", "Review {{target}} in {{mode}} mode", List.of(),
                                    Map.of("target", "lexer", "mode", "strict"), List.of("coder"), null, null)),
                    List.of());

            scheduler.executeRecipe(recipe, RecipeRunOptions.withVariables(Map.of()));

            assertEquals("Refactor parser", runtime.invocations().get(0).task());
            assertEquals("Review lexer in strict mode", runtime.invocations().get(1).task());
        }

        @Test
        @DisplayName("each step writes its own output file")
        void perStepOutput() {
            var options = new RecipeRunOptions(null, "out/result.md", Map.of(), null, 0, OutputFormat.TEXT);

            scheduler.executeRecipe(abc(), options);

            assertTrue(Files.exists(fixture.workspace().resolve("out/A_result.md")));
            assertTrue(Files.exists(fixture.workspace().resolve("out/C_result.md")));
        }

        @Test
        @DisplayName("cleanup runs after the steps and its failure does not fail the recipe")
        void cleanupFailureIgnored() {
            runtime.on("janitor", (task, context) -> AgentResponse.failure("disk busy"));
            Recipe recipe = new Recipe("with-cleanup", null, null, List.of(), Map.of(),
                    List.of(Step.of("A", "work")), List.of(Step.of("janitor", "tidy up")));

            RecipeResult result = scheduler.executeRecipe(recipe, RecipeRunOptions.defaults());

            assertTrue(result.success());
            assertEquals(List.of("A", "janitor"), runtime.invokedAgents());
            assertEquals(1, result.results().size());
        }

        @Test
        @DisplayName("publishes start, batch and completion events")
        void publishesEvents() {
            List<AgentryEvent> events = new CopyOnWriteArrayList<>();
            fixture.eventBus().subscribeAll(e -> {
                if (e.eventType().startsWith("recipe.")) {
                    events.add(e);
                }
            });

            scheduler.executeRecipe(abc(), RecipeRunOptions.defaults());

            assertEquals(List.of("recipe.started", "recipe.batch", "recipe.batch", "recipe.completed"),
                    events.stream().map(AgentryEvent::eventType).toList());
        }
    }
}
