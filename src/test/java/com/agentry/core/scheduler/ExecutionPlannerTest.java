package com.agentry.core.scheduler;

import com.agentry.core.model.ExecutionPlan;
import com.agentry.core.model.Step;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ExecutionPlanner}.
 */
class ExecutionPlannerTest {

    private final ExecutionPlanner planner = new ExecutionPlanner();

    @Nested
    @DisplayName("Batching")
    class Batching {

        @Test
        @DisplayName("independent steps share the first batch")
        void independentThenDependent() {
            ExecutionPlan plan = planner.plan(List.of(
                    Step.of("A", "a"),
                    Step.of("B", "b"),
                    Step.of("C", "c", "A", "B")));

            assertEquals(List.of(List.of(0, 1), List.of(2)), plan.batches());
            assertEquals(3, plan.stepCount());
        }

        @Test
        @DisplayName("a diamond runs in three batches")
        void diamond() {
            ExecutionPlan plan = planner.plan(List.of(
                    Step.of("A", "a"),
                    Step.of("B", "b", "A"),
                    Step.of("C", "c", "A"),
                    Step.of("D", "d", "B", "C")));

            assertEquals(List.of(List.of(0), List.of(1, 2), List.of(3)), plan.batches());
        }

        @Test
        @DisplayName("a step never shares a batch with its dependency")
        void dependencyDeclaredEarlier() {
            ExecutionPlan plan = planner.plan(List.of(
                    Step.of("A", "a"),
                    Step.of("B", "b", "A")));

            assertEquals(2, plan.batchCount());
        }

        @Test
        @DisplayName("declaration order does not matter")
        void reverseDeclaration() {
            ExecutionPlan plan = planner.plan(List.of(
                    Step.of("C", "c", "B"),
                    Step.of("B", "b", "A"),
                    Step.of("A", "a")));

            assertEquals(List.of(List.of(2), List.of(1), List.of(0)), plan.batches());
        }

        @Test
        @DisplayName("ids distinguish steps that use the same agent")
        void idsDisambiguate() {
            ExecutionPlan plan = planner.plan(List.of(
                    Step.withId("draft", "writer", "draft it"),
                    Step.withId("polish", "writer", "polish it", "draft")));

            assertEquals(List.of(List.of(0), List.of(1)), plan.batches());
        }

        @Test
        @DisplayName("no steps means no batches")
        void empty() {
            assertEquals(0, planner.plan(List.of()).batchCount());
        }
    }

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        @DisplayName("a two-step cycle names its members")
        void twoStepCycle() {
            var ex = assertThrows(CircularDependencyException.class, () -> planner.plan(List.of(
                    Step.of("A", "a", "B"),
                    Step.of("B", "b", "A"))));

            assertEquals(List.of("A", "B", "A"), ex.getCycle());
            assertEquals("Circular dependency detected: A -> B -> A", ex.getMessage());
        }

        @Test
        @DisplayName("a self dependency is a cycle")
        void selfDependency() {
            var ex = assertThrows(CircularDependencyException.class,
                    () -> planner.plan(List.of(Step.of("A", "a", "A"))));

            assertEquals(List.of("A", "A"), ex.getCycle());
        }

        @Test
        @DisplayName("a cycle behind schedulable steps is still found")
        void cycleAfterValidSteps() {
            var ex = assertThrows(CircularDependencyException.class, () -> planner.plan(List.of(
                    Step.of("A", "a"),
                    Step.of("B", "b", "A", "D"),
                    Step.of("C", "c", "B"),
                    Step.of("D", "d", "C"))));

            assertTrue(ex.getCycle().containsAll(List.of("B", "C", "D")));
            assertFalse(ex.getCycle().contains("A"));
        }

        @Test
        @DisplayName("an unknown dependency is a validation error")
        void unknownDependency() {
            var ex = assertThrows(RecipeValidationException.class,
                    () -> planner.plan(List.of(Step.of("A", "a"), Step.of("B", "b", "Z"))));

            assertEquals(List.of("Step 'B' depends on unknown step 'Z'"), ex.getErrors());
        }

        @Test
        @DisplayName("two steps with the same identity are rejected")
        void duplicateIdentity() {
            var errors = planner.structuralErrors(List.of(
                    Step.of("coder", "first"),
                    Step.of("coder", "second")));

            assertEquals(1, errors.size());
            assertTrue(errors.get(0).startsWith("Duplicate step identity 'coder' (steps 1 and 2)"));
        }
    }
}
