package com.agentry.core.scheduler;

import com.agentry.core.model.ExecutionResult;
import com.agentry.core.model.Recipe;
import com.agentry.core.model.Step;

import java.util.List;

final class RecipeReports {

    private RecipeReports() {}

    /**
     * @param steps   steps in the order their results appear
     * @param results one result per step
     */
    static String summary(Recipe recipe, List<Step> steps, List<ExecutionResult> results, long durationMs) {
        long succeeded = results.stream().filter(ExecutionResult::success).count();
        boolean success = succeeded == results.size();

        var sb = new StringBuilder();
        sb.append("# Recipe Execution Summary\n\n");
        sb.append("**Recipe:** ").append(recipe.name()).append('\n');
        if (recipe.description() != null && !recipe.description().isBlank()) {
            sb.append("**Description:** ").append(recipe.description()).append('\n');
        }
        sb.append("**Version:** ").append(recipe.version()).append('\n');
        sb.append("**Status:** ").append(success ? "Success" : "Failed").append('\n');
        sb.append("**Steps Completed:** ").append(succeeded).append('/').append(recipe.steps().size()).append('\n');
        sb.append("**Total Duration:** ").append(durationMs).append("ms\n");

        sb.append("\n## Step Results\n\n");
        for (int i = 0; i < results.size(); i++) {
            ExecutionResult result = results.get(i);
            long ms = result.metrics() != null ? result.metrics().durationMs() : 0;
            sb.append(i + 1).append(". ").append(steps.get(i).identity());
            if (result.success()) {
                sb.append(": OK (").append(ms).append("ms)\n");
            } else {
                sb.append(": FAILED (").append(ms).append("ms) - ").append(result.error()).append('\n');
            }
        }
        return sb.toString();
    }
}
