package com.agentry.core.execution;

import com.agentry.core.model.ExecutionResult;

import java.util.List;

/**
 * Human-readable batch reports.
 */
public final class ExecutionReports {

    private ExecutionReports() {}

    public static String batchSummary(List<ExecutionResult> results, long totalDurationMs) {
        long successful = results.stream().filter(ExecutionResult::success).count();
        long failed = results.size() - successful;
        long average = results.isEmpty() ? 0 : Math.round(results.stream()
                .mapToLong(ExecutionReports::durationOf).average().orElse(0));

        var sb = new StringBuilder();
        sb.append("## Batch Execution Summary\n\n");
        sb.append("**Total Tasks:** ").append(results.size()).append('\n');
        sb.append("**Successful:** ").append(successful).append('\n');
        sb.append("**Failed:** ").append(failed).append('\n');
        sb.append("**Total Duration:** ").append(totalDurationMs).append("ms\n");
        sb.append("**Average Duration:** ").append(average).append("ms\n");

        if (successful > 0) {
            sb.append("\n### Successful Executions\n");
            for (ExecutionResult r : results) {
                if (r.success()) {
                    sb.append("- ").append(r.agentName()).append(" (").append(durationOf(r)).append("ms)\n");
                }
            }
        }
        if (failed > 0) {
            sb.append("\n### Failed Executions\n");
            for (ExecutionResult r : results) {
                if (!r.success()) {
                    sb.append("- ").append(r.agentName()).append(": ").append(r.error()).append('\n');
                }
            }
        }
        return sb.toString();
    }

    static long durationOf(ExecutionResult result) {
        return result.metrics() != null ? result.metrics().durationMs() : 0;
    }
}
