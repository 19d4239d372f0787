package com.agentry.core.execution;

import com.agentry.core.model.ExecutionResult;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Running totals over every execution since startup. Unlike the history,
 * these are never evicted.
 */
public class ExecutionStats {

    private long executions;
    private long successes;
    private long failures;
    private long totalDurationMs;
    private long totalTokens;
    private final Map<String, long[]> perAgent = new HashMap<>();

    public synchronized void record(ExecutionResult result) {
        long duration = result.metrics() != null ? result.metrics().durationMs() : 0;
        executions++;
        if (result.success()) {
            successes++;
        } else {
            failures++;
        }
        totalDurationMs += duration;
        if (result.metrics() != null && result.metrics().tokensUsed() != null) {
            totalTokens += result.metrics().tokensUsed();
        }
        // executions, successes, total duration
        long[] agent = perAgent.computeIfAbsent(String.valueOf(result.agentName()), k -> new long[3]);
        agent[0]++;
        if (result.success()) {
            agent[1]++;
        }
        agent[2] += duration;
    }

    public synchronized long executions() {
        return executions;
    }

    public synchronized long successes() {
        return successes;
    }

    public synchronized long failures() {
        return failures;
    }

    public synchronized long totalTokens() {
        return totalTokens;
    }

    public synchronized double averageDurationMs() {
        return executions == 0 ? 0.0 : (double) totalDurationMs / executions;
    }

    public synchronized double successRate() {
        return executions == 0 ? 0.0 : (double) successes / executions;
    }

    public synchronized List<AgentStats> perAgent() {
        return perAgent.entrySet().stream()
                .map(e -> new AgentStats(e.getKey(), e.getValue()[0], e.getValue()[1],
                        e.getValue()[0] == 0 ? 0.0 : (double) e.getValue()[2] / e.getValue()[0]))
                .sorted(Comparator.comparing(AgentStats::executions).reversed()
                        .thenComparing(AgentStats::agentName))
                .toList();
    }

    public Optional<AgentStats> forAgent(String agentName) {
        return perAgent().stream().filter(s -> s.agentName().equals(agentName)).findFirst();
    }

    public Optional<String> mostUsedAgent() {
        return perAgent().stream().findFirst().map(AgentStats::agentName);
    }

    public synchronized void reset() {
        executions = 0;
        successes = 0;
        failures = 0;
        totalDurationMs = 0;
        totalTokens = 0;
        perAgent.clear();
    }
}
