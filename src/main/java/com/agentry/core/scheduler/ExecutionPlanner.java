package com.agentry.core.scheduler;

import com.agentry.core.model.ExecutionPlan;
import com.agentry.core.model.Step;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layers recipe steps into batches. A step joins the first batch after all of its
 * dependencies have been scheduled in earlier batches, so no batch holds a step
 * together with one of its dependencies.
 */
@Component
public class ExecutionPlanner {

    /**
     * @throws RecipeValidationException   for duplicate identities or unknown dependency targets
     * @throws CircularDependencyException when the remaining steps depend on each other
     */
    public ExecutionPlan plan(List<Step> steps) {
        Map<String, Integer> indexByIdentity = indexSteps(steps);

        Set<String> scheduled = new HashSet<>();
        Set<Integer> remaining = new LinkedHashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            remaining.add(i);
        }

        List<List<Integer>> batches = new ArrayList<>();
        while (!remaining.isEmpty()) {
            List<Integer> batch = new ArrayList<>();
            for (int index : remaining) {
                if (scheduled.containsAll(steps.get(index).dependsOn())) {
                    batch.add(index);
                }
            }
            if (batch.isEmpty()) {
                throw new CircularDependencyException(findCycle(steps, remaining, indexByIdentity));
            }
            for (int index : batch) {
                scheduled.add(steps.get(index).identity());
            }
            remaining.removeAll(batch);
            batches.add(batch);
        }
        return new ExecutionPlan(batches);
    }

    /**
     * Errors that make a step list unplannable, without checking for cycles.
     */
    public List<String> structuralErrors(List<Step> steps) {
        List<String> errors = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            String identity = steps.get(i).identity();
            if (identity == null || identity.isBlank()) {
                errors.add("Step " + (i + 1) + " has no agent or id");
                continue;
            }
            Integer previous = seen.putIfAbsent(identity, i);
            if (previous != null) {
                errors.add("Duplicate step identity '" + identity + "' (steps " + (previous + 1) + " and " + (i + 1)
                        + "); give the steps distinct ids");
            }
        }
        for (Step step : steps) {
            for (String dependency : step.dependsOn()) {
                if (!seen.containsKey(dependency)) {
                    errors.add("Step '" + step.identity() + "' depends on unknown step '" + dependency + "'");
                }
            }
        }
        return errors;
    }

    private Map<String, Integer> indexSteps(List<Step> steps) {
        List<String> errors = structuralErrors(steps);
        if (!errors.isEmpty()) {
            throw new RecipeValidationException(errors);
        }
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            index.put(steps.get(i).identity(), i);
        }
        return index;
    }

    /**
     * Depth-first search over the unschedulable steps for one concrete cycle.
     */
    private List<String> findCycle(List<Step> steps, Set<Integer> remaining, Map<String, Integer> indexByIdentity) {
        Set<Integer> visited = new HashSet<>();
        for (int start : remaining) {
            List<Integer> path = new ArrayList<>();
            List<String> cycle = dfs(start, steps, remaining, indexByIdentity, visited, path);
            if (cycle != null) {
                return cycle;
            }
        }
        // Unreachable for a well-formed step list; report the stuck steps instead
        List<String> stuck = new ArrayList<>();
        for (int index : remaining) {
            stuck.add(steps.get(index).identity());
        }
        return stuck;
    }

    private List<String> dfs(int node, List<Step> steps, Set<Integer> remaining, Map<String, Integer> indexByIdentity,
                             Set<Integer> visited, List<Integer> path) {
        int onPath = path.indexOf(node);
        if (onPath >= 0) {
            List<String> cycle = new ArrayList<>();
            for (int i = onPath; i < path.size(); i++) {
                cycle.add(steps.get(path.get(i)).identity());
            }
            cycle.add(steps.get(node).identity());
            return cycle;
        }
        if (!visited.add(node)) {
            return null;
        }
        path.add(node);
        for (String dependency : steps.get(node).dependsOn()) {
            Integer next = indexByIdentity.get(dependency);
            if (next != null && remaining.contains(next)) {
                List<String> cycle = dfs(next, steps, remaining, indexByIdentity, visited, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        return null;
    }
}
