package com.agentrelay.workflow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * An ordered list of steps forming a DAG. Construction validates indices and
 * rejects cycles, so every spec that exists can be executed.
 */
public final class WorkflowSpec {

    private final List<WorkflowStep> steps;
    private final List<Integer> executionOrder;

    private WorkflowSpec(List<WorkflowStep> steps, List<Integer> executionOrder) {
        this.steps = steps;
        this.executionOrder = executionOrder;
    }

    public static WorkflowSpec of(WorkflowStep... steps) {
        return of(List.of(steps));
    }

    public static WorkflowSpec of(List<WorkflowStep> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowValidationException("workflow has no steps");
        }
        var copy = List.copyOf(steps);
        for (int i = 0; i < copy.size(); i++) {
            for (int dep : copy.get(i).dependsOn()) {
                if (dep == i) {
                    throw new WorkflowValidationException("step " + i + " depends on itself");
                }
                if (dep < 0 || dep >= copy.size()) {
                    throw new WorkflowValidationException(
                            "step " + i + " depends on unknown step " + dep + " (spec has " + copy.size() + " steps)");
                }
            }
        }
        return new WorkflowSpec(copy, topologicalOrder(copy));
    }

    public List<WorkflowStep> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    /** Step indices such that every step comes after its dependencies, ties broken by declaration order. */
    public List<Integer> executionOrder() {
        return executionOrder;
    }

    private static List<Integer> topologicalOrder(List<WorkflowStep> steps) {
        int n = steps.size();
        int[] pending = new int[n];
        List<List<Integer>> dependents = new ArrayList<>();
        for (int i = 0; i < n; i++) dependents.add(new ArrayList<>());
        for (int i = 0; i < n; i++) {
            pending[i] = steps.get(i).dependsOn().size();
            for (int dep : steps.get(i).dependsOn()) dependents.get(dep).add(i);
        }

        var ready = new PriorityQueue<Integer>();
        for (int i = 0; i < n; i++) {
            if (pending[i] == 0) ready.add(i);
        }
        var order = new ArrayList<Integer>(n);
        while (!ready.isEmpty()) {
            int next = ready.poll();
            order.add(next);
            for (int d : dependents.get(next)) {
                if (--pending[d] == 0) ready.add(d);
            }
        }
        if (order.size() < n) {
            throw new WorkflowValidationException("workflow has a dependency cycle: " + describeCycle(steps, pending));
        }
        return Collections.unmodifiableList(order);
    }

    // Walks dependency edges among the steps left unscheduled until one repeats.
    private static String describeCycle(List<WorkflowStep> steps, int[] pending) {
        int start = 0;
        while (pending[start] == 0) start++;
        var path = new ArrayList<Integer>();
        var seen = new int[steps.size()];
        Arrays.fill(seen, -1);
        int current = start;
        while (seen[current] < 0) {
            seen[current] = path.size();
            path.add(current);
            int from = current;
            current = steps.get(from).dependsOn().stream()
                    .filter(d -> pending[d] > 0)
                    .findFirst()
                    .orElseThrow();
        }
        var rendered = new ArrayList<>(path.subList(seen[current], path.size()));
        rendered.add(current);
        return rendered.stream().map(String::valueOf).collect(Collectors.joining(" -> "));
    }

    @Override
    public String toString() {
        return "WorkflowSpec" + steps;
    }
}
