package com.agentrelay.workflow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Mutable per-execution step table. Transitions out of RUNNING are first-wins,
 * so a call that finishes after the deadline cannot overwrite CANCELLED.
 */
final class WorkflowRun {

    private final String workflowId;
    private final String mode;
    private final List<WorkflowStep> steps;
    private final long startNanos = System.nanoTime();

    private final StepStatus[] status;
    private final String[] agents;
    private final String[] results;
    private final String[] errors;
    private final String[] errorTypes;
    private final long[] stepStart;
    private final long[] durations;
    private volatile boolean cancelled;

    WorkflowRun(String workflowId, String mode, List<WorkflowStep> steps) {
        this.workflowId = workflowId;
        this.mode = mode;
        this.steps = steps;
        int n = steps.size();
        status = new StepStatus[n];
        Arrays.fill(status, StepStatus.PENDING);
        agents = new String[n];
        for (int i = 0; i < n; i++) agents[i] = steps.get(i).agent();
        results = new String[n];
        errors = new String[n];
        errorTypes = new String[n];
        stepStart = new long[n];
        durations = new long[n];
    }

    String workflowId() { return workflowId; }

    String mode() { return mode; }

    WorkflowStep step(int index) { return steps.get(index); }

    boolean cancelled() { return cancelled; }

    synchronized StepStatus status(int index) {
        return status[index];
    }

    synchronized boolean start(int index, String agentName) {
        if (status[index] != StepStatus.PENDING) return false;
        status[index] = StepStatus.RUNNING;
        agents[index] = agentName;
        stepStart[index] = System.nanoTime();
        return true;
    }

    synchronized void complete(int index, String text) {
        if (status[index] != StepStatus.RUNNING) return;
        status[index] = StepStatus.COMPLETED;
        results[index] = text;
        durations[index] = elapsedMillis(stepStart[index]);
    }

    synchronized void fail(int index, Throwable error) {
        if (status[index] != StepStatus.RUNNING && status[index] != StepStatus.PENDING) return;
        if (status[index] == StepStatus.RUNNING) durations[index] = elapsedMillis(stepStart[index]);
        status[index] = StepStatus.FAILED;
        errors[index] = String.valueOf(error.getMessage());
        errorTypes[index] = error.getClass().getSimpleName();
    }

    synchronized void settle(int index, StepStatus terminal, String reason) {
        if (status[index].isTerminal()) return;
        if (status[index] == StepStatus.RUNNING) durations[index] = elapsedMillis(stepStart[index]);
        status[index] = terminal;
        errors[index] = reason;
    }

    /** Marks every unfinished step CANCELLED. */
    synchronized void cancel() {
        cancelled = true;
        for (int i = 0; i < status.length; i++) {
            if (status[i] == StepStatus.PENDING) {
                settle(i, StepStatus.CANCELLED, "not started before workflow deadline");
            } else if (status[i] == StepStatus.RUNNING) {
                settle(i, StepStatus.CANCELLED, "abandoned at deadline");
            }
        }
    }

    synchronized List<StepResult> snapshotSteps() {
        var out = new ArrayList<StepResult>(status.length);
        for (int i = 0; i < status.length; i++) {
            long duration = status[i] == StepStatus.RUNNING ? elapsedMillis(stepStart[i]) : durations[i];
            out.add(new StepResult(i, agents[i], steps.get(i).task(), status[i],
                    results[i], errors[i], errorTypes[i], duration));
        }
        return out;
    }

    WorkflowResult snapshot(WorkflowStatus overall) {
        return new WorkflowResult(workflowId, overall, snapshotSteps(), elapsedMillis(startNanos));
    }

    long elapsedMillis() {
        return elapsedMillis(startNanos);
    }

    private static long elapsedMillis(long since) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - since);
    }
}
