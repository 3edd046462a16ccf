package com.agentrelay.workflow;

/**
 * Outcome of one step. {@code agent} is the resolved agent name when resolution
 * succeeded, otherwise the identifier the step asked for.
 */
public record StepResult(
    int index,
    String agent,
    String task,
    StepStatus status,
    String result,
    String error,
    String errorType,
    long durationMillis
) {}
