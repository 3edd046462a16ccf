package com.agentrelay.workflow;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * One task in a workflow. {@code agent} is an agent name or a capability;
 * {@code dependsOn} holds indices of earlier or later steps in the same spec.
 */
public record WorkflowStep(String agent, String task, Set<Integer> dependsOn) {

    public WorkflowStep {
        if (agent == null || agent.isBlank()) {
            throw new WorkflowValidationException("step agent must not be blank");
        }
        if (task == null) {
            throw new WorkflowValidationException("step task must not be null");
        }
        dependsOn = dependsOn == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(dependsOn));
    }

    public WorkflowStep(String agent, String task) {
        this(agent, task, Set.of());
    }

    public static WorkflowStep of(String agent, String task, Integer... dependsOn) {
        return new WorkflowStep(agent, task, Set.of(dependsOn));
    }
}
