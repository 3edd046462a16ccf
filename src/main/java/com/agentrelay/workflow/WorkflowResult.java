package com.agentrelay.workflow;

import java.util.List;
import java.util.stream.Collectors;

public record WorkflowResult(String workflowId, WorkflowStatus status, List<StepResult> steps, long durationMillis) {

    public WorkflowResult {
        steps = List.copyOf(steps);
    }

    public List<StepResult> failedSteps() {
        return steps.stream()
                .filter(s -> s.status() != StepStatus.COMPLETED)
                .collect(Collectors.toList());
    }

    public List<String> completedResults() {
        return steps.stream()
                .filter(s -> s.status() == StepStatus.COMPLETED)
                .map(StepResult::result)
                .collect(Collectors.toList());
    }

    public StepResult step(int index) {
        return steps.get(index);
    }

    /**
     * Returns this result if every step completed.
     *
     * @throws WorkflowPartialFailureException otherwise
     */
    public WorkflowResult requireCompleted() {
        if (status != WorkflowStatus.COMPLETED) {
            throw new WorkflowPartialFailureException(this);
        }
        return this;
    }
}
