package com.agentrelay.workflow;

import com.agentrelay.shared.DelegationException;

public class WorkflowPartialFailureException extends DelegationException {

    private final WorkflowResult result;

    public WorkflowPartialFailureException(WorkflowResult result) {
        super("Workflow " + result.workflowId() + " finished " + result.status()
                + ": " + result.failedSteps().size() + " of " + result.steps().size() + " steps did not complete");
        this.result = result;
    }

    public WorkflowResult result() {
        return result;
    }
}
