package com.agentrelay.workflow;

import com.agentrelay.shared.DelegationException;

public class WorkflowValidationException extends DelegationException {

    public WorkflowValidationException(String message) {
        super(message);
    }
}
