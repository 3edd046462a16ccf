package com.agentrelay.workflow;

public enum WorkflowStatus {
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED,
    CANCELLED
}
