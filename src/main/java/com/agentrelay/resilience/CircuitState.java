package com.agentrelay.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
