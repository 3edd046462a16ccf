package com.agentrelay.resilience;

import com.agentrelay.shared.DelegationException;

import java.time.Instant;

public class CircuitOpenException extends DelegationException {

    private final String agent;
    private final Instant retryAt;

    public CircuitOpenException(String agent, Instant retryAt) {
        super("Circuit open for agent '" + agent + "' until " + retryAt);
        this.agent = agent;
        this.retryAt = retryAt;
    }

    public String agent() {
        return agent;
    }

    public Instant retryAt() {
        return retryAt;
    }
}
