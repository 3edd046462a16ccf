package com.agentrelay.registry;

import com.agentrelay.shared.DelegationException;

public class AgentNotFoundException extends DelegationException {

    private final String identifier;

    public AgentNotFoundException(String identifier) {
        super("Agent not found: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
