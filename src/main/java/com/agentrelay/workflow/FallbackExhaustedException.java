package com.agentrelay.workflow;

import com.agentrelay.shared.DelegationException;

import java.util.List;
import java.util.stream.Collectors;

public class FallbackExhaustedException extends DelegationException {

    private final List<FallbackAttempt> attempts;

    public FallbackExhaustedException(List<FallbackAttempt> attempts) {
        super("All agents failed:\n" + attempts.stream()
                .map(a -> a.agent() + ": " + a.error())
                .collect(Collectors.joining("\n")));
        this.attempts = List.copyOf(attempts);
    }

    public List<FallbackAttempt> attempts() {
        return attempts;
    }
}
