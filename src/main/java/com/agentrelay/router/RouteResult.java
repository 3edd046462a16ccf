package com.agentrelay.router;

/**
 * Outcome of routing one message. {@code agent} is null for local handling.
 */
public record RouteResult(Kind kind, String agent, String content, String intent) {

    public enum Kind {
        REMOTE,
        LOCAL,
        AGENT_NOT_FOUND,
        UNAVAILABLE,
        RATE_LIMITED,
        REMOTE_ERROR
    }

    public boolean delegated() {
        return kind == Kind.REMOTE;
    }
}
