package com.agentrelay.shared;

/**
 * Base type for every failure raised while routing, dispatching or orchestrating
 * delegated work. Subtypes carry the structured detail callers need to render a
 * short user-facing message or decide on a fallback.
 */
public class DelegationException extends RuntimeException {

    public DelegationException(String message) {
        super(message);
    }

    public DelegationException(String message, Throwable cause) {
        super(message, cause);
    }
}
