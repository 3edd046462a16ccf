package com.agentrelay.transport;

import com.agentrelay.shared.DelegationException;

public class CommunicationException extends DelegationException {

    public enum Kind {
        TIMEOUT,
        CONNECTION_REFUSED,
        PROTOCOL_ERROR,
        REMOTE_ERROR
    }

    private final Kind kind;
    private final String detail;
    private final boolean retryable;

    public CommunicationException(Kind kind, String detail, boolean retryable, Throwable cause) {
        super(kind.name().toLowerCase() + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
        this.retryable = retryable;
    }

    public CommunicationException(Kind kind, String detail) {
        this(kind, detail, kind == Kind.TIMEOUT || kind == Kind.CONNECTION_REFUSED, null);
    }

    public Kind kind() { return kind; }

    public String detail() { return detail; }

    public boolean retryable() { return retryable; }
}
