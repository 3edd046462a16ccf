package com.agentrelay.resilience;

import com.agentrelay.shared.DelegationException;

import java.time.Instant;

public class RateLimitExceededException extends DelegationException {

    private final String key;
    private final int remaining;
    private final Instant resetAt;

    public RateLimitExceededException(String key, int remaining, Instant resetAt) {
        super("Rate limit exceeded for '" + key + "', resets at " + resetAt);
        this.key = key;
        this.remaining = remaining;
        this.resetAt = resetAt;
    }

    public String key() { return key; }

    public int remaining() { return remaining; }

    public Instant resetAt() { return resetAt; }
}
