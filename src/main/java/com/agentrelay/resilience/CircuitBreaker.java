package com.agentrelay.resilience;

import com.agentrelay.shared.config.ResilienceConfig.BreakerSettings;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-agent failure gate. CLOSED trips to OPEN after {@code failureThreshold}
 * consecutive failures; once {@code openTimeout} has elapsed a single trial call
 * is admitted (HALF_OPEN) and its outcome closes or re-opens the circuit.
 */
public class CircuitBreaker {

    @FunctionalInterface
    public interface Listener {
        void onStateChange(String agent, CircuitState from, CircuitState to);
    }

    private final String agent;
    private final BreakerSettings settings;
    private final Clock clock;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String agent, BreakerSettings settings, Clock clock) {
        this.agent = agent;
        this.settings = settings;
        this.clock = clock;
    }

    public CircuitBreaker(String agent, BreakerSettings settings) {
        this(agent, settings, Clock.systemUTC());
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public String agent() { return agent; }

    public BreakerSettings settings() { return settings; }

    /**
     * Admits a call or throws {@link CircuitOpenException}. Every admitted call
     * must be followed by exactly one {@link #onSuccess()} or {@link #onFailure()}.
     */
    public void acquire() {
        CircuitState from = null;
        synchronized (this) {
            switch (state) {
                case CLOSED -> { return; }
                case OPEN -> {
                    var retryAt = openedAt.plus(settings.openTimeout());
                    if (clock.instant().isBefore(retryAt)) {
                        throw new CircuitOpenException(agent, retryAt);
                    }
                    from = state;
                    state = CircuitState.HALF_OPEN;
                    trialInFlight = true;
                }
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        throw new CircuitOpenException(agent, clock.instant());
                    }
                    trialInFlight = true;
                }
            }
        }
        if (from != null) fire(from, CircuitState.HALF_OPEN);
    }

    /**
     * A success that lands while OPEN came from a call admitted before the trip
     * and leaves the circuit open until its timeout elapses.
     */
    public void onSuccess() {
        CircuitState from;
        synchronized (this) {
            if (state == CircuitState.OPEN) return;
            consecutiveFailures = 0;
            trialInFlight = false;
            if (state == CircuitState.CLOSED) return;
            from = state;
            state = CircuitState.CLOSED;
            openedAt = null;
        }
        fire(from, CircuitState.CLOSED);
    }

    public void onFailure() {
        CircuitState from;
        synchronized (this) {
            trialInFlight = false;
            consecutiveFailures++;
            if (state == CircuitState.OPEN) return;
            if (state == CircuitState.CLOSED && consecutiveFailures < settings.failureThreshold()) return;
            from = state;
            state = CircuitState.OPEN;
            openedAt = clock.instant();
        }
        fire(from, CircuitState.OPEN);
    }

    /**
     * Gives back an admitted call that never reached the agent.
     */
    public synchronized void release() {
        trialInFlight = false;
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant openedAt() {
        return openedAt;
    }

    public synchronized void reset() {
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
    }

    private void fire(CircuitState from, CircuitState to) {
        for (var l : listeners) l.onStateChange(agent, from, to);
    }
}
