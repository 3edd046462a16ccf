package com.agentrelay.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window limiter keyed by agent. Only admitted calls are recorded, so a
 * caller that keeps retrying against a full window is not penalized further.
 */
public class RateLimiter {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final Duration window;
    private final Clock clock;
    private final ConcurrentHashMap<String, ArrayDeque<Instant>> windows = new ConcurrentHashMap<>();

    public RateLimiter(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    public RateLimiter() {
        this(DEFAULT_WINDOW, Clock.systemUTC());
    }

    public RateDecision allow(String key, int limitPerWindow) {
        var deque = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (deque) {
            var now = clock.instant();
            prune(deque, now);
            if (deque.size() >= limitPerWindow) {
                var resetAt = deque.isEmpty() ? now.plus(window) : deque.peekFirst().plus(window);
                return new RateDecision(false, 0, resetAt);
            }
            deque.addLast(now);
            return new RateDecision(true, limitPerWindow - deque.size(), deque.peekFirst().plus(window));
        }
    }

    public void acquire(String key, int limitPerWindow) {
        var decision = allow(key, limitPerWindow);
        if (!decision.allowed()) {
            throw new RateLimitExceededException(key, decision.remaining(), decision.resetAt());
        }
    }

    public int count(String key) {
        var deque = windows.get(key);
        if (deque == null) return 0;
        synchronized (deque) {
            prune(deque, clock.instant());
            return deque.size();
        }
    }

    public void reset(String key) {
        var deque = windows.get(key);
        if (deque == null) return;
        synchronized (deque) {
            deque.clear();
        }
    }

    private void prune(ArrayDeque<Instant> deque, Instant now) {
        var cutoff = now.minus(window);
        while (!deque.isEmpty() && !deque.peekFirst().isAfter(cutoff)) {
            deque.pollFirst();
        }
    }
}
