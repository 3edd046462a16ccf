package com.agentrelay.delegation;

import com.agentrelay.observability.RelayMetrics;
import com.agentrelay.registry.AgentDescriptor;
import com.agentrelay.resilience.CircuitBreakerRegistry;
import com.agentrelay.resilience.CircuitOpenException;
import com.agentrelay.resilience.RateLimitExceededException;
import com.agentrelay.resilience.RateLimiter;
import com.agentrelay.shared.Futures;
import com.agentrelay.shared.config.ResilienceConfig;
import com.agentrelay.shared.config.ResilienceConfig.RateLimitConfig;
import com.agentrelay.transport.CommunicationException;
import com.agentrelay.transport.TransportClientPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Sends one task to one agent through circuit breaker, rate limiter and
 * transport, in that order. Breaker and limiter rejections fail fast and are
 * never retried here.
 */
public class AgentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatcher.class);

    private final TransportClientPool pool;
    private final CircuitBreakerRegistry breakers;
    private final RateLimiter rateLimiter;
    private final RateLimitConfig rateLimits;
    private final Duration callTimeout;
    private final RelayMetrics metrics;

    public AgentDispatcher(TransportClientPool pool, CircuitBreakerRegistry breakers,
                           RateLimiter rateLimiter, RateLimitConfig rateLimits,
                           Duration callTimeout, RelayMetrics metrics) {
        this.pool = pool;
        this.breakers = breakers;
        this.rateLimiter = rateLimiter;
        this.rateLimits = rateLimits;
        this.callTimeout = callTimeout;
        this.metrics = metrics;
    }

    public CompletableFuture<String> dispatch(AgentDescriptor agent, String task, String correlationId) {
        return dispatch(agent, task, correlationId, callTimeout);
    }

    public CompletableFuture<String> dispatch(AgentDescriptor agent, String task, String correlationId,
                                              Duration timeout) {
        var name = ResilienceConfig.agentKey(agent.name());
        var breaker = breakers.forAgent(name);
        try {
            breaker.acquire();
        } catch (CircuitOpenException e) {
            metrics.delegations(name, "circuit_open").increment();
            log.debug("[{}] circuit open for '{}', not calling", correlationId, name);
            return CompletableFuture.failedFuture(e);
        }

        var decision = rateLimiter.allow(name, rateLimits.limitFor(name));
        if (!decision.allowed()) {
            breaker.release();
            metrics.rateLimitRejections(name).increment();
            log.debug("[{}] rate limit reached for '{}', resets at {}", correlationId, name, decision.resetAt());
            return CompletableFuture.failedFuture(
                    new RateLimitExceededException(name, decision.remaining(), decision.resetAt()));
        }

        long start = System.nanoTime();
        CompletableFuture<String> call;
        try {
            call = pool.get(agent.endpoint()).delegate(task, correlationId, timeout);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.whenComplete((text, err) -> {
            var outcome = "success";
            if (err == null) {
                breaker.onSuccess();
            } else if (Futures.unwrap(err) instanceof CommunicationException ce
                    && ce.kind() == CommunicationException.Kind.REMOTE_ERROR) {
                // the agent answered, so it is healthy even if the task failed
                breaker.onSuccess();
                outcome = "remote_error";
            } else {
                breaker.onFailure();
                outcome = "failure";
            }
            metrics.recordDelegation(name, outcome, System.nanoTime() - start);
            if (err != null) {
                log.warn("[{}] delegation to '{}' failed: {}", correlationId, name, Futures.unwrap(err).getMessage());
            }
        });
    }

    /**
     * Blocking form of {@link #dispatch}; rethrows the original delegation failure.
     */
    public String delegate(AgentDescriptor agent, String task, String correlationId) {
        return Futures.join(dispatch(agent, task, correlationId));
    }
}
