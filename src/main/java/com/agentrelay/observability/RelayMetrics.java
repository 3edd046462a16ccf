package com.agentrelay.observability;

import com.agentrelay.resilience.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter delegations(String agent, String outcome) {
        return Counter.builder("relay.delegations")
                .tag("agent", agent)
                .tag("outcome", outcome)
                .register(registry);
    }

    public Timer delegationLatency(String agent) {
        return Timer.builder("relay.delegation.latency").tag("agent", agent).register(registry);
    }

    public void recordDelegation(String agent, String outcome, long elapsedNanos) {
        delegations(agent, outcome).increment();
        delegationLatency(agent).record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public Counter circuitTransitions(String agent, String toState) {
        return Counter.builder("relay.circuit.transitions")
                .tag("agent", agent)
                .tag("state", toState)
                .register(registry);
    }

    public CircuitBreaker.Listener circuitListener() {
        return (agent, from, to) -> circuitTransitions(agent, to.name()).increment();
    }

    public Counter rateLimitRejections(String agent) {
        return Counter.builder("relay.ratelimit.rejections").tag("agent", agent).register(registry);
    }

    public Timer workflowDuration(String mode, String status) {
        return Timer.builder("relay.workflow.duration")
                .tag("mode", mode)
                .tag("status", status)
                .register(registry);
    }

    public Counter routes(String kind) {
        return Counter.builder("relay.routes").tag("kind", kind).register(registry);
    }
}
