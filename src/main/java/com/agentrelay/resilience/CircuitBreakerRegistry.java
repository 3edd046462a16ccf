package com.agentrelay.resilience;

import com.agentrelay.shared.config.ResilienceConfig;
import com.agentrelay.shared.config.ResilienceConfig.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One {@link CircuitBreaker} per agent name, created on first use with that
 * agent's configured settings. Names are case-insensitive.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final List<CircuitBreaker.Listener> listeners = new CopyOnWriteArrayList<>();

    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        listeners.add((agent, from, to) ->
                log.info("Circuit for agent '{}' {} -> {}", agent, from, to));
    }

    public CircuitBreakerRegistry(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Listeners added here are attached to breakers created afterwards as well
     * as to the existing ones.
     */
    public void addListener(CircuitBreaker.Listener listener) {
        listeners.add(listener);
        breakers.values().forEach(b -> b.addListener(listener));
    }

    public CircuitBreaker forAgent(String agent) {
        return breakers.computeIfAbsent(ResilienceConfig.agentKey(agent), name -> {
            var breaker = new CircuitBreaker(name, config.forAgent(name), clock);
            listeners.forEach(breaker::addListener);
            return breaker;
        });
    }

    public Map<String, CircuitState> states() {
        var out = new TreeMap<String, CircuitState>();
        breakers.forEach((name, b) -> out.put(name, b.state()));
        return out;
    }
}
