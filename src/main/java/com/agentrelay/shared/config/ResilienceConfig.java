package com.agentrelay.shared.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

public record ResilienceConfig(
    CircuitBreakerConfig circuitBreaker,
    RateLimitConfig rateLimit
) {
    public record BreakerSettings(int failureThreshold, Duration openTimeout) {
        public BreakerSettings {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be >= 1");
            }
            if (openTimeout == null || openTimeout.isNegative()) {
                throw new IllegalArgumentException("openTimeout must be >= 0");
            }
        }

        public static BreakerSettings defaults() {
            return new BreakerSettings(5, Duration.ofSeconds(60));
        }
    }

    public record CircuitBreakerConfig(BreakerSettings defaults, Map<String, BreakerSettings> perAgent) {
        public CircuitBreakerConfig {
            perAgent = byAgentKey(perAgent);
        }

        public BreakerSettings forAgent(String agent) {
            return perAgent.getOrDefault(agentKey(agent), defaults);
        }

        public static CircuitBreakerConfig standard() {
            return new CircuitBreakerConfig(BreakerSettings.defaults(), Map.of());
        }
    }

    public record RateLimitConfig(int defaultPerMinute, Map<String, Integer> perAgent) {
        public RateLimitConfig {
            perAgent = byAgentKey(perAgent);
        }

        public int limitFor(String agent) {
            return perAgent.getOrDefault(agentKey(agent), defaultPerMinute);
        }

        public static RateLimitConfig defaults() {
            return new RateLimitConfig(60, Map.of());
        }
    }

    public static ResilienceConfig defaults() {
        return new ResilienceConfig(CircuitBreakerConfig.standard(), RateLimitConfig.defaults());
    }

    /**
     * Breaker and limiter state is keyed the same way the registry keys agent names.
     */
    public static String agentKey(String agent) {
        return agent.trim().toLowerCase(Locale.ROOT);
    }

    private static <V> Map<String, V> byAgentKey(Map<String, V> perAgent) {
        var out = new HashMap<String, V>();
        perAgent.forEach((name, v) -> out.put(agentKey(name), v));
        return Map.copyOf(out);
    }
}
