package com.agentrelay.shared.config;

import java.time.Duration;

public record TransportConfig(
    Duration requestTimeout,
    Duration connectTimeout,
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    double jitterRatio,
    Duration shutdownGrace
) {
    public static TransportConfig defaults() {
        return new TransportConfig(
            Duration.ofSeconds(30),
            Duration.ofSeconds(10),
            3,
            Duration.ofMillis(500),
            Duration.ofSeconds(4),
            0.2,
            Duration.ofSeconds(5)
        );
    }
}
