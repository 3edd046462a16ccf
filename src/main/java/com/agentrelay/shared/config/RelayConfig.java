package com.agentrelay.shared.config;

import java.time.Duration;

public record RelayConfig(
    int serverPort,
    String registryFile,
    String registryEnvPrefix,
    TransportConfig transport,
    ResilienceConfig resilience,
    RoutingConfig routing,
    Duration workflowTimeout
) {}
