package com.agentrelay.gateway;

import com.agentrelay.delegation.AgentDispatcher;
import com.agentrelay.observability.RelayMetrics;
import com.agentrelay.registry.AgentRegistry;
import com.agentrelay.registry.AgentRegistryLoader;
import com.agentrelay.resilience.CircuitBreakerRegistry;
import com.agentrelay.resilience.RateLimiter;
import com.agentrelay.router.AgentRouter;
import com.agentrelay.router.KeywordClassifier;
import com.agentrelay.router.LocalHandler;
import com.agentrelay.shared.config.ConfigLoader;
import com.agentrelay.shared.config.RelayConfig;
import com.agentrelay.transport.TransportClientPool;
import com.agentrelay.workflow.WorkflowOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Map;

@Configuration
public class RelayBeans {

    private static final Logger log = LoggerFactory.getLogger(RelayBeans.class);

    @Bean
    public RelayConfig relayConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public RelayMetrics relayMetrics() {
        return new RelayMetrics();
    }

    @Bean
    public AgentRegistry agentRegistry(RelayConfig config) {
        var registry = new AgentRegistry();
        var loader = new AgentRegistryLoader(registry);
        if (!config.registryFile().isBlank()) {
            loader.loadFromFile(Path.of(config.registryFile()));
        }
        loader.loadFromEnvironment(System.getenv(), config.registryEnvPrefix());
        log.info("Registry ready: {} agents, capabilities {}", registry.size(), registry.listCapabilities());
        return registry;
    }

    @Bean(destroyMethod = "closeAll")
    public TransportClientPool transportClientPool(RelayConfig config) {
        return new TransportClientPool(config.transport());
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(RelayConfig config, RelayMetrics metrics) {
        var breakers = new CircuitBreakerRegistry(config.resilience().circuitBreaker());
        breakers.addListener(metrics.circuitListener());
        return breakers;
    }

    @Bean
    public RateLimiter rateLimiter() {
        return new RateLimiter();
    }

    @Bean
    public AgentDispatcher agentDispatcher(RelayConfig config, TransportClientPool pool,
                                           CircuitBreakerRegistry breakers, RateLimiter rateLimiter,
                                           RelayMetrics metrics) {
        return new AgentDispatcher(pool, breakers, rateLimiter, config.resilience().rateLimit(),
                config.transport().requestTimeout(), metrics);
    }

    @Bean
    public WorkflowOrchestrator workflowOrchestrator(AgentRegistry registry, AgentDispatcher dispatcher,
                                                     RelayMetrics metrics) {
        return new WorkflowOrchestrator(registry, dispatcher, metrics);
    }

    @Bean
    public AgentRouter agentRouter(RelayConfig config, AgentRegistry registry, AgentDispatcher dispatcher,
                                   RelayMetrics metrics) {
        Map<String, LocalHandler> handlers = Map.of(
                "general", text -> "Hello! Ask me to delegate a task, e.g. \"ask the billing_agent to check invoice 7\".");
        LocalHandler fallback = text -> "No agent is configured for this request. Known capabilities: "
                + registry.listCapabilities();
        return new AgentRouter(registry, dispatcher, new KeywordClassifier(config.routing().keywords()),
                config.routing(), handlers, fallback, metrics);
    }
}
