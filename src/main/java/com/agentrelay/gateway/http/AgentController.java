package com.agentrelay.gateway.http;

import com.agentrelay.registry.AgentNotFoundException;
import com.agentrelay.registry.AgentRegistry;
import com.agentrelay.registry.AgentRegistryLoader;
import com.agentrelay.resilience.CircuitBreakerRegistry;
import com.agentrelay.transport.TransportClientPool;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class AgentController {

    private final AgentRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final TransportClientPool pool;

    public AgentController(AgentRegistry registry, CircuitBreakerRegistry breakers, TransportClientPool pool) {
        this.registry = registry;
        this.breakers = breakers;
        this.pool = pool;
    }

    @GetMapping("/v1/agents")
    public List<Map<String, Object>> list() {
        return registry.listAgents().stream().map(a -> {
            Map<String, Object> m = new LinkedHashMap<>(a.toMap());
            m.put("circuit", breakers.forAgent(a.name()).state().name());
            return m;
        }).toList();
    }

    @PostMapping("/v1/agents")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> register(@RequestBody Map<String, Object> body) {
        var descriptor = AgentRegistryLoader.fromMap(body);
        registry.register(descriptor);
        return descriptor.toMap();
    }

    @DeleteMapping("/v1/agents/{name}")
    public Map<String, Object> unregister(@PathVariable String name) {
        if (!registry.unregister(name)) {
            throw new AgentNotFoundException(name);
        }
        return Map.of("removed", name);
    }

    @GetMapping("/v1/agents/{name}/health")
    public Map<String, Object> health(@PathVariable String name) {
        var agent = registry.requireByName(name);
        boolean healthy = pool.get(agent.endpoint()).healthCheck().join();
        return Map.of("agent", agent.name(), "healthy", healthy);
    }
}
