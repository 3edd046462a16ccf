package com.agentrelay.router;

import com.agentrelay.delegation.AgentDispatcher;
import com.agentrelay.observability.RelayMetrics;
import com.agentrelay.registry.AgentDescriptor;
import com.agentrelay.registry.AgentRegistry;
import com.agentrelay.resilience.CircuitOpenException;
import com.agentrelay.resilience.RateLimitExceededException;
import com.agentrelay.shared.Futures;
import com.agentrelay.shared.config.RoutingConfig;
import com.agentrelay.transport.CommunicationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a message is handled locally or delegated. Explicit
 * delegation phrases win; otherwise the classifier label picks a remote
 * capability or a local handler.
 */
public class AgentRouter {

    private static final Logger log = LoggerFactory.getLogger(AgentRouter.class);

    private final AgentRegistry registry;
    private final AgentDispatcher dispatcher;
    private final Classifier classifier;
    private final RoutingConfig routing;
    private final Map<String, LocalHandler> localHandlers = new LinkedHashMap<>();
    private final LocalHandler defaultHandler;
    private final RelayMetrics metrics;
    private final DelegationParser parser = new DelegationParser();

    public AgentRouter(AgentRegistry registry, AgentDispatcher dispatcher, Classifier classifier,
                       RoutingConfig routing, Map<String, LocalHandler> localHandlers,
                       LocalHandler defaultHandler, RelayMetrics metrics) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.classifier = classifier;
        this.routing = routing;
        this.localHandlers.putAll(localHandlers);
        this.defaultHandler = defaultHandler;
        this.metrics = metrics;
    }

    public RouteResult route(String message) {
        return route(message, UUID.randomUUID().toString().substring(0, 8));
    }

    public RouteResult route(String message, String correlationId) {
        var result = decide(message, correlationId);
        metrics.routes(result.kind().name().toLowerCase(Locale.ROOT)).increment();
        return result;
    }

    private RouteResult decide(String message, String correlationId) {
        var explicit = parser.parse(message);
        if (explicit.isPresent()) {
            var request = explicit.get();
            var agent = registry.resolve(request.agentName());
            if (agent.isEmpty()) {
                log.info("[{}] Delegation target '{}' not registered", correlationId, request.agentName());
                return new RouteResult(RouteResult.Kind.AGENT_NOT_FOUND, request.agentName(),
                        "⚠ agent not found: " + request.agentName(), "delegation");
            }
            return dispatch(agent.get(), request.taskText(), correlationId, "delegation");
        }

        var classification = classifySafely(message, correlationId);
        var label = classification.label();
        if (classification.confidence() >= routing.minConfidence() && routing.remoteLabels().containsKey(label)) {
            var target = remoteTarget(label, routing.remoteLabels().get(label));
            if (target.isPresent()) {
                return dispatch(target.get(), message, correlationId, label);
            }
            log.debug("[{}] No agent serves '{}', handling locally", correlationId, label);
        }

        var handler = localHandlers.getOrDefault(label, defaultHandler);
        return new RouteResult(RouteResult.Kind.LOCAL, null, handler.handle(message), label);
    }

    private Optional<AgentDescriptor> remoteTarget(String label, String capability) {
        var byCapability = registry.findByCapability(capability);
        if (!byCapability.isEmpty()) return Optional.of(byCapability.get(0));
        return registry.findByName(label);
    }

    private Classification classifySafely(String message, String correlationId) {
        try {
            var c = classifier.classify(message);
            return c != null ? c : Classification.unknown();
        } catch (RuntimeException e) {
            log.warn("[{}] Classifier failed, treating message as unknown: {}", correlationId, e.getMessage());
            return Classification.unknown();
        }
    }

    private RouteResult dispatch(AgentDescriptor agent, String task, String correlationId, String intent) {
        var name = agent.name();
        try {
            var text = Futures.join(dispatcher.dispatch(agent, task, correlationId));
            return new RouteResult(RouteResult.Kind.REMOTE, name, "✅ Delegated to " + name + ":\n" + text, intent);
        } catch (CircuitOpenException e) {
            return new RouteResult(RouteResult.Kind.UNAVAILABLE, name, "⚠ agent unavailable: " + name, intent);
        } catch (RateLimitExceededException e) {
            return new RouteResult(RouteResult.Kind.RATE_LIMITED, name, "⚠ agent busy: " + name, intent);
        } catch (CommunicationException e) {
            if (e.kind() == CommunicationException.Kind.REMOTE_ERROR) {
                return new RouteResult(RouteResult.Kind.REMOTE_ERROR, name,
                        "⚠ agent error: " + name + ": " + e.detail(), intent);
            }
            return new RouteResult(RouteResult.Kind.UNAVAILABLE, name, "⚠ agent unavailable: " + name, intent);
        } catch (RuntimeException e) {
            log.warn("[{}] Delegation to '{}' failed unexpectedly", correlationId, name, e);
            return new RouteResult(RouteResult.Kind.UNAVAILABLE, name, "⚠ agent unavailable: " + name, intent);
        }
    }
}
