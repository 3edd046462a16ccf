package com.agentrelay.transport;

import com.agentrelay.shared.config.TransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.URI;
import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Exactly one {@link TransportClient} per endpoint, created on first use.
 */
public class TransportClientPool implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(TransportClientPool.class);

    private final Function<URI, TransportClient> factory;
    private final ConcurrentHashMap<URI, TransportClient> clients = new ConcurrentHashMap<>();

    public TransportClientPool(Function<URI, TransportClient> factory) {
        this.factory = factory;
    }

    public TransportClientPool(TransportConfig config) {
        this(endpoint -> new HttpTransportClient(endpoint, config));
    }

    public TransportClient get(URI endpoint) {
        return clients.computeIfAbsent(endpoint, e -> {
            log.debug("Creating transport client for {}", e);
            return factory.apply(e);
        });
    }

    public int size() {
        return clients.size();
    }

    public Set<URI> endpoints() {
        return Set.copyOf(clients.keySet());
    }

    /**
     * Best-effort: each client is given its own bounded grace period and a
     * failing close never stops the others.
     */
    public void closeAll() {
        var snapshot = new ArrayList<>(clients.values());
        clients.clear();
        for (var client : snapshot) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close transport {}: {}", client.endpoint(), e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        closeAll();
    }
}
