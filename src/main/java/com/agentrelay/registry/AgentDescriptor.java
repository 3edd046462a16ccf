package com.agentrelay.registry;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Directory record for one remote agent: where it lives and what it can do.
 */
public record AgentDescriptor(
    String name,
    URI endpoint,
    Set<String> capabilities,
    String description,
    String version,
    Map<String, Object> metadata
) {
    public static final String DEFAULT_VERSION = "1.0.0";

    public AgentDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank");
        }
        if (endpoint == null || !endpoint.isAbsolute() || endpoint.getHost() == null) {
            throw new IllegalArgumentException("Agent '" + name + "' has invalid endpoint: " + endpoint);
        }
        var scheme = endpoint.getScheme().toLowerCase();
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("Agent '" + name + "' endpoint must be http(s): " + endpoint);
        }
        capabilities = capabilities == null ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        description = description != null ? description : "";
        version = version != null && !version.isBlank() ? version : DEFAULT_VERSION;
        metadata = metadata == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public AgentDescriptor(String name, URI endpoint, Set<String> capabilities) {
        this(name, endpoint, capabilities, "", DEFAULT_VERSION, Map.of());
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public Map<String, Object> toMap() {
        var m = new LinkedHashMap<String, Object>();
        m.put("name", name);
        m.put("url", endpoint.toString());
        m.put("capabilities", capabilities.stream().toList());
        m.put("description", description);
        m.put("version", version);
        m.put("metadata", metadata);
        return m;
    }
}
