package com.agentrelay.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * In-memory directory of remote agents. Writers are serialized and publish an
 * immutable snapshot; readers never block.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public synchronized void register(AgentDescriptor descriptor) {
        var agents = new LinkedHashMap<>(snapshot.agents());
        var previous = agents.put(key(descriptor.name()), descriptor);
        snapshot = Snapshot.of(agents);
        if (previous != null) {
            log.info("Agent '{}' re-registered, endpoint {} -> {}",
                    descriptor.name(), previous.endpoint(), descriptor.endpoint());
        } else {
            log.info("Registered agent '{}' at {} capabilities={}",
                    descriptor.name(), descriptor.endpoint(), descriptor.capabilities());
        }
    }

    public synchronized boolean unregister(String name) {
        if (name == null || !snapshot.agents().containsKey(key(name))) return false;
        var agents = new LinkedHashMap<>(snapshot.agents());
        agents.remove(key(name));
        snapshot = Snapshot.of(agents);
        log.info("Unregistered agent '{}'", name);
        return true;
    }

    public Optional<AgentDescriptor> findByName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(snapshot.agents().get(key(name)));
    }

    public AgentDescriptor requireByName(String name) {
        return findByName(name).orElseThrow(() -> new AgentNotFoundException(name));
    }

    public List<AgentDescriptor> findByCapability(String capability) {
        var current = snapshot;
        var names = current.byCapability().getOrDefault(capability, List.of());
        var result = new ArrayList<AgentDescriptor>(names.size());
        for (var n : names) result.add(current.agents().get(n));
        return result;
    }

    /**
     * Name first, then the first agent advertising {@code identifier} as a capability.
     */
    public Optional<AgentDescriptor> resolve(String identifier) {
        var byName = findByName(identifier);
        if (byName.isPresent()) return byName;
        return findByCapability(identifier).stream().findFirst();
    }

    public List<AgentDescriptor> listAgents() {
        return List.copyOf(snapshot.agents().values());
    }

    public List<String> listCapabilities() {
        return List.copyOf(new TreeSet<>(snapshot.byCapability().keySet()));
    }

    public int size() {
        return snapshot.agents().size();
    }

    public boolean contains(String name) {
        return findByName(name).isPresent();
    }

    public void saveTo(Path path) throws IOException {
        var agents = listAgents().stream().map(AgentDescriptor::toMap).toList();
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), Map.of("agents", agents));
        log.info("Saved {} agents to {}", agents.size(), path);
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private record Snapshot(Map<String, AgentDescriptor> agents, Map<String, List<String>> byCapability) {

        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        static Snapshot of(LinkedHashMap<String, AgentDescriptor> agents) {
            var index = new LinkedHashMap<String, List<String>>();
            agents.forEach((k, d) -> {
                for (var cap : d.capabilities()) {
                    index.computeIfAbsent(cap, c -> new ArrayList<>()).add(k);
                }
            });
            index.replaceAll((c, names) -> List.copyOf(names));
            return new Snapshot(Collections.unmodifiableMap(agents), Collections.unmodifiableMap(index));
        }
    }
}
