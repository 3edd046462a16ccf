package com.agentrelay.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bulk-loads descriptors into an {@link AgentRegistry}. Bad entries are skipped
 * with a warning, never fatal.
 */
public class AgentRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistryLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AgentRegistry registry;

    public AgentRegistryLoader(AgentRegistry registry) {
        this.registry = registry;
    }

    public int loadFromFile(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("Agent registry file {} not found, skipping", path);
            return 0;
        }
        Map<String, Object> raw;
        try (var in = Files.newInputStream(path)) {
            var fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
            if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
                raw = new Yaml().load(in);
            } else {
                raw = MAPPER.readValue(in, new TypeReference<Map<String, Object>>() {});
            }
        } catch (Exception e) {
            log.warn("Failed to read agent registry file {}: {}", path, e.getMessage());
            return 0;
        }
        if (raw == null || !(raw.get("agents") instanceof List<?> entries)) {
            log.warn("Agent registry file {} has no 'agents' list, skipping", path);
            return 0;
        }

        int loaded = 0;
        for (var entry : entries) {
            if (!(entry instanceof Map<?, ?> map)) {
                log.warn("Skipping malformed agent entry in {}: {}", path, entry);
                continue;
            }
            try {
                registry.register(fromMap(map));
                loaded++;
            } catch (RuntimeException e) {
                log.warn("Skipping agent entry in {}: {}", path, e.getMessage());
            }
        }
        log.info("Loaded {} of {} agents from {}", loaded, entries.size(), path);
        return loaded;
    }

    public int loadFromEnvironment(Map<String, String> env) {
        return loadFromEnvironment(env, "AGENT_");
    }

    /**
     * Reads {@code <prefix><NAME>_URL}, {@code _CAPABILITIES}, {@code _DESCRIPTION}
     * and {@code _VERSION}. Names are lower-cased.
     */
    public int loadFromEnvironment(Map<String, String> env, String prefix) {
        var found = new LinkedHashMap<String, Map<String, String>>();
        env.keySet().stream().sorted().forEach(key -> {
            if (!key.startsWith(prefix)) return;
            for (var suffix : List.of("_URL", "_CAPABILITIES", "_DESCRIPTION", "_VERSION")) {
                if (key.endsWith(suffix) && key.length() > prefix.length() + suffix.length()) {
                    var name = key.substring(prefix.length(), key.length() - suffix.length())
                            .toLowerCase(Locale.ROOT);
                    found.computeIfAbsent(name, n -> new LinkedHashMap<>()).put(suffix, env.get(key));
                    return;
                }
            }
        });

        int loaded = 0;
        for (var e : found.entrySet()) {
            var name = e.getKey();
            var fields = e.getValue();
            var url = fields.get("_URL");
            if (url == null || url.isBlank()) {
                log.warn("Skipping environment agent '{}': no {}{}_URL", name, prefix, name.toUpperCase(Locale.ROOT));
                continue;
            }
            try {
                var caps = new LinkedHashSet<String>();
                var rawCaps = fields.getOrDefault("_CAPABILITIES", "");
                Arrays.stream(rawCaps.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(caps::add);
                registry.register(new AgentDescriptor(
                        name,
                        URI.create(url.trim()),
                        caps,
                        fields.getOrDefault("_DESCRIPTION", "Agent loaded from environment: " + name),
                        fields.get("_VERSION"),
                        Map.of("source", "env")));
                loaded++;
            } catch (RuntimeException ex) {
                log.warn("Skipping environment agent '{}': {}", name, ex.getMessage());
            }
        }
        return loaded;
    }

    @SuppressWarnings("unchecked")
    public static AgentDescriptor fromMap(Map<?, ?> map) {
        var name = map.get("name");
        if (!(name instanceof String n) || n.isBlank()) {
            throw new IllegalArgumentException("missing 'name'");
        }
        var url = map.get("url") != null ? map.get("url") : map.get("endpoint");
        if (!(url instanceof String u) || u.isBlank()) {
            throw new IllegalArgumentException("agent '" + n + "' missing 'url'");
        }
        var caps = new LinkedHashSet<String>();
        var rawCaps = map.get("capabilities");
        if (rawCaps instanceof List<?> list) {
            list.forEach(c -> caps.add(String.valueOf(c)));
        } else if (rawCaps != null) {
            throw new IllegalArgumentException("agent '" + n + "' capabilities must be a list");
        }
        var rawMeta = map.get("metadata");
        var metadata = rawMeta instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.<String, Object>of();
        var version = map.get("version");
        var description = map.get("description");
        return new AgentDescriptor(
                n.trim(),
                URI.create(u.trim()),
                caps,
                description != null ? String.valueOf(description) : "",
                version != null ? String.valueOf(version) : null,
                metadata);
    }
}
