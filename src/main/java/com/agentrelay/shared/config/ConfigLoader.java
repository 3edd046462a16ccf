package com.agentrelay.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".agentrelay", "config.yaml"
    );

    public static RelayConfig load() {
        return load(DEFAULT_PATH, System.getenv());
    }

    public static RelayConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    public static RelayConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var registry = (Map<String, Object>) raw.getOrDefault("registry", Map.of());
        var transport = (Map<String, Object>) raw.getOrDefault("transport", Map.of());
        var breaker = (Map<String, Object>) raw.getOrDefault("circuit-breaker", Map.of());
        var rateLimit = (Map<String, Object>) raw.getOrDefault("rate-limit", Map.of());
        var routing = (Map<String, Object>) raw.getOrDefault("routing", Map.of());
        var workflow = (Map<String, Object>) raw.getOrDefault("workflow", Map.of());

        return new RelayConfig(
            Integer.parseInt(envOrDefault(env, "RELAY_PORT",
                String.valueOf(server.getOrDefault("port", 8080)))),
            envOrDefault(env, "RELAY_REGISTRY_FILE",
                (String) registry.getOrDefault("file", "")),
            (String) registry.getOrDefault("env-prefix", "AGENT_"),
            parseTransport(transport, env),
            new ResilienceConfig(parseBreaker(breaker), parseRateLimit(rateLimit)),
            parseRouting(routing),
            Duration.ofSeconds(Long.parseLong(envOrDefault(env, "RELAY_WORKFLOW_TIMEOUT",
                String.valueOf(workflow.getOrDefault("timeout", 120)))))
        );
    }

    private static TransportConfig parseTransport(Map<String, Object> t, Map<String, String> env) {
        var def = TransportConfig.defaults();
        return new TransportConfig(
            Duration.ofSeconds(Long.parseLong(envOrDefault(env, "RELAY_TRANSPORT_TIMEOUT",
                String.valueOf(t.getOrDefault("timeout", def.requestTimeout().toSeconds()))))),
            Duration.ofSeconds(longValue(t, "connect-timeout", def.connectTimeout().toSeconds())),
            Integer.parseInt(envOrDefault(env, "RELAY_MAX_RETRIES",
                String.valueOf(t.getOrDefault("max-retries", def.maxRetries())))),
            Duration.ofMillis(longValue(t, "base-delay-ms", def.baseDelay().toMillis())),
            Duration.ofMillis(longValue(t, "max-delay-ms", def.maxDelay().toMillis())),
            Double.parseDouble(String.valueOf(t.getOrDefault("jitter", def.jitterRatio()))),
            Duration.ofSeconds(longValue(t, "shutdown-grace", def.shutdownGrace().toSeconds()))
        );
    }

    @SuppressWarnings("unchecked")
    private static ResilienceConfig.CircuitBreakerConfig parseBreaker(Map<String, Object> b) {
        var def = ResilienceConfig.BreakerSettings.defaults();
        var defaults = breakerSettings(b, def);
        var perAgent = new HashMap<String, ResilienceConfig.BreakerSettings>();
        var agents = (Map<String, Map<String, Object>>) b.getOrDefault("agents", Map.of());
        agents.forEach((name, cfg) -> perAgent.put(name, breakerSettings(cfg != null ? cfg : Map.of(), defaults)));
        return new ResilienceConfig.CircuitBreakerConfig(defaults, perAgent);
    }

    private static ResilienceConfig.BreakerSettings breakerSettings(Map<String, Object> m,
                                                                    ResilienceConfig.BreakerSettings fallback) {
        return new ResilienceConfig.BreakerSettings(
            (int) longValue(m, "failure-threshold", fallback.failureThreshold()),
            Duration.ofSeconds(longValue(m, "open-timeout", fallback.openTimeout().toSeconds()))
        );
    }

    @SuppressWarnings("unchecked")
    private static ResilienceConfig.RateLimitConfig parseRateLimit(Map<String, Object> r) {
        var def = ResilienceConfig.RateLimitConfig.defaults();
        var perAgent = new HashMap<String, Integer>();
        var agents = (Map<String, Object>) r.getOrDefault("agents", Map.of());
        agents.forEach((name, v) -> perAgent.put(name, Integer.parseInt(String.valueOf(v))));
        return new ResilienceConfig.RateLimitConfig(
            (int) longValue(r, "per-minute", def.defaultPerMinute()),
            perAgent
        );
    }

    @SuppressWarnings("unchecked")
    private static RoutingConfig parseRouting(Map<String, Object> r) {
        var def = RoutingConfig.defaults();
        var labels = new HashMap<String, String>();
        var rawLabels = (Map<String, Object>) r.getOrDefault("remote-labels", Map.of());
        rawLabels.forEach((label, cap) -> labels.put(label, String.valueOf(cap)));

        Map<String, List<String>> keywords = def.keywords();
        if (r.containsKey("keywords")) {
            var parsed = new LinkedHashMap<String, List<String>>();
            var rawKw = (Map<String, Object>) r.get("keywords");
            rawKw.forEach((label, words) -> parsed.put(label, words instanceof List<?> list
                    ? list.stream().map(String::valueOf).toList()
                    : List.of(String.valueOf(words))));
            keywords = parsed;
        }

        return new RoutingConfig(
            Double.parseDouble(String.valueOf(r.getOrDefault("min-confidence", def.minConfidence()))),
            labels,
            keywords
        );
    }

    private static long longValue(Map<String, Object> m, String key, long fallback) {
        return Long.parseLong(String.valueOf(m.getOrDefault(key, fallback)));
    }

    private static String envOrDefault(Map<String, String> env, String name, String fallback) {
        var val = env.get(name);
        return val != null && !val.isBlank() ? val : fallback;
    }
}
