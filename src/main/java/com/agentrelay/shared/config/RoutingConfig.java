package com.agentrelay.shared.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps classifier labels onto remote capabilities. Labels absent from
 * {@code remoteLabels} are handled locally.
 */
public record RoutingConfig(
    double minConfidence,
    Map<String, String> remoteLabels,
    Map<String, List<String>> keywords
) {
    public RoutingConfig {
        remoteLabels = Map.copyOf(remoteLabels);
        // declaration order matters: labels are checked in sequence
        keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public static Map<String, List<String>> defaultKeywords() {
        var kw = new LinkedHashMap<String, List<String>>();
        kw.put("general", List.of("hello", "hi", "hey", "good morning", "good afternoon",
                "good evening", "thanks", "thank you", "how are you"));
        kw.put("payments", List.of("payment", "pay", "billing", "invoice", "charge", "bill", "refund"));
        kw.put("account", List.of("account", "profile", "user", "settings"));
        kw.put("tickets", List.of("ticket", "support", "issue", "problem", "bug", "error"));
        return kw;
    }

    public static RoutingConfig defaults() {
        return new RoutingConfig(0.5, Map.of(), defaultKeywords());
    }
}
