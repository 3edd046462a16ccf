package com.agentrelay.router;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects explicit delegation such as "ask the billing_agent to refund order 42".
 */
public class DelegationParser {

    static final List<String> PHRASES = List.of(
            "get help from", "ask the", "delegate to", "forward to",
            "check with", "talk to", "send to", "consult");

    private static final Pattern DELEGATION = Pattern.compile(
            "\\b(" + PHRASES.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")\\s+"
                    + "(?:(?:the|an|a)\\s+)?"
                    + "([\\w.-]+)(\\s+agent\\b)?"
                    + "(.*)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern CONNECTOR = Pattern.compile(
            "^[\\s,;]*(?:(?:to|about|for|regarding)\\b|:)\\s*", Pattern.CASE_INSENSITIVE);

    public Optional<DelegationRequest> parse(String message) {
        if (message == null || message.isBlank()) return Optional.empty();
        var m = DELEGATION.matcher(message);
        if (!m.find()) return Optional.empty();

        var name = m.group(2).toLowerCase(Locale.ROOT).replaceAll("[.\\-]+$", "");
        if (name.isEmpty()) return Optional.empty();
        if (m.group(3) != null && !name.endsWith("_agent")) {
            name = name + "_agent";
        }

        var rest = m.group(4);
        var connector = CONNECTOR.matcher(rest);
        var task = (connector.find() ? rest.substring(connector.end()) : rest).trim();
        if (task.isEmpty()) task = message.trim();

        return Optional.of(new DelegationRequest(name, task, m.group(1).toLowerCase(Locale.ROOT)));
    }
}
