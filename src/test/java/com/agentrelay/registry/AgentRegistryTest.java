package com.agentrelay.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryTest {

    private static AgentDescriptor agent(String name, String... caps) {
        return new AgentDescriptor(name, URI.create("http://" + name.replace('_', '-') + ".local:9000"),
                new LinkedHashSet<>(List.of(caps)));
    }

    @Test
    void registerThenFindAndUnregister() {
        var registry = new AgentRegistry();
        var billing = agent("billing_agent", "payments");
        registry.register(billing);

        assertEquals(billing, registry.findByName("billing_agent").orElseThrow());
        assertTrue(registry.unregister("billing_agent"));
        assertTrue(registry.findByName("billing_agent").isEmpty());
        assertFalse(registry.unregister("billing_agent"));
    }

    @Test
    void lookupIgnoresCase() {
        var registry = new AgentRegistry();
        registry.register(agent("Billing_Agent"));

        assertTrue(registry.findByName("billing_agent").isPresent());
        assertTrue(registry.contains("BILLING_AGENT"));
    }

    @Test
    void sharedCapabilityKeepsRegistrationOrder() {
        var registry = new AgentRegistry();
        registry.register(agent("a_agent", "search", "payments"));
        registry.register(agent("b_agent", "payments"));
        registry.register(agent("c_agent", "tickets"));

        var names = registry.findByCapability("payments").stream().map(AgentDescriptor::name).toList();
        assertEquals(List.of("a_agent", "b_agent"), names);
        assertTrue(registry.findByCapability("weather").isEmpty());
    }

    @Test
    void reRegisteringOverwritesInPlace() {
        var registry = new AgentRegistry();
        registry.register(agent("a_agent", "old"));
        registry.register(agent("b_agent"));
        var replacement = new AgentDescriptor("a_agent", URI.create("http://a-agent.local:9100"), Set.of("new"));
        registry.register(replacement);

        assertEquals(2, registry.size());
        assertEquals(List.of("a_agent", "b_agent"),
                registry.listAgents().stream().map(AgentDescriptor::name).toList());
        assertEquals(replacement, registry.requireByName("a_agent"));
        assertTrue(registry.findByCapability("old").isEmpty());
        assertEquals(1, registry.findByCapability("new").size());
    }

    @Test
    void requireByNameThrowsForUnknown() {
        var registry = new AgentRegistry();
        var ex = assertThrows(AgentNotFoundException.class, () -> registry.requireByName("ghost"));
        assertEquals("ghost", ex.identifier());
    }

    @Test
    void resolvePrefersNameOverCapability() {
        var registry = new AgentRegistry();
        registry.register(agent("payments_helper", "payments"));
        registry.register(agent("payments", "other"));

        assertEquals("payments", registry.resolve("payments").orElseThrow().name());
        assertTrue(registry.resolve("unknown").isEmpty());
    }

    @Test
    void resolveFallsBackToFirstCapabilityMatch() {
        var registry = new AgentRegistry();
        registry.register(agent("billing_agent", "payments"));
        registry.register(agent("backup_billing", "payments"));

        assertEquals("billing_agent", registry.resolve("payments").orElseThrow().name());
    }

    @Test
    void listCapabilitiesIsSortedAndDistinct() {
        var registry = new AgentRegistry();
        registry.register(agent("a_agent", "tickets", "account"));
        registry.register(agent("b_agent", "account", "payments"));

        assertEquals(List.of("account", "payments", "tickets"), registry.listCapabilities());
    }

    @Test
    void saveToWritesAgentsFile(@TempDir Path dir) throws Exception {
        var registry = new AgentRegistry();
        registry.register(agent("billing_agent", "payments"));
        var file = dir.resolve("out/agents.json");

        registry.saveTo(file);

        var json = Files.readString(file);
        assertThat(json).contains("\"agents\"").contains("billing_agent").contains("http://billing-agent.local:9000");
        var reloaded = new AgentRegistry();
        assertEquals(1, new AgentRegistryLoader(reloaded).loadFromFile(file));
        assertEquals(Set.of("payments"), reloaded.requireByName("billing_agent").capabilities());
    }

    @Test
    void descriptorValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new AgentDescriptor(" ", URI.create("http://h:1"), Set.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new AgentDescriptor("x", URI.create("ftp://h/x"), Set.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new AgentDescriptor("x", URI.create("/relative"), Set.of()));

        var d = new AgentDescriptor("x", URI.create("https://h"), Set.of("a"), null, null, Map.of());
        assertEquals(AgentDescriptor.DEFAULT_VERSION, d.version());
        assertEquals("", d.description());
        assertTrue(d.hasCapability("a"));
    }
}
