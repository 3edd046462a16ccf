package com.agentrelay.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryLoaderTest {

    @TempDir
    Path tempDir;

    private AgentRegistry registry;
    private AgentRegistryLoader loader;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry();
        loader = new AgentRegistryLoader(registry);
    }

    @Test
    void loadsJsonAndSkipsBadEntries() throws IOException {
        var file = tempDir.resolve("agents.json");
        Files.writeString(file, """
                {"agents": [
                  {"name": "billing_agent", "url": "http://billing:9001", "capabilities": ["payments", "refunds"],
                   "description": "Handles billing", "version": "2.1.0", "metadata": {"team": "fin"}},
                  {"name": "tickets_agent", "endpoint": "http://tickets:9002", "capabilities": ["tickets"]},
                  {"name": "no_url_agent", "capabilities": ["x"]},
                  {"name": "bad_url", "url": "not a url"},
                  "just a string"
                ]}
                """);

        assertEquals(2, loader.loadFromFile(file));

        var billing = registry.requireByName("billing_agent");
        assertEquals(URI.create("http://billing:9001"), billing.endpoint());
        assertEquals(List.of("payments", "refunds"), List.copyOf(billing.capabilities()));
        assertEquals("2.1.0", billing.version());
        assertEquals("fin", billing.metadata().get("team"));
        assertEquals(URI.create("http://tickets:9002"), registry.requireByName("tickets_agent").endpoint());
        assertFalse(registry.contains("no_url_agent"));
    }

    @Test
    void loadsYaml() throws IOException {
        var file = tempDir.resolve("agents.yaml");
        Files.writeString(file, """
                agents:
                  - name: account_agent
                    url: http://account:9003
                    capabilities: [account, profile]
                """);

        assertEquals(1, loader.loadFromFile(file));
        assertEquals("1.0.0", registry.requireByName("account_agent").version());
    }

    @Test
    void capabilitiesMustBeAList() throws IOException {
        var file = tempDir.resolve("agents.json");
        Files.writeString(file, "{\"agents\": [{\"name\": \"a\", \"url\": \"http://a:1\", \"capabilities\": \"x\"}]}");

        assertEquals(0, loader.loadFromFile(file));
    }

    @Test
    void missingOrMalformedFileIsNotFatal() throws IOException {
        assertEquals(0, loader.loadFromFile(tempDir.resolve("nope.json")));

        var broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"agents\": [");
        assertEquals(0, loader.loadFromFile(broken));

        var noList = tempDir.resolve("nolist.json");
        Files.writeString(noList, "{\"agents\": {}}");
        assertEquals(0, loader.loadFromFile(noList));
        assertEquals(0, registry.size());
    }

    @Test
    void loadsFromEnvironment() {
        var env = Map.of(
                "AGENT_BILLING_AGENT_URL", "http://billing:9001",
                "AGENT_BILLING_AGENT_CAPABILITIES", "payments, refunds,",
                "AGENT_BILLING_AGENT_VERSION", "3.0.0",
                "AGENT_ORPHAN_CAPABILITIES", "nothing",
                "PATH", "/usr/bin");

        assertEquals(1, loader.loadFromEnvironment(env));

        var billing = registry.requireByName("billing_agent");
        assertEquals(List.of("payments", "refunds"), List.copyOf(billing.capabilities()));
        assertEquals("3.0.0", billing.version());
        assertEquals("env", billing.metadata().get("source"));
        assertFalse(registry.contains("orphan"));
    }

    @Test
    void environmentPrefixIsConfigurable() {
        var env = Map.of(
                "RELAY_AGENT_SEARCH_URL", "http://search:9005",
                "AGENT_OTHER_URL", "http://other:9006");

        assertEquals(1, loader.loadFromEnvironment(env, "RELAY_AGENT_"));
        assertTrue(registry.contains("search"));
        assertFalse(registry.contains("other"));
    }
}
