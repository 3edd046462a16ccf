package com.agentrelay.gateway.http;

import com.agentrelay.support.RelayFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AgentControllerTest {

    private RelayFixture fx;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        fx = new RelayFixture().replying("billing_agent", t -> "ok", "payments");
        mvc = MockMvcBuilders.standaloneSetup(new AgentController(fx.registry, fx.breakers, fx.pool))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void listsAgentsWithCircuitState() throws Exception {
        mvc.perform(get("/v1/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("billing_agent"))
                .andExpect(jsonPath("$[0].url").value("http://billing-agent.test:8080/rpc"))
                .andExpect(jsonPath("$[0].capabilities[0]").value("payments"))
                .andExpect(jsonPath("$[0].circuit").value("CLOSED"));
    }

    @Test
    void registersAgentFromJson() throws Exception {
        mvc.perform(post("/v1/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"tickets_agent\",\"url\":\"http://tickets:9002\",\"capabilities\":[\"tickets\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.version").value("1.0.0"));

        assertTrue(fx.registry.contains("tickets_agent"));
    }

    @Test
    void rejectsInvalidDescriptor() throws Exception {
        mvc.perform(post("/v1/agents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"x\",\"url\":\"ftp://files\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("IllegalArgumentException"));
    }

    @Test
    void unregisterUnknownIsNotFound() throws Exception {
        mvc.perform(delete("/v1/agents/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("AgentNotFoundException"));

        mvc.perform(delete("/v1/agents/billing_agent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value("billing_agent"));
        assertEquals(0, fx.registry.size());
    }

    @Test
    void healthUsesPooledTransport() throws Exception {
        mvc.perform(get("/v1/agents/billing_agent/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.healthy").value(true));
    }
}
