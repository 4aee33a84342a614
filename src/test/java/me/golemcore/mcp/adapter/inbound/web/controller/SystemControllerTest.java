package me.golemcore.mcp.adapter.inbound.web.controller;

import me.golemcore.mcp.adapter.outbound.agent.DummyAgent;
import me.golemcore.mcp.domain.service.AgentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

class SystemControllerTest {

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        AgentRegistry registry = new AgentRegistry();
        registry.register(new DummyAgent());
        webTestClient = WebTestClient.bindToController(new SystemController(registry)).build();
    }

    @Test
    void healthReturnsOk() {
        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("OK");
    }

    @Test
    void agentsListsRegisteredNames() {
        webTestClient.get()
                .uri("/agents")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0]").isEqualTo("dummy");
    }
}
