package me.golemcore.mcp.adapter.outbound.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mcp.domain.exception.InternalAgentException;
import me.golemcore.mcp.domain.model.Envelope;
import me.golemcore.mcp.domain.service.ConversationService;
import me.golemcore.mcp.domain.stream.JsonLineStreamDecoder;
import me.golemcore.mcp.infrastructure.config.AutoConfiguration;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import me.golemcore.mcp.infrastructure.http.ChunkedHttpClient;
import me.golemcore.mcp.infrastructure.http.FeignClientFactory;
import me.golemcore.mcp.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class DeepSeekAgentTest {

    private static final String BASE_URL = "https://api.test.deepseek.ai/";

    private OkHttpMockEngine engine;
    private ObjectMapper objectMapper;
    private DeepSeekAgent agent;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = engine.client();
        objectMapper = AutoConfiguration.objectMapper();

        McpProperties properties = new McpProperties();
        properties.getAgents().getDeepseek().setApiKey("test_key");
        properties.getAgents().getDeepseek().setBaseUrl(BASE_URL);
        properties.getAgents().getDeepseek().setModel("test-model");

        agent = new DeepSeekAgent(properties, new FeignClientFactory(client, objectMapper),
                new ChunkedHttpClient(client), new JsonLineStreamDecoder(objectMapper),
                new ConversationService(properties, Clock.systemUTC()), objectMapper);
    }

    @Test
    void shouldReturnAnswerWithIdAndFinishReason() {
        engine.enqueueJson(200, "{\"id\":\"test-id-123\",\"choices\":[{\"message\":{\"role\":\"assistant\","
                + "\"content\":\"Quantum computing uses qubits.\"},\"finish_reason\":\"stop\"}]}");

        Envelope response = agent.handle(request("{\"user_prompt\":\"What is quantum computing?\"}"));

        assertEquals("deepseek_response", response.getCommand());
        assertEquals("Quantum computing uses qubits.", response.getPayload().get("answer").asText());
        assertEquals("test-id-123", response.getPayload().get("id").asText());
        assertEquals("stop", response.getPayload().get("finish_reason").asText());
        assertEquals("/v1/chat/completions", engine.takeRequest().path());
    }

    @Test
    void shouldDefaultFinishReasonToUnknown() {
        engine.enqueueJson(200, "{\"id\":\"id-1\",\"choices\":[{\"message\":{\"role\":\"assistant\","
                + "\"content\":\"ok\"}}]}");

        Envelope response = agent.handle(request("{\"user_prompt\":\"hi\"}"));

        assertEquals("unknown", response.getPayload().get("finish_reason").asText());
    }

    @Test
    void shouldForwardTemperatureAndMaxTokens() throws Exception {
        engine.enqueueJson(200, "{\"id\":\"id-1\",\"choices\":[{\"message\":{\"content\":\"ok\"},"
                + "\"finish_reason\":\"length\"}]}");

        agent.handle(request("{\"user_prompt\":\"hi\",\"temperature\":0.7,\"max_tokens\":100}"));

        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertEquals("test-model", body.get("model").asText());
        assertEquals(0.7, body.get("temperature").asDouble(), 1e-9);
        assertEquals(100, body.get("max_tokens").asInt());
    }

    @Test
    void shouldIgnoreMalformedOptionalFields() throws Exception {
        engine.enqueueJson(200, "{\"id\":\"id-1\",\"choices\":[{\"message\":{\"content\":\"ok\"}}]}");

        agent.handle(request("{\"user_prompt\":\"hi\",\"temperature\":\"hot\",\"max_tokens\":1.5}"));

        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertFalse(body.has("temperature"));
        assertFalse(body.has("max_tokens"));
    }

    @Test
    void shouldRequireUserPrompt() {
        InternalAgentException ex = assertThrows(InternalAgentException.class,
                () -> agent.handle(request("{\"wrong_field\":\"value\"}")));

        assertTrue(ex.getMessage().contains("Missing user_prompt"));
    }

    @Test
    void shouldReportErrorStatusWithProviderName() {
        engine.enqueueJson(503, "{}");

        InternalAgentException ex = assertThrows(InternalAgentException.class,
                () -> agent.handle(request("{\"user_prompt\":\"hi\"}")));

        assertEquals("Internal agent error: DeepSeek API returned status 503", ex.getMessage());
    }

    private Envelope request(String payloadJson) {
        try {
            return Envelope.of("deepseek:chat", objectMapper.readTree(payloadJson));
        } catch (IOException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
