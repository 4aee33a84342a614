package me.golemcore.mcp.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import me.golemcore.mcp.domain.component.AgentCapability;
import me.golemcore.mcp.domain.exception.AgentNotRegisteredException;
import me.golemcore.mcp.domain.exception.InternalAgentException;
import me.golemcore.mcp.domain.exception.InvalidCommandFormatException;
import me.golemcore.mcp.domain.exception.InvalidMagicException;
import me.golemcore.mcp.domain.model.Envelope;
import me.golemcore.mcp.domain.model.StreamingToken;
import me.golemcore.mcp.domain.model.TokenEvent;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DispatchServiceTest {

    private AgentRegistry registry;
    private ObjectMapper objectMapper;
    private DispatchService service;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry();
        objectMapper = new ObjectMapper();
        McpProperties properties = new McpProperties();
        properties.getStream().setBufferSize(4);
        service = new DispatchService(registry, objectMapper, properties);
    }

    // ==================== dispatch ====================

    @Test
    void dispatchRoutesToAgent() {
        registry.register(echoAgent("dummy"));
        Envelope request = Envelope.of("dummy:echo", JsonNodeFactory.instance.objectNode().put("k", "v"));

        StepVerifier.create(service.dispatch(request))
                .assertNext(response -> {
                    assertEquals("dummy_response", response.getCommand());
                    assertEquals("v", response.getPayload().get("k").asText());
                })
                .verifyComplete();
    }

    @Test
    void dispatchAnswersInvalidMagicWithErrorEnvelope() {
        AgentCapability agent = echoAgent("dummy");
        registry.register(agent);
        Envelope request = Envelope.of("dummy:echo", null).toBuilder().magic("XXXX").build();

        StepVerifier.create(service.dispatch(request))
                .assertNext(response -> {
                    assertTrue(response.isError());
                    assertEquals(Envelope.MAGIC, response.getMagic());
                    assertTrue(response.getPayload().get("message").asText().contains("XXXX"));
                })
                .verifyComplete();
        verify(agent, never()).handle(any());
    }

    @Test
    void dispatchInvalidMagicWinsOverRoutingErrors() {
        Envelope request = Envelope.of("nocolon", null).toBuilder().magic("BAD!").build();

        StepVerifier.create(service.dispatch(request))
                .assertNext(response -> assertTrue(response.isError()))
                .verifyComplete();
    }

    @Test
    void dispatchSurfacesRoutingErrors() {
        StepVerifier.create(service.dispatch(Envelope.of("ghost:chat", null)))
                .expectError(AgentNotRegisteredException.class)
                .verify();
        StepVerifier.create(service.dispatch(Envelope.of("invalidcommand", null)))
                .expectError(InvalidCommandFormatException.class)
                .verify();
    }

    @Test
    void dispatchSurfacesAgentErrors() {
        AgentCapability agent = mock(AgentCapability.class);
        when(agent.getName()).thenReturn("openai");
        when(agent.handle(any())).thenThrow(new InternalAgentException("Missing user_prompt"));
        registry.register(agent);

        StepVerifier.create(service.dispatch(Envelope.of("openai:chat", null)))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(InternalAgentException.class, error);
                    assertTrue(error.getMessage().contains("Missing user_prompt"));
                })
                .verify();
    }

    // ==================== stream ====================

    @Test
    void streamFromStreamingAgentEndsWithSingleFinish() {
        AgentCapability agent = streamingAgent("openai", Flux.just(
                TokenEvent.of(StreamingToken.content("Hel")),
                TokenEvent.of(StreamingToken.content("lo")),
                TokenEvent.finish()));
        registry.register(agent);

        StepVerifier.create(service.stream(Envelope.of("openai:chat", null)))
                .assertNext(event -> assertEquals("Hel", event.token().getContent()))
                .assertNext(event -> assertEquals("lo", event.token().getContent()))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void streamAppendsFinishWhenAgentOmitsIt() {
        registry.register(streamingAgent("openai", Flux.just(TokenEvent.of(StreamingToken.content("x")))));

        StepVerifier.create(service.stream(Envelope.of("openai:chat", null)))
                .assertNext(event -> assertEquals("x", event.token().getContent()))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void streamDropsEventsAfterFinish() {
        registry.register(streamingAgent("openai", Flux.just(
                TokenEvent.finish(),
                TokenEvent.of(StreamingToken.content("late")),
                TokenEvent.finish())));

        StepVerifier.create(service.stream(Envelope.of("openai:chat", null)))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void streamMapsAgentFailureInBand() {
        registry.register(streamingAgent("openai", Flux.concat(
                Flux.just(TokenEvent.of(StreamingToken.content("a"))),
                Flux.error(new IllegalStateException("socket closed")))));

        StepVerifier.create(service.stream(Envelope.of("openai:chat", null)))
                .assertNext(event -> assertEquals("a", event.token().getContent()))
                .assertNext(event -> {
                    assertInstanceOf(InternalAgentException.class, event.error());
                    assertTrue(event.error().getMessage().contains("socket closed"));
                })
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void streamReportsRoutingErrorInBand() {
        StepVerifier.create(service.stream(Envelope.of("ghost:chat", null)))
                .assertNext(event -> assertInstanceOf(AgentNotRegisteredException.class, event.error()))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void streamReportsInvalidMagicInBand() {
        Envelope request = Envelope.of("openai:chat", null).toBuilder().magic("NOPE").build();

        StepVerifier.create(service.stream(request))
                .assertNext(event -> assertInstanceOf(InvalidMagicException.class, event.error()))
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void streamWrapsNonStreamingAgentResponseAsSingleToken() throws Exception {
        registry.register(echoAgent("dummy"));
        Envelope request = Envelope.of("dummy:echo", JsonNodeFactory.instance.objectNode().put("k", "v"));

        StepVerifier.create(service.stream(request))
                .assertNext(event -> {
                    Envelope response = readEnvelope(event.token().getContent());
                    assertEquals("dummy_response", response.getCommand());
                    assertEquals("v", response.getPayload().get("k").asText());
                })
                .assertNext(event -> assertTrue(event.isFinish()))
                .verifyComplete();
    }

    @Test
    void cancellingStreamStopsProducer() {
        AtomicBoolean cancelled = new AtomicBoolean();
        AtomicLong produced = new AtomicLong();
        Flux<TokenEvent> endless = Flux.<TokenEvent, Long>generate(() -> 0L, (i, sink) -> {
            sink.next(TokenEvent.of(StreamingToken.content("t" + i)));
            return i + 1;
        })
                .doOnNext(event -> produced.incrementAndGet())
                .doOnCancel(() -> cancelled.set(true));
        registry.register(streamingAgent("openai", endless));

        StepVerifier.create(service.stream(Envelope.of("openai:chat", null)), 2)
                .expectNextCount(2)
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertTrue(cancelled.get());
        assertTrue(produced.get() < 64, "produced " + produced.get());
    }

    @Test
    void slowConsumerSeesBoundedPrefetch() {
        AtomicLong requested = new AtomicLong();
        Flux<TokenEvent> source = Flux.range(0, 1000)
                .map(i -> TokenEvent.of(StreamingToken.content("t" + i)))
                .doOnRequest(n -> requested.accumulateAndGet(n, (a, b) -> a + b < 0 ? Long.MAX_VALUE : a + b));
        registry.register(streamingAgent("openai", source));

        StepVerifier.create(service.stream(Envelope.of("openai:chat", null)), 1)
                .expectNextCount(1)
                .thenAwait(Duration.ofMillis(100))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertTrue(requested.get() < 1000, "producer was asked for " + requested.get());
    }

    private Envelope readEnvelope(String json) {
        try {
            return objectMapper.readValue(json, Envelope.class);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    private static AgentCapability echoAgent(String name) {
        AgentCapability agent = mock(AgentCapability.class);
        when(agent.getName()).thenReturn(name);
        when(agent.handle(any())).thenAnswer(invocation -> {
            Envelope request = invocation.getArgument(0);
            return Envelope.response(name, request.getPayload());
        });
        return agent;
    }

    private static AgentCapability streamingAgent(String name, Flux<TokenEvent> tokens) {
        AgentCapability agent = mock(AgentCapability.class);
        when(agent.getName()).thenReturn(name);
        when(agent.supportsStreaming()).thenReturn(true);
        when(agent.handleStream(any())).thenReturn(tokens);
        return agent;
    }
}
