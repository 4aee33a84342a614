package me.golemcore.mcp.adapter.inbound.web.security;

import me.golemcore.mcp.domain.service.AuthTokenService;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class BearerTokenWebFilterTest {

    private static final String TOKEN = "test-token-value";

    private McpProperties properties;
    private AuthTokenService authTokenService;

    @BeforeEach
    void setUp() {
        properties = new McpProperties();
        properties.getAuth().setEnabled(true);
        properties.getAuth().setTokens(List.of(TOKEN));
        authTokenService = new AuthTokenService(properties);
    }

    @Test
    void shouldPassWithValidToken() {
        MockServerWebExchange exchange = exchange("/mcp", "Bearer " + TOKEN);
        AtomicBoolean chainCalled = new AtomicBoolean(false);

        StepVerifier.create(filter().filter(exchange, chain(chainCalled)))
                .verifyComplete();

        assertTrue(chainCalled.get(), "Filter chain should have been called");
    }

    @Test
    void shouldRejectMissingToken() {
        MockServerWebExchange exchange = exchange("/conversation/abc", null);
        AtomicBoolean chainCalled = new AtomicBoolean(false);

        StepVerifier.create(filter().filter(exchange, chain(chainCalled)))
                .verifyComplete();

        assertFalse(chainCalled.get());
        assertEquals(HttpStatus.UNAUTHORIZED, exchange.getResponse().getStatusCode());
        StepVerifier.create(exchange.getResponse().getBodyAsString())
                .assertNext(body -> assertTrue(body.contains("\"message\"")))
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownToken() {
        MockServerWebExchange exchange = exchange("/mcp/stream", "Bearer wrong");
        AtomicBoolean chainCalled = new AtomicBoolean(false);

        StepVerifier.create(filter().filter(exchange, chain(chainCalled)))
                .verifyComplete();

        assertFalse(chainCalled.get());
        assertEquals(HttpStatus.UNAUTHORIZED, exchange.getResponse().getStatusCode());
    }

    @Test
    void shouldRejectNonBearerScheme() {
        MockServerWebExchange exchange = exchange("/mcp", "Basic " + TOKEN);
        AtomicBoolean chainCalled = new AtomicBoolean(false);

        StepVerifier.create(filter().filter(exchange, chain(chainCalled)))
                .verifyComplete();

        assertFalse(chainCalled.get());
    }

    @Test
    void shouldNotProtectHealthEndpoint() {
        MockServerWebExchange exchange = exchange("/health", null);
        AtomicBoolean chainCalled = new AtomicBoolean(false);

        StepVerifier.create(filter().filter(exchange, chain(chainCalled)))
                .verifyComplete();

        assertTrue(chainCalled.get());
    }

    @Test
    void shouldNotTreatSimilarPrefixAsProtected() {
        MockServerWebExchange exchange = exchange("/mcpx", null);
        AtomicBoolean chainCalled = new AtomicBoolean(false);

        StepVerifier.create(filter().filter(exchange, chain(chainCalled)))
                .verifyComplete();

        assertTrue(chainCalled.get());
    }

    @Test
    void shouldPassEverythingWhenDisabled() {
        properties.getAuth().setEnabled(false);
        MockServerWebExchange exchange = exchange("/mcp", null);
        AtomicBoolean chainCalled = new AtomicBoolean(false);

        StepVerifier.create(filter().filter(exchange, chain(chainCalled)))
                .verifyComplete();

        assertTrue(chainCalled.get());
    }

    @Test
    void shouldHonorTokenAddedAtRuntime() {
        authTokenService.addToken("late-token");
        MockServerWebExchange exchange = exchange("/mcp", "Bearer late-token");
        AtomicBoolean chainCalled = new AtomicBoolean(false);

        StepVerifier.create(filter().filter(exchange, chain(chainCalled)))
                .verifyComplete();

        assertTrue(chainCalled.get());
    }

    private BearerTokenWebFilter filter() {
        return new BearerTokenWebFilter(authTokenService, properties);
    }

    private static MockServerWebExchange exchange(String path, String authorization) {
        MockServerHttpRequest.BaseBuilder<?> builder = MockServerHttpRequest.post(path);
        if (authorization != null) {
            builder.header(HttpHeaders.AUTHORIZATION, authorization);
        }
        return MockServerWebExchange.from(builder.build());
    }

    private static WebFilterChain chain(AtomicBoolean chainCalled) {
        return webExchange -> {
            chainCalled.set(true);
            return Mono.empty();
        };
    }
}
