/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mcp.adapter.inbound.web.security;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.domain.service.AuthTokenService;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Rejects requests to protected paths that carry no accepted bearer token.
 * Disabled unless {@code mcp.auth.enabled} is set.
 */
@Component
@Slf4j
public class BearerTokenWebFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String UNAUTHORIZED_BODY = "{\"message\":\"Unauthorized\"}";

    private final AuthTokenService authTokenService;
    private final boolean enabled;
    private final List<String> protectedPaths;

    public BearerTokenWebFilter(AuthTokenService authTokenService, McpProperties properties) {
        this.authTokenService = authTokenService;
        this.enabled = properties.getAuth().isEnabled();
        this.protectedPaths = List.copyOf(properties.getAuth().getProtectedPaths());
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        if (!enabled || !isProtected(request.getPath().value())) {
            return chain.filter(exchange);
        }
        String token = extractToken(request);
        if (token != null && authTokenService.isValidToken(token)) {
            return chain.filter(exchange);
        }
        log.warn("[Auth] Rejected request to {}: {}", request.getPath().value(),
                token == null ? "missing bearer token" : "invalid bearer token");
        return unauthorized(exchange.getResponse());
    }

    private boolean isProtected(String path) {
        for (String prefix : protectedPaths) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private String extractToken(ServerHttpRequest request) {
        String authHeader = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).strip();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    private Mono<Void> unauthorized(ServerHttpResponse response) {
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(UNAUTHORIZED_BODY.getBytes(StandardCharsets.UTF_8));
        return response.writeWith(Mono.just(buffer));
    }
}
