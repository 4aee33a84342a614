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

package me.golemcore.mcp.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.domain.component.AgentCapability;
import me.golemcore.mcp.domain.exception.InternalAgentException;
import me.golemcore.mcp.domain.exception.InvalidMagicException;
import me.golemcore.mcp.domain.exception.McpException;
import me.golemcore.mcp.domain.model.Envelope;
import me.golemcore.mcp.domain.model.StreamingToken;
import me.golemcore.mcp.domain.model.TokenEvent;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Request orchestration between the HTTP layer and the agent registry.
 *
 * <p>
 * A request whose magic does not match the protocol sentinel is answered with
 * an {@code error} envelope instead of failing. Routing and agent failures
 * surface as {@link McpException} errors of the returned publisher.
 *
 * <p>
 * Agents run on the bounded elastic scheduler, never on the event loop. Token
 * streams pass through a bounded buffer; cancelling the subscription stops the
 * producer.
 */
@Service
@Slf4j
public class DispatchService {

    private final AgentRegistry registry;
    private final ObjectMapper objectMapper;
    private final int bufferSize;

    public DispatchService(AgentRegistry registry, ObjectMapper objectMapper, McpProperties properties) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.bufferSize = Math.max(1, properties.getStream().getBufferSize());
    }

    public Mono<Envelope> dispatch(Envelope request) {
        if (!request.hasValidMagic()) {
            log.warn("[Dispatch] Rejected envelope with invalid magic: {}", request.getMagic());
            return Mono.just(Envelope.error(invalidMagicMessage(request)));
        }
        log.debug("[Dispatch] Routing command: {}", request.getCommand());
        return Mono.fromCallable(() -> registry.dispatch(request))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(McpException.class,
                        e -> log.debug("[Dispatch] Command {} failed: {}", request.getCommand(), e.getMessage()));
    }

    /**
     * Streams the answer for a request. Failures, including routing failures
     * and an invalid magic, are delivered in-band and the stream always ends
     * with one finish token.
     */
    public Flux<TokenEvent> stream(Envelope request) {
        Flux<TokenEvent> source;
        if (!request.hasValidMagic()) {
            log.warn("[Stream] Rejected envelope with invalid magic: {}", request.getMagic());
            source = Flux.just(TokenEvent.failure(new InvalidMagicException(request.getMagic())));
        } else {
            source = Flux.defer(() -> openStream(request))
                    .subscribeOn(Schedulers.boundedElastic());
        }
        return terminated(source)
                .publishOn(Schedulers.boundedElastic(), bufferSize)
                .doOnCancel(() -> log.debug("[Stream] Consumer cancelled stream for command: {}",
                        request.getCommand()));
    }

    private Flux<TokenEvent> openStream(Envelope request) {
        AgentCapability agent = registry.resolve(request);
        if (agent.supportsStreaming()) {
            log.debug("[Stream] Streaming from agent: {}", agent.getName());
            return agent.handleStream(request);
        }
        Envelope response = registry.dispatch(request);
        return Flux.just(TokenEvent.of(StreamingToken.content(serialize(response))));
    }

    /**
     * Converts errors into in-band elements and guarantees a single terminal
     * finish token.
     */
    private Flux<TokenEvent> terminated(Flux<TokenEvent> source) {
        return Flux.defer(() -> {
            boolean[] finished = new boolean[1];
            return source
                    .takeUntil(TokenEvent::isFinish)
                    .doOnNext(event -> {
                        if (event.isFinish()) {
                            finished[0] = true;
                        }
                    })
                    .onErrorResume(error -> Mono.just(TokenEvent.failure(toMcpException(error))))
                    .concatWith(Mono.fromSupplier(() -> finished[0] ? null : TokenEvent.finish()));
        });
    }

    private McpException toMcpException(Throwable error) {
        if (error instanceof McpException mcpException) {
            return mcpException;
        }
        log.warn("[Stream] Agent stream failed: {}", error.getMessage());
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new InternalAgentException(detail, error);
    }

    private String serialize(Envelope response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new InternalAgentException("Failed to serialize response: " + e.getOriginalMessage(), e);
        }
    }

    private String invalidMagicMessage(Envelope request) {
        return "Invalid magic: expected " + Envelope.MAGIC + " but got " + request.getMagic();
    }
}
