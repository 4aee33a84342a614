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

package me.golemcore.mcp.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.mcp.domain.model.Envelope;
import me.golemcore.mcp.domain.model.StreamingToken;
import me.golemcore.mcp.domain.model.TokenEvent;
import me.golemcore.mcp.domain.service.DispatchService;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Envelope endpoints. {@code POST /mcp} answers with one envelope,
 * {@code POST /mcp/stream} with server-sent events.
 */
@RestController
@RequiredArgsConstructor
public class McpController {

    static final String EVENT_TOKEN = "token";
    static final String EVENT_ERROR = "error";
    static final String EVENT_FINISH = "finish";

    private final DispatchService dispatchService;

    @PostMapping(value = "/mcp", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Envelope> handle(@RequestBody Envelope request) {
        return dispatchService.dispatch(request);
    }

    /**
     * Streams tokens as {@code token} events, in-band failures as
     * {@code error} events and completion as a single {@code finish} event.
     * An envelope with an invalid magic yields one {@code error} event.
     */
    @PostMapping(value = "/mcp/stream", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> stream(@RequestBody Envelope request) {
        Flux<TokenEvent> events = dispatchService.stream(request);
        if (!request.hasValidMagic()) {
            events = events.filter(TokenEvent::isError);
        }
        return events.map(this::toServerSentEvent);
    }

    private ServerSentEvent<Object> toServerSentEvent(TokenEvent event) {
        if (event.isError()) {
            return ServerSentEvent.<Object>builder()
                    .event(EVENT_ERROR)
                    .data(Map.of("error", event.error().getMessage()))
                    .build();
        }
        StreamingToken token = event.token();
        return ServerSentEvent.<Object>builder()
                .event(token.isFinish() ? EVENT_FINISH : EVENT_TOKEN)
                .data(token)
                .build();
    }
}
