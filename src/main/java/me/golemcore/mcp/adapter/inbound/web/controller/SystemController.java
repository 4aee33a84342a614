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
import me.golemcore.mcp.domain.service.AgentRegistry;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Liveness and agent listing.
 */
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final AgentRegistry agentRegistry;

    @GetMapping(value = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> health() {
        return Mono.just("OK");
    }

    @GetMapping("/agents")
    public Mono<ResponseEntity<Set<String>>> listAgents() {
        return Mono.just(ResponseEntity.ok(agentRegistry.listAgentNames()));
    }
}
