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

package me.golemcore.mcp.adapter.outbound.agent;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.domain.component.AgentCapability;
import me.golemcore.mcp.domain.model.Envelope;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Echo agent for smoke tests: answers {@code dummy_response} with the request
 * payload unchanged.
 */
@Component
@ConditionalOnProperty(prefix = "mcp.agents.dummy", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DummyAgent implements AgentCapability {

    public static final String NAME = "dummy";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Envelope handle(Envelope request) {
        log.debug("[Agent] dummy echo: {}", request.getCommand());
        return Envelope.response(NAME, request.getPayload());
    }
}
