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

package me.golemcore.mcp.domain.component;

import me.golemcore.mcp.domain.model.Envelope;
import me.golemcore.mcp.domain.model.TokenEvent;
import reactor.core.publisher.Flux;

/**
 * Contract implemented by every agent backend. An agent is addressed by the
 * part of an envelope command before the first separator.
 *
 * <p>
 * Implementations must be stateless or synchronize internally: the same
 * instance serves many concurrent requests. Each agent validates its own
 * payload fields, builds the outbound backend request and maps the backend
 * answer back into a response envelope.
 */
public interface AgentCapability {

    /**
     * Returns the routing key this agent is registered under (e.g., "openai").
     *
     * @return the agent name
     */
    String getName();

    /**
     * Handles a request envelope and returns the response envelope.
     *
     * @param request
     *            the request, already checked for the protocol magic
     * @return the response, by convention with command {@code <name>_response}
     * @throws me.golemcore.mcp.domain.exception.InternalAgentException
     *             if the request cannot be served
     */
    Envelope handle(Envelope request);

    /**
     * Checks whether this agent produces incremental token streams.
     *
     * @return true if {@link #handleStream(Envelope)} is supported
     */
    default boolean supportsStreaming() {
        return false;
    }

    /**
     * Handles a request envelope and streams the answer token by token. The
     * returned stream ends with exactly one finish token.
     *
     * @param request
     *            the request, already checked for the protocol magic
     * @return the token stream
     */
    default Flux<TokenEvent> handleStream(Envelope request) {
        throw new UnsupportedOperationException("Streaming not supported by agent " + getName());
    }
}
