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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.domain.component.AgentCapability;
import me.golemcore.mcp.domain.exception.AgentNotRegisteredException;
import me.golemcore.mcp.domain.exception.InternalAgentException;
import me.golemcore.mcp.domain.model.CommandRoute;
import me.golemcore.mcp.domain.model.Envelope;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatch table routing an envelope to the agent named by its command
 * prefix.
 *
 * <p>
 * Registration under an existing name replaces the previous agent
 * (last write wins). Requests already running on the replaced agent finish
 * normally because the agent is resolved once per dispatch. Registration and
 * dispatch are safe to run concurrently; a dispatch that starts after a
 * registration returned sees the new agent.
 *
 * <p>
 * Agents are invoked outside of any lock.
 */
@Slf4j
public class AgentRegistry {

    private final Map<String, AgentCapability> agents = new ConcurrentHashMap<>();

    public void register(AgentCapability agent) {
        AgentCapability previous = agents.put(agent.getName(), agent);
        if (previous != null && previous != agent) {
            log.info("[Registry] Replaced agent: {}", agent.getName());
        } else {
            log.info("[Registry] Registered agent: {}", agent.getName());
        }
    }

    public Optional<AgentCapability> find(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public Set<String> listAgentNames() {
        return new TreeSet<>(agents.keySet());
    }

    /**
     * Resolves the agent addressed by the envelope command.
     *
     * @throws me.golemcore.mcp.domain.exception.InvalidCommandFormatException
     *             if the command has no separator
     * @throws AgentNotRegisteredException
     *             if no agent is registered under the routing key
     */
    public AgentCapability resolve(Envelope request) {
        CommandRoute route = request.splitCommand();
        AgentCapability agent = agents.get(route.agentKey());
        if (agent == null) {
            throw new AgentNotRegisteredException(route.agentKey());
        }
        return agent;
    }

    /**
     * Routes the envelope and runs the agent. Routing errors propagate
     * unchanged. Every failure raised by the agent itself is reported as
     * {@link InternalAgentException}.
     */
    public Envelope dispatch(Envelope request) {
        AgentCapability agent = resolve(request);
        Envelope response;
        try {
            response = agent.handle(request);
        } catch (InternalAgentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Registry] Agent {} failed: {}", agent.getName(), e.getMessage());
            throw new InternalAgentException(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
        if (response == null) {
            throw new InternalAgentException("Agent '" + agent.getName() + "' returned no response");
        }
        return response;
    }
}
