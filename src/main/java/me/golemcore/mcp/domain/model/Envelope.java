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

package me.golemcore.mcp.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import me.golemcore.mcp.domain.exception.InvalidCommandFormatException;

/**
 * Wire message exchanged with agents.
 *
 * <p>
 * Requests and responses share the same shape:
 *
 * <pre>
 * {"magic": "MCP0", "version": 1, "command": "&lt;agent&gt;:&lt;action&gt;", "payload": {...}}
 * </pre>
 *
 * <p>
 * The payload is opaque at this level; only the agent that receives the
 * envelope interprets its fields. Envelopes are immutable, use
 * {@link #toBuilder()} to derive a modified copy.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Envelope {

    public static final String MAGIC = "MCP0";
    public static final int VERSION = 1;
    public static final char COMMAND_SEPARATOR = ':';
    public static final String ERROR_COMMAND = "error";
    public static final String RESPONSE_SUFFIX = "_response";

    String magic;
    int version;
    String command;
    JsonNode payload;

    /**
     * Creates an envelope with the protocol magic and version. Command and
     * payload are stored as given.
     */
    public static Envelope of(String command, JsonNode payload) {
        return Envelope.builder()
                .magic(MAGIC)
                .version(VERSION)
                .command(command)
                .payload(payload)
                .build();
    }

    /**
     * Builds an envelope addressed to {@code agent:action}.
     */
    public static Envelope forAgent(String agent, String action, JsonNode payload) {
        return of(agent + COMMAND_SEPARATOR + action, payload);
    }

    /**
     * Builds the conventional success response of an agent,
     * {@code <agent>_response}.
     */
    public static Envelope response(String agent, JsonNode payload) {
        return of(agent + RESPONSE_SUFFIX, payload);
    }

    /**
     * Builds the soft error envelope returned for protocol framing failures.
     */
    public static Envelope error(String message) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("message", message);
        return of(ERROR_COMMAND, payload);
    }

    /**
     * Splits the command on the first separator. Everything after it belongs to
     * the action, which may itself contain separators.
     *
     * @throws InvalidCommandFormatException
     *             if the command has no separator
     */
    public CommandRoute splitCommand() {
        if (command == null) {
            throw new InvalidCommandFormatException();
        }
        int separatorIndex = command.indexOf(COMMAND_SEPARATOR);
        if (separatorIndex < 0) {
            throw new InvalidCommandFormatException();
        }
        return new CommandRoute(command.substring(0, separatorIndex), command.substring(separatorIndex + 1));
    }

    @JsonIgnore
    public boolean hasValidMagic() {
        return MAGIC.equals(magic);
    }

    @JsonIgnore
    public boolean isError() {
        return ERROR_COMMAND.equals(command);
    }
}
