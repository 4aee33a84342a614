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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatChoice;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatCompletionResponse;
import me.golemcore.mcp.domain.stream.JsonLineStreamDecoder;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import me.golemcore.mcp.infrastructure.http.ChunkedHttpClient;
import me.golemcore.mcp.infrastructure.http.FeignClientFactory;
import me.golemcore.mcp.port.outbound.ConversationPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * OpenAI chat completions agent. Answers {@code openai_response} with
 * {@code {"answer": ...}}.
 */
@Component
@ConditionalOnProperty(prefix = "mcp.agents.openai", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OpenAiAgent extends OpenAiCompatibleAgent {

    public static final String NAME = "openai";

    public OpenAiAgent(McpProperties properties, FeignClientFactory feignClientFactory,
            ChunkedHttpClient chunkedHttpClient, JsonLineStreamDecoder streamDecoder,
            ConversationPort conversationPort, ObjectMapper objectMapper) {
        super(properties.getAgents().getOpenai(), feignClientFactory, chunkedHttpClient, streamDecoder,
                conversationPort, objectMapper);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected String getProviderLabel() {
        return "OpenAI";
    }

    @Override
    protected ObjectNode buildResponsePayload(ChatCompletionResponse response, ChatChoice choice, String answer) {
        ObjectNode payload = newPayload();
        payload.put(FIELD_ANSWER, answer);
        return payload;
    }
}
