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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatChoice;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatCompletionRequest;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatCompletionResponse;
import me.golemcore.mcp.domain.stream.JsonLineStreamDecoder;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import me.golemcore.mcp.infrastructure.http.ChunkedHttpClient;
import me.golemcore.mcp.infrastructure.http.FeignClientFactory;
import me.golemcore.mcp.port.outbound.ConversationPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * DeepSeek chat agent.
 *
 * <p>
 * Besides {@code user_prompt} it forwards the optional {@code temperature}
 * and {@code max_tokens} payload fields. Answers {@code deepseek_response}
 * with {@code answer}, the completion {@code id} and its
 * {@code finish_reason} ({@code "unknown"} when the API omits it).
 */
@Component
@ConditionalOnProperty(prefix = "mcp.agents.deepseek", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DeepSeekAgent extends OpenAiCompatibleAgent {

    public static final String NAME = "deepseek";
    public static final String FIELD_TEMPERATURE = "temperature";
    public static final String FIELD_MAX_TOKENS = "max_tokens";
    public static final String UNKNOWN_FINISH_REASON = "unknown";

    public DeepSeekAgent(McpProperties properties, FeignClientFactory feignClientFactory,
            ChunkedHttpClient chunkedHttpClient, JsonLineStreamDecoder streamDecoder,
            ConversationPort conversationPort, ObjectMapper objectMapper) {
        super(properties.getAgents().getDeepseek(), feignClientFactory, chunkedHttpClient, streamDecoder,
                conversationPort, objectMapper);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected String getProviderLabel() {
        return "DeepSeek";
    }

    @Override
    protected void customizeRequest(JsonNode payload, ChatCompletionRequest request) {
        if (payload == null) {
            return;
        }
        JsonNode temperature = payload.get(FIELD_TEMPERATURE);
        if (temperature != null && temperature.isNumber()) {
            request.setTemperature(temperature.asDouble());
        }
        JsonNode maxTokens = payload.get(FIELD_MAX_TOKENS);
        if (maxTokens != null && maxTokens.isIntegralNumber() && maxTokens.canConvertToInt()
                && maxTokens.asInt() >= 0) {
            request.setMaxTokens(maxTokens.asInt());
        }
    }

    @Override
    protected ObjectNode buildResponsePayload(ChatCompletionResponse response, ChatChoice choice, String answer) {
        ObjectNode payload = newPayload();
        payload.put(FIELD_ANSWER, answer);
        payload.put("id", response.getId());
        payload.put("finish_reason",
                choice.getFinishReason() != null ? choice.getFinishReason() : UNKNOWN_FINISH_REASON);
        return payload;
    }
}
