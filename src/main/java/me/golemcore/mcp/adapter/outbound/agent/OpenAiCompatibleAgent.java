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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import feign.FeignException;
import feign.codec.DecodeException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ApiMessage;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatChoice;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatCompletionChunk;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatCompletionRequest;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChatCompletionResponse;
import me.golemcore.mcp.adapter.outbound.agent.ChatCompletionApi.ChunkChoice;
import me.golemcore.mcp.domain.component.AgentCapability;
import me.golemcore.mcp.domain.exception.ConversationNotFoundException;
import me.golemcore.mcp.domain.exception.InternalAgentException;
import me.golemcore.mcp.domain.exception.NetworkTransportException;
import me.golemcore.mcp.domain.model.Conversation;
import me.golemcore.mcp.domain.model.ConversationMessage;
import me.golemcore.mcp.domain.model.Envelope;
import me.golemcore.mcp.domain.model.TokenEvent;
import me.golemcore.mcp.domain.stream.JsonLineStreamDecoder;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import me.golemcore.mcp.infrastructure.http.ChunkedHttpClient;
import me.golemcore.mcp.infrastructure.http.FeignClientFactory;
import me.golemcore.mcp.port.outbound.ConversationPort;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for agents backed by an OpenAI-compatible chat completions API.
 *
 * <p>
 * Payload fields:
 * <ul>
 * <li>{@code user_prompt} - required prompt text</li>
 * <li>{@code conversation_id} - optional; prior messages of that conversation
 * are sent as history, and the prompt and answer are appended to it</li>
 * </ul>
 * Subclasses add provider-specific request options and response fields.
 * Every failure is reported as {@link InternalAgentException}.
 */
@Slf4j
public abstract class OpenAiCompatibleAgent implements AgentCapability {

    public static final String FIELD_USER_PROMPT = "user_prompt";
    public static final String FIELD_CONVERSATION_ID = "conversation_id";
    public static final String FIELD_ANSWER = "answer";

    protected static final String ROLE_USER = "user";
    protected static final String ROLE_ASSISTANT = "assistant";

    private final McpProperties.BackendAgentProperties settings;
    private final FeignClientFactory feignClientFactory;
    private final ChunkedHttpClient chunkedHttpClient;
    private final JsonLineStreamDecoder streamDecoder;
    private final ConversationPort conversationPort;
    private final ObjectMapper objectMapper;

    private volatile ChatCompletionApi client;

    protected OpenAiCompatibleAgent(McpProperties.BackendAgentProperties settings,
            FeignClientFactory feignClientFactory,
            ChunkedHttpClient chunkedHttpClient,
            JsonLineStreamDecoder streamDecoder,
            ConversationPort conversationPort,
            ObjectMapper objectMapper) {
        this.settings = settings;
        this.feignClientFactory = feignClientFactory;
        this.chunkedHttpClient = chunkedHttpClient;
        this.streamDecoder = streamDecoder;
        this.conversationPort = conversationPort;
        this.objectMapper = objectMapper;
    }

    /**
     * Provider name used in error messages, e.g. "OpenAI".
     */
    protected abstract String getProviderLabel();

    /**
     * Adds provider-specific options from the request payload.
     */
    protected void customizeRequest(JsonNode payload, ChatCompletionRequest request) {
    }

    /**
     * Builds the payload of the success response.
     */
    protected abstract ObjectNode buildResponsePayload(ChatCompletionResponse response, ChatChoice choice,
            String answer);

    @Override
    public Envelope handle(Envelope request) {
        JsonNode payload = request.getPayload();
        String prompt = requirePrompt(payload);
        String conversationId = textField(payload, FIELD_CONVERSATION_ID);

        ChatCompletionRequest apiRequest = buildRequest(payload, prompt, conversationId, false);
        ChatCompletionResponse apiResponse = execute(apiRequest);
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            throw new InternalAgentException("No response choices");
        }
        ChatChoice choice = apiResponse.getChoices().get(0);
        String answer = choice.getMessage() != null ? choice.getMessage().getContent() : null;
        if (answer == null) {
            throw new InternalAgentException("No response choices");
        }

        recordExchange(conversationId, prompt, answer);
        log.debug("[Agent] {} answered, {} chars", getName(), answer.length());
        return Envelope.response(getName(), buildResponsePayload(apiResponse, choice, answer));
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    /**
     * Streams the completion. Token content is the delta text of each
     * {@code data:} line.
     */
    @Override
    public Flux<TokenEvent> handleStream(Envelope request) {
        JsonNode payload = request.getPayload();
        String prompt = requirePrompt(payload);
        String conversationId = textField(payload, FIELD_CONVERSATION_ID);

        ChatCompletionRequest apiRequest = buildRequest(payload, prompt, conversationId, true);
        byte[] body = serialize(apiRequest);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + requireApiKey());
        headers.put("Accept", "text/event-stream");

        Flux<byte[]> chunks = chunkedHttpClient.postJson(chatCompletionsUrl(), headers, body);
        return Flux.defer(() -> {
            StringBuilder answer = new StringBuilder();
            boolean[] transportFailed = new boolean[1];
            return streamDecoder.decode(chunks, ChatCompletionChunk.class, this::deltaContent)
                    .doOnNext(event -> {
                        if (event.isError()) {
                            transportFailed[0] |= event.error() instanceof NetworkTransportException;
                        } else if (event.isFinish()) {
                            if (!transportFailed[0]) {
                                recordExchange(conversationId, prompt, answer.toString());
                            }
                        } else {
                            answer.append(event.token().getContent());
                        }
                    });
        });
    }

    private ChatCompletionRequest buildRequest(JsonNode payload, String prompt, String conversationId,
            boolean stream) {
        List<ApiMessage> messages = new ArrayList<>();
        if (conversationId != null) {
            Conversation conversation = conversationPort.get(conversationId)
                    .orElseThrow(() -> new InternalAgentException("Unknown conversation_id: " + conversationId));
            for (ConversationMessage message : conversation.getMessages()) {
                messages.add(new ApiMessage(message.getRole(), message.getContent()));
            }
        }
        messages.add(new ApiMessage(ROLE_USER, prompt));

        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel(settings.getModel());
        request.setMessages(messages);
        if (stream) {
            request.setStream(true);
        }
        customizeRequest(payload, request);
        return request;
    }

    private ChatCompletionResponse execute(ChatCompletionRequest apiRequest) {
        try {
            return api().chatCompletion(requireApiKey(), apiRequest);
        } catch (FeignException e) {
            throw toAgentException(e);
        }
    }

    private InternalAgentException toAgentException(FeignException e) {
        int status = e.status();
        if (e instanceof DecodeException || (status >= 200 && status < 300)) {
            log.warn("[Agent] {} returned an unreadable response: {}", getName(), e.getMessage());
            return new InternalAgentException("Invalid response from " + getProviderLabel() + " API: "
                    + e.getMessage(), e);
        }
        if (status > 0) {
            log.warn("[Agent] {} returned status {}", getName(), status);
            return new InternalAgentException(getProviderLabel() + " API returned status " + status, e);
        }
        log.warn("[Agent] {} request failed: {}", getName(), e.getMessage());
        return new InternalAgentException("Request to " + getProviderLabel() + " API failed: " + e.getMessage(), e);
    }

    private void recordExchange(String conversationId, String prompt, String answer) {
        if (conversationId == null) {
            return;
        }
        try {
            conversationPort.appendMessage(conversationId, ROLE_USER, prompt);
            conversationPort.appendMessage(conversationId, ROLE_ASSISTANT, answer);
        } catch (ConversationNotFoundException e) {
            // Expired or deleted while the backend call was running.
            log.warn("[Agent] Conversation {} disappeared before the answer was recorded", conversationId);
        }
    }

    private String deltaContent(ChatCompletionChunk chunk) {
        if (chunk.getChoices() == null || chunk.getChoices().isEmpty()) {
            return null;
        }
        ChunkChoice choice = chunk.getChoices().get(0);
        return choice.getDelta() != null ? choice.getDelta().getContent() : null;
    }

    private ChatCompletionApi api() {
        ChatCompletionApi current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = feignClientFactory.create(ChatCompletionApi.class, baseUrl());
                    client = current;
                    log.info("[Agent] {} client initialized with URL: {}", getName(), baseUrl());
                }
            }
        }
        return current;
    }

    private String chatCompletionsUrl() {
        return baseUrl() + ChatCompletionApi.PATH;
    }

    private String baseUrl() {
        String baseUrl = settings.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new InternalAgentException(getProviderLabel() + " base URL is not configured");
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private String requireApiKey() {
        String apiKey = settings.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new InternalAgentException(getProviderLabel() + " API key is not configured");
        }
        return apiKey;
    }

    private byte[] serialize(ChatCompletionRequest request) {
        try {
            return objectMapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new InternalAgentException("Failed to encode request: " + e.getOriginalMessage(), e);
        }
    }

    private static String requirePrompt(JsonNode payload) {
        String prompt = textField(payload, FIELD_USER_PROMPT);
        if (prompt == null) {
            throw new InternalAgentException("Missing user_prompt");
        }
        return prompt;
    }

    protected static String textField(JsonNode payload, String field) {
        if (payload == null) {
            return null;
        }
        JsonNode node = payload.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    protected ObjectNode newPayload() {
        return objectMapper.createObjectNode();
    }
}
