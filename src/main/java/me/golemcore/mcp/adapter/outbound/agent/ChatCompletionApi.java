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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Feign client for OpenAI-compatible chat completion endpoints.
 */
public interface ChatCompletionApi {

    String PATH = "/v1/chat/completions";

    @RequestLine("POST " + PATH)
    @Headers({
            "Content-Type: application/json",
            "Authorization: Bearer {apiKey}"
    })
    ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private Boolean stream;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class ApiMessage {
        private String role;
        private String content;
    }

    /**
     * One {@code data:} line of a streamed completion.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class ChatCompletionChunk {
        private String id;
        private List<ChunkChoice> choices;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class ChunkChoice {
        private int index;
        private ApiMessage delta;
        @JsonProperty("finish_reason")
        private String finishReason;
    }
}
