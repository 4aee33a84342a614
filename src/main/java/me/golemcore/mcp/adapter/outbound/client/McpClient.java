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

package me.golemcore.mcp.adapter.outbound.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.domain.model.Envelope;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Blocking client for a remote envelope router.
 *
 * <pre>{@code
 * Envelope answer = mcpClient.send("http://localhost:3000/mcp",
 *         Envelope.forAgent("openai", "chat", payload));
 * }</pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpClient {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public Envelope send(String serverUrl, Envelope envelope) throws McpClientException {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Envelope cannot be serialized: " + e.getOriginalMessage(), e);
        }
        Request request = new Request.Builder()
                .url(serverUrl)
                .post(RequestBody.create(body, JSON))
                .build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.debug("[Client] {} returned status {}", serverUrl, response.code());
                throw McpClientException.unexpectedStatus(response.code());
            }
            return readEnvelope(response.body());
        } catch (IOException e) {
            log.debug("[Client] Request to {} failed: {}", serverUrl, e.getMessage());
            throw McpClientException.network(e);
        }
    }

    private Envelope readEnvelope(ResponseBody body) throws IOException, McpClientException {
        if (body == null) {
            throw McpClientException.deserialization(new IOException("empty response body"));
        }
        String json = body.string();
        try {
            return objectMapper.readValue(json, Envelope.class);
        } catch (JsonProcessingException e) {
            throw McpClientException.deserialization(e);
        }
    }
}
