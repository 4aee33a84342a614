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

package me.golemcore.mcp.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code mcp.*} prefix:
 * <ul>
 * <li>{@link ConversationProperties} - conversation expiry and sweeping</li>
 * <li>{@link StreamProperties} - streaming buffer sizing</li>
 * <li>{@link AuthProperties} - bearer token access control</li>
 * <li>{@link HttpProperties} - outbound HTTP client</li>
 * <li>{@link AgentsProperties} - agent backends</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "mcp")
@Data
public class McpProperties {

    private ConversationProperties conversation = new ConversationProperties();
    private StreamProperties stream = new StreamProperties();
    private AuthProperties auth = new AuthProperties();
    private HttpProperties http = new HttpProperties();
    private AgentsProperties agents = new AgentsProperties();

    @Data
    public static class ConversationProperties {
        private Duration maxAge = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofHours(1);
        private boolean sweepEnabled = true;
    }

    @Data
    public static class StreamProperties {
        private int bufferSize = 100;
    }

    @Data
    public static class AuthProperties {
        private boolean enabled = false;
        private List<String> tokens = new ArrayList<>();
        private List<String> protectedPaths = new ArrayList<>(List.of("/mcp", "/conversation"));
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== AGENTS ====================

    @Data
    public static class AgentsProperties {
        private DummyAgentProperties dummy = new DummyAgentProperties();
        private BackendAgentProperties openai = new BackendAgentProperties("gpt-3.5-turbo",
                "https://api.openai.com");
        private BackendAgentProperties deepseek = new BackendAgentProperties("deepseek-chat",
                "https://api.deepseek.ai");
    }

    @Data
    public static class DummyAgentProperties {
        private boolean enabled = true;
    }

    @Data
    public static class BackendAgentProperties {
        private boolean enabled = true;
        private String apiKey;
        private String model;
        private String baseUrl;

        public BackendAgentProperties() {
        }

        public BackendAgentProperties(String model, String baseUrl) {
            this.model = model;
            this.baseUrl = baseUrl;
        }
    }
}
