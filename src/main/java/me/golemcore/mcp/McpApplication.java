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

package me.golemcore.mcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore MCP router.
 *
 * <p>
 * Routes envelope requests ({@code magic}, {@code version}, {@code command},
 * {@code payload}) to pluggable AI model agents, keeps multi-turn conversation
 * state with time-based expiry and streams backend answers token by token.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound        → McpController, ConversationController, BearerTokenWebFilter
 * Domain         → DispatchService, AgentRegistry, ConversationService, JsonLineStreamDecoder
 * Outbound       → DummyAgent, OpenAiAgent, DeepSeekAgent, McpClient
 * </pre>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class McpApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpApplication.class, args);
    }
}
