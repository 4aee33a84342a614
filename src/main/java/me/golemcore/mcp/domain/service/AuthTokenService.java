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
import me.golemcore.mcp.infrastructure.config.McpProperties;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable set of accepted bearer tokens. Tokens are opaque strings, only
 * membership is checked.
 */
@Service
@Slf4j
public class AuthTokenService {

    private final Set<String> tokens = ConcurrentHashMap.newKeySet();

    public AuthTokenService(McpProperties properties) {
        for (String token : properties.getAuth().getTokens()) {
            addToken(token);
        }
        log.info("[Auth] Loaded {} accepted tokens", tokens.size());
    }

    public void addToken(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        tokens.add(token.strip());
    }

    public boolean removeToken(String token) {
        if (token == null) {
            return false;
        }
        return tokens.remove(token.strip());
    }

    public boolean isValidToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return tokens.contains(token.strip());
    }

    public int tokenCount() {
        return tokens.size();
    }
}
