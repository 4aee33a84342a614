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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import me.golemcore.mcp.port.outbound.ConversationPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes expired conversations from the store.
 */
@Component
@Slf4j
public class ConversationSweepScheduler {

    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final ConversationPort conversationPort;
    private final McpProperties.ConversationProperties settings;
    private final ScheduledExecutorService sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "conversation-sweep");
        t.setDaemon(true);
        return t;
    });

    public ConversationSweepScheduler(ConversationPort conversationPort, McpProperties properties) {
        this.conversationPort = conversationPort;
        this.settings = properties.getConversation();
    }

    @PostConstruct
    void init() {
        if (!settings.isSweepEnabled()) {
            log.info("[Conversation] Expiry sweep disabled");
            return;
        }
        Duration interval = settings.getSweepInterval();
        long intervalMillis = Math.max(1, interval.toMillis());
        sweepExecutor.scheduleAtFixedRate(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[Conversation] Expiry sweep scheduled every {} (max age {})", interval, settings.getMaxAge());
    }

    @PreDestroy
    void destroy() {
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs one sweep. Failures are logged so the schedule keeps running.
     *
     * @return removed conversation count, or 0 if the sweep failed
     */
    int sweep() {
        try {
            return conversationPort.sweepExpired();
        } catch (RuntimeException e) {
            log.error("[Conversation] Expiry sweep failed", e);
            return 0;
        }
    }
}
