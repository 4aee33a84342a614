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
import me.golemcore.mcp.domain.exception.ConversationNotFoundException;
import me.golemcore.mcp.domain.model.Conversation;
import me.golemcore.mcp.infrastructure.config.McpProperties;
import me.golemcore.mcp.port.outbound.ConversationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory conversation store with time-based expiry.
 *
 * <p>
 * The map is the sole owner of all conversations. Every access goes through
 * one read/write lock, and callers only ever receive copies. Conversations
 * expire once {@code now - updatedAt} exceeds the configured max age; an
 * active conversation therefore never expires regardless of its total age.
 *
 * <p>
 * Expiry is driven from outside via {@link #sweepExpired()}, the store owns no
 * timer. Nothing is persisted across restarts.
 */
@Service
@Slf4j
public class ConversationService implements ConversationPort {

    private final Map<String, Conversation> conversations = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final Duration maxAge;

    public ConversationService(McpProperties properties, Clock clock) {
        this.clock = clock;
        this.maxAge = properties.getConversation().getMaxAge();
    }

    @Override
    public Conversation create() {
        Instant now = clock.instant();
        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .createdAt(now)
                .updatedAt(now)
                .build();

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            conversations.put(conversation.getId(), conversation);
        } finally {
            writeLock.unlock();
        }
        log.debug("[Conversation] Created: {}", conversation.getId());
        return conversation.copy();
    }

    @Override
    public Optional<Conversation> get(String conversationId) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            Conversation conversation = conversations.get(conversationId);
            return conversation != null ? Optional.of(conversation.copy()) : Optional.empty();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Replaces the stored conversation wholesale and bumps its
     * {@code updatedAt}. Inserts the conversation if the id is unknown.
     */
    @Override
    public void update(Conversation conversation) {
        if (conversation == null || conversation.getId() == null) {
            throw new IllegalArgumentException("conversation id is required");
        }
        Conversation stored = conversation.copy();

        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Conversation previous = conversations.get(stored.getId());
            if (previous != null && previous.getUpdatedAt() != null) {
                stored.touch(previous.getUpdatedAt());
            }
            stored.touch(clock.instant());
            if (stored.getCreatedAt() == null) {
                stored.setCreatedAt(stored.getUpdatedAt());
            }
            conversations.put(stored.getId(), stored);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Appends one message and bumps {@code updatedAt} in the same critical
     * section.
     *
     * @throws ConversationNotFoundException
     *             if the id is not in the store
     */
    @Override
    public void appendMessage(String conversationId, String role, String content) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Conversation conversation = conversations.get(conversationId);
            if (conversation == null) {
                throw new ConversationNotFoundException(conversationId);
            }
            conversation.addMessage(role, content, nextTimestamp(conversation));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Merges metadata entries and bumps {@code updatedAt} in one critical
     * section. Messages are left untouched.
     *
     * @throws ConversationNotFoundException
     *             if the id is not in the store
     */
    @Override
    public Conversation putMetadata(String conversationId, Map<String, String> entries) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Conversation conversation = conversations.get(conversationId);
            if (conversation == null) {
                throw new ConversationNotFoundException(conversationId);
            }
            entries.forEach(conversation::putMetadata);
            conversation.touch(clock.instant());
            return conversation.copy();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean delete(String conversationId) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            boolean removed = conversations.remove(conversationId) != null;
            if (removed) {
                log.debug("[Conversation] Deleted: {}", conversationId);
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes every conversation idle for longer than the max age.
     *
     * @return the number of removed conversations
     */
    @Override
    public int sweepExpired() {
        int removed = 0;
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Instant now = clock.instant();
            Iterator<Conversation> iterator = conversations.values().iterator();
            while (iterator.hasNext()) {
                Conversation conversation = iterator.next();
                if (isExpired(conversation, now)) {
                    iterator.remove();
                    removed++;
                }
            }
        } finally {
            writeLock.unlock();
        }
        if (removed > 0) {
            log.info("[Conversation] Swept {} expired conversations (max age {})", removed, maxAge);
        }
        return removed;
    }

    @Override
    public int size() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return conversations.size();
        } finally {
            readLock.unlock();
        }
    }

    // Clock may step backwards; message timestamps must not.
    private Instant nextTimestamp(Conversation conversation) {
        Instant now = clock.instant();
        Instant updatedAt = conversation.getUpdatedAt();
        return updatedAt != null && updatedAt.isAfter(now) ? updatedAt : now;
    }

    private boolean isExpired(Conversation conversation, Instant now) {
        Instant updatedAt = conversation.getUpdatedAt();
        if (updatedAt == null) {
            return false;
        }
        return Duration.between(updatedAt, now).compareTo(maxAge) > 0;
    }
}
