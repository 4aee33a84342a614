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

package me.golemcore.mcp.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-turn conversation tracked by the conversation store.
 *
 * <p>
 * Instances handed out by the store are snapshots: changing them has no
 * effect until they are written back with
 * {@link me.golemcore.mcp.port.outbound.ConversationPort#update(Conversation)}.
 * The message list is append-only, nothing in the system removes or reorders
 * earlier messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private String id;

    @Builder.Default
    private List<ConversationMessage> messages = new ArrayList<>();

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Appends a message and moves {@code updatedAt} forward. Never moves it
     * backwards, even if the supplied timestamp is older.
     */
    public void addMessage(String role, String content, Instant timestamp) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(ConversationMessage.builder()
                .role(role)
                .content(content)
                .timestamp(timestamp)
                .build());
        touch(timestamp);
    }

    public void putMetadata(String key, String value) {
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        metadata.put(key, value);
    }

    /**
     * Moves {@code updatedAt} to the given instant unless it is already later.
     */
    public void touch(Instant timestamp) {
        if (updatedAt == null || timestamp.isAfter(updatedAt)) {
            updatedAt = timestamp;
        }
    }

    /**
     * Deep copy. Messages are immutable and shared, the collections are not.
     */
    public Conversation copy() {
        return Conversation.builder()
                .id(id)
                .messages(messages != null ? new ArrayList<>(messages) : new ArrayList<>())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
