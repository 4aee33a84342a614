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

package me.golemcore.mcp.port.outbound;

import me.golemcore.mcp.domain.model.Conversation;

import java.util.Map;
import java.util.Optional;

/**
 * Port for the conversation store. Abstracts conversation lifecycle and
 * expiry from agents and web adapters.
 *
 * <p>
 * {@link #appendMessage(String, String, String)} and
 * {@link #putMetadata(String, Map)} are atomic with respect to a single
 * conversation. {@code get}, local change and {@code update} is not, and
 * concurrent updates of the same id race (last write wins).
 */
public interface ConversationPort {

    Conversation create();

    Optional<Conversation> get(String conversationId);

    void update(Conversation conversation);

    void appendMessage(String conversationId, String role, String content);

    /**
     * Merges {@code entries} into the metadata of an existing conversation.
     *
     * @return a copy of the conversation after the merge
     */
    Conversation putMetadata(String conversationId, Map<String, String> entries);

    boolean delete(String conversationId);

    int sweepExpired();

    int size();
}
