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

package me.golemcore.mcp.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mcp.adapter.inbound.web.dto.AppendMessageRequest;
import me.golemcore.mcp.adapter.inbound.web.dto.ConversationCreatedResponse;
import me.golemcore.mcp.adapter.inbound.web.dto.ConversationDto;
import me.golemcore.mcp.adapter.inbound.web.dto.MetadataUpdateRequest;
import me.golemcore.mcp.domain.exception.ConversationNotFoundException;
import me.golemcore.mcp.domain.model.Conversation;
import me.golemcore.mcp.domain.model.ConversationMessage;
import me.golemcore.mcp.port.outbound.ConversationPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Conversation lifecycle endpoints.
 */
@RestController
@RequestMapping("/conversation")
@RequiredArgsConstructor
@Slf4j
public class ConversationController {

    private final ConversationPort conversationPort;

    @PostMapping
    public Mono<ResponseEntity<ConversationCreatedResponse>> createConversation() {
        Conversation conversation = conversationPort.create();
        log.info("[Conversation] Created via API: {}", conversation.getId());
        ConversationCreatedResponse body = ConversationCreatedResponse.builder()
                .conversationId(conversation.getId())
                .createdAt(toIso(conversation.getCreatedAt()))
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(body));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ConversationDto>> getConversation(@PathVariable String id) {
        Conversation conversation = conversationPort.get(id)
                .orElseThrow(() -> new ConversationNotFoundException(id));
        return Mono.just(ResponseEntity.ok(toDto(conversation)));
    }

    @PostMapping("/{id}/messages")
    public Mono<ResponseEntity<ConversationDto>> appendMessage(@PathVariable String id,
            @RequestBody AppendMessageRequest request) {
        if (request == null || isBlank(request.getRole()) || request.getContent() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "role and content are required");
        }
        conversationPort.appendMessage(id, request.getRole(), request.getContent());
        Conversation conversation = conversationPort.get(id)
                .orElseThrow(() -> new ConversationNotFoundException(id));
        return Mono.just(ResponseEntity.ok(toDto(conversation)));
    }

    @PutMapping("/{id}/metadata")
    public Mono<ResponseEntity<ConversationDto>> updateMetadata(@PathVariable String id,
            @RequestBody MetadataUpdateRequest request) {
        if (request == null || request.getMetadata() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "metadata is required");
        }
        Conversation updated = conversationPort.putMetadata(id, request.getMetadata());
        return Mono.just(ResponseEntity.ok(toDto(updated)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteConversation(@PathVariable String id) {
        if (!conversationPort.delete(id)) {
            throw new ConversationNotFoundException(id);
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    private ConversationDto toDto(Conversation conversation) {
        List<ConversationDto.MessageDto> messages = conversation.getMessages().stream()
                .map(this::toMessageDto)
                .toList();
        return ConversationDto.builder()
                .id(conversation.getId())
                .messages(messages)
                .metadata(conversation.getMetadata())
                .createdAt(toIso(conversation.getCreatedAt()))
                .updatedAt(toIso(conversation.getUpdatedAt()))
                .build();
    }

    private ConversationDto.MessageDto toMessageDto(ConversationMessage message) {
        return ConversationDto.MessageDto.builder()
                .role(message.getRole())
                .content(message.getContent())
                .timestamp(toIso(message.getTimestamp()))
                .build();
    }

    private String toIso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
