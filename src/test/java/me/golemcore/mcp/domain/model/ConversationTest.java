package me.golemcore.mcp.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ConversationTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void addMessageNeverMovesUpdatedAtBackwards() {
        Conversation conversation = Conversation.builder().id("c1").createdAt(T0).updatedAt(T0).build();

        conversation.addMessage("user", "late", T0.minusSeconds(30));

        assertEquals(T0, conversation.getUpdatedAt());
        assertEquals(1, conversation.getMessages().size());
    }

    @Test
    void copyIsIndependentOfOriginal() {
        Conversation conversation = Conversation.builder().id("c1").createdAt(T0).updatedAt(T0).build();
        conversation.addMessage("user", "hi", T0);

        Conversation copy = conversation.copy();
        copy.addMessage("assistant", "hello", T0.plusSeconds(1));
        copy.putMetadata("topic", "greeting");

        assertEquals(1, conversation.getMessages().size());
        assertTrue(conversation.getMetadata().isEmpty());
        assertEquals(T0, conversation.getUpdatedAt());
        assertEquals(2, copy.getMessages().size());
    }
}
