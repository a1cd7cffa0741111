package me.go_gradually.voicerelay.domain.conversation;

import me.go_gradually.voicerelay.domain.generation.MessageRole;

import java.time.Instant;

public record ConversationMessage(String sessionId, MessageRole role, String content, Instant createdAt) {
    public ConversationMessage {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        content = content == null ? "" : content;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static ConversationMessage of(String sessionId, MessageRole role, String content) {
        return new ConversationMessage(sessionId, role, content, Instant.now());
    }
}
