package me.go_gradually.voicerelay.application.relay.port;

import me.go_gradually.voicerelay.domain.generation.MessageRole;

public interface MessageStorePort {
    void appendMessage(String sessionId, MessageRole role, String content);
}
