package me.go_gradually.voicerelay.infrastructure.conversation.store;

import me.go_gradually.voicerelay.application.relay.port.MessageStorePort;
import me.go_gradually.voicerelay.domain.conversation.ConversationMessage;
import me.go_gradually.voicerelay.domain.generation.MessageRole;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
@ConditionalOnProperty(prefix = "relay.persistence", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryMessageStore implements MessageStorePort {
    private final Map<String, List<ConversationMessage>> messages = new ConcurrentHashMap<>();

    @Override
    public void appendMessage(String sessionId, MessageRole role, String content) {
        ConversationMessage message = ConversationMessage.of(sessionId, role, content);
        messages.computeIfAbsent(sessionId, ignored -> new CopyOnWriteArrayList<>()).add(message);
    }

    public List<ConversationMessage> messagesFor(String sessionId) {
        return List.copyOf(messages.getOrDefault(sessionId, List.of()));
    }
}
