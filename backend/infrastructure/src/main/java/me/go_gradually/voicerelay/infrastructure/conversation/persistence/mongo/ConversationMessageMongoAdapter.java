package me.go_gradually.voicerelay.infrastructure.conversation.persistence.mongo;

import me.go_gradually.voicerelay.application.relay.port.MessageStorePort;
import me.go_gradually.voicerelay.domain.conversation.ConversationMessage;
import me.go_gradually.voicerelay.domain.generation.MessageRole;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(prefix = "relay.persistence", name = "store", havingValue = "mongo")
public class ConversationMessageMongoAdapter implements MessageStorePort {
    private final ConversationMessageMongoRepository repository;

    public ConversationMessageMongoAdapter(ConversationMessageMongoRepository repository) {
        this.repository = repository;
    }

    @Override
    public void appendMessage(String sessionId, MessageRole role, String content) {
        repository.save(toDocument(ConversationMessage.of(sessionId, role, content)));
    }

    public List<ConversationMessage> messagesFor(String sessionId) {
        return repository.findBySessionIdOrderByCreatedAtAsc(sessionId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    private ConversationMessage toDomain(ConversationMessageDocument doc) {
        return new ConversationMessage(
                doc.getSessionId(),
                MessageRole.fromWireName(doc.getRole()),
                doc.getContent(),
                doc.getCreatedAt()
        );
    }

    private ConversationMessageDocument toDocument(ConversationMessage message) {
        ConversationMessageDocument doc = new ConversationMessageDocument();
        doc.setSessionId(message.sessionId());
        doc.setRole(message.role().wireName());
        doc.setContent(message.content());
        doc.setCreatedAt(message.createdAt());
        return doc;
    }
}
