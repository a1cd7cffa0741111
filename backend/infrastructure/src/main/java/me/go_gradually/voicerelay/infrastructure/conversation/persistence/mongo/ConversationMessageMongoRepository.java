package me.go_gradually.voicerelay.infrastructure.conversation.persistence.mongo;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ConversationMessageMongoRepository extends MongoRepository<ConversationMessageDocument, String> {
    List<ConversationMessageDocument> findBySessionIdOrderByCreatedAtAsc(String sessionId);
}
