package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.ConversationMessageDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ConversationMessageRepository extends MongoRepository<ConversationMessageDocument, String> {
    List<ConversationMessageDocument> findByConversationIdOrderBySeqAsc(String conversationId);
    long countByConversationId(String conversationId);
}
