package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.LlmInteractionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface LlmInteractionRepository extends MongoRepository<LlmInteractionDocument, String> {
    List<LlmInteractionDocument> findBySessionIdOrderByTimestampAsc(String sessionId);
    List<LlmInteractionDocument> findByTimestampAfterOrderByTimestampDesc(Instant after);
    long countBySessionId(String sessionId);
}
