package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.AuditEntryDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface AuditEntryRepository extends MongoRepository<AuditEntryDocument, String> {
    List<AuditEntryDocument> findBySessionIdOrderByTimestampAsc(String sessionId);
    List<AuditEntryDocument> findByProjectIdOrderByTimestampDesc(String projectId, Pageable pageable);
    List<AuditEntryDocument> findByProjectIdAndEventTypeOrderByTimestampDesc(String projectId, String eventType, Pageable pageable);
    long countByProjectIdAndRoleNameAndToolNameAndEventTypeAndTimestampAfter(
            String projectId, String roleName, String toolName, String eventType, Instant after);
}
