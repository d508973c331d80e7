package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SessionRepository extends MongoRepository<SessionDocument, String>, SessionRepositoryCustom {
    List<SessionDocument> findByProjectIdOrderByStartedAtDesc(String projectId, Pageable pageable);
    List<SessionDocument> findByProjectIdAndStatusOrderByStartedAtDesc(String projectId, SessionStatus status, Pageable pageable);
    List<SessionDocument> findByProjectIdAndRoleNameOrderByStartedAtDesc(String projectId, String roleName, Pageable pageable);
    List<SessionDocument> findByParentSessionId(String parentSessionId);
}
