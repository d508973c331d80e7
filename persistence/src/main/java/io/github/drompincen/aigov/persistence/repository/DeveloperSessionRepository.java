package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.DeveloperSessionDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DeveloperSessionRepository extends MongoRepository<DeveloperSessionDocument, String> {
    List<DeveloperSessionDocument> findAllByOrderByUpdatedAtDesc(Pageable pageable);
    List<DeveloperSessionDocument> findByProjectIdOrderByUpdatedAtDesc(String projectId, Pageable pageable);
}
