package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface DecisionRepository extends MongoRepository<DecisionDocument, String>, DecisionRepositoryCustom {
    List<DecisionDocument> findByProjectIdOrderByDecisionNumberDesc(String projectId, Pageable pageable);
    Optional<DecisionDocument> findByProjectIdAndDecisionNumber(String projectId, int decisionNumber);
    long countByProjectId(String projectId);
}
