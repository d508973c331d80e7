package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.ChallengeDocument;
import io.github.drompincen.aigov.protocol.api.ChallengeStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ChallengeRepository extends MongoRepository<ChallengeDocument, String> {
    List<ChallengeDocument> findByProjectIdOrderBySubmittedAtDesc(String projectId);
    List<ChallengeDocument> findByProjectIdAndStatusOrderBySubmittedAtDesc(String projectId, ChallengeStatus status);
    List<ChallengeDocument> findByDecisionId(String decisionId);
}
