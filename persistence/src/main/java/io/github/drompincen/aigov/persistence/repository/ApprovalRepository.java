package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.ApprovalDocument;
import io.github.drompincen.aigov.protocol.api.ApprovalStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ApprovalRepository extends MongoRepository<ApprovalDocument, String> {
    Optional<ApprovalDocument> findFirstByProjectIdAndRoleNameAndToolNameAndApproverAndStatus(
            String projectId, String roleName, String toolName, String approver, ApprovalStatus status);
    List<ApprovalDocument> findByProjectIdAndStatusOrderByCreatedAtDesc(String projectId, ApprovalStatus status);
    List<ApprovalDocument> findByProjectIdOrderByCreatedAtDesc(String projectId);
}
