package io.github.drompincen.aigov.runtime.approval;

import io.github.drompincen.aigov.persistence.document.ApprovalDocument;
import io.github.drompincen.aigov.persistence.repository.ApprovalRepository;
import io.github.drompincen.aigov.protocol.api.ApprovalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Approval grants backing the {@code approval_required} constraint. A grant is single-use: it is
 * consumed by the first tool call it admits.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final ApprovalRepository approvalRepository;
    private final Clock clock;

    public ApprovalService(ApprovalRepository approvalRepository, Clock clock) {
        this.approvalRepository = approvalRepository;
        this.clock = clock;
    }

    public String createRequest(String projectId, String sessionId, String roleName, String toolName,
                                String approver, Map<String, Object> input) {
        ApprovalDocument doc = new ApprovalDocument();
        doc.setApprovalId(UUID.randomUUID().toString());
        doc.setProjectId(projectId);
        doc.setSessionId(sessionId);
        doc.setRoleName(roleName);
        doc.setToolName(toolName);
        doc.setApprover(approver);
        doc.setToolInput(input);
        doc.setStatus(ApprovalStatus.PENDING);
        doc.setCreatedAt(clock.instant());
        approvalRepository.save(doc);
        log.info("Created approval request {} for tool {} of role {} (approver {})",
                doc.getApprovalId(), toolName, roleName, approver);
        return doc.getApprovalId();
    }

    public boolean hasGrant(String projectId, String roleName, String toolName, String approver) {
        return approvalRepository.findFirstByProjectIdAndRoleNameAndToolNameAndApproverAndStatus(
                projectId, roleName, toolName, approver, ApprovalStatus.APPROVED).isPresent();
    }

    public boolean hasPendingRequest(String projectId, String roleName, String toolName, String approver) {
        return approvalRepository.findFirstByProjectIdAndRoleNameAndToolNameAndApproverAndStatus(
                projectId, roleName, toolName, approver, ApprovalStatus.PENDING).isPresent();
    }

    /**
     * Consumes a granted approval matching the call, if one exists.
     */
    public boolean consumeGrant(String projectId, String roleName, String toolName, String approver) {
        Optional<ApprovalDocument> grant = approvalRepository
                .findFirstByProjectIdAndRoleNameAndToolNameAndApproverAndStatus(
                        projectId, roleName, toolName, approver, ApprovalStatus.APPROVED);
        if (grant.isEmpty()) return false;
        ApprovalDocument doc = grant.get();
        doc.setStatus(ApprovalStatus.CONSUMED);
        approvalRepository.save(doc);
        log.info("Consumed approval {} for tool {}", doc.getApprovalId(), toolName);
        return true;
    }

    public Optional<ApprovalDocument> respond(String approvalId, boolean granted, String respondedBy) {
        return approvalRepository.findById(approvalId)
                .filter(doc -> doc.getStatus() == ApprovalStatus.PENDING)
                .map(doc -> {
                    doc.setStatus(granted ? ApprovalStatus.APPROVED : ApprovalStatus.DENIED);
                    doc.setRespondedAt(clock.instant());
                    doc.setRespondedBy(respondedBy);
                    approvalRepository.save(doc);
                    log.info("Approval {} responded with {} by {}", approvalId, doc.getStatus(), respondedBy);
                    return doc;
                });
    }

    public List<ApprovalDocument> list(String projectId, ApprovalStatus status) {
        if (status != null) {
            return approvalRepository.findByProjectIdAndStatusOrderByCreatedAtDesc(projectId, status);
        }
        return approvalRepository.findByProjectIdOrderByCreatedAtDesc(projectId);
    }
}
