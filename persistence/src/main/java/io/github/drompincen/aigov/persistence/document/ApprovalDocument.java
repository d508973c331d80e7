package io.github.drompincen.aigov.persistence.document;

import io.github.drompincen.aigov.protocol.api.ApprovalStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "approvals")
@CompoundIndex(name = "grant_lookup", def = "{'projectId': 1, 'roleName': 1, 'toolName': 1, 'approver': 1, 'status': 1}")
public class ApprovalDocument {

    @Id
    private String approvalId;
    private String projectId;
    private String sessionId;
    private String roleName;
    private String toolName;
    private String approver;
    private Map<String, Object> toolInput;
    private ApprovalStatus status;
    private Instant createdAt;
    private Instant respondedAt;
    private String respondedBy;

    public ApprovalDocument() {}

    public String getApprovalId() { return approvalId; }
    public void setApprovalId(String approvalId) { this.approvalId = approvalId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getRoleName() { return roleName; }
    public void setRoleName(String roleName) { this.roleName = roleName; }

    public String getToolName() { return toolName; }
    public void setToolName(String toolName) { this.toolName = toolName; }

    public String getApprover() { return approver; }
    public void setApprover(String approver) { this.approver = approver; }

    public Map<String, Object> getToolInput() { return toolInput; }
    public void setToolInput(Map<String, Object> toolInput) { this.toolInput = toolInput; }

    public ApprovalStatus getStatus() { return status; }
    public void setStatus(ApprovalStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getRespondedAt() { return respondedAt; }
    public void setRespondedAt(Instant respondedAt) { this.respondedAt = respondedAt; }

    public String getRespondedBy() { return respondedBy; }
    public void setRespondedBy(String respondedBy) { this.respondedBy = respondedBy; }
}
