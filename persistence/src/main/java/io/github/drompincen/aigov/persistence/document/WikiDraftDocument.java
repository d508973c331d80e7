package io.github.drompincen.aigov.persistence.document;

import io.github.drompincen.aigov.protocol.api.WikiDraftStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "wiki_drafts")
@CompoundIndex(name = "project_status", def = "{'projectId': 1, 'status': 1}")
@CompoundIndex(name = "project_page", def = "{'projectId': 1, 'pagePath': 1}")
public class WikiDraftDocument {

    @Id
    private String draftId;
    private String projectId;
    private DraftType type;
    private String pagePath;
    private String proposedContent;
    private String originalContent;
    private String proposedBy;
    private Instant proposedAt;
    private String editSummary;
    private WikiDraftStatus status;
    private String reviewedBy;
    private Instant reviewedAt;
    private String feedback;

    public enum DraftType { NEW_PAGE, EDIT_PAGE }

    public WikiDraftDocument() {}

    public String getDraftId() { return draftId; }
    public void setDraftId(String draftId) { this.draftId = draftId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public DraftType getType() { return type; }
    public void setType(DraftType type) { this.type = type; }

    public String getPagePath() { return pagePath; }
    public void setPagePath(String pagePath) { this.pagePath = pagePath; }

    public String getProposedContent() { return proposedContent; }
    public void setProposedContent(String proposedContent) { this.proposedContent = proposedContent; }

    public String getOriginalContent() { return originalContent; }
    public void setOriginalContent(String originalContent) { this.originalContent = originalContent; }

    public String getProposedBy() { return proposedBy; }
    public void setProposedBy(String proposedBy) { this.proposedBy = proposedBy; }

    public Instant getProposedAt() { return proposedAt; }
    public void setProposedAt(Instant proposedAt) { this.proposedAt = proposedAt; }

    public String getEditSummary() { return editSummary; }
    public void setEditSummary(String editSummary) { this.editSummary = editSummary; }

    public WikiDraftStatus getStatus() { return status; }
    public void setStatus(WikiDraftStatus status) { this.status = status; }

    public String getReviewedBy() { return reviewedBy; }
    public void setReviewedBy(String reviewedBy) { this.reviewedBy = reviewedBy; }

    public Instant getReviewedAt() { return reviewedAt; }
    public void setReviewedAt(Instant reviewedAt) { this.reviewedAt = reviewedAt; }

    public String getFeedback() { return feedback; }
    public void setFeedback(String feedback) { this.feedback = feedback; }
}
