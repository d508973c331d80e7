package io.github.drompincen.aigov.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A delegated-development session run by the external coding CLI. The id is the CLI's own
 * session id so it can be resumed.
 */
@Document(collection = "developer_sessions")
public class DeveloperSessionDocument {

    @Id
    private String sessionId;
    @Indexed
    private String projectId;
    private String governanceSessionId;
    private String prompt;
    private String workingDirectory;
    private String status;
    private String result;
    private int numTurns;
    private int invocations;
    private Instant createdAt;
    @Indexed(direction = org.springframework.data.mongodb.core.index.IndexDirection.DESCENDING)
    private Instant updatedAt;

    public DeveloperSessionDocument() {}

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getGovernanceSessionId() { return governanceSessionId; }
    public void setGovernanceSessionId(String governanceSessionId) { this.governanceSessionId = governanceSessionId; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getResult() { return result; }
    public void setResult(String result) { this.result = result; }

    public int getNumTurns() { return numTurns; }
    public void setNumTurns(int numTurns) { this.numTurns = numTurns; }

    public int getInvocations() { return invocations; }
    public void setInvocations(int invocations) { this.invocations = invocations; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
