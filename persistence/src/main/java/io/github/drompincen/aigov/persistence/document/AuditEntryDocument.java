package io.github.drompincen.aigov.persistence.document;

import io.github.drompincen.aigov.protocol.api.TrustLevel;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "audit_log")
@CompoundIndex(name = "project_time", def = "{'projectId': 1, 'timestamp': -1}")
@CompoundIndex(name = "rate_window", def = "{'projectId': 1, 'roleName': 1, 'toolName': 1, 'eventType': 1, 'timestamp': -1}")
public class AuditEntryDocument {

    @Id
    private String id;
    private Instant timestamp;
    private String projectId;
    @Indexed
    private String sessionId;
    private String eventType;
    private String actor;
    private String action;
    private String roleName;
    private String toolName;
    private Map<String, Object> details;
    private TrustLevel trustLevel;

    public AuditEntryDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }

    public String getActor() { return actor; }
    public void setActor(String actor) { this.actor = actor; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getRoleName() { return roleName; }
    public void setRoleName(String roleName) { this.roleName = roleName; }

    public String getToolName() { return toolName; }
    public void setToolName(String toolName) { this.toolName = toolName; }

    public Map<String, Object> getDetails() { return details; }
    public void setDetails(Map<String, Object> details) { this.details = details; }

    public TrustLevel getTrustLevel() { return trustLevel; }
    public void setTrustLevel(TrustLevel trustLevel) { this.trustLevel = trustLevel; }
}
