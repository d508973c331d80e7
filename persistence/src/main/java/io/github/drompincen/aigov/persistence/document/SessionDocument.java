package io.github.drompincen.aigov.persistence.document;

import io.github.drompincen.aigov.protocol.api.Channel;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import io.github.drompincen.aigov.protocol.api.TrustLevel;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One invocation of one role against one request. The tool-use log and the decision list are
 * append-only; see {@code SessionRepositoryCustom}.
 */
@Document(collection = "sessions")
@CompoundIndex(name = "project_started", def = "{'projectId': 1, 'startedAt': -1}")
public class SessionDocument {

    @Id
    private String sessionId;
    private String projectId;
    private String roleName;
    private RequestSnapshot request;
    @Indexed
    private SessionStatus status;
    private Instant startedAt;
    private Instant endedAt;
    private List<ToolUse> toolUses = new ArrayList<>();
    private List<String> decisionsLogged = new ArrayList<>();
    private List<String> escalations = new ArrayList<>();
    private int depth;
    private String parentSessionId;
    private String failureReason;

    /** Copy of the originating request as it was when the session started. */
    public static class RequestSnapshot {
        private String requestId;
        private Instant timestamp;
        private TrustLevel trust;
        private Channel channel;
        private String identity;
        private String intent;
        private Map<String, Object> payload;

        public RequestSnapshot() {}

        public String getRequestId() { return requestId; }
        public void setRequestId(String requestId) { this.requestId = requestId; }

        public Instant getTimestamp() { return timestamp; }
        public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

        public TrustLevel getTrust() { return trust; }
        public void setTrust(TrustLevel trust) { this.trust = trust; }

        public Channel getChannel() { return channel; }
        public void setChannel(Channel channel) { this.channel = channel; }

        public String getIdentity() { return identity; }
        public void setIdentity(String identity) { this.identity = identity; }

        public String getIntent() { return intent; }
        public void setIntent(String intent) { this.intent = intent; }

        public Map<String, Object> getPayload() { return payload; }
        public void setPayload(Map<String, Object> payload) { this.payload = payload; }
    }

    public static class ToolUse {
        private Instant timestamp;
        private String toolName;
        private Map<String, Object> input;
        private Object output;
        private String error;
        private boolean blocked;
        private String blockReason;

        public ToolUse() {}

        public Instant getTimestamp() { return timestamp; }
        public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

        public String getToolName() { return toolName; }
        public void setToolName(String toolName) { this.toolName = toolName; }

        public Map<String, Object> getInput() { return input; }
        public void setInput(Map<String, Object> input) { this.input = input; }

        public Object getOutput() { return output; }
        public void setOutput(Object output) { this.output = output; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }

        public boolean isBlocked() { return blocked; }
        public void setBlocked(boolean blocked) { this.blocked = blocked; }

        public String getBlockReason() { return blockReason; }
        public void setBlockReason(String blockReason) { this.blockReason = blockReason; }
    }

    public SessionDocument() {}

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getRoleName() { return roleName; }
    public void setRoleName(String roleName) { this.roleName = roleName; }

    public RequestSnapshot getRequest() { return request; }
    public void setRequest(RequestSnapshot request) { this.request = request; }

    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public List<ToolUse> getToolUses() { return toolUses; }
    public void setToolUses(List<ToolUse> toolUses) { this.toolUses = toolUses; }

    public List<String> getDecisionsLogged() { return decisionsLogged; }
    public void setDecisionsLogged(List<String> decisionsLogged) { this.decisionsLogged = decisionsLogged; }

    public List<String> getEscalations() { return escalations; }
    public void setEscalations(List<String> escalations) { this.escalations = escalations; }

    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }

    public String getParentSessionId() { return parentSessionId; }
    public void setParentSessionId(String parentSessionId) { this.parentSessionId = parentSessionId; }

    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }
}
