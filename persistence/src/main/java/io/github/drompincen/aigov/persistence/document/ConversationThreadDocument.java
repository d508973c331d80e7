package io.github.drompincen.aigov.persistence.document;

import io.github.drompincen.aigov.protocol.api.ConversationStatus;
import io.github.drompincen.aigov.protocol.api.Participant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A persisted exchange between a fixed set of participants.
 * <p>
 * While the thread is active, {@code activeKey} holds {@code projectId|participantKey}. The unique
 * sparse index on it admits at most one active thread per participant set; resolving or staling
 * the thread clears the key.
 */
@Document(collection = "conversation_threads")
@CompoundIndex(name = "project_status_updated", def = "{'projectId': 1, 'status': 1, 'updatedAt': -1}")
public class ConversationThreadDocument {

    @Id
    private String threadId;
    private String projectId;
    private List<Participant> participants = new ArrayList<>();
    @Indexed
    private List<String> memberKeys = new ArrayList<>();
    private String participantKey;
    @Indexed(unique = true, sparse = true)
    private String activeKey;
    private ConversationStatus status;
    private String topic;
    private String resolution;
    private Instant createdAt;
    private Instant updatedAt;

    public ConversationThreadDocument() {}

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public List<Participant> getParticipants() { return participants; }
    public void setParticipants(List<Participant> participants) { this.participants = participants; }

    public List<String> getMemberKeys() { return memberKeys; }
    public void setMemberKeys(List<String> memberKeys) { this.memberKeys = memberKeys; }

    public String getParticipantKey() { return participantKey; }
    public void setParticipantKey(String participantKey) { this.participantKey = participantKey; }

    public String getActiveKey() { return activeKey; }
    public void setActiveKey(String activeKey) { this.activeKey = activeKey; }

    public ConversationStatus getStatus() { return status; }
    public void setStatus(ConversationStatus status) { this.status = status; }

    public String getTopic() { return topic; }
    public void setTopic(String topic) { this.topic = topic; }

    public String getResolution() { return resolution; }
    public void setResolution(String resolution) { this.resolution = resolution; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
