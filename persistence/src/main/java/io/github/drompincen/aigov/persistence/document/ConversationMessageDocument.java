package io.github.drompincen.aigov.persistence.document;

import io.github.drompincen.aigov.protocol.api.Participant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "conversation_messages")
@CompoundIndex(name = "conversation_seq", def = "{'conversationId': 1, 'seq': 1}", unique = true)
public class ConversationMessageDocument {

    @Id
    private String messageId;
    private String conversationId;
    private long seq;
    private Participant fromParticipant;
    private String content;
    private Instant timestamp;

    public ConversationMessageDocument() {}

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getConversationId() { return conversationId; }
    public void setConversationId(String conversationId) { this.conversationId = conversationId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public Participant getFromParticipant() { return fromParticipant; }
    public void setFromParticipant(Participant fromParticipant) { this.fromParticipant = fromParticipant; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
