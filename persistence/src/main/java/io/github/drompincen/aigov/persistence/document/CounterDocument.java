package io.github.drompincen.aigov.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Monotonic sequence, incremented atomically with findAndModify.
 */
@Document(collection = "counters")
public class CounterDocument {

    @Id
    private String id;
    private long seq;

    public CounterDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }
}
