package io.github.drompincen.aigov.persistence.document;

import io.github.drompincen.aigov.protocol.api.DecisionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A logged decision. Only {@code relatedDecisions} may change after creation.
 */
@Document(collection = "decisions")
@CompoundIndex(name = "project_number", def = "{'projectId': 1, 'decisionNumber': 1}", unique = true)
public class DecisionDocument {

    @Id
    private String id;
    private int decisionNumber;
    @Indexed
    private String projectId;
    private String title;
    private LocalDate date;
    private DecisionStatus status;
    private String decisionMaker;
    private String decision;
    private String reasoning;
    private String considerations;
    private String uncertainties;
    private String reversibility;
    private String wouldChangeIf;
    private List<Double> embedding;
    private List<String> relatedDecisions = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private Instant createdAt;

    public DecisionDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public int getDecisionNumber() { return decisionNumber; }
    public void setDecisionNumber(int decisionNumber) { this.decisionNumber = decisionNumber; }

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public DecisionStatus getStatus() { return status; }
    public void setStatus(DecisionStatus status) { this.status = status; }

    public String getDecisionMaker() { return decisionMaker; }
    public void setDecisionMaker(String decisionMaker) { this.decisionMaker = decisionMaker; }

    public String getDecision() { return decision; }
    public void setDecision(String decision) { this.decision = decision; }

    public String getReasoning() { return reasoning; }
    public void setReasoning(String reasoning) { this.reasoning = reasoning; }

    public String getConsiderations() { return considerations; }
    public void setConsiderations(String considerations) { this.considerations = considerations; }

    public String getUncertainties() { return uncertainties; }
    public void setUncertainties(String uncertainties) { this.uncertainties = uncertainties; }

    public String getReversibility() { return reversibility; }
    public void setReversibility(String reversibility) { this.reversibility = reversibility; }

    public String getWouldChangeIf() { return wouldChangeIf; }
    public void setWouldChangeIf(String wouldChangeIf) { this.wouldChangeIf = wouldChangeIf; }

    public List<Double> getEmbedding() { return embedding; }
    public void setEmbedding(List<Double> embedding) { this.embedding = embedding; }

    public List<String> getRelatedDecisions() { return relatedDecisions; }
    public void setRelatedDecisions(List<String> relatedDecisions) { this.relatedDecisions = relatedDecisions; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
