package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.ChallengeDocument;
import io.github.drompincen.aigov.persistence.repository.ChallengeRepository;
import io.github.drompincen.aigov.persistence.repository.DecisionRepository;
import io.github.drompincen.aigov.protocol.api.ChallengeStatus;
import io.github.drompincen.aigov.runtime.tools.*;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

public class SubmitChallengeTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private ChallengeRepository challengeRepository;
    private DecisionRepository decisionRepository;
    private Clock clock = Clock.systemUTC();

    @Override public String name() { return "submit_challenge"; }
    @Override public String description() {
        return "Challenge a logged decision with an argument and optional evidence. The challenge stays pending until a maintainer responds.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("decision_id").put("type", "string").put("description", "Decision being challenged");
        props.putObject("project_id").put("type", "string");
        props.putObject("submitted_by").put("type", "string").put("description", "Who is challenging");
        props.putObject("argument").put("type", "string").put("description", "Why the decision should change");
        props.putObject("evidence").put("type", "string").put("description", "Supporting evidence (optional)");
        schema.putArray("required").add("decision_id").add("submitted_by").add("argument");
        return schema;
    }

    public void setChallengeRepository(ChallengeRepository challengeRepository) {
        this.challengeRepository = challengeRepository;
    }

    public void setDecisionRepository(DecisionRepository decisionRepository) {
        this.decisionRepository = decisionRepository;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (challengeRepository == null) return ToolResult.failure("Challenge repository not available");
        String decisionId = ToolInputs.text(input, "decision_id");
        String projectId = ToolInputs.projectId(ctx, input);
        String submittedBy = ToolInputs.actor(ctx, input, "submitted_by");
        String argument = ToolInputs.text(input, "argument");
        if (decisionId == null) return ToolResult.failure("'decision_id' is required");
        if (projectId == null) return ToolResult.failure("'project_id' is required");
        if (submittedBy == null) return ToolResult.failure("'submitted_by' is required");
        if (argument == null) return ToolResult.failure("'argument' is required");
        if (decisionRepository != null && decisionRepository.findById(decisionId).isEmpty()) {
            return ToolResult.failure("Decision not found: " + decisionId);
        }

        Instant now = clock.instant();
        ChallengeDocument doc = new ChallengeDocument();
        doc.setChallengeId(UUID.randomUUID().toString());
        doc.setDecisionId(decisionId);
        doc.setProjectId(projectId);
        doc.setSubmittedBy(submittedBy);
        doc.setSubmittedAt(now);
        doc.setStatus(ChallengeStatus.PENDING);
        doc.setArgument(argument);
        doc.setEvidence(ToolInputs.text(input, "evidence"));
        doc.setUpdatedAt(now);
        challengeRepository.save(doc);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("challenge_id", doc.getChallengeId());
        result.put("message", "Challenge submitted successfully");
        return ToolResult.success(result);
    }

    static ObjectNode toJson(ChallengeDocument c) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("id", c.getChallengeId());
        n.put("decision_id", c.getDecisionId());
        n.put("project_id", c.getProjectId());
        n.put("submitted_by", c.getSubmittedBy());
        n.put("submitted_at", c.getSubmittedAt() != null ? c.getSubmittedAt().toString() : null);
        n.put("status", c.getStatus() != null ? c.getStatus().name().toLowerCase() : null);
        n.put("argument", c.getArgument());
        n.put("evidence", c.getEvidence());
        n.put("responded_by", c.getRespondedBy());
        n.put("responded_at", c.getRespondedAt() != null ? c.getRespondedAt().toString() : null);
        n.put("response", c.getResponse());
        n.put("outcome", c.getOutcome());
        return n;
    }
}
