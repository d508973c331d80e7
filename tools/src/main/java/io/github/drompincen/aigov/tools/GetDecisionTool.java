package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.Optional;

public class GetDecisionTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private DecisionService decisionService;

    @Override public String name() { return "get_decision"; }
    @Override public String description() { return "Get a specific decision by ID"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("decision_id").put("type", "string");
        schema.putArray("required").add("decision_id");
        return schema;
    }

    public void setDecisionService(DecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (decisionService == null) return ToolResult.failure("Decision service not available");
        String decisionId = ToolInputs.text(input, "decision_id");
        if (decisionId == null) return ToolResult.failure("'decision_id' is required");

        Optional<DecisionDocument> found = decisionService.get(decisionId)
                .filter(d -> ctx == null || ctx.projectId() == null || ctx.projectId().equals(d.getProjectId()));
        if (found.isEmpty()) return ToolResult.failure("Decision not found: " + decisionId);
        return ToolResult.success(toJson(found.get()));
    }

    static ObjectNode toJson(DecisionDocument d) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("id", d.getId());
        n.put("decision_number", d.getDecisionNumber());
        n.put("project_id", d.getProjectId());
        n.put("title", d.getTitle());
        n.put("date", d.getDate() != null ? d.getDate().toString() : null);
        n.put("status", d.getStatus() != null ? d.getStatus().name().toLowerCase() : null);
        n.put("decision_maker", d.getDecisionMaker());
        n.put("decision", d.getDecision());
        n.put("reasoning", d.getReasoning());
        n.put("considerations", d.getConsiderations());
        n.put("uncertainties", d.getUncertainties());
        n.put("reversibility", d.getReversibility());
        n.put("would_change_if", d.getWouldChangeIf());
        ArrayNode related = n.putArray("related_decisions");
        d.getRelatedDecisions().forEach(related::add);
        ArrayNode tags = n.putArray("tags");
        d.getTags().forEach(tags::add);
        return n;
    }
}
