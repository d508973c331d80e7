package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import io.github.drompincen.aigov.persistence.repository.ScoredDecision;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.List;

public class SearchDecisionsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final int DEFAULT_LIMIT = 5;
    static final double DEFAULT_THRESHOLD = 0.7;

    private DecisionService decisionService;

    @Override public String name() { return "search_decisions"; }
    @Override public String description() {
        return "Search for decisions semantically similar to a query. Returns relevant past decisions that may provide precedent.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("project_id").put("type", "string").put("description", "Project to search within");
        props.putObject("query").put("type", "string").put("description", "What you are looking for");
        props.putObject("limit").put("type", "integer").put("description", "Maximum number of results (default 5)");
        props.putObject("threshold").put("type", "number").put("description", "Minimum similarity (default 0.7)");
        schema.putArray("required").add("query");
        return schema;
    }

    public void setDecisionService(DecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (decisionService == null) return ToolResult.failure("Decision service not available");
        String projectId = ToolInputs.projectId(ctx, input);
        String query = ToolInputs.text(input, "query");
        if (projectId == null) return ToolResult.failure("'project_id' is required");
        if (query == null) return ToolResult.failure("'query' is required");

        int limit = input.path("limit").asInt(DEFAULT_LIMIT);
        double threshold = input.path("threshold").asDouble(DEFAULT_THRESHOLD);
        List<ScoredDecision> found = decisionService.search(projectId, query, Math.max(1, limit), threshold);

        ArrayNode results = MAPPER.createArrayNode();
        for (ScoredDecision scored : found) {
            DecisionDocument d = scored.decision();
            ObjectNode n = results.addObject();
            ObjectNode decision = n.putObject("decision");
            decision.put("id", d.getId());
            decision.put("number", d.getDecisionNumber());
            decision.put("title", d.getTitle());
            decision.put("date", d.getDate() != null ? d.getDate().toString() : null);
            decision.put("decision", d.getDecision());
            decision.put("reasoning", d.getReasoning());
            n.put("similarity", scored.similarity());
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.put("query", query);
        result.set("results", results);
        return ToolResult.success(result);
    }
}
