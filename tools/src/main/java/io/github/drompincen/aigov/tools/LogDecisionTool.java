package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import io.github.drompincen.aigov.runtime.decision.DecisionDraft;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.List;

/**
 * Explicit decision logging. The returned {@code decision_id} is what the post-tool hook records
 * against the session, so a role that logs its own decision never gets a synthesized one.
 */
public class LogDecisionTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private DecisionService decisionService;

    @Override public String name() { return "log_decision"; }
    @Override public String description() {
        return "Log a new governance decision. Should be used for all significant actions that require documented reasoning.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("project_id").put("type", "string");
        props.putObject("title").put("type", "string").put("description", "Brief title of the decision");
        props.putObject("decision").put("type", "string").put("description", "What was decided");
        props.putObject("reasoning").put("type", "string").put("description", "Why this decision was made");
        props.putObject("considerations").put("type", "string").put("description", "Factors considered (optional)");
        props.putObject("uncertainties").put("type", "string").put("description", "What remains uncertain (optional)");
        props.putObject("reversibility").put("type", "string").put("description", "How easily this can be reversed (optional)");
        props.putObject("would_change_if").put("type", "string")
                .put("description", "Conditions that would change this decision (optional)");
        props.putObject("decision_maker").put("type", "string").put("description", "Who made this decision");
        schema.putArray("required").add("title").add("decision").add("reasoning").add("decision_maker");
        return schema;
    }

    public void setDecisionService(DecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (decisionService == null) return ToolResult.failure("Decision service not available");
        String projectId = ToolInputs.projectId(ctx, input);
        String title = ToolInputs.text(input, "title");
        String decision = ToolInputs.text(input, "decision");
        String reasoning = ToolInputs.text(input, "reasoning");
        String maker = ToolInputs.actor(ctx, input, "decision_maker");
        if (projectId == null) return ToolResult.failure("'project_id' is required");
        if (title == null) return ToolResult.failure("'title' is required");
        if (decision == null) return ToolResult.failure("'decision' is required");
        if (reasoning == null) return ToolResult.failure("'reasoning' is required");
        if (maker == null) return ToolResult.failure("'decision_maker' is required");

        DecisionDraft draft = new DecisionDraft(title, decision, reasoning,
                ToolInputs.text(input, "considerations"),
                ToolInputs.text(input, "uncertainties"),
                ToolInputs.text(input, "reversibility"),
                ToolInputs.text(input, "would_change_if"),
                maker,
                ctx != null && ctx.roleName() != null ? List.of(name(), ctx.roleName()) : List.of(name()));
        DecisionDocument doc = decisionService.log(projectId, draft);

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("decision_id", doc.getId());
        result.put("decision_number", doc.getDecisionNumber());
        result.put("message", "Decision #" + doc.getDecisionNumber() + " logged");
        return ToolResult.success(result);
    }
}
