package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.DeveloperSessionDocument;
import io.github.drompincen.aigov.runtime.developer.DeveloperSessionService;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.Optional;

public class DeveloperResumeTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private DeveloperSessionService developerSessionService;

    @Override public String name() { return "developer_resume"; }
    @Override public String description() { return "Continue a developer session with follow-up instructions"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("session_id").put("type", "string");
        props.putObject("prompt").put("type", "string");
        props.putObject("max_turns").put("type", "integer");
        schema.putArray("required").add("session_id").add("prompt");
        return schema;
    }

    public void setDeveloperSessionService(DeveloperSessionService developerSessionService) {
        this.developerSessionService = developerSessionService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (developerSessionService == null) return ToolResult.failure("Developer sessions not available");
        String sessionId = ToolInputs.text(input, "session_id");
        String prompt = ToolInputs.text(input, "prompt");
        if (sessionId == null) return ToolResult.failure("'session_id' is required");
        if (prompt == null) return ToolResult.failure("'prompt' is required");

        Optional<DeveloperSessionDocument> existing = developerSessionService.get(sessionId);
        if (existing.isEmpty()) return ToolResult.failure("Developer session not found: " + sessionId);
        if (!DeveloperSessionService.canResume(existing.get())) {
            return ToolResult.failure("Developer session " + sessionId + " failed and cannot be resumed");
        }

        Integer maxTurns = input.hasNonNull("max_turns") ? input.get("max_turns").asInt() : null;
        return developerSessionService.resume(sessionId, prompt, maxTurns)
                .map(doc -> ToolResult.success(DeveloperInvokeTool.toJson(doc, true)))
                .orElseGet(() -> ToolResult.failure("Developer session not found: " + sessionId));
    }
}
