package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.runtime.developer.DeveloperSessionService;
import io.github.drompincen.aigov.runtime.tools.*;

public class DeveloperGetSessionTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private DeveloperSessionService developerSessionService;

    @Override public String name() { return "developer_get_session"; }
    @Override public String description() { return "Show a developer session and its latest result"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("session_id").put("type", "string");
        schema.putArray("required").add("session_id");
        return schema;
    }

    public void setDeveloperSessionService(DeveloperSessionService developerSessionService) {
        this.developerSessionService = developerSessionService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (developerSessionService == null) return ToolResult.failure("Developer sessions not available");
        String sessionId = ToolInputs.text(input, "session_id");
        if (sessionId == null) return ToolResult.failure("'session_id' is required");
        return developerSessionService.get(sessionId)
                .map(doc -> ToolResult.success(DeveloperInvokeTool.toJson(doc, true)))
                .orElseGet(() -> ToolResult.failure("Developer session not found: " + sessionId));
    }
}
