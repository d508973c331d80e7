package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.DeveloperSessionDocument;
import io.github.drompincen.aigov.runtime.developer.DeveloperSessionService;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.List;

public class DeveloperListSessionsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_LIMIT = 10;
    private DeveloperSessionService developerSessionService;

    @Override public String name() { return "developer_list_sessions"; }
    @Override public String description() { return "List recent developer sessions, newest first"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        ObjectNode status = props.putObject("status");
        status.put("type", "string");
        status.putArray("enum").add("active").add("completed").add("failed").add("all");
        props.putObject("limit").put("type", "integer").put("description", "Max sessions (default 10)");
        return schema;
    }

    public void setDeveloperSessionService(DeveloperSessionService developerSessionService) {
        this.developerSessionService = developerSessionService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (developerSessionService == null) return ToolResult.failure("Developer sessions not available");
        String status = ToolInputs.text(input, "status");
        int limit = input.path("limit").asInt(DEFAULT_LIMIT);

        List<DeveloperSessionDocument> sessions = developerSessionService.list(status, limit);
        ArrayNode arr = MAPPER.createArrayNode();
        sessions.forEach(s -> arr.add(DeveloperInvokeTool.toJson(s, false)));

        ObjectNode result = MAPPER.createObjectNode();
        result.set("sessions", arr);
        result.put("count", sessions.size());
        return ToolResult.success(result);
    }
}
