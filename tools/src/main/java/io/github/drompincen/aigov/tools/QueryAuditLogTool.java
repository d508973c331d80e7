package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.AuditEntryDocument;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.List;
import java.util.stream.Collectors;

public class QueryAuditLogTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_LIMIT = 50;
    private AuditService auditService;

    @Override public String name() { return "query_audit_log"; }
    @Override public String description() { return "Query the audit log of a project by event type or session"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("project_id").put("type", "string");
        props.putObject("event_type").put("type", "string").put("description", "e.g. tool_use_blocked (optional)");
        props.putObject("session_id").put("type", "string").put("description", "Only entries of this session (optional)");
        props.putObject("limit").put("type", "integer").put("description", "Max entries (default 50)");
        return schema;
    }

    public void setAuditService(AuditService auditService) {
        this.auditService = auditService;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (auditService == null) return ToolResult.failure("Audit log not available");
        String projectId = ToolInputs.projectId(ctx, input);
        if (projectId == null) return ToolResult.failure("'project_id' is required");
        String eventType = ToolInputs.text(input, "event_type");
        String sessionId = ToolInputs.text(input, "session_id");
        int limit = Math.max(1, input.path("limit").asInt(DEFAULT_LIMIT));

        List<AuditEntryDocument> entries;
        if (sessionId != null) {
            entries = auditService.forSession(sessionId).stream()
                    .filter(e -> projectId.equals(e.getProjectId()))
                    .filter(e -> eventType == null || eventType.equals(e.getEventType()))
                    .limit(limit)
                    .collect(Collectors.toList());
        } else {
            entries = auditService.forProject(projectId, eventType, limit);
        }

        ArrayNode arr = MAPPER.createArrayNode();
        entries.forEach(e -> arr.add(TraceJson.audit(e)));
        ObjectNode result = MAPPER.createObjectNode();
        result.set("entries", arr);
        result.put("count", entries.size());
        return ToolResult.success(result);
    }
}
