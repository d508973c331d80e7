package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.persistence.repository.SessionRepository;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import io.github.drompincen.aigov.runtime.tools.*;
import org.springframework.data.domain.PageRequest;

import java.util.List;
import java.util.stream.Collectors;

public class QuerySessionsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_LIMIT = 20;
    private SessionRepository sessionRepository;

    @Override public String name() { return "query_sessions"; }
    @Override public String description() { return "List recent agent sessions in a project, optionally by role and status"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("project_id").put("type", "string");
        props.putObject("role").put("type", "string").put("description", "Only sessions run by this role (optional)");
        ObjectNode status = props.putObject("status");
        status.put("type", "string");
        status.putArray("enum").add("active").add("completed").add("failed").add("blocked");
        props.putObject("limit").put("type", "integer").put("description", "Max sessions (default 20)");
        return schema;
    }

    public void setSessionRepository(SessionRepository sessionRepository) {
        this.sessionRepository = sessionRepository;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (sessionRepository == null) return ToolResult.failure("Session repository not available");
        String projectId = ToolInputs.projectId(ctx, input);
        if (projectId == null) return ToolResult.failure("'project_id' is required");
        String role = ToolInputs.text(input, "role");
        String statusStr = ToolInputs.text(input, "status");
        int limit = Math.max(1, input.path("limit").asInt(DEFAULT_LIMIT));

        SessionStatus status = null;
        if (statusStr != null) {
            try {
                status = SessionStatus.valueOf(statusStr.toUpperCase());
            } catch (IllegalArgumentException e) {
                return ToolResult.failure("Invalid status: " + statusStr);
            }
        }

        List<SessionDocument> sessions;
        if (role != null) {
            SessionStatus wanted = status;
            sessions = sessionRepository.findByProjectIdAndRoleNameOrderByStartedAtDesc(projectId, role, PageRequest.of(0, limit * 5))
                    .stream()
                    .filter(s -> wanted == null || s.getStatus() == wanted)
                    .limit(limit)
                    .collect(Collectors.toList());
        } else if (status != null) {
            sessions = sessionRepository.findByProjectIdAndStatusOrderByStartedAtDesc(projectId, status, PageRequest.of(0, limit));
        } else {
            sessions = sessionRepository.findByProjectIdOrderByStartedAtDesc(projectId, PageRequest.of(0, limit));
        }

        ArrayNode arr = MAPPER.createArrayNode();
        sessions.forEach(s -> arr.add(TraceJson.sessionSummary(s)));
        ObjectNode result = MAPPER.createObjectNode();
        result.set("sessions", arr);
        result.put("count", sessions.size());
        return ToolResult.success(result);
    }
}
