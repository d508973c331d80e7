package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.persistence.repository.LlmInteractionRepository;
import io.github.drompincen.aigov.persistence.repository.SessionRepository;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import io.github.drompincen.aigov.runtime.tools.*;

import java.util.Optional;

/**
 * Everything recorded for one session: the session itself with its tool-use log, the audit entries
 * in order, the LLM calls, and the ids of sessions it spawned through conversations.
 */
public class GetSessionTraceTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private SessionRepository sessionRepository;
    private AuditService auditService;
    private LlmInteractionRepository llmInteractionRepository;

    @Override public String name() { return "get_session_trace"; }
    @Override public String description() { return "Show the full trace of a session: tool uses, audit events and LLM calls"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("session_id").put("type", "string");
        schema.putArray("required").add("session_id");
        return schema;
    }

    public void setSessionRepository(SessionRepository sessionRepository) {
        this.sessionRepository = sessionRepository;
    }

    public void setAuditService(AuditService auditService) {
        this.auditService = auditService;
    }

    public void setLlmInteractionRepository(LlmInteractionRepository llmInteractionRepository) {
        this.llmInteractionRepository = llmInteractionRepository;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (sessionRepository == null) return ToolResult.failure("Session repository not available");
        String sessionId = ToolInputs.text(input, "session_id");
        if (sessionId == null) return ToolResult.failure("'session_id' is required");

        Optional<SessionDocument> found = sessionRepository.findById(sessionId);
        if (found.isEmpty()) return ToolResult.failure("Session not found: " + sessionId);
        SessionDocument session = found.get();
        if (ctx != null && ctx.projectId() != null && !ctx.projectId().equals(session.getProjectId())) {
            return ToolResult.failure("Session not found: " + sessionId);
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.set("session", TraceJson.sessionDetail(session));

        ArrayNode audit = result.putArray("audit");
        if (auditService != null) {
            auditService.forSession(sessionId).forEach(e -> audit.add(TraceJson.audit(e)));
        }
        ArrayNode llm = result.putArray("llm_interactions");
        if (llmInteractionRepository != null) {
            llmInteractionRepository.findBySessionIdOrderByTimestampAsc(sessionId).forEach(i -> llm.add(TraceJson.llm(i)));
        }
        ArrayNode children = result.putArray("child_sessions");
        sessionRepository.findByParentSessionId(sessionId).forEach(c -> children.add(c.getSessionId()));
        return ToolResult.success(result);
    }
}
