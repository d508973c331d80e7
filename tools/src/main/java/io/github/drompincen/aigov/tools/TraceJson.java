package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.AuditEntryDocument;
import io.github.drompincen.aigov.persistence.document.LlmInteractionDocument;
import io.github.drompincen.aigov.persistence.document.SessionDocument;

import java.time.Instant;

/**
 * JSON views of session, audit and LLM records for the observability tools.
 */
final class TraceJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TraceJson() {}

    static ObjectNode sessionSummary(SessionDocument s) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("session_id", s.getSessionId());
        n.put("project_id", s.getProjectId());
        n.put("role", s.getRoleName());
        n.put("status", s.getStatus() != null ? s.getStatus().name().toLowerCase() : null);
        n.put("started_at", iso(s.getStartedAt()));
        n.put("ended_at", iso(s.getEndedAt()));
        n.put("tool_uses", s.getToolUses().size());
        n.put("decisions_logged", s.getDecisionsLogged().size());
        n.put("depth", s.getDepth());
        n.put("parent_session_id", s.getParentSessionId());
        n.put("failure_reason", s.getFailureReason());
        if (s.getRequest() != null) {
            n.put("intent", s.getRequest().getIntent());
            n.put("identity", s.getRequest().getIdentity());
            n.put("trust", s.getRequest().getTrust() != null ? s.getRequest().getTrust().name().toLowerCase() : null);
        }
        return n;
    }

    static ObjectNode sessionDetail(SessionDocument s) {
        ObjectNode n = sessionSummary(s);
        ArrayNode uses = n.putArray("tool_use_log");
        for (SessionDocument.ToolUse use : s.getToolUses()) {
            ObjectNode u = uses.addObject();
            u.put("timestamp", iso(use.getTimestamp()));
            u.put("tool", use.getToolName());
            u.set("input", MAPPER.valueToTree(use.getInput()));
            u.set("output", MAPPER.valueToTree(use.getOutput()));
            u.put("error", use.getError());
            u.put("blocked", use.isBlocked());
            u.put("block_reason", use.getBlockReason());
        }
        ArrayNode decisions = n.putArray("decision_ids");
        s.getDecisionsLogged().forEach(decisions::add);
        ArrayNode escalations = n.putArray("escalations");
        s.getEscalations().forEach(escalations::add);
        return n;
    }

    static ObjectNode audit(AuditEntryDocument e) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("id", e.getId());
        n.put("timestamp", iso(e.getTimestamp()));
        n.put("event_type", e.getEventType());
        n.put("session_id", e.getSessionId());
        n.put("actor", e.getActor());
        n.put("action", e.getAction());
        n.put("role", e.getRoleName());
        n.put("tool", e.getToolName());
        n.put("trust", e.getTrustLevel() != null ? e.getTrustLevel().name().toLowerCase() : null);
        n.set("details", MAPPER.valueToTree(e.getDetails()));
        return n;
    }

    static ObjectNode llm(LlmInteractionDocument i) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("timestamp", iso(i.getTimestamp()));
        n.put("provider", i.getProvider());
        n.put("model", i.getModel());
        n.put("messages", i.getMessageCount());
        n.put("prompt_tokens", i.getPromptTokens());
        n.put("completion_tokens", i.getCompletionTokens());
        n.put("duration_ms", i.getDurationMs());
        n.put("success", i.isSuccess());
        n.put("stop_reason", i.getStopReason());
        n.put("error", i.getErrorMessage());
        return n;
    }

    static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
