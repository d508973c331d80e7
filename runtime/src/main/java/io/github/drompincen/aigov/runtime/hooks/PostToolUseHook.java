package io.github.drompincen.aigov.runtime.hooks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;
import io.github.drompincen.aigov.runtime.audit.AuditEventType;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import io.github.drompincen.aigov.runtime.decision.DecisionDraft;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import io.github.drompincen.aigov.runtime.session.SessionService;
import io.github.drompincen.aigov.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs after every executed tool call: audits it, appends it to the session's tool-use log and,
 * for significant actions, logs a decision.
 */
@Component
public class PostToolUseHook {

    private static final Logger log = LoggerFactory.getLogger(PostToolUseHook.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String MISSING_REASONING = "Significant action performed without documented reasoning";

    private final AuditService auditService;
    private final SessionService sessionService;
    private final DecisionService decisionService;

    public PostToolUseHook(AuditService auditService, SessionService sessionService, DecisionService decisionService) {
        this.auditService = auditService;
        this.sessionService = sessionService;
        this.decisionService = decisionService;
    }

    public PostToolUseResult process(SessionDocument session, String toolName, JsonNode toolInput, ToolResult output,
                                     GovernanceRequest request, RoleDefinition role, boolean requiresDecisionLogging) {
        AuditService.AuditScope scope = SessionService.scopeOf(session, request).withTool(toolName);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("toolName", toolName);
        details.put("toolInput", toolInput != null ? toolInput.toString() : null);
        details.put("success", output.success());
        details.put("toolOutput", output.success() ? output.content() : output.error());
        details.put("trustLevel", request.trust().wireName());
        details.put("role", role.name());
        auditService.record(AuditEventType.TOOL_USE_COMPLETED, scope, "Completed tool: " + toolName, details);

        SessionDocument.ToolUse use = new SessionDocument.ToolUse();
        use.setToolName(toolName);
        use.setInput(toolInput != null ? MAPPER.convertValue(toolInput, Map.class) : null);
        use.setOutput(output.output() != null ? MAPPER.convertValue(output.output(), Object.class) : null);
        use.setError(output.error());
        sessionService.recordToolUse(session.getSessionId(), use);

        if (!output.success()) {
            return new PostToolUseResult(false, null, List.of());
        }

        String loggedId = output.output() != null ? output.output().path("decision_id").asText(null) : null;
        if (loggedId != null) {
            sessionService.recordDecision(session.getSessionId(), loggedId);
            auditService.record(AuditEventType.DECISION_LOGGED, scope, "Decision recorded by " + toolName,
                    Map.of("decisionId", loggedId));
            return new PostToolUseResult(true, loggedId, List.of());
        }

        if (!requiresDecisionLogging) {
            return new PostToolUseResult(false, null, List.of());
        }

        List<String> warnings = new ArrayList<>();
        DecisionDraft draft = extractDecision(toolName, toolInput, output.output())
                .withMakerAndTags(request.source().hasIdentity() ? request.source().identity() : role.name(),
                        List.of(toolName, role.name()));
        if (!draft.hasReasoning()) {
            warnings.add(MISSING_REASONING);
            log.warn("Session {}: significant action {} has no documented reasoning", session.getSessionId(), toolName);
            return new PostToolUseResult(false, null, warnings);
        }

        DecisionDocument decision = decisionService.log(session.getProjectId(), draft);
        sessionService.recordDecision(session.getSessionId(), decision.getId());
        auditService.record(AuditEventType.DECISION_LOGGED, scope,
                "Logged decision #" + decision.getDecisionNumber() + ": " + decision.getTitle(),
                Map.of("decisionId", decision.getId(), "decisionNumber", decision.getDecisionNumber()));
        return new PostToolUseResult(true, decision.getId(), warnings);
    }

    /**
     * Decision metadata returned by the tool itself wins; otherwise a minimal decision is synthesized
     * from the call.
     */
    static DecisionDraft extractDecision(String toolName, JsonNode toolInput, JsonNode toolOutput) {
        JsonNode meta = toolOutput != null ? toolOutput.path("decision") : null;
        if (meta != null && meta.isObject()) {
            return new DecisionDraft(
                    meta.path("title").asText(toolName + " execution"),
                    meta.path("decision").asText(null),
                    meta.path("reasoning").asText(null),
                    meta.path("considerations").asText(null),
                    meta.path("uncertainties").asText(null),
                    meta.path("reversibility").asText(null),
                    meta.path("would_change_if").asText(meta.path("wouldChangeIf").asText(null)),
                    meta.path("decision_maker").asText(null),
                    List.of());
        }
        return new DecisionDraft(
                toolName + " execution",
                "Executed " + toolName + " with parameters: " + (toolInput != null ? toolInput.toString() : "{}"),
                "No explicit reasoning provided",
                null, null, null, null, null, List.of());
    }
}
