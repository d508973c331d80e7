package io.github.drompincen.aigov.runtime.hooks;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.protocol.api.Constraint;
import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;
import io.github.drompincen.aigov.runtime.audit.AuditEventType;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import io.github.drompincen.aigov.runtime.hooks.constraint.ConstraintCheck;
import io.github.drompincen.aigov.runtime.hooks.constraint.ConstraintEvaluators;
import io.github.drompincen.aigov.runtime.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gate run before every tool call. Checks, in order: deny list, allow list, then each hard
 * constraint in declaration order. Soft constraints never block. Once all hard constraints pass
 * they are admitted, which is when single-use approvals are consumed. Every attempt is audited before
 * the verdict is returned.
 */
@Component
public class PreToolUseHook {

    private static final Logger log = LoggerFactory.getLogger(PreToolUseHook.class);

    private final AuditService auditService;
    private final SessionService sessionService;
    private final ConstraintEvaluators constraintEvaluators;

    public PreToolUseHook(AuditService auditService, SessionService sessionService,
                          ConstraintEvaluators constraintEvaluators) {
        this.auditService = auditService;
        this.sessionService = sessionService;
        this.constraintEvaluators = constraintEvaluators;
    }

    public PreToolUseResult validate(SessionDocument session, String toolName, JsonNode toolInput,
                                     GovernanceRequest request, RoleDefinition role) {
        AuditService.AuditScope scope = SessionService.scopeOf(session, request).withTool(toolName);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("toolName", toolName);
        details.put("toolInput", toolInput != null ? toolInput.toString() : null);
        details.put("trustLevel", request.trust().wireName());
        details.put("role", role.name());
        auditService.record(AuditEventType.TOOL_USE_ATTEMPT, scope, "Attempting to use tool: " + toolName, details);

        PreToolUseResult result = evaluate(session, toolName, toolInput, request, role);
        if (!result.allowed()) {
            auditService.record(AuditEventType.TOOL_USE_BLOCKED, scope, "Blocked tool: " + toolName,
                    Map.of("reason", result.reason()));
            SessionDocument.ToolUse use = new SessionDocument.ToolUse();
            use.setToolName(toolName);
            use.setInput(details);
            use.setBlocked(true);
            use.setBlockReason(result.reason());
            sessionService.recordToolUse(session.getSessionId(), use);
            log.info("Session {}: tool {} rejected: {}", session.getSessionId(), toolName, result.reason());
        }
        return result;
    }

    private PreToolUseResult evaluate(SessionDocument session, String toolName, JsonNode toolInput,
                                      GovernanceRequest request, RoleDefinition role) {
        if (role.tools().isDenied(toolName)) {
            return PreToolUseResult.reject("Tool \"" + toolName + "\" is explicitly denied for role " + role.name());
        }
        if (!role.tools().allowed().isEmpty() && !role.tools().allowed().contains(toolName)) {
            return PreToolUseResult.reject("Tool \"" + toolName + "\" is not in the allowed list for role " + role.name());
        }

        ConstraintCheck check = new ConstraintCheck(session.getSessionId(), request, role, toolName, toolInput);
        List<Constraint> applicable = role.getHardConstraints().stream()
                .filter(c -> c.appliesTo(toolName))
                .collect(Collectors.toList());
        for (Constraint constraint : applicable) {
            if (constraintEvaluators.isViolated(constraint, check)) {
                return PreToolUseResult.reject("Hard constraint violated: " + constraint.description());
            }
        }
        for (Constraint constraint : applicable) {
            if (!constraintEvaluators.admit(constraint, check)) {
                return PreToolUseResult.reject("Hard constraint violated: " + constraint.description());
            }
        }
        return PreToolUseResult.allow(role.isSignificant(toolName));
    }
}
