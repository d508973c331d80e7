package io.github.drompincen.aigov.runtime.hooks;

import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import io.github.drompincen.aigov.protocol.api.TrustLevel;
import io.github.drompincen.aigov.runtime.audit.AuditEventType;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import io.github.drompincen.aigov.runtime.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final gate of a session. Every significant action performed needs at least one decision logged
 * in the session; otherwise the session is marked {@code blocked} instead of {@code completed}.
 */
@Component
public class StopHook {

    private static final Logger log = LoggerFactory.getLogger(StopHook.class);

    private final SessionService sessionService;
    private final AuditService auditService;

    public StopHook(SessionService sessionService, AuditService auditService) {
        this.sessionService = sessionService;
        this.auditService = auditService;
    }

    public StopHookResult validate(SessionDocument session, GovernanceRequest request, RoleDefinition role,
                                   List<String> actionsPerformed, List<String> decisionsLogged) {
        List<String> missing = new ArrayList<>();
        for (String action : actionsPerformed) {
            if (role.isSignificant(action) && decisionsLogged.isEmpty() && !missing.contains(action)) {
                missing.add(action);
            }
        }
        AuditService.AuditScope scope = SessionService.scopeOf(session, request);

        if (!missing.isEmpty()) {
            String reason = "Cannot complete session: significant actions were not properly logged";
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("missingDecisions", missing);
            details.put("role", role.name());
            auditService.record(AuditEventType.SESSION_COMPLETION_BLOCKED, scope,
                    "Session blocked due to missing decision logging", details);
            sessionService.finish(session.getSessionId(), SessionStatus.BLOCKED, reason);
            log.warn("Session {} blocked: no decision logged for {}", session.getSessionId(), missing);
            return new StopHookResult(false, reason, missing);
        }

        sessionService.finish(session.getSessionId(), SessionStatus.COMPLETED, null);
        auditService.record(AuditEventType.SESSION_COMPLETED, scope, "Session completed successfully",
                Map.of("role", role.name(), "decisionsLogged", decisionsLogged.size()));
        log.info("Session {} completed with {} decisions", session.getSessionId(), decisionsLogged.size());
        return StopHookResult.complete();
    }

    /**
     * Unconditional completion used when an invocation cannot finish normally.
     */
    public void forceComplete(SessionDocument session, SessionStatus status, String reason) {
        sessionService.finish(session.getSessionId(), status, reason);
        auditService.record(AuditEventType.SESSION_FORCE_COMPLETED,
                new AuditService.AuditScope(session.getProjectId(), session.getSessionId(), "system",
                        session.getRoleName(), null, TrustLevel.ANONYMOUS),
                "Session force completed: " + status.name().toLowerCase(),
                Map.of("reason", reason != null ? reason : ""));
        log.warn("Session {} force completed as {}: {}", session.getSessionId(), status, reason);
    }
}
