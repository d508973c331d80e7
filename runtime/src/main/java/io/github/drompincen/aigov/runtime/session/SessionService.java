package io.github.drompincen.aigov.runtime.session;

import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.persistence.repository.SessionRepository;
import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import io.github.drompincen.aigov.runtime.audit.AuditEventType;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRepository sessionRepository;
    private final AuditService auditService;
    private final Clock clock;

    public SessionService(SessionRepository sessionRepository, AuditService auditService, Clock clock) {
        this.sessionRepository = sessionRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    public SessionDocument start(GovernanceRequest request, RoleDefinition role, int depth, String parentSessionId) {
        SessionDocument doc = new SessionDocument();
        doc.setSessionId(UUID.randomUUID().toString());
        doc.setProjectId(request.project());
        doc.setRoleName(role.name());
        doc.setRequest(snapshotOf(request));
        doc.setStatus(SessionStatus.ACTIVE);
        doc.setStartedAt(clock.instant());
        doc.setDepth(depth);
        doc.setParentSessionId(parentSessionId);
        sessionRepository.save(doc);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestId", request.id());
        details.put("depth", depth);
        if (parentSessionId != null) details.put("parentSessionId", parentSessionId);
        auditService.record(AuditEventType.SESSION_STARTED, scopeOf(doc, request),
                "Session started for role " + role.name(), details);
        log.info("Session {} started: role={}, project={}, depth={}", doc.getSessionId(), role.name(),
                request.project(), depth);
        return doc;
    }

    public void recordToolUse(String sessionId, SessionDocument.ToolUse toolUse) {
        if (toolUse.getTimestamp() == null) toolUse.setTimestamp(clock.instant());
        sessionRepository.appendToolUse(sessionId, toolUse);
    }

    public void recordDecision(String sessionId, String decisionId) {
        sessionRepository.appendDecision(sessionId, decisionId);
    }

    public void recordEscalation(String sessionId, String escalation) {
        sessionRepository.appendEscalation(sessionId, escalation);
    }

    public void finish(String sessionId, SessionStatus status, String reason) {
        sessionRepository.finish(sessionId, status, clock.instant(), reason);
    }

    public Optional<SessionDocument> find(String sessionId) {
        return sessionRepository.findById(sessionId);
    }

    public static AuditService.AuditScope scopeOf(SessionDocument session, GovernanceRequest request) {
        return new AuditService.AuditScope(session.getProjectId(), session.getSessionId(),
                request.source().actor(), session.getRoleName(), null, request.trust());
    }

    private static SessionDocument.RequestSnapshot snapshotOf(GovernanceRequest request) {
        SessionDocument.RequestSnapshot snapshot = new SessionDocument.RequestSnapshot();
        snapshot.setRequestId(request.id());
        snapshot.setTimestamp(request.timestamp());
        snapshot.setTrust(request.trust());
        snapshot.setChannel(request.source().channel());
        snapshot.setIdentity(request.source().identity());
        snapshot.setIntent(request.intent());
        snapshot.setPayload(new LinkedHashMap<>(request.payload()));
        return snapshot;
    }
}
