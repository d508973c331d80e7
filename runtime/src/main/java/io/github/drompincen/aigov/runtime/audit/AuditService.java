package io.github.drompincen.aigov.runtime.audit;

import io.github.drompincen.aigov.persistence.document.AuditEntryDocument;
import io.github.drompincen.aigov.persistence.repository.AuditEntryRepository;
import io.github.drompincen.aigov.protocol.api.TrustLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit trail of governance events.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditEntryRepository auditEntryRepository;
    private final Clock clock;

    public AuditService(AuditEntryRepository auditEntryRepository, Clock clock) {
        this.auditEntryRepository = auditEntryRepository;
        this.clock = clock;
    }

    public AuditEntryDocument record(AuditEventType type, AuditScope scope, String action, Map<String, Object> details) {
        AuditEntryDocument doc = new AuditEntryDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setTimestamp(clock.instant());
        doc.setProjectId(scope.projectId());
        doc.setSessionId(scope.sessionId());
        doc.setEventType(type.wireName());
        doc.setActor(scope.actor());
        doc.setAction(action);
        doc.setRoleName(scope.roleName());
        doc.setToolName(scope.toolName());
        doc.setTrustLevel(scope.trust());
        doc.setDetails(details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>());
        auditEntryRepository.save(doc);
        log.debug("Audit {} [{}] {}", type.wireName(), scope.sessionId(), action);
        return doc;
    }

    /** Completed uses of a tool by a role in a project since {@code now - window}. */
    public long countCompletedUses(String projectId, String roleName, String toolName, Duration window) {
        Instant after = clock.instant().minus(window);
        return auditEntryRepository.countByProjectIdAndRoleNameAndToolNameAndEventTypeAndTimestampAfter(
                projectId, roleName, toolName, AuditEventType.TOOL_USE_COMPLETED.wireName(), after);
    }

    public List<AuditEntryDocument> forSession(String sessionId) {
        return auditEntryRepository.findBySessionIdOrderByTimestampAsc(sessionId);
    }

    public List<AuditEntryDocument> forProject(String projectId, String eventType, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        if (eventType != null && !eventType.isBlank()) {
            return auditEntryRepository.findByProjectIdAndEventTypeOrderByTimestampDesc(projectId, eventType, page);
        }
        return auditEntryRepository.findByProjectIdOrderByTimestampDesc(projectId, page);
    }

    /**
     * Who and where an audit entry is about.
     */
    public record AuditScope(String projectId, String sessionId, String actor, String roleName,
                             String toolName, TrustLevel trust) {

        public AuditScope withTool(String tool) {
            return new AuditScope(projectId, sessionId, actor, roleName, tool, trust);
        }
    }
}
