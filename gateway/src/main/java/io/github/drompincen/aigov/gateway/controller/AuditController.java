package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.persistence.document.AuditEntryDocument;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    /**
     * A session's entries in order when {@code sessionId} is given, else the project's newest entries.
     */
    @GetMapping
    public List<AuditEntryDocument> list(@RequestParam String projectId,
                                         @RequestParam(required = false) String sessionId,
                                         @RequestParam(required = false) String eventType,
                                         @RequestParam(defaultValue = "100") int limit) {
        if (sessionId != null && !sessionId.isBlank()) {
            return auditService.forSession(sessionId).stream()
                    .filter(e -> projectId.equals(e.getProjectId()))
                    .filter(e -> eventType == null || eventType.equals(e.getEventType()))
                    .limit(Math.max(1, limit))
                    .collect(Collectors.toList());
        }
        return auditService.forProject(projectId, eventType, limit);
    }
}
