package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.persistence.repository.SessionRepository;
import io.github.drompincen.aigov.protocol.api.SessionDto;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionRepository sessionRepository;

    public SessionController(SessionRepository sessionRepository) {
        this.sessionRepository = sessionRepository;
    }

    @GetMapping
    public List<SessionDto> list(@RequestParam String projectId,
                                 @RequestParam(required = false) SessionStatus status,
                                 @RequestParam(defaultValue = "50") int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<SessionDocument> sessions = status != null
                ? sessionRepository.findByProjectIdAndStatusOrderByStartedAtDesc(projectId, status, page)
                : sessionRepository.findByProjectIdOrderByStartedAtDesc(projectId, page);
        return sessions.stream().map(SessionController::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionDto> get(@PathVariable String id) {
        return sessionRepository.findById(id)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    static SessionDto toDto(SessionDocument doc) {
        SessionDocument.RequestSnapshot req = doc.getRequest();
        return new SessionDto(doc.getSessionId(), doc.getProjectId(), doc.getRoleName(),
                req != null ? req.getRequestId() : null,
                req != null ? req.getTrust() : null,
                req != null ? req.getIntent() : null,
                doc.getStatus(), doc.getStartedAt(), doc.getEndedAt(),
                doc.getToolUses().size(), doc.getDecisionsLogged(), doc.getEscalations(),
                doc.getDepth(), doc.getParentSessionId());
    }
}
