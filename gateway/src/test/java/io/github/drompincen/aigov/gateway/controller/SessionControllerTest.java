package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.persistence.repository.SessionRepository;
import io.github.drompincen.aigov.protocol.api.SessionDto;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import io.github.drompincen.aigov.protocol.api.TrustLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock private SessionRepository sessionRepository;

    private SessionController controller;

    @BeforeEach
    void setUp() {
        controller = new SessionController(sessionRepository);
    }

    private static SessionDocument session(String id) {
        SessionDocument doc = new SessionDocument();
        doc.setSessionId(id);
        doc.setProjectId("widgets");
        doc.setRoleName("maintainer");
        doc.setStatus(SessionStatus.COMPLETED);
        doc.setStartedAt(Instant.parse("2026-05-04T10:00:00Z"));
        doc.setDepth(1);
        doc.setParentSessionId("parent");
        SessionDocument.RequestSnapshot req = new SessionDocument.RequestSnapshot();
        req.setRequestId("r1");
        req.setTrust(TrustLevel.AUTHORIZED);
        req.setIntent("review pr #4");
        doc.setRequest(req);
        doc.getToolUses().add(new SessionDocument.ToolUse());
        doc.getDecisionsLogged().add("d1");
        return doc;
    }

    @Test
    void getReturns404WhenNotFound() {
        when(sessionRepository.findById("bad")).thenReturn(Optional.empty());
        ResponseEntity<SessionDto> response = controller.get("bad");
        assertThat(response.getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void getMapsRequestSnapshot() {
        when(sessionRepository.findById("s1")).thenReturn(Optional.of(session("s1")));

        SessionDto dto = controller.get("s1").getBody();

        assertThat(dto.requestId()).isEqualTo("r1");
        assertThat(dto.trust()).isEqualTo(TrustLevel.AUTHORIZED);
        assertThat(dto.intent()).isEqualTo("review pr #4");
        assertThat(dto.toolUseCount()).isEqualTo(1);
        assertThat(dto.decisionsLogged()).containsExactly("d1");
        assertThat(dto.depth()).isEqualTo(1);
        assertThat(dto.parentSessionId()).isEqualTo("parent");
    }

    @Test
    void listFiltersByStatus() {
        when(sessionRepository.findByProjectIdAndStatusOrderByStartedAtDesc("widgets", SessionStatus.BLOCKED, PageRequest.of(0, 10)))
                .thenReturn(List.of(session("s1")));

        List<SessionDto> sessions = controller.list("widgets", SessionStatus.BLOCKED, 10);

        assertThat(sessions).extracting(SessionDto::sessionId).containsExactly("s1");
        verify(sessionRepository, never()).findByProjectIdOrderByStartedAtDesc(any(), any());
    }

    @Test
    void listWithoutStatusReturnsNewest() {
        when(sessionRepository.findByProjectIdOrderByStartedAtDesc("widgets", PageRequest.of(0, 50)))
                .thenReturn(List.of(session("a"), session("b")));

        assertThat(controller.list("widgets", null, 50)).hasSize(2);
    }
}
