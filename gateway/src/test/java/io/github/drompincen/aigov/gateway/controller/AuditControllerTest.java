package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.persistence.document.AuditEntryDocument;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditControllerTest {

    @Mock private AuditService auditService;

    private AuditController controller;

    @BeforeEach
    void setUp() {
        controller = new AuditController(auditService);
    }

    private static AuditEntryDocument entry(String projectId, String eventType) {
        AuditEntryDocument e = new AuditEntryDocument();
        e.setProjectId(projectId);
        e.setSessionId("s1");
        e.setEventType(eventType);
        return e;
    }

    @Test
    void sessionEntriesStayInProject() {
        when(auditService.forSession("s1")).thenReturn(List.of(
                entry("widgets", "session_started"), entry("other", "session_started"), entry("widgets", "tool_use_blocked")));

        List<AuditEntryDocument> result = controller.list("widgets", "s1", null, 100);

        assertThat(result).hasSize(2);
        verify(auditService, never()).forProject(any(), any(), anyInt());
    }

    @Test
    void projectEntriesDelegate() {
        when(auditService.forProject("widgets", "decision_logged", 10)).thenReturn(List.of(entry("widgets", "decision_logged")));

        assertThat(controller.list("widgets", null, "decision_logged", 10)).hasSize(1);
    }
}
