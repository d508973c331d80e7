package io.github.drompincen.aigov.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.aigov.persistence.document.AuditEntryDocument;
import io.github.drompincen.aigov.persistence.document.LlmInteractionDocument;
import io.github.drompincen.aigov.persistence.document.SessionDocument;
import io.github.drompincen.aigov.persistence.repository.LlmInteractionRepository;
import io.github.drompincen.aigov.persistence.repository.SessionRepository;
import io.github.drompincen.aigov.protocol.api.SessionStatus;
import io.github.drompincen.aigov.runtime.audit.AuditService;
import io.github.drompincen.aigov.runtime.tools.ToolContext;
import io.github.drompincen.aigov.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.PageRequest;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ObservabilityToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2026-05-04T12:00:00Z");

    @Mock private SessionRepository sessionRepository;
    @Mock private AuditService auditService;
    @Mock private LlmInteractionRepository llmInteractionRepository;

    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new ToolContext("s0", "proj", "maintainer", null, Path.of("."));
    }

    private static SessionDocument session(String id, String role, SessionStatus status) {
        SessionDocument s = new SessionDocument();
        s.setSessionId(id);
        s.setProjectId("proj");
        s.setRoleName(role);
        s.setStatus(status);
        s.setStartedAt(NOW.minusSeconds(60));
        return s;
    }

    private static AuditEntryDocument audit(String eventType, String sessionId, String projectId) {
        AuditEntryDocument e = new AuditEntryDocument();
        e.setEventType(eventType);
        e.setSessionId(sessionId);
        e.setProjectId(projectId);
        e.setTimestamp(NOW);
        e.setDetails(Map.of("tool", "close_issue"));
        return e;
    }

    private static LlmInteractionDocument call(String projectId, boolean success, int prompt, int completion, long ms) {
        LlmInteractionDocument i = new LlmInteractionDocument();
        i.setProjectId(projectId);
        i.setModel("claude-sonnet-4-5-20250929");
        i.setSuccess(success);
        i.setPromptTokens(prompt);
        i.setCompletionTokens(completion);
        i.setDurationMs(ms);
        i.setTimestamp(NOW.minusSeconds(600));
        return i;
    }

    @Test
    void querySessionsCombinesRoleAndStatus() {
        QuerySessionsTool tool = new QuerySessionsTool();
        tool.setSessionRepository(sessionRepository);
        when(sessionRepository.findByProjectIdAndRoleNameOrderByStartedAtDesc(any(), any(), any()))
                .thenReturn(List.of(session("a", "engineer", SessionStatus.COMPLETED),
                        session("b", "engineer", SessionStatus.FAILED)));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("role", "engineer").put("status", "failed"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("count").asInt()).isEqualTo(1);
        assertThat(result.output().at("/sessions/0/session_id").asText()).isEqualTo("b");
        assertThat(result.output().at("/sessions/0/status").asText()).isEqualTo("failed");
    }

    @Test
    void querySessionsByStatusUsesLimit() {
        QuerySessionsTool tool = new QuerySessionsTool();
        tool.setSessionRepository(sessionRepository);
        when(sessionRepository.findByProjectIdAndStatusOrderByStartedAtDesc(any(), any(), any())).thenReturn(List.of());

        tool.execute(ctx, MAPPER.createObjectNode().put("status", "blocked").put("limit", 3));

        verify(sessionRepository).findByProjectIdAndStatusOrderByStartedAtDesc("proj", SessionStatus.BLOCKED, PageRequest.of(0, 3));
    }

    @Test
    void sessionTraceCollectsAuditAndLlmCalls() {
        GetSessionTraceTool tool = new GetSessionTraceTool();
        tool.setSessionRepository(sessionRepository);
        tool.setAuditService(auditService);
        tool.setLlmInteractionRepository(llmInteractionRepository);
        SessionDocument s = session("s1", "maintainer", SessionStatus.COMPLETED);
        s.getDecisionsLogged().add("d1");
        when(sessionRepository.findById("s1")).thenReturn(Optional.of(s));
        when(auditService.forSession("s1")).thenReturn(List.of(audit("session_started", "s1", "proj"),
                audit("session_completed", "s1", "proj")));
        when(llmInteractionRepository.findBySessionIdOrderByTimestampAsc("s1")).thenReturn(List.of(call("proj", true, 100, 20, 900)));
        when(sessionRepository.findByParentSessionId("s1")).thenReturn(List.of(session("child", "engineer", SessionStatus.COMPLETED)));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("session_id", "s1"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("audit")).hasSize(2);
        assertThat(result.output().at("/audit/0/details/tool").asText()).isEqualTo("close_issue");
        assertThat(result.output().get("llm_interactions")).hasSize(1);
        assertThat(result.output().at("/session/decision_ids/0").asText()).isEqualTo("d1");
        assertThat(result.output().at("/child_sessions/0").asText()).isEqualTo("child");
    }

    @Test
    void sessionTraceHidesOtherProjects() {
        GetSessionTraceTool tool = new GetSessionTraceTool();
        tool.setSessionRepository(sessionRepository);
        SessionDocument foreign = session("s9", "maintainer", SessionStatus.COMPLETED);
        foreign.setProjectId("elsewhere");
        when(sessionRepository.findById("s9")).thenReturn(Optional.of(foreign));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("session_id", "s9"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Session not found: s9");
    }

    @Test
    void auditLogBySessionStaysInProject() {
        QueryAuditLogTool tool = new QueryAuditLogTool();
        tool.setAuditService(auditService);
        when(auditService.forSession("s1")).thenReturn(List.of(
                audit("tool_use_blocked", "s1", "proj"),
                audit("tool_use_blocked", "s1", "other"),
                audit("tool_use_completed", "s1", "proj")));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("session_id", "s1").put("event_type", "tool_use_blocked"));

        assertThat(result.output().get("count").asInt()).isEqualTo(1);
        verify(auditService, never()).forProject(any(), any(), anyInt());
    }

    @Test
    void auditLogByProjectDelegates() {
        QueryAuditLogTool tool = new QueryAuditLogTool();
        tool.setAuditService(auditService);
        when(auditService.forProject("proj", null, 50)).thenReturn(List.of(audit("session_started", "s1", "proj")));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode());

        assertThat(result.output().get("count").asInt()).isEqualTo(1);
    }

    @Test
    void llmMetricsAggregatesWindow() {
        GetLlmMetricsTool tool = new GetLlmMetricsTool();
        tool.setLlmInteractionRepository(llmInteractionRepository);
        tool.setClock(Clock.fixed(NOW, ZoneOffset.UTC));
        when(llmInteractionRepository.findByTimestampAfterOrderByTimestampDesc(NOW.minusSeconds(24 * 3600)))
                .thenReturn(List.of(call("proj", true, 100, 50, 1000),
                        call("proj", false, 10, 0, 3000),
                        call("other", true, 999, 999, 9999)));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode());

        assertThat(result.success()).isTrue();
        assertThat(result.output().get("total_calls").asLong()).isEqualTo(2);
        assertThat(result.output().get("failures").asLong()).isEqualTo(1);
        assertThat(result.output().get("total_tokens").asLong()).isEqualTo(160);
        assertThat(result.output().get("avg_duration_ms").asLong()).isEqualTo(2000);
        assertThat(result.output().at("/calls_by_model/claude-sonnet-4-5-20250929").asInt()).isEqualTo(2);
    }

    @Test
    void llmMetricsRejectsNonPositiveWindow() {
        GetLlmMetricsTool tool = new GetLlmMetricsTool();
        tool.setLlmInteractionRepository(llmInteractionRepository);
        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("hours", 0));
        assertThat(result.success()).isFalse();
    }
}
