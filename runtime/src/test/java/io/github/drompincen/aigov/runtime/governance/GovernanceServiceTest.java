package io.github.drompincen.aigov.runtime.governance;

import io.github.drompincen.aigov.protocol.api.*;
import io.github.drompincen.aigov.runtime.agent.AgentInvoker;
import io.github.drompincen.aigov.runtime.agent.AgentResponse;
import io.github.drompincen.aigov.runtime.agent.InvocationContext;
import io.github.drompincen.aigov.runtime.error.ProjectConfigurationException;
import io.github.drompincen.aigov.runtime.project.ProjectConfigResolver;
import io.github.drompincen.aigov.runtime.routing.IntentRouter;
import io.github.drompincen.aigov.runtime.routing.RoutingDecision;
import io.github.drompincen.aigov.runtime.trust.TrustClassifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static io.github.drompincen.aigov.runtime.GovernanceFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GovernanceServiceTest {

    @Mock
    private ProjectConfigResolver projectConfigResolver;
    @Mock
    private TrustClassifier trustClassifier;
    @Mock
    private IntentRouter intentRouter;
    @Mock
    private AgentInvoker agentInvoker;

    @InjectMocks
    private GovernanceService service;

    private final RoleDefinition triage = role("triage", TrustLevel.ANONYMOUS, TrustLevel.CONTRIBUTOR);
    private final ProjectConfig project = project(triage);

    @Test
    void classifiedRequestIsRoutedAndInvoked() {
        GovernanceRequest inbound = request("Please label issue 4", TrustLevel.ANONYMOUS);
        when(projectConfigResolver.resolve("proj")).thenReturn(project);
        when(trustClassifier.classify(inbound, project)).thenReturn(TrustLevel.CONTRIBUTOR);
        when(intentRouter.route(any(), any())).thenReturn(new RoutingDecision(IntentCategory.TRIAGE, triage, false));
        when(agentInvoker.invoke(any())).thenReturn(new AgentResponse("s-1", "Labeled", SessionStatus.COMPLETED, List.of()));

        GovernanceResponse response = service.handle(inbound);

        assertThat(response.requestId()).isEqualTo("req-1");
        assertThat(response.sessionId()).isEqualTo("s-1");
        assertThat(response.role()).isEqualTo("triage");
        assertThat(response.trustLevel()).isEqualTo(TrustLevel.CONTRIBUTOR);
        assertThat(response.category()).isEqualTo(IntentCategory.TRIAGE);
        assertThat(response.response()).isEqualTo("Labeled");
        assertThat(response.warnings()).isEmpty();

        ArgumentCaptor<InvocationContext> ctx = ArgumentCaptor.forClass(InvocationContext.class);
        verify(agentInvoker).invoke(ctx.capture());
        assertThat(ctx.getValue().request().trust()).isEqualTo(TrustLevel.CONTRIBUTOR);
        assertThat(ctx.getValue().depth()).isZero();
        assertThat(ctx.getValue().parentSessionId()).isNull();
    }

    @Test
    void fallbackRoutingIsReportedFirst() {
        when(projectConfigResolver.resolve("proj")).thenReturn(project);
        when(trustClassifier.classify(any(), any())).thenReturn(TrustLevel.ANONYMOUS);
        when(intentRouter.route(any(), any())).thenReturn(new RoutingDecision(IntentCategory.GOVERNANCE, triage, true));
        when(agentInvoker.invoke(any()))
                .thenReturn(new AgentResponse("s-2", "ok", SessionStatus.BLOCKED, List.of("stop warning")));

        GovernanceResponse response = service.handle(request("Change the constitution", TrustLevel.ANONYMOUS));

        assertThat(response.warnings()).containsExactly(
                "No role configured for governance accepts trust level anonymous; routed to triage",
                "stop warning");
    }

    @Test
    void unknownProjectStopsBeforeClassification() {
        when(projectConfigResolver.resolve("proj")).thenThrow(new ProjectConfigurationException("Unknown project: proj"));

        assertThatThrownBy(() -> service.handle(request("x", TrustLevel.ANONYMOUS)))
                .isInstanceOf(ProjectConfigurationException.class);
        verifyNoInteractions(trustClassifier, intentRouter, agentInvoker);
    }
}
