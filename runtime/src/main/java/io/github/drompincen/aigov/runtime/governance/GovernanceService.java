package io.github.drompincen.aigov.runtime.governance;

import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.GovernanceResponse;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.TrustLevel;
import io.github.drompincen.aigov.runtime.agent.AgentInvoker;
import io.github.drompincen.aigov.runtime.agent.AgentResponse;
import io.github.drompincen.aigov.runtime.agent.InvocationContext;
import io.github.drompincen.aigov.runtime.project.ProjectConfigResolver;
import io.github.drompincen.aigov.runtime.routing.IntentRouter;
import io.github.drompincen.aigov.runtime.routing.RoutingDecision;
import io.github.drompincen.aigov.runtime.trust.TrustClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for an inbound request: resolve the project, classify trust, route to a role and run
 * that role's agent.
 */
@Service
public class GovernanceService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceService.class);

    private final ProjectConfigResolver projectConfigResolver;
    private final TrustClassifier trustClassifier;
    private final IntentRouter intentRouter;
    private final AgentInvoker agentInvoker;

    public GovernanceService(ProjectConfigResolver projectConfigResolver,
                             TrustClassifier trustClassifier,
                             IntentRouter intentRouter,
                             AgentInvoker agentInvoker) {
        this.projectConfigResolver = projectConfigResolver;
        this.trustClassifier = trustClassifier;
        this.intentRouter = intentRouter;
        this.agentInvoker = agentInvoker;
    }

    public GovernanceResponse handle(GovernanceRequest inbound) {
        ProjectConfig project = projectConfigResolver.resolve(inbound.project());
        TrustLevel trust = trustClassifier.classify(inbound, project);
        GovernanceRequest request = inbound.withTrust(trust);

        RoutingDecision routing = intentRouter.route(request, project);
        log.info("Request {} for project {}: trust={}, category={}, role={}{}", request.id(), project.id(),
                trust.wireName(), routing.category(), routing.role().name(), routing.fallback() ? " (fallback)" : "");

        AgentResponse response = agentInvoker.invoke(InvocationContext.topLevel(request, project, routing.role()));
        List<String> warnings = new ArrayList<>(response.warnings());
        if (routing.fallback()) {
            warnings.add(0, "No role configured for " + routing.category().name().toLowerCase()
                    + " accepts trust level " + trust.wireName() + "; routed to " + routing.role().name());
        }
        return new GovernanceResponse(request.id(), response.sessionId(), routing.role().name(), trust,
                routing.category(), response.text(), warnings);
    }
}
