package io.github.drompincen.aigov.runtime.routing;

import io.github.drompincen.aigov.protocol.api.*;
import io.github.drompincen.aigov.runtime.error.ProjectConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.drompincen.aigov.runtime.GovernanceFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentRouterTest {

    private final IntentRouter router = new IntentRouter();

    private final RoleDefinition reception = role("reception", TrustLevel.ANONYMOUS, TrustLevel.CONTRIBUTOR);
    private final RoleDefinition maintainer =
            role("maintainer", TrustLevel.CONTRIBUTOR, TrustLevel.AUTHORIZED, TrustLevel.ELEVATED);

    @Test
    void triageIntentRoutesToReceptionForContributor() {
        RoutingDecision decision = router.route(request("Triage new issue #10: login broken", TrustLevel.CONTRIBUTOR),
                project(reception, maintainer));

        assertThat(decision.category()).isEqualTo(IntentCategory.TRIAGE);
        assertThat(decision.role().name()).isEqualTo("reception");
        assertThat(decision.fallback()).isFalse();
    }

    @Test
    void routingIsDeterministic() {
        ProjectConfig project = project(reception, maintainer);
        GovernanceRequest request = request("Triage new issue #10: login broken", TrustLevel.CONTRIBUTOR);

        for (int i = 0; i < 10; i++) {
            assertThat(router.route(request, project).role().name()).isEqualTo("reception");
        }
    }

    @Test
    void fallsBackToAnyRoleAcceptingTrust() {
        RoutingDecision decision = router.route(request("Triage new issue #10: login broken", TrustLevel.ELEVATED),
                project(role("engineer", TrustLevel.ELEVATED)));

        assertThat(decision.role().name()).isEqualTo("engineer");
        assertThat(decision.fallback()).isTrue();
    }

    @Test
    void triageCandidateChainSkipsRolesRejectingTrust() {
        RoutingDecision decision = router.route(request("Triage new issue #10: login broken", TrustLevel.ELEVATED),
                project(reception, maintainer));

        assertThat(decision.role().name()).isEqualTo("maintainer");
        assertThat(decision.fallback()).isFalse();
    }

    @Test
    void noQualifyingRoleIsConfigurationError() {
        assertThatThrownBy(() -> router.route(request("Triage new issue #10", TrustLevel.ELEVATED), project(reception)))
                .isInstanceOf(ProjectConfigurationException.class)
                .hasMessageContaining("elevated");
    }

    @Test
    void receptionRejectingTrustIsNotALastResort() {
        assertThatThrownBy(() -> router.route(request("Triage new issue #10: login broken", TrustLevel.ELEVATED),
                project(reception)))
                .isInstanceOf(ProjectConfigurationException.class)
                .hasMessageContaining("elevated");
    }

    @Test
    void projectRoutingOverridesDefaults() {
        RoleDefinition triager = role("triager", TrustLevel.CONTRIBUTOR);
        ProjectConfig project = new ProjectConfig("proj", "Project", "acme/widgets", null,
                List.of(reception, triager), Map.of("triage", List.of("triager")), List.of(), null);

        assertThat(router.route(request("triage issue #4", TrustLevel.CONTRIBUTOR), project).role().name())
                .isEqualTo("triager");
    }

    @Test
    void classificationRules() {
        assertThat(router.classifyIntent(request("Evaluate this challenge", TrustLevel.ANONYMOUS)))
                .isEqualTo(IntentCategory.GOVERNANCE);
        assertThat(router.classifyIntent(request("Please implement the parser", TrustLevel.ANONYMOUS)))
                .isEqualTo(IntentCategory.DEVELOPMENT);
        assertThat(router.classifyIntent(request("Pull request opened", TrustLevel.ANONYMOUS)))
                .isEqualTo(IntentCategory.REVIEW);
        assertThat(router.classifyIntent(request("Run scheduled_maintenance", TrustLevel.ANONYMOUS)))
                .isEqualTo(IntentCategory.MAINTENANCE);
        assertThat(router.classifyIntent(request("Notification for maintainer: escalation", TrustLevel.ANONYMOUS)))
                .isEqualTo(IntentCategory.GOVERNANCE);
        assertThat(router.classifyIntent(request("hello there", TrustLevel.ANONYMOUS)))
                .isEqualTo(IntentCategory.UNKNOWN);
    }

    @Test
    void developmentLabelWinsOverText() {
        GovernanceRequest labelled = new GovernanceRequest("r", null, TrustLevel.AUTHORIZED,
                RequestSource.of(Channel.GITHUB_WEBHOOK, "octocat"), "proj", "New issue #3 opened",
                Map.of("issue", Map.of("labels", List.of(Map.of("name", "Ready-For-Development")))));

        assertThat(router.classifyIntent(labelled)).isEqualTo(IntentCategory.DEVELOPMENT);
    }

    @Test
    void bugLabelIsNotAnAuthorizationSignal() {
        GovernanceRequest labelled = new GovernanceRequest("r", null, TrustLevel.AUTHORIZED,
                RequestSource.of(Channel.GITHUB_WEBHOOK, "octocat"), "proj", "New issue #3 opened",
                Map.of("labels", List.of("bug")));

        assertThat(router.classifyIntent(labelled)).isEqualTo(IntentCategory.TRIAGE);
    }

    @Test
    void unknownCategoryUsesFallback() {
        RoutingDecision decision = router.route(request("hello there", TrustLevel.CONTRIBUTOR), project(reception, maintainer));

        assertThat(decision.category()).isEqualTo(IntentCategory.UNKNOWN);
        assertThat(decision.role().name()).isEqualTo("reception");
        assertThat(decision.fallback()).isTrue();
    }
}
