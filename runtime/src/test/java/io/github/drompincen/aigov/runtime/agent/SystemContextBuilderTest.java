package io.github.drompincen.aigov.runtime.agent;

import io.github.drompincen.aigov.persistence.document.ConversationThreadDocument;
import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import io.github.drompincen.aigov.persistence.document.WikiPageDocument;
import io.github.drompincen.aigov.persistence.repository.ScoredDecision;
import io.github.drompincen.aigov.persistence.repository.WikiPageRepository;
import io.github.drompincen.aigov.protocol.api.*;
import io.github.drompincen.aigov.runtime.conversation.ConversationService;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static io.github.drompincen.aigov.runtime.GovernanceFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SystemContextBuilderTest {

    @Mock
    private WikiPageRepository wikiPageRepository;
    @Mock
    private DecisionService decisionService;
    @Mock
    private ConversationService conversationService;

    private SystemContextBuilder builder(String philosophyLocation) {
        return new SystemContextBuilder(new DefaultResourceLoader(), wikiPageRepository, decisionService,
                conversationService, philosophyLocation);
    }

    private static WikiPageDocument page(String path, String title, String content) {
        WikiPageDocument doc = new WikiPageDocument();
        doc.setPath(path);
        doc.setTitle(title);
        doc.setContent(content);
        doc.setSummary(title + " summary");
        return doc;
    }

    private static RoleDefinition reviewer() {
        return role("reviewer", List.of(TrustLevel.CONTRIBUTOR), ToolPermissions.allowAll(), List.of(),
                List.of(new TrustLevelConstraint("Merges need maintainers", Enforcement.HARD,
                                new TrustLevelConstraint.Parameters(TrustLevel.ELEVATED), List.of("merge_pull_request")),
                        new RateLimitConstraint("Go slow", Enforcement.SOFT,
                                new RateLimitConstraint.Parameters(5, 60_000), List.of())));
    }

    @Test
    void sectionsAppearInFixedOrder() {
        when(wikiPageRepository.findByProjectIdOrderByPathAsc("proj"))
                .thenReturn(List.of(page("Home", "Home", "Welcome to widgets"), page("api", "API", "...")));
        DecisionDocument decision = new DecisionDocument();
        decision.setDecisionNumber(7);
        decision.setTitle("Adopt semver");
        decision.setDate(LocalDate.of(2025, 5, 1));
        decision.setDecision("Use semver");
        decision.setReasoning("Predictability");
        when(decisionService.search("proj", "Review PR 12", 5, 0.7))
                .thenReturn(List.of(new ScoredDecision(decision, 0.9)));
        ConversationThreadDocument thread = new ConversationThreadDocument();
        thread.setThreadId("c1");
        thread.setParticipants(List.of(Participant.role("reviewer"), Participant.role("maintainer")));
        thread.setTopic("release");
        thread.setUpdatedAt(Instant.parse("2026-01-01T00:00:00Z"));
        when(conversationService.activeFor("proj", "reviewer")).thenReturn(List.of(thread));
        RoleDefinition role = reviewer();

        String prompt = builder("classpath:governance/philosophy.md")
                .build(InvocationContext.topLevel(request("Review PR 12", TrustLevel.CONTRIBUTOR), project(role), role));

        assertThat(prompt).containsSubsequence(
                "# Foundational Principles", "Decisions are recorded before they are forgotten.",
                "# Project Constitution", "Be kind.",
                "# Project Wiki", "Welcome to widgets", "## Key Pages", "- [API](api): API summary",
                "# Relevant Past Decisions", "## Decision #7: Adopt semver", "**Reasoning:** Predictability",
                "# Open Conversations", "- `c1` with maintainer about: release",
                "# Your Role", "**Role:** reviewer", "reviewer instructions",
                "Merges need maintainers (HARD - will be blocked)", "Go slow (SOFT - please follow)",
                "# Current Request", "**Trust Level:** contributor", "**Identity:** octocat",
                "**Intent:** Review PR 12");
        assertThat(prompt).doesNotContain("- [Home]");
    }

    @Test
    void emptyOptionalSectionsAreOmitted() {
        RoleDefinition role = role("reception", TrustLevel.ANONYMOUS);

        String prompt = builder("classpath:governance/philosophy.md")
                .build(InvocationContext.topLevel(request("hello", TrustLevel.ANONYMOUS), project(role), role));

        assertThat(prompt).contains("The wiki has not been initialized yet.");
        assertThat(prompt).doesNotContain("## Key Pages", "# Relevant Past Decisions", "# Open Conversations",
                "## Constraints");
    }

    @Test
    void conversationContextIsAppendedLast() {
        RoleDefinition role = role("engineer", TrustLevel.ELEVATED);
        InvocationContext ctx = InvocationContext.topLevel(request("x", TrustLevel.ELEVATED), project(role), role)
                .nested(role, "parent", "## Active Conversation\nmaintainer: hi");

        String prompt = builder("classpath:governance/philosophy.md").build(ctx);

        assertThat(prompt).endsWith("## Active Conversation\nmaintainer: hi");
    }

    @Test
    void missingPhilosophyFallsBackAndIsCached() {
        SystemContextBuilder builder = builder("classpath:governance/does-not-exist.md");

        assertThat(builder.philosophy()).isEqualTo("No foundational principles configured.");
        assertThat(builder.philosophy()).isSameAs(builder.philosophy());
    }

    @Test
    void pastDecisionsAreSearchedWithIntent() {
        RoleDefinition role = role("engineer", TrustLevel.ELEVATED);

        builder("classpath:governance/philosophy.md")
                .build(InvocationContext.topLevel(request("Fix flaky build", TrustLevel.ELEVATED), project(role), role));

        verify(decisionService).search(eq("proj"), eq("Fix flaky build"), eq(5), eq(0.7));
    }
}
