package io.github.drompincen.aigov.runtime.agent;

import io.github.drompincen.aigov.persistence.document.ConversationThreadDocument;
import io.github.drompincen.aigov.persistence.document.WikiPageDocument;
import io.github.drompincen.aigov.persistence.repository.ScoredDecision;
import io.github.drompincen.aigov.persistence.repository.WikiPageRepository;
import io.github.drompincen.aigov.protocol.api.Constraint;
import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.Participant;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;
import io.github.drompincen.aigov.runtime.conversation.ConversationService;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assembles the system prompt of an agent run. Sections appear in a fixed order; optional ones
 * (key pages, past decisions, open conversations) are omitted when empty.
 */
@Component
public class SystemContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(SystemContextBuilder.class);

    static final String HOME_PAGE = "Home";
    static final int RELEVANT_DECISIONS = 5;
    static final double RELEVANCE_THRESHOLD = 0.7;
    static final int KEY_PAGES = 10;

    private final ResourceLoader resourceLoader;
    private final WikiPageRepository wikiPageRepository;
    private final DecisionService decisionService;
    private final ConversationService conversationService;
    private final String philosophyLocation;
    private volatile String philosophy;

    public SystemContextBuilder(ResourceLoader resourceLoader,
                                WikiPageRepository wikiPageRepository,
                                DecisionService decisionService,
                                ConversationService conversationService,
                                @Value("${aigov.context.philosophy-location:classpath:governance/philosophy.md}")
                                String philosophyLocation) {
        this.resourceLoader = resourceLoader;
        this.wikiPageRepository = wikiPageRepository;
        this.decisionService = decisionService;
        this.conversationService = conversationService;
        this.philosophyLocation = philosophyLocation;
    }

    public String build(InvocationContext ctx) {
        GovernanceRequest request = ctx.request();
        ProjectConfig project = ctx.project();
        RoleDefinition role = ctx.role();
        StringBuilder sb = new StringBuilder();

        sb.append("# Foundational Principles\n\n").append(philosophy()).append("\n\n");

        sb.append("# Project Constitution\n\n")
                .append(project.constitution().isBlank() ? "No constitution has been defined for this project."
                        : project.constitution())
                .append("\n\n");

        appendWiki(sb, project);
        appendDecisions(sb, project, request);
        appendConversations(sb, project, role);

        sb.append("# Your Role\n\n");
        sb.append("**Role:** ").append(role.name()).append('\n');
        sb.append("**Purpose:** ").append(role.purpose() != null ? role.purpose() : "").append("\n\n");
        sb.append("## Instructions\n\n").append(role.instructions()).append("\n\n");
        if (!role.constraints().isEmpty()) {
            sb.append("## Constraints\n");
            for (Constraint c : role.constraints()) {
                sb.append("- **").append(c.type()).append(":** ").append(c.description())
                        .append(c.isHard() ? " (HARD - will be blocked)" : " (SOFT - please follow)").append('\n');
            }
            sb.append('\n');
        }

        sb.append("# Current Request\n\n");
        sb.append("**Trust Level:** ").append(request.trust().wireName()).append('\n');
        sb.append("**Source:** ").append(request.source().channel().wireName()).append('\n');
        if (request.source().hasIdentity()) {
            sb.append("**Identity:** ").append(request.source().identity()).append('\n');
        }
        sb.append("**Intent:** ").append(request.intent()).append('\n');

        if (ctx.conversationContext() != null) {
            sb.append('\n').append(ctx.conversationContext());
        }
        return sb.toString();
    }

    private void appendWiki(StringBuilder sb, ProjectConfig project) {
        List<WikiPageDocument> pages = wikiPageRepository.findByProjectIdOrderByPathAsc(project.id());
        Optional<WikiPageDocument> home = pages.stream()
                .filter(p -> HOME_PAGE.equalsIgnoreCase(p.getPath()))
                .findFirst();
        sb.append("# Project Wiki\n\n");
        if (home.isPresent()) {
            sb.append(home.get().getContent());
        } else if (pages.isEmpty()) {
            sb.append("# ").append(project.name() != null ? project.name() : project.id()).append(" Wiki\n\n")
                    .append("The wiki has not been initialized yet.");
        } else {
            sb.append("# ").append(project.name() != null ? project.name() : project.id()).append(" Wiki\n\n")
                    .append(pages.size()).append(" pages available.");
        }
        sb.append("\n\n");

        List<WikiPageDocument> keyPages = pages.stream()
                .filter(p -> !HOME_PAGE.equalsIgnoreCase(p.getPath()))
                .limit(KEY_PAGES)
                .collect(Collectors.toList());
        if (!keyPages.isEmpty()) {
            sb.append("## Key Pages\n");
            for (WikiPageDocument page : keyPages) {
                sb.append("- [").append(page.getTitle()).append("](").append(page.getPath()).append("): ")
                        .append(page.getSummary() != null ? page.getSummary() : "").append('\n');
            }
            sb.append('\n');
        }
    }

    private void appendDecisions(StringBuilder sb, ProjectConfig project, GovernanceRequest request) {
        if (request.intent() == null || request.intent().isBlank()) return;
        List<ScoredDecision> relevant = decisionService.search(project.id(), request.intent(),
                RELEVANT_DECISIONS, RELEVANCE_THRESHOLD);
        if (relevant.isEmpty()) return;

        sb.append("# Relevant Past Decisions\n\n");
        sb.append("These past decisions may provide relevant precedent for your current task:\n");
        for (ScoredDecision scored : relevant) {
            var d = scored.decision();
            sb.append("\n## Decision #").append(d.getDecisionNumber()).append(": ").append(d.getTitle()).append('\n');
            sb.append("**Date:** ").append(d.getDate()).append('\n');
            sb.append("**Decision:** ").append(d.getDecision()).append('\n');
            sb.append("**Reasoning:** ").append(d.getReasoning()).append('\n');
        }
        sb.append('\n');
    }

    private void appendConversations(StringBuilder sb, ProjectConfig project, RoleDefinition role) {
        List<ConversationThreadDocument> open = conversationService.activeFor(project.id(), role.name());
        if (open.isEmpty()) return;

        sb.append("# Open Conversations\n\n");
        for (ConversationThreadDocument thread : open) {
            String others = thread.getParticipants().stream()
                    .map(Participant::id)
                    .filter(id -> !id.equalsIgnoreCase(role.name()))
                    .collect(Collectors.joining(", "));
            sb.append("- `").append(thread.getThreadId()).append("` with ").append(others);
            if (thread.getTopic() != null) sb.append(" about: ").append(thread.getTopic());
            sb.append(" (last activity ").append(thread.getUpdatedAt()).append(")\n");
        }
        sb.append('\n');
    }

    String philosophy() {
        String cached = philosophy;
        if (cached != null) return cached;
        Resource resource = resourceLoader.getResource(philosophyLocation);
        try (InputStream in = resource.getInputStream()) {
            cached = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.warn("Foundational principles not readable at {}: {}", philosophyLocation, e.getMessage());
            cached = "No foundational principles configured.";
        }
        philosophy = cached;
        return cached;
    }
}
