package io.github.drompincen.aigov.runtime.routing;

import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.IntentCategory;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.RoleDefinition;
import io.github.drompincen.aigov.protocol.api.TrustLevel;
import io.github.drompincen.aigov.runtime.error.ProjectConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Picks the role that handles a request: intent category first, then the first candidate role of
 * that category whose accepted trust set includes the request's trust level.
 */
@Service
public class IntentRouter {

    private static final Logger log = LoggerFactory.getLogger(IntentRouter.class);

    static final Map<IntentCategory, List<String>> DEFAULT_ROUTING = Map.of(
            IntentCategory.TRIAGE, List.of("reception", "maintainer"),
            IntentCategory.GOVERNANCE, List.of("maintainer"),
            IntentCategory.REVIEW, List.of("maintainer"),
            IntentCategory.DEVELOPMENT, List.of("engineer", "maintainer"),
            IntentCategory.MAINTENANCE, List.of("engineer", "maintainer"));

    private static final Set<String> DEVELOPMENT_LABELS =
            Set.of("ready-for-development", "approved-for-development", "approved");
    private static final List<String> GOVERNANCE_KEYWORDS =
            List.of("governance", "challenge", "evaluate", "assess priority", "appeal", "constitution", "decision");
    private static final List<String> DEVELOPMENT_KEYWORDS =
            List.of("implement", "fix_bug", "fix bug", "develop", "refactor");
    private static final List<String> REVIEW_KEYWORDS =
            List.of("pull request", "pr #", "review", "merged", "ci failure");
    private static final List<String> TRIAGE_KEYWORDS =
            List.of("new issue", "issue #", "comment on issue");

    public RoutingDecision route(GovernanceRequest request, ProjectConfig project) {
        IntentCategory category = classifyIntent(request);
        RoutingDecision decision = findBestRole(category, request.trust(), project);
        log.info("Routed request {} ({}, trust {}) to role {}{}", request.id(), category,
                request.trust().wireName(), decision.role().name(), decision.fallback() ? " via fallback" : "");
        return decision;
    }

    /**
     * Ordered rules: development labels, maintenance, notifications, then keyword families.
     */
    public IntentCategory classifyIntent(GovernanceRequest request) {
        String text = request.intent() != null ? request.intent().toLowerCase() : "";
        Map<String, Object> payload = request.payload();

        if (labelsOf(payload).stream().anyMatch(DEVELOPMENT_LABELS::contains)) {
            return IntentCategory.DEVELOPMENT;
        }
        if (Boolean.TRUE.equals(payload.get("scheduled")) || text.contains("maintenance")) {
            return IntentCategory.MAINTENANCE;
        }
        if (text.contains("notification for")) {
            if (text.contains("notification for engineer")) return IntentCategory.DEVELOPMENT;
            if (text.contains("notification for maintainer")) return IntentCategory.GOVERNANCE;
            if (text.contains("notification for reception")) return IntentCategory.TRIAGE;
        }
        if (containsAny(text, GOVERNANCE_KEYWORDS)) return IntentCategory.GOVERNANCE;
        if (containsAny(text, DEVELOPMENT_KEYWORDS)) return IntentCategory.DEVELOPMENT;
        if (text.contains("triage")) return IntentCategory.TRIAGE;
        if (containsAny(text, REVIEW_KEYWORDS)) return IntentCategory.REVIEW;
        if (containsAny(text, TRIAGE_KEYWORDS)) return IntentCategory.TRIAGE;
        return IntentCategory.UNKNOWN;
    }

    public RoutingDecision findBestRole(IntentCategory category, TrustLevel trust, ProjectConfig project) {
        if (category != IntentCategory.UNKNOWN) {
            List<String> candidates = project.routingFor(category)
                    .orElse(DEFAULT_ROUTING.getOrDefault(category, List.of()));
            for (String candidate : candidates) {
                Optional<RoleDefinition> role = project.findRole(candidate);
                if (role.isPresent() && role.get().accepts(trust)) {
                    return new RoutingDecision(category, role.get(), false);
                }
            }
        }

        for (RoleDefinition role : project.roles()) {
            if (role.accepts(trust)) return new RoutingDecision(category, role, true);
        }
        // a role named reception gets no trust exemption
        throw new ProjectConfigurationException(
                "No role in project " + project.id() + " accepts trust level " + trust.wireName());
    }

    @SuppressWarnings("unchecked")
    static List<String> labelsOf(Map<String, Object> payload) {
        List<String> labels = new ArrayList<>();
        collectLabels(payload.get("labels"), labels);
        if (payload.get("issue") instanceof Map<?, ?> issue) {
            collectLabels(((Map<String, Object>) issue).get("labels"), labels);
        }
        if (payload.get("pull_request") instanceof Map<?, ?> pr) {
            collectLabels(((Map<String, Object>) pr).get("labels"), labels);
        }
        return labels;
    }

    private static void collectLabels(Object value, List<String> into) {
        if (!(value instanceof Collection<?> items)) return;
        for (Object item : items) {
            if (item instanceof String s) {
                into.add(s.toLowerCase());
            } else if (item instanceof Map<?, ?> m && m.get("name") != null) {
                into.add(m.get("name").toString().toLowerCase());
            }
        }
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }
}
