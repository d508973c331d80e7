package io.github.drompincen.aigov.runtime.decision;

import java.util.List;

/**
 * Fields of a decision about to be logged. Only title, decision and reasoning are expected; the
 * rest are optional.
 */
public record DecisionDraft(
        String title,
        String decision,
        String reasoning,
        String considerations,
        String uncertainties,
        String reversibility,
        String wouldChangeIf,
        String decisionMaker,
        List<String> tags
) {
    public DecisionDraft {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public boolean hasReasoning() {
        return reasoning != null && !reasoning.isBlank();
    }

    public DecisionDraft withMakerAndTags(String maker, List<String> newTags) {
        return new DecisionDraft(title, decision, reasoning, considerations, uncertainties, reversibility,
                wouldChangeIf, decisionMaker != null && !decisionMaker.isBlank() ? decisionMaker : maker, newTags);
    }
}
