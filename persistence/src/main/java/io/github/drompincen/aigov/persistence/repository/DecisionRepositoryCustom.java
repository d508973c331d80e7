package io.github.drompincen.aigov.persistence.repository;

import java.util.List;

public interface DecisionRepositoryCustom {

    /**
     * Reserves the next decision number for a project. Numbers are never reused, even when the
     * decision that reserved one is never saved.
     */
    int nextDecisionNumber(String projectId);

    /**
     * Nearest decisions of a project by cosine similarity, best first, keeping only those at or
     * above {@code threshold}.
     */
    List<ScoredDecision> findSimilar(String projectId, float[] embedding, int limit, double threshold);
}
