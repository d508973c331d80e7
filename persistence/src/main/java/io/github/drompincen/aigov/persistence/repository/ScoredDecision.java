package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.DecisionDocument;

public record ScoredDecision(DecisionDocument decision, double similarity) {}
