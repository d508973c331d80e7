package io.github.drompincen.aigov.protocol.api;

import java.time.LocalDate;
import java.util.List;

public record DecisionDto(
        String id,
        int decisionNumber,
        String projectId,
        String title,
        LocalDate date,
        DecisionStatus status,
        String decisionMaker,
        String decision,
        String reasoning,
        String considerations,
        String uncertainties,
        String reversibility,
        String wouldChangeIf,
        List<String> relatedDecisions,
        List<String> tags
) {}
