package io.github.drompincen.aigov.runtime.decision;

import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import io.github.drompincen.aigov.persistence.repository.DecisionRepository;
import io.github.drompincen.aigov.persistence.repository.ScoredDecision;
import io.github.drompincen.aigov.protocol.api.DecisionDto;
import io.github.drompincen.aigov.protocol.api.DecisionStatus;
import io.github.drompincen.aigov.runtime.embedding.EmbeddingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class DecisionService {

    private static final Logger log = LoggerFactory.getLogger(DecisionService.class);

    private final DecisionRepository decisionRepository;
    private final EmbeddingService embeddingService;
    private final Clock clock;

    public DecisionService(DecisionRepository decisionRepository, EmbeddingService embeddingService, Clock clock) {
        this.decisionRepository = decisionRepository;
        this.embeddingService = embeddingService;
        this.clock = clock;
    }

    /**
     * Embeds and persists a decision under the project's next sequential number. Logging the same
     * draft twice yields two decisions with distinct numbers.
     */
    public DecisionDocument log(String projectId, DecisionDraft draft) {
        float[] embedding = embeddingService.embed(draft.title() + "\n" + draft.decision() + "\n" + draft.reasoning());

        DecisionDocument doc = new DecisionDocument();
        doc.setId(UUID.randomUUID().toString());
        doc.setDecisionNumber(decisionRepository.nextDecisionNumber(projectId));
        doc.setProjectId(projectId);
        doc.setTitle(draft.title());
        doc.setDate(LocalDate.now(clock));
        doc.setStatus(DecisionStatus.ADOPTED);
        doc.setDecisionMaker(draft.decisionMaker());
        doc.setDecision(draft.decision());
        doc.setReasoning(draft.reasoning());
        doc.setConsiderations(draft.considerations());
        doc.setUncertainties(draft.uncertainties());
        doc.setReversibility(draft.reversibility());
        doc.setWouldChangeIf(draft.wouldChangeIf());
        doc.setEmbedding(toList(embedding));
        doc.setTags(new ArrayList<>(draft.tags()));
        doc.setCreatedAt(clock.instant());
        decisionRepository.save(doc);
        log.info("Logged decision #{} '{}' for project {}", doc.getDecisionNumber(), doc.getTitle(), projectId);
        return doc;
    }

    public List<ScoredDecision> search(String projectId, String query, int limit, double threshold) {
        float[] embedding = embeddingService.embed(query);
        if (embedding.length == 0) return List.of();
        return decisionRepository.findSimilar(projectId, embedding, limit, threshold);
    }

    public Optional<DecisionDocument> get(String decisionId) {
        return decisionRepository.findById(decisionId);
    }

    public List<DecisionDocument> recent(String projectId, int limit) {
        return decisionRepository.findByProjectIdOrderByDecisionNumberDesc(projectId, PageRequest.of(0, Math.max(1, limit)));
    }

    public void linkRelated(String decisionId, String relatedId) {
        decisionRepository.findById(decisionId).ifPresent(doc -> {
            if (!doc.getRelatedDecisions().contains(relatedId)) {
                doc.getRelatedDecisions().add(relatedId);
                decisionRepository.save(doc);
            }
        });
    }

    public static DecisionDto toDto(DecisionDocument doc) {
        return new DecisionDto(doc.getId(), doc.getDecisionNumber(), doc.getProjectId(), doc.getTitle(),
                doc.getDate(), doc.getStatus(), doc.getDecisionMaker(), doc.getDecision(), doc.getReasoning(),
                doc.getConsiderations(), doc.getUncertainties(), doc.getReversibility(), doc.getWouldChangeIf(),
                doc.getRelatedDecisions(), doc.getTags());
    }

    private static List<Double> toList(float[] embedding) {
        if (embedding.length == 0) return null;
        List<Double> values = new ArrayList<>(embedding.length);
        for (float v : embedding) values.add((double) v);
        return values;
    }
}
