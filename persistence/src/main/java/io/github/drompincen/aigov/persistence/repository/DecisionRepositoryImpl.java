package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.CounterDocument;
import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class DecisionRepositoryImpl implements DecisionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public DecisionRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public int nextDecisionNumber(String projectId) {
        Query query = Query.query(Criteria.where("_id").is("decisions:" + projectId));
        CounterDocument counter = mongoTemplate.findAndModify(query, new Update().inc("seq", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true), CounterDocument.class);
        if (counter == null) {
            throw new IllegalStateException("Decision counter upsert returned nothing for " + projectId);
        }
        return Math.toIntExact(counter.getSeq());
    }

    @Override
    public List<ScoredDecision> findSimilar(String projectId, float[] embedding, int limit, double threshold) {
        if (embedding == null || embedding.length == 0) return List.of();
        Query query = Query.query(Criteria.where("projectId").is(projectId).and("embedding").exists(true));
        return mongoTemplate.find(query, DecisionDocument.class).stream()
                .map(d -> new ScoredDecision(d, cosine(embedding, d.getEmbedding())))
                .filter(s -> s.similarity() >= threshold)
                .sorted(Comparator.comparingDouble(ScoredDecision::similarity).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    static double cosine(float[] a, List<Double> b) {
        if (b == null || b.size() != a.length) return -1;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            double y = b.get(i);
            dot += a[i] * y;
            normA += a[i] * a[i];
            normB += y * y;
        }
        if (normA == 0 || normB == 0) return -1;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
