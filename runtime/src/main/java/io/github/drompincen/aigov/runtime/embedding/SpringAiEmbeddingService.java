package io.github.drompincen.aigov.runtime.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Service
public class SpringAiEmbeddingService implements EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingService.class);
    private static final float[] NONE = new float[0];

    private final ObjectProvider<EmbeddingModel> embeddingModel;

    public SpringAiEmbeddingService(ObjectProvider<EmbeddingModel> embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) return NONE;
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (model == null) {
            log.warn("No embedding model configured, semantic search disabled for this call");
            return NONE;
        }
        try {
            return model.embed(text);
        } catch (Exception e) {
            log.warn("Embedding failed, continuing without a vector: {}", e.getMessage());
            return NONE;
        }
    }
}
