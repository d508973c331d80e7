package io.github.drompincen.aigov.runtime.embedding;

/**
 * Text embedding capability used for decision indexing and precedent search.
 */
public interface EmbeddingService {

    /**
     * @return the embedding vector, or an empty array when no embedding model is available
     */
    float[] embed(String text);
}
