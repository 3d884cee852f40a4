package com.network.matching.ai;

import com.network.matching.core.model.Embedding;

import java.util.List;

/**
 * Embedder used when no embedding service is configured.
 * Reports itself unavailable so the matcher skips embedding and scores the semantic metric as 0.
 */
public class NoOpEmbedder implements Embedder {

    @Override
    public List<Embedding> embed(List<String> texts, EmbeddingPurpose purpose) {
        if (texts.isEmpty()) {
            return List.of();
        }
        throw new CollaboratorException("embedder", "No embedding service configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
