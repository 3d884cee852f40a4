package com.network.matching.ai;

import com.network.matching.core.model.Embedding;

import java.util.List;

/**
 * Produces embedding vectors for texts.
 */
public interface Embedder {

    /**
     * Embeds the texts.
     *
     * @return one embedding per input text, in input order; empty input yields empty output
     * @throws CollaboratorException if the upstream service fails
     */
    List<Embedding> embed(List<String> texts, EmbeddingPurpose purpose);

    /**
     * Embeds a single text.
     */
    default Embedding embedOne(String text, EmbeddingPurpose purpose) {
        List<Embedding> embeddings = embed(List.of(text), purpose);
        if (embeddings.size() != 1) {
            throw new CollaboratorException("embedder",
                    "Expected 1 embedding but received " + embeddings.size());
        }
        return embeddings.get(0);
    }

    String getProviderName();

    boolean isAvailable();
}
