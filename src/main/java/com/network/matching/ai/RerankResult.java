package com.network.matching.ai;

import java.util.Objects;

/**
 * Reranker output for one document.
 *
 * @param id             id of the submitted document
 * @param relevanceScore relevance in [0, 1] as reported by the reranker
 * @param rank           1-based position in the reranker's ordering
 */
public record RerankResult(String id, double relevanceScore, int rank) {
    public RerankResult {
        Objects.requireNonNull(id, "id is required");
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1");
        }
    }
}
