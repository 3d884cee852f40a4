package com.network.matching.ai;

import java.util.List;

/**
 * Reranker used when no reranking service is configured. Only local ranking is possible with it.
 */
public class NoOpReranker implements Reranker {

    @Override
    public List<RerankResult> rerank(String query, List<RerankDocument> documents, int topN) {
        throw new CollaboratorException("reranker", "No reranking service configured");
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
