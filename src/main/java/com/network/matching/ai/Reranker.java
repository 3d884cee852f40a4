package com.network.matching.ai;

import java.util.List;

/**
 * Orders candidate documents by relevance to a query.
 */
public interface Reranker {

    /**
     * Reranks the documents.
     *
     * @param query     the search query
     * @param documents candidate documents
     * @param topN      maximum number of results
     * @return at most {@code topN} results, most relevant first
     * @throws CollaboratorException if the upstream service fails
     */
    List<RerankResult> rerank(String query, List<RerankDocument> documents, int topN);

    String getProviderName();

    boolean isAvailable();
}
