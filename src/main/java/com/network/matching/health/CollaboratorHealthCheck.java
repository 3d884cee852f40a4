package com.network.matching.health;

import com.network.matching.ai.Embedder;
import com.network.matching.ai.QueryParser;
import com.network.matching.ai.Reranker;

/**
 * Reports which collaborators are configured. DEGRADED when the query parser or the embedder
 * is unavailable, since matches then run without structured criteria or semantic scores.
 */
public class CollaboratorHealthCheck implements HealthCheck {

    private final QueryParser queryParser;
    private final Embedder embedder;
    private final Reranker reranker;

    public CollaboratorHealthCheck(QueryParser queryParser, Embedder embedder, Reranker reranker) {
        this.queryParser = queryParser;
        this.embedder = embedder;
        this.reranker = reranker;
    }

    @Override
    public String getName() {
        return "collaborators";
    }

    @Override
    public HealthStatus check() {
        HealthStatus base;
        if (!queryParser.isAvailable()) {
            base = HealthStatus.degraded("Query parser unavailable");
        } else if (!embedder.isAvailable()) {
            base = HealthStatus.degraded("Embedder unavailable");
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("queryParser", queryParser.getProviderName())
                .withDetail("embedder", embedder.getProviderName())
                .withDetail("reranker", reranker.getProviderName());
    }
}
