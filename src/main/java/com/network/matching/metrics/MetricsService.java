package com.network.matching.metrics;

import com.network.matching.ranking.RankingMode;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordMatchDuration(RankingMode mode, Duration duration);

    void recordCandidatesEvaluated(int count);

    void recordMatchScore(double score);

    /**
     * @param collaborator {@code parser}, {@code embedder} or {@code reranker}
     */
    void incrementCollaboratorFailure(String collaborator);

    void incrementEmbeddingDegraded();

    void recordCacheHits(int count);

    void recordCacheMisses(int count);

    void incrementStoreLoad(boolean success);
}
