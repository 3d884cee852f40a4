package com.network.matching.metrics;

import com.network.matching.ranking.RankingMode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchDuration(RankingMode mode, Duration duration) {
    }

    @Override
    public void recordCandidatesEvaluated(int count) {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void incrementCollaboratorFailure(String collaborator) {
    }

    @Override
    public void incrementEmbeddingDegraded() {
    }

    @Override
    public void recordCacheHits(int count) {
    }

    @Override
    public void recordCacheMisses(int count) {
    }

    @Override
    public void incrementStoreLoad(boolean success) {
    }
}
