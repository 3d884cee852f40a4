package com.network.matching.api;

import com.network.matching.cache.CacheConfig;
import com.network.matching.ranking.RankingMode;
import com.network.matching.similarity.SimilarityWeights;

import java.util.Objects;

/**
 * Options for the connection matcher: ranking mode, similarity weights, scoring behaviour,
 * caching and timeouts.
 */
public class MatchingOptions {

    private static final int DEFAULT_MAX_RESULTS = 10;
    private static final long DEFAULT_ASYNC_TIMEOUT_MS = 30_000;
    private static final int DEFAULT_COLLABORATOR_THREADS = 4;

    private final RankingMode rankingMode;
    private final SimilarityWeights similarityWeights;
    private final boolean parallelScoring;
    private final boolean embedProfiles;
    private final int defaultMaxResults;
    private final long asyncTimeoutMs;
    private final int collaboratorThreads;
    private final CacheConfig cacheConfig;

    private MatchingOptions(Builder builder) {
        this.rankingMode = builder.rankingMode;
        this.similarityWeights = builder.similarityWeights;
        this.parallelScoring = builder.parallelScoring;
        this.embedProfiles = builder.embedProfiles;
        this.defaultMaxResults = builder.defaultMaxResults;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
        this.collaboratorThreads = builder.collaboratorThreads;
        this.cacheConfig = builder.cacheConfig;
    }

    public RankingMode getRankingMode() {
        return rankingMode;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public boolean isParallelScoring() {
        return parallelScoring;
    }

    public boolean isEmbedProfiles() {
        return embedProfiles;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public int getCollaboratorThreads() {
        return collaboratorThreads;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Options ranking candidates with the external reranker.
     */
    public static MatchingOptions reranked() {
        return builder().rankingMode(RankingMode.RERANK).build();
    }

    /**
     * Options scoring locally with profile document embeddings, so the semantic metric is populated.
     */
    public static MatchingOptions semantic() {
        return builder().embedProfiles(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RankingMode rankingMode = RankingMode.LOCAL;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private boolean parallelScoring = false;
        private boolean embedProfiles = false;
        private int defaultMaxResults = DEFAULT_MAX_RESULTS;
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;
        private int collaboratorThreads = DEFAULT_COLLABORATOR_THREADS;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder rankingMode(RankingMode rankingMode) {
            this.rankingMode = Objects.requireNonNull(rankingMode, "rankingMode is required");
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            this.similarityWeights = Objects.requireNonNull(similarityWeights, "similarityWeights is required");
            return this;
        }

        public Builder parallelScoring(boolean parallelScoring) {
            this.parallelScoring = parallelScoring;
            return this;
        }

        public Builder embedProfiles(boolean embedProfiles) {
            this.embedProfiles = embedProfiles;
            return this;
        }

        public Builder defaultMaxResults(int defaultMaxResults) {
            if (defaultMaxResults <= 0) {
                throw new IllegalArgumentException("defaultMaxResults must be positive");
            }
            this.defaultMaxResults = defaultMaxResults;
            return this;
        }

        public Builder asyncTimeoutMs(long asyncTimeoutMs) {
            if (asyncTimeoutMs <= 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be positive");
            }
            this.asyncTimeoutMs = asyncTimeoutMs;
            return this;
        }

        public Builder collaboratorThreads(int collaboratorThreads) {
            if (collaboratorThreads <= 0) {
                throw new IllegalArgumentException("collaboratorThreads must be positive");
            }
            this.collaboratorThreads = collaboratorThreads;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "rankingMode=" + rankingMode +
                ", parallelScoring=" + parallelScoring +
                ", embedProfiles=" + embedProfiles +
                ", defaultMaxResults=" + defaultMaxResults +
                ", asyncTimeoutMs=" + asyncTimeoutMs +
                ", collaboratorThreads=" + collaboratorThreads +
                ", cacheEnabled=" + cacheConfig.enabled() +
                '}';
    }
}
