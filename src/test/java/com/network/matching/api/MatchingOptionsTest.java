package com.network.matching.api;

import com.network.matching.cache.CacheConfig;
import com.network.matching.ranking.RankingMode;
import com.network.matching.similarity.SimilarityWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchingOptions Tests")
class MatchingOptionsTest {

    @Test
    @DisplayName("Defaults should score locally without profile embeddings")
    void defaults() {
        MatchingOptions options = MatchingOptions.defaults();

        assertEquals(RankingMode.LOCAL, options.getRankingMode());
        assertFalse(options.isEmbedProfiles());
        assertEquals(10, options.getDefaultMaxResults());
        assertEquals(30_000, options.getAsyncTimeoutMs());
        assertEquals(SimilarityWeights.defaultWeights(), options.getSimilarityWeights());
        assertEquals(CacheConfig.defaults(), options.getCacheConfig());
    }

    @Test
    @DisplayName("Presets should select their ranking features")
    void presets() {
        assertEquals(RankingMode.RERANK, MatchingOptions.reranked().getRankingMode());
        assertTrue(MatchingOptions.semantic().isEmbedProfiles());
        assertEquals(RankingMode.LOCAL, MatchingOptions.semantic().getRankingMode());
    }

    @Test
    @DisplayName("Builder should reject non-positive limits")
    void rejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().defaultMaxResults(0));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().asyncTimeoutMs(-1));
        assertThrows(IllegalArgumentException.class, () -> MatchingOptions.builder().collaboratorThreads(0));
    }

    @Test
    @DisplayName("Builder should keep custom weights")
    void customWeights() {
        MatchingOptions options = MatchingOptions.builder()
                .similarityWeights(SimilarityWeights.relationshipFocused())
                .parallelScoring(true)
                .build();

        assertEquals(SimilarityWeights.relationshipFocused(), options.getSimilarityWeights());
        assertTrue(options.isParallelScoring());
    }
}
