package com.network.matching.metrics;

import com.network.matching.ranking.RankingMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallable() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordMatchDuration(RankingMode.LOCAL, Duration.ofMillis(10));
                noOp.recordCandidatesEvaluated(20);
                noOp.recordMatchScore(0.4);
                noOp.incrementCollaboratorFailure("parser");
                noOp.incrementEmbeddingDegraded();
                noOp.recordCacheHits(3);
                noOp.recordCacheMisses(1);
                noOp.incrementStoreLoad(true);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record match duration per ranking mode")
        void matchDuration() {
            metrics.recordMatchDuration(RankingMode.LOCAL, Duration.ofMillis(120));
            metrics.recordMatchDuration(RankingMode.LOCAL, Duration.ofMillis(80));
            metrics.recordMatchDuration(RankingMode.RERANK, Duration.ofMillis(300));

            Timer local = registry.find("matching.duration").tag("rankingMode", "LOCAL").timer();
            Timer rerank = registry.find("matching.duration").tag("rankingMode", "RERANK").timer();

            assertNotNull(local);
            assertEquals(2, local.count());
            assertNotNull(rerank);
            assertEquals(1, rerank.count());
        }

        @Test
        @DisplayName("Should record candidates and scores as summaries")
        void summaries() {
            metrics.recordCandidatesEvaluated(49);
            metrics.recordMatchScore(0.5);
            metrics.recordMatchScore(0.7);

            DistributionSummary candidates = registry.find("matching.candidates").summary();
            DistributionSummary scores = registry.find("matching.score").summary();

            assertEquals(49.0, candidates.totalAmount());
            assertEquals(2, scores.count());
            assertEquals(0.7, scores.max(), 1e-9);
        }

        @Test
        @DisplayName("Should count collaborator failures per collaborator")
        void collaboratorFailures() {
            metrics.incrementCollaboratorFailure("parser");
            metrics.incrementCollaboratorFailure("parser");
            metrics.incrementCollaboratorFailure("reranker");

            Counter parser = registry.find("matching.collaborator.failure").tag("collaborator", "parser").counter();
            Counter reranker = registry.find("matching.collaborator.failure").tag("collaborator", "reranker").counter();

            assertEquals(2.0, parser.count());
            assertEquals(1.0, reranker.count());
        }

        @Test
        @DisplayName("Should count degraded embeddings and cache traffic")
        void degradedAndCache() {
            metrics.incrementEmbeddingDegraded();
            metrics.recordCacheHits(5);
            metrics.recordCacheMisses(2);
            metrics.recordCacheMisses(0);

            assertEquals(1.0, registry.find("matching.embedding.degraded").counter().count());
            assertEquals(5.0, registry.find("matching.cache.hit").counter().count());
            assertEquals(2.0, registry.find("matching.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Should tag store loads by outcome")
        void storeLoads() {
            metrics.incrementStoreLoad(true);
            metrics.incrementStoreLoad(false);
            metrics.incrementStoreLoad(true);

            assertEquals(2.0, registry.find("store.load").tag("outcome", "success").counter().count());
            assertEquals(1.0, registry.find("store.load").tag("outcome", "rejected").counter().count());
        }
    }
}
