package com.network.matching.metrics;

import com.network.matching.ranking.RankingMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code matching.duration}: Timer (tag: rankingMode)</li>
 *   <li>{@code matching.candidates}: DistributionSummary</li>
 *   <li>{@code matching.score}: DistributionSummary of returned scores</li>
 *   <li>{@code matching.collaborator.failure}: Counter (tag: collaborator)</li>
 *   <li>{@code matching.embedding.degraded}: Counter</li>
 *   <li>{@code matching.cache.hit} and {@code matching.cache.miss}: Counters</li>
 *   <li>{@code store.load}: Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary candidatesSummary;
    private final DistributionSummary scoreSummary;
    private final Counter embeddingDegradedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.candidatesSummary = DistributionSummary.builder("matching.candidates")
                .description("Number of candidates evaluated per match request")
                .register(registry);
        this.scoreSummary = DistributionSummary.builder("matching.score")
                .description("Distribution of scores of returned matches")
                .register(registry);
        this.embeddingDegradedCounter = Counter.builder("matching.embedding.degraded")
                .description("Match requests that proceeded without a query embedding")
                .register(registry);
        this.cacheHitCounter = Counter.builder("matching.cache.hit")
                .description("Document embeddings served from the cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("matching.cache.miss")
                .description("Document embeddings requested from the embedder")
                .register(registry);
    }

    @Override
    public void recordMatchDuration(RankingMode mode, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(mode.name(), k ->
                Timer.builder("matching.duration")
                        .description("Duration of match requests")
                        .tag("rankingMode", mode.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCandidatesEvaluated(int count) {
        candidatesSummary.record(count);
    }

    @Override
    public void recordMatchScore(double score) {
        scoreSummary.record(score);
    }

    @Override
    public void incrementCollaboratorFailure(String collaborator) {
        counter("failure:" + collaborator, "matching.collaborator.failure",
                "Failed calls to external collaborators", "collaborator", collaborator).increment();
    }

    @Override
    public void incrementEmbeddingDegraded() {
        embeddingDegradedCounter.increment();
    }

    @Override
    public void recordCacheHits(int count) {
        cacheHitCounter.increment(count);
    }

    @Override
    public void recordCacheMisses(int count) {
        cacheMissCounter.increment(count);
    }

    @Override
    public void incrementStoreLoad(boolean success) {
        String outcome = success ? "success" : "rejected";
        counter("load:" + outcome, "store.load", "Population loads", "outcome", outcome).increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
