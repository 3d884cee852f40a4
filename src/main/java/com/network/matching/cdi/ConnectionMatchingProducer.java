package com.network.matching.cdi;

import com.network.matching.ai.CohereClient;
import com.network.matching.api.AsyncConnectionMatcher;
import com.network.matching.api.ConnectionMatcher;
import com.network.matching.api.MatchingOptions;
import com.network.matching.cache.CacheConfig;
import com.network.matching.ranking.RankingMode;
import com.network.matching.similarity.SimilarityWeights;
import com.network.matching.source.JsonProfileSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the connection matcher from MicroProfile Config properties.
 *
 * <p>Every property has a default, so an empty configuration yields a matcher with local
 * ranking and no-op collaborators. A typical configuration:</p>
 * <pre>
 * connection-matching:
 *   ranking:
 *     mode: rerank
 *   cohere:
 *     enabled: true
 *     api-key: ${COHERE_API_KEY}
 *   source:
 *     path: /data/network.json
 *     initial-count: 200
 * </pre>
 */
@ApplicationScoped
public class ConnectionMatchingProducer {

    private static final Logger log = LoggerFactory.getLogger(ConnectionMatchingProducer.class);

    // ── Ranking ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-matching.ranking.mode", defaultValue = "local")
    String rankingMode;

    @Inject
    @ConfigProperty(name = "connection-matching.ranking.parallel-scoring", defaultValue = "false")
    boolean parallelScoring;

    @Inject
    @ConfigProperty(name = "connection-matching.ranking.embed-profiles", defaultValue = "false")
    boolean embedProfiles;

    @Inject
    @ConfigProperty(name = "connection-matching.ranking.default-max-results", defaultValue = "10")
    int defaultMaxResults;

    @Inject
    @ConfigProperty(name = "connection-matching.ranking.collaborator-threads", defaultValue = "4")
    int collaboratorThreads;

    // ── Weights ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-matching.weights.semantic", defaultValue = "0.25")
    double semanticWeight;

    @Inject
    @ConfigProperty(name = "connection-matching.weights.relationship", defaultValue = "0.20")
    double relationshipWeight;

    @Inject
    @ConfigProperty(name = "connection-matching.weights.mutual-connections", defaultValue = "0.15")
    double mutualConnectionsWeight;

    @Inject
    @ConfigProperty(name = "connection-matching.weights.company", defaultValue = "0.15")
    double companyWeight;

    @Inject
    @ConfigProperty(name = "connection-matching.weights.education", defaultValue = "0.10")
    double educationWeight;

    @Inject
    @ConfigProperty(name = "connection-matching.weights.query-relevance", defaultValue = "0.15")
    double queryRelevanceWeight;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-matching.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "connection-matching.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "connection-matching.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ── Cohere ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-matching.cohere.enabled", defaultValue = "false")
    boolean cohereEnabled;

    @Inject
    @ConfigProperty(name = "connection-matching.cohere.api-key")
    Optional<String> cohereApiKey;

    @Inject
    @ConfigProperty(name = "connection-matching.cohere.base-url", defaultValue = "https://api.cohere.ai")
    String cohereBaseUrl;

    @Inject
    @ConfigProperty(name = "connection-matching.cohere.chat-model", defaultValue = "command-r-plus-08-2024")
    String cohereChatModel;

    @Inject
    @ConfigProperty(name = "connection-matching.cohere.embed-model", defaultValue = "embed-v4.0")
    String cohereEmbedModel;

    @Inject
    @ConfigProperty(name = "connection-matching.cohere.rerank-model", defaultValue = "rerank-english-v3.0")
    String cohereRerankModel;

    @Inject
    @ConfigProperty(name = "connection-matching.cohere.timeout-seconds", defaultValue = "60")
    int cohereTimeoutSeconds;

    // ── Source ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-matching.source.path")
    Optional<String> sourcePath;

    @Inject
    @ConfigProperty(name = "connection-matching.source.initial-count", defaultValue = "0")
    int sourceInitialCount;

    // ── Async ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "connection-matching.async.timeout-ms", defaultValue = "30000")
    long asyncTimeoutMs;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ConnectionMatcher connectionMatcher() {
        MatchingOptions options = matchingOptions();
        log.info("Producing ConnectionMatcher: {}", options);

        ConnectionMatcher.Builder builder = ConnectionMatcher.builder().options(options);

        if (cohereEnabled) {
            CohereClient cohere = createCohereClient();
            builder.queryParser(cohere).embedder(cohere).reranker(cohere);
            log.info("Cohere collaborators enabled: baseUrl={} rerankModel={}", cohereBaseUrl, cohereRerankModel);
        } else {
            log.info("Cohere collaborators disabled");
        }

        sourcePath.ifPresent(path -> builder.profileSource(new JsonProfileSource(Path.of(path))));

        ConnectionMatcher matcher = builder.build();
        if (sourceInitialCount > 0 && sourcePath.isPresent()) {
            initializeOrClose(matcher);
        }
        return matcher;
    }

    public void closeMatcher(@Disposes ConnectionMatcher matcher) {
        log.info("Closing ConnectionMatcher");
        matcher.close();
    }

    @Produces
    @ApplicationScoped
    public AsyncConnectionMatcher asyncConnectionMatcher(ConnectionMatcher matcher) {
        return matcher.async();
    }

    public void closeAsyncMatcher(@Disposes AsyncConnectionMatcher asyncMatcher) {
        asyncMatcher.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    MatchingOptions matchingOptions() {
        return MatchingOptions.builder()
                .rankingMode(RankingMode.fromString(rankingMode))
                .similarityWeights(new SimilarityWeights(semanticWeight, relationshipWeight,
                        mutualConnectionsWeight, companyWeight, educationWeight, queryRelevanceWeight))
                .parallelScoring(parallelScoring)
                .embedProfiles(embedProfiles)
                .defaultMaxResults(defaultMaxResults)
                .collaboratorThreads(collaboratorThreads)
                .cacheConfig(cacheEnabled
                        ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                        : CacheConfig.disabled())
                .asyncTimeoutMs(asyncTimeoutMs)
                .build();
    }

    void initializeOrClose(ConnectionMatcher matcher) {
        try {
            matcher.initialize(sourceInitialCount);
        } catch (RuntimeException e) {
            log.error("Initial load from {} failed, closing matcher: {}", sourcePath.orElse("?"), e.getMessage());
            matcher.close();
            throw e;
        }
    }

    private CohereClient createCohereClient() {
        if (cohereApiKey.isEmpty() || cohereApiKey.get().isBlank()) {
            log.warn("Cohere enabled without connection-matching.cohere.api-key; collaborators will report unavailable");
        }
        return CohereClient.builder()
                .apiKey(cohereApiKey.orElse(null))
                .baseUrl(cohereBaseUrl)
                .chatModel(cohereChatModel)
                .embedModel(cohereEmbedModel)
                .rerankModel(cohereRerankModel)
                .timeout(Duration.ofSeconds(cohereTimeoutSeconds))
                .build();
    }
}
