package com.network.matching.api;

import com.network.matching.ai.Embedder;
import com.network.matching.ai.NoOpEmbedder;
import com.network.matching.ai.NoOpQueryParser;
import com.network.matching.ai.NoOpReranker;
import com.network.matching.ai.QueryParser;
import com.network.matching.ai.Reranker;
import com.network.matching.cache.CacheStats;
import com.network.matching.cache.CaffeineEmbeddingCache;
import com.network.matching.cache.EmbeddingCache;
import com.network.matching.cache.NoOpEmbeddingCache;
import com.network.matching.core.model.ConnectionEdge;
import com.network.matching.core.model.Profile;
import com.network.matching.core.model.ProfileSummary;
import com.network.matching.graph.ConnectionPath;
import com.network.matching.graph.GraphQueries;
import com.network.matching.health.CollaboratorHealthCheck;
import com.network.matching.health.HealthCheckRegistry;
import com.network.matching.health.HealthStatus;
import com.network.matching.health.ProfileStoreHealthCheck;
import com.network.matching.logging.LogContext;
import com.network.matching.metrics.MetricsService;
import com.network.matching.metrics.NoOpMetricsService;
import com.network.matching.ranking.LocalScoringStrategy;
import com.network.matching.ranking.ProfileDocumentFormatter;
import com.network.matching.ranking.RankingMode;
import com.network.matching.ranking.RankingStrategy;
import com.network.matching.ranking.RerankStrategy;
import com.network.matching.similarity.CompositeSimilarityScorer;
import com.network.matching.source.ProfilePopulation;
import com.network.matching.source.ProfileSource;
import com.network.matching.stats.NetworkStatistics;
import com.network.matching.stats.StatsSummary;
import com.network.matching.store.DataIntegrityException;
import com.network.matching.store.LoadResult;
import com.network.matching.store.PopulationSnapshot;
import com.network.matching.store.ProfileStore;
import com.network.matching.store.StoreReloadListener;
import com.network.matching.tracing.NoOpTracingService;
import com.network.matching.tracing.Span;
import com.network.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point of the connection matching library.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (ConnectionMatcher matcher = ConnectionMatcher.builder()
 *         .profileSource(new JsonProfileSource(Path.of("network.json")))
 *         .queryParser(cohere)
 *         .embedder(cohere)
 *         .build()) {
 *
 *     matcher.initialize(200);
 *     MatchResponse response = matcher.findConnections("p-17", "AI engineers who worked at a large search company", 5, true);
 *     response.results().forEach(r -> System.out.println(r.rank() + " " + r.profile().getName()));
 * }
 * </pre>
 *
 * <p>Instances are thread-safe. Match requests read an immutable snapshot of the population,
 * so they may run concurrently with a reload.</p>
 */
public class ConnectionMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionMatcher.class);

    private final ProfileStore store;
    private final NetworkStatistics networkStatistics;
    private final MatchingPipeline pipeline;
    private final ProfileSource profileSource;
    private final EmbeddingCache embeddingCache;
    private final MatchingOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final HealthCheckRegistry healthCheckRegistry;
    private final ExecutorService collaboratorExecutor;

    private ConnectionMatcher(Builder builder) {
        this.options = builder.options;
        this.store = builder.store != null ? builder.store : new ProfileStore();
        this.profileSource = builder.profileSource;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        QueryParser queryParser = builder.queryParser != null ? builder.queryParser : new NoOpQueryParser();
        Embedder embedder = builder.embedder != null ? builder.embedder : new NoOpEmbedder();
        Reranker reranker = builder.reranker != null ? builder.reranker : new NoOpReranker();

        if (builder.embeddingCache != null) {
            this.embeddingCache = builder.embeddingCache;
        } else if (options.getCacheConfig().enabled()) {
            this.embeddingCache = new CaffeineEmbeddingCache(options.getCacheConfig());
        } else {
            this.embeddingCache = new NoOpEmbeddingCache();
        }
        if (embeddingCache instanceof StoreReloadListener reloadListener) {
            store.addReloadListener(reloadListener);
        }

        RankingStrategy rankingStrategy = createRankingStrategy(embedder, reranker);

        this.networkStatistics = new NetworkStatistics();
        this.collaboratorExecutor = Executors.newFixedThreadPool(
                options.getCollaboratorThreads(), new CollaboratorThreadFactory());
        this.pipeline = new MatchingPipeline(store, queryParser, embedder, rankingStrategy,
                collaboratorExecutor, metricsService, tracingService);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new ProfileStoreHealthCheck(store));
        healthCheckRegistry.register(new CollaboratorHealthCheck(queryParser, embedder, reranker));

        log.info("ConnectionMatcher initialized: {} parser={} embedder={} reranker={}",
                options, queryParser.getProviderName(), embedder.getProviderName(), reranker.getProviderName());
    }

    private RankingStrategy createRankingStrategy(Embedder embedder, Reranker reranker) {
        ProfileDocumentFormatter formatter = new ProfileDocumentFormatter();
        if (options.getRankingMode() == RankingMode.RERANK) {
            if (!reranker.isAvailable()) {
                throw new IllegalStateException("RERANK ranking mode requires an available reranker, got "
                        + reranker.getProviderName());
            }
            return new RerankStrategy(reranker, formatter);
        }
        return LocalScoringStrategy.builder()
                .scorer(new CompositeSimilarityScorer(options.getSimilarityWeights()))
                .embedder(embedder)
                .embeddingCache(embeddingCache)
                .formatter(formatter)
                .metricsService(metricsService)
                .parallelScoring(options.isParallelScoring())
                .embedProfiles(options.isEmbedProfiles())
                .build();
    }

    // ========== Matching API ==========

    /**
     * Finds the best connections for a requester.
     *
     * @param requesterId         id of the requesting profile
     * @param query               natural-language description of who the requester wants to meet
     * @param maxResults          maximum number of results, at least 1
     * @param includeExplanations whether to attach a human-readable explanation to each result
     * @throws IllegalArgumentException if an argument is invalid
     * @throws com.network.matching.store.ProfileNotFoundException if the requester is not loaded
     * @throws MatchingServiceException if query parsing or ranking failed
     */
    public MatchResponse findConnections(String requesterId, String query, int maxResults,
                                         boolean includeExplanations) {
        return pipeline.findConnections(requesterId, query, maxResults, includeExplanations);
    }

    /**
     * Finds connections with the configured default result count and explanations included.
     */
    public MatchResponse findConnections(String requesterId, String query) {
        return findConnections(requesterId, query, options.getDefaultMaxResults(), true);
    }

    // ========== Population API ==========

    /**
     * Loads at most {@code candidateCount} profiles from the configured profile source.
     *
     * @throws IllegalArgumentException if {@code candidateCount <= 0}
     * @throws IllegalStateException    if no profile source is configured
     */
    public InitializationResult initialize(int candidateCount) {
        if (candidateCount <= 0) {
            throw new IllegalArgumentException("candidateCount must be > 0");
        }
        if (profileSource == null) {
            throw new IllegalStateException("No profile source configured");
        }
        try (LogContext ctx = LogContext.forLoad(LogContext.generateCorrelationId(), profileSource.getDescription());
             Span span = tracingService.startSpan("matcher.initialize")) {
            span.setAttribute("candidateCount", candidateCount);
            ProfilePopulation population = profileSource.read(candidateCount);
            LoadResult result = load(population.profiles(), population.edges());
            span.setAttribute("profiles", result.profileCount());
            span.setStatus(Span.SpanStatus.OK);
            log.info("matcher.initialized source={} profiles={} connections={}",
                    profileSource.getDescription(), result.profileCount(), result.connectionCount());
            return new InitializationResult(result.profileCount(), result.connectionCount(),
                    profileSource.getDescription());
        }
    }

    /**
     * Replaces the population with the given profiles and additional connections.
     *
     * @throws DataIntegrityException if the population is inconsistent; the previous one is kept
     */
    public LoadResult load(Collection<Profile> profiles, Collection<ConnectionEdge> edges) {
        try {
            LoadResult result = store.load(profiles, edges);
            metricsService.incrementStoreLoad(true);
            return result;
        } catch (DataIntegrityException e) {
            metricsService.incrementStoreLoad(false);
            throw e;
        }
    }

    // ========== Graph API ==========

    /**
     * Returns up to five connections shared by two profiles.
     *
     * @throws com.network.matching.store.ProfileNotFoundException if either id is not loaded
     */
    public List<ProfileSummary> mutualConnections(String firstId, String secondId) {
        PopulationSnapshot population = store.snapshot();
        return new GraphQueries(population).mutualConnections(population.get(firstId), population.get(secondId));
    }

    /**
     * Classifies how {@code fromId} can reach {@code toId}.
     *
     * @throws com.network.matching.store.ProfileNotFoundException if either id is not loaded
     */
    public ConnectionPath connectionPath(String fromId, String toId) {
        PopulationSnapshot population = store.snapshot();
        return new GraphQueries(population).classifyPath(population.get(fromId), population.get(toId));
    }

    public StatsSummary networkStats() {
        return networkStatistics.compute(store);
    }

    // ========== Operational API ==========

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    public CacheStats getEmbeddingCacheStats() {
        return embeddingCache.getStats();
    }

    public MatchingOptions getOptions() {
        return options;
    }

    public ProfileStore getStore() {
        return store;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public TracingService getTracingService() {
        return tracingService;
    }

    /**
     * Creates an async view of this matcher. The caller owns the returned instance and must close it.
     */
    public AsyncConnectionMatcher async() {
        return new AsyncConnectionMatcherImpl(this, options.getAsyncTimeoutMs());
    }

    @Override
    public void close() {
        collaboratorExecutor.shutdown();
        try {
            if (!collaboratorExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                collaboratorExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            collaboratorExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("ConnectionMatcher closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ProfileStore store;
        private ProfileSource profileSource;
        private QueryParser queryParser;
        private Embedder embedder;
        private Reranker reranker;
        private EmbeddingCache embeddingCache;
        private MatchingOptions options = MatchingOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;

        /**
         * Uses an existing store instead of a new empty one.
         */
        public Builder store(ProfileStore store) {
            this.store = store;
            return this;
        }

        public Builder profileSource(ProfileSource profileSource) {
            this.profileSource = profileSource;
            return this;
        }

        public Builder queryParser(QueryParser queryParser) {
            this.queryParser = queryParser;
            return this;
        }

        public Builder embedder(Embedder embedder) {
            this.embedder = embedder;
            return this;
        }

        public Builder reranker(Reranker reranker) {
            this.reranker = reranker;
            return this;
        }

        /**
         * Overrides the cache built from {@link MatchingOptions#getCacheConfig()}.
         */
        public Builder embeddingCache(EmbeddingCache embeddingCache) {
            this.embeddingCache = embeddingCache;
            return this;
        }

        public Builder options(MatchingOptions options) {
            this.options = Objects.requireNonNull(options, "options are required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * @throws IllegalStateException if the options need a collaborator that is unavailable
         */
        public ConnectionMatcher build() {
            return new ConnectionMatcher(this);
        }
    }

    private static class CollaboratorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "matching-collaborator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
