package com.network.matching.api;

import com.network.matching.ai.CollaboratorException;
import com.network.matching.ai.Embedder;
import com.network.matching.ai.EmbeddingPurpose;
import com.network.matching.ai.QueryParser;
import com.network.matching.core.model.Embedding;
import com.network.matching.core.model.ParsedQuery;
import com.network.matching.core.model.Profile;
import com.network.matching.core.model.ProfileSummary;
import com.network.matching.graph.ConnectionPath;
import com.network.matching.graph.GraphQueries;
import com.network.matching.logging.LogContext;
import com.network.matching.metrics.MetricsService;
import com.network.matching.ranking.RankedCandidate;
import com.network.matching.ranking.RankingContext;
import com.network.matching.ranking.RankingStrategy;
import com.network.matching.store.PopulationSnapshot;
import com.network.matching.store.ProfileStore;
import com.network.matching.tracing.Span;
import com.network.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Orchestrates one match request: validation, requester lookup, concurrent query parsing and
 * embedding, ranking, truncation and result assembly.
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Invalid arguments fail with {@link IllegalArgumentException} and an unknown requester with
 *       {@link com.network.matching.store.ProfileNotFoundException}, both before any collaborator call.</li>
 *   <li>Query embedding is best-effort: a failure or an unavailable embedder degrades to no
 *       embedding, so semantic query scores are 0.</li>
 *   <li>Parsing or ranking failures abort the request with {@link MatchingServiceException}.
 *       Nothing is retried.</li>
 * </ul>
 */
public class MatchingPipeline {
    private static final Logger log = LoggerFactory.getLogger(MatchingPipeline.class);

    static final int MAX_HIGHLIGHTS = 5;

    private final ProfileStore store;
    private final QueryParser queryParser;
    private final Embedder embedder;
    private final RankingStrategy rankingStrategy;
    private final Executor collaboratorExecutor;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public MatchingPipeline(ProfileStore store, QueryParser queryParser, Embedder embedder,
                            RankingStrategy rankingStrategy, Executor collaboratorExecutor,
                            MetricsService metricsService, TracingService tracingService) {
        this.store = store;
        this.queryParser = queryParser;
        this.embedder = embedder;
        this.rankingStrategy = rankingStrategy;
        this.collaboratorExecutor = collaboratorExecutor;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public MatchResponse findConnections(String requesterId, String query, int maxResults,
                                         boolean includeExplanations) {
        validate(requesterId, query, maxResults);
        PopulationSnapshot population = store.snapshot();
        Profile requester = population.get(requesterId);

        Instant start = Instant.now();
        String correlationId = LogContext.generateCorrelationId();

        try (LogContext ctx = LogContext.forMatch(correlationId, requesterId);
             Span span = tracingService.startSpan("match.find", Map.of(
                     "requesterId", requesterId,
                     "rankingMode", rankingStrategy.getMode().name()))) {

            span.setAttribute("maxResults", maxResults);
            try {
                CompletableFuture<ParsedQuery> parsing =
                        CompletableFuture.supplyAsync(() -> queryParser.parse(query), collaboratorExecutor);
                CompletableFuture<Embedding> embedding = embedQuery(query);

                ParsedQuery parsedQuery = awaitParsedQuery(parsing);
                Embedding queryEmbedding = awaitQueryEmbedding(embedding, span);

                List<Profile> candidates = population.allExcept(requesterId);
                List<RankedCandidate> ranked = rank(new RankingContext(
                        requester, candidates, query, parsedQuery, queryEmbedding, maxResults));

                List<RankedCandidate> top = ranked.size() > maxResults ? ranked.subList(0, maxResults) : ranked;
                List<MatchResult> results = assemble(new GraphQueries(population), requester, top,
                        includeExplanations);

                Duration elapsed = Duration.between(start, Instant.now());
                MatchMetadata metadata = new MatchMetadata(candidates.size(), elapsed, Instant.now(),
                        rankingStrategy.getMode(), queryEmbedding != null);

                metricsService.recordMatchDuration(rankingStrategy.getMode(), elapsed);
                metricsService.recordCandidatesEvaluated(candidates.size());
                results.forEach(result -> metricsService.recordMatchScore(result.totalScore()));

                span.setAttribute("candidates", candidates.size());
                span.setAttribute("results", results.size());
                span.setStatus(Span.SpanStatus.OK);
                log.info("match.completed requester={} results={} candidates={} durationMs={}",
                        requesterId, results.size(), candidates.size(), elapsed.toMillis());

                return new MatchResponse(query, parsedQuery, requester.toSummary(), results, metadata);
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private static void validate(String requesterId, String query, int maxResults) {
        if (requesterId == null || requesterId.isBlank()) {
            throw new IllegalArgumentException("requesterId must not be blank");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
    }

    private CompletableFuture<Embedding> embedQuery(String query) {
        if (!embedder.isAvailable()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.supplyAsync(
                () -> embedder.embedOne(query, EmbeddingPurpose.QUERY), collaboratorExecutor);
    }

    private ParsedQuery awaitParsedQuery(CompletableFuture<ParsedQuery> parsing) {
        try {
            ParsedQuery parsed = parsing.join();
            if (parsed == null) {
                throw new CollaboratorException("parser", "Query parser returned no result");
            }
            return parsed;
        } catch (CompletionException | CollaboratorException e) {
            Throwable cause = unwrap(e);
            log.error("match.parse.failed provider={} error={}", queryParser.getProviderName(), cause.getMessage(), cause);
            metricsService.incrementCollaboratorFailure("parser");
            throw new MatchingServiceException("Query could not be processed");
        }
    }

    private Embedding awaitQueryEmbedding(CompletableFuture<Embedding> embedding, Span span) {
        Embedding result = null;
        String reason = null;
        try {
            result = embedding.join();
            if (result == null) {
                reason = "embedder " + embedder.getProviderName() + " unavailable";
            }
        } catch (CompletionException e) {
            reason = unwrap(e).getMessage();
            metricsService.incrementCollaboratorFailure("embedder");
        }
        if (result == null) {
            log.warn("match.embedding.degraded reason={}", reason);
            metricsService.incrementEmbeddingDegraded();
            span.addEvent("embedding.degraded");
        }
        return result;
    }

    private List<RankedCandidate> rank(RankingContext context) {
        try {
            return rankingStrategy.rank(context);
        } catch (RuntimeException e) {
            String collaborator = e instanceof CollaboratorException collaboratorError
                    ? collaboratorError.getCollaborator()
                    : "ranking";
            log.error("match.ranking.failed mode={} collaborator={} error={}",
                    rankingStrategy.getMode(), collaborator, e.getMessage(), e);
            metricsService.incrementCollaboratorFailure(collaborator);
            throw new MatchingServiceException("Candidates could not be ranked");
        }
    }

    private List<MatchResult> assemble(GraphQueries graphQueries, Profile requester,
                                       List<RankedCandidate> ranked, boolean includeExplanations) {
        List<MatchResult> results = new ArrayList<>(ranked.size());
        int rank = 1;
        for (RankedCandidate candidate : ranked) {
            Profile profile = candidate.profile();
            List<ProfileSummary> mutual = graphQueries.mutualConnections(requester, profile);
            ConnectionPath path = graphQueries.classifyPath(requester, profile);
            List<String> skills = profile.getSkills();
            List<String> highlights = skills.size() > MAX_HIGHLIGHTS ? skills.subList(0, MAX_HIGHLIGHTS) : skills;
            String explanation = includeExplanations
                    ? rankingStrategy.explain(candidate, mutual.size())
                    : null;

            results.add(new MatchResult(rank++, profile, candidate.score(), candidate.scoreMap(),
                    mutual, highlights, path, explanation));
        }
        return results;
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
