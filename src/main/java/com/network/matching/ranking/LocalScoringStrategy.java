package com.network.matching.ranking;

import com.network.matching.ai.CollaboratorException;
import com.network.matching.ai.Embedder;
import com.network.matching.ai.EmbeddingPurpose;
import com.network.matching.cache.EmbeddingCache;
import com.network.matching.cache.NoOpEmbeddingCache;
import com.network.matching.core.model.Embedding;
import com.network.matching.core.model.Profile;
import com.network.matching.metrics.MetricsService;
import com.network.matching.metrics.NoOpMetricsService;
import com.network.matching.similarity.CompositeSimilarityScorer;
import com.network.matching.similarity.ScoreBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ranks candidates by the six-metric composite score.
 *
 * <p>Candidates are sorted by score descending, then by id ascending, so the ordering does not
 * depend on whether scoring ran in parallel. When profile embedding is enabled, document
 * embeddings for the requester and every candidate are taken from the cache or requested from
 * the embedder in one batch; a failure of that batch fails the ranking.</p>
 */
public class LocalScoringStrategy implements RankingStrategy {
    private static final Logger log = LoggerFactory.getLogger(LocalScoringStrategy.class);

    static final Comparator<RankedCandidate> BY_SCORE_THEN_ID =
            Comparator.comparingDouble(RankedCandidate::score).reversed()
                    .thenComparing(candidate -> candidate.profile().getId());

    private final CompositeSimilarityScorer scorer;
    private final Embedder embedder;
    private final EmbeddingCache embeddingCache;
    private final ProfileDocumentFormatter formatter;
    private final MetricsService metricsService;
    private final boolean parallelScoring;
    private final boolean embedProfiles;

    private LocalScoringStrategy(Builder builder) {
        this.scorer = builder.scorer != null ? builder.scorer : new CompositeSimilarityScorer();
        this.embedder = builder.embedder;
        this.embeddingCache = builder.embeddingCache != null ? builder.embeddingCache : new NoOpEmbeddingCache();
        this.formatter = builder.formatter != null ? builder.formatter : new ProfileDocumentFormatter();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.parallelScoring = builder.parallelScoring;
        this.embedProfiles = builder.embedProfiles;
        if (embedProfiles && (embedder == null || !embedder.isAvailable())) {
            throw new IllegalStateException("Profile embedding requires an available embedder");
        }
    }

    @Override
    public List<RankedCandidate> rank(RankingContext context) {
        Profile requester = context.requester();
        Map<String, Embedding> documentEmbeddings = embedProfiles
                ? documentEmbeddings(requester, context.candidates())
                : Map.of();
        Embedding requesterEmbedding = documentEmbeddings.get(requester.getId());

        Stream<Profile> candidates = parallelScoring
                ? context.candidates().parallelStream()
                : context.candidates().stream();

        List<RankedCandidate> ranked = candidates
                .map(candidate -> {
                    ScoreBreakdown breakdown = scorer.computeWithBreakdown(requester, candidate,
                            requesterEmbedding, documentEmbeddings.get(candidate.getId()),
                            context.parsedQuery(), context.queryEmbedding());
                    return new RankedCandidate(candidate, breakdown.compositeScore(), breakdown);
                })
                .sorted(BY_SCORE_THEN_ID)
                .collect(Collectors.toList());

        log.debug("Locally scored {} candidates for {} (parallel={})",
                ranked.size(), requester.getId(), parallelScoring);
        return ranked;
    }

    @Override
    public String explain(RankedCandidate candidate, int mutualConnectionCount) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.ROOT, "Match score: %.3f", candidate.score()));
        parts.add(mutualConnectionCount + " mutual connections");
        candidate.getBreakdown()
                .map(scorer::explain)
                .ifPresent(parts::addAll);
        return String.join(" • ", parts);
    }

    @Override
    public RankingMode getMode() {
        return RankingMode.LOCAL;
    }

    private Map<String, Embedding> documentEmbeddings(Profile requester, List<Profile> candidates) {
        Map<String, Profile> byId = new HashMap<>();
        byId.put(requester.getId(), requester);
        candidates.forEach(candidate -> byId.put(candidate.getId(), candidate));

        Map<String, Embedding> embeddings = new HashMap<>(embeddingCache.getAllPresent(byId.keySet()));
        List<Profile> missing = byId.values().stream()
                .filter(profile -> !embeddings.containsKey(profile.getId()))
                .sorted(Comparator.comparing(Profile::getId))
                .collect(Collectors.toList());
        metricsService.recordCacheHits(embeddings.size());
        metricsService.recordCacheMisses(missing.size());

        if (!missing.isEmpty()) {
            List<String> texts = missing.stream().map(formatter::format).collect(Collectors.toList());
            List<Embedding> fresh = embedder.embed(texts, EmbeddingPurpose.DOCUMENT);
            if (fresh.size() != missing.size()) {
                throw new CollaboratorException("embedder",
                        "Expected " + missing.size() + " document embeddings but received " + fresh.size());
            }
            Map<String, Embedding> computed = new HashMap<>();
            for (int i = 0; i < missing.size(); i++) {
                computed.put(missing.get(i).getId(), fresh.get(i));
            }
            embeddingCache.putAll(computed);
            embeddings.putAll(computed);
        }
        log.debug("Document embeddings: {} cached, {} computed", byId.size() - missing.size(), missing.size());
        return embeddings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CompositeSimilarityScorer scorer;
        private Embedder embedder;
        private EmbeddingCache embeddingCache;
        private ProfileDocumentFormatter formatter;
        private MetricsService metricsService;
        private boolean parallelScoring;
        private boolean embedProfiles;

        public Builder scorer(CompositeSimilarityScorer scorer) {
            this.scorer = Objects.requireNonNull(scorer, "scorer is required");
            return this;
        }

        public Builder embedder(Embedder embedder) {
            this.embedder = embedder;
            return this;
        }

        public Builder embeddingCache(EmbeddingCache embeddingCache) {
            this.embeddingCache = embeddingCache;
            return this;
        }

        public Builder formatter(ProfileDocumentFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
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

        public LocalScoringStrategy build() {
            return new LocalScoringStrategy(this);
        }
    }
}
