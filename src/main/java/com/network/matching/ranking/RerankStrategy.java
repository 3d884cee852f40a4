package com.network.matching.ranking;

import com.network.matching.ai.CollaboratorException;
import com.network.matching.ai.RerankDocument;
import com.network.matching.ai.RerankResult;
import com.network.matching.ai.Reranker;
import com.network.matching.core.model.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks candidates with an external reranker. Each candidate is rendered by the
 * {@link ProfileDocumentFormatter}; the reranker's relevance score becomes the total score
 * and its ordering is kept as returned.
 */
public class RerankStrategy implements RankingStrategy {
    private static final Logger log = LoggerFactory.getLogger(RerankStrategy.class);

    private final Reranker reranker;
    private final ProfileDocumentFormatter formatter;

    public RerankStrategy(Reranker reranker) {
        this(reranker, new ProfileDocumentFormatter());
    }

    public RerankStrategy(Reranker reranker, ProfileDocumentFormatter formatter) {
        this.reranker = Objects.requireNonNull(reranker, "reranker is required");
        this.formatter = Objects.requireNonNull(formatter, "formatter is required");
    }

    @Override
    public List<RankedCandidate> rank(RankingContext context) {
        if (context.candidates().isEmpty()) {
            return List.of();
        }
        Map<String, Profile> byId = new HashMap<>();
        List<RerankDocument> documents = new ArrayList<>(context.candidates().size());
        for (Profile candidate : context.candidates()) {
            byId.put(candidate.getId(), candidate);
            documents.add(new RerankDocument(candidate.getId(), formatter.format(candidate)));
        }

        List<RerankResult> results = reranker.rerank(context.query(), documents, context.maxResults());

        List<RankedCandidate> ranked = new ArrayList<>(results.size());
        for (RerankResult result : results) {
            Profile profile = byId.get(result.id());
            if (profile == null) {
                throw new CollaboratorException("reranker", "Reranker returned unknown document id " + result.id());
            }
            ranked.add(RankedCandidate.reranked(profile, result.relevanceScore()));
        }
        log.debug("Reranker {} returned {} of {} candidates",
                reranker.getProviderName(), ranked.size(), documents.size());
        return ranked;
    }

    @Override
    public String explain(RankedCandidate candidate, int mutualConnectionCount) {
        return String.format(Locale.ROOT, "Rerank score: %.3f • %d mutual connections",
                candidate.score(), mutualConnectionCount);
    }

    @Override
    public RankingMode getMode() {
        return RankingMode.RERANK;
    }
}
