package com.network.matching.ranking;

import com.network.matching.core.model.Profile;
import com.network.matching.similarity.ScoreBreakdown;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A candidate with the score a ranking strategy assigned to it.
 *
 * @param profile   the candidate
 * @param score     total score used for ordering
 * @param breakdown per-metric scores, or null when the score came from the reranker
 */
public record RankedCandidate(Profile profile, double score, ScoreBreakdown breakdown) {

    public RankedCandidate {
        Objects.requireNonNull(profile, "profile is required");
    }

    public static RankedCandidate reranked(Profile profile, double relevanceScore) {
        return new RankedCandidate(profile, relevanceScore, null);
    }

    public Optional<ScoreBreakdown> getBreakdown() {
        return Optional.ofNullable(breakdown);
    }

    /**
     * Returns the per-metric scores, or {@code rerank_score} alone for reranked candidates.
     */
    public Map<String, Double> scoreMap() {
        return breakdown != null ? breakdown.asMap() : Map.of("rerank_score", score);
    }
}
