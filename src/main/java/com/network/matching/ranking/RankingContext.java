package com.network.matching.ranking;

import com.network.matching.core.model.Embedding;
import com.network.matching.core.model.ParsedQuery;
import com.network.matching.core.model.Profile;

import java.util.List;
import java.util.Objects;

/**
 * Inputs of one ranking pass.
 *
 * @param requester      the profile asking for connections
 * @param candidates     every candidate, in store order
 * @param query          the raw query text
 * @param parsedQuery    structured criteria extracted from the query
 * @param queryEmbedding query embedding, or null when embedding was unavailable
 * @param maxResults     how many results the caller will keep
 */
public record RankingContext(
        Profile requester,
        List<Profile> candidates,
        String query,
        ParsedQuery parsedQuery,
        Embedding queryEmbedding,
        int maxResults
) {
    public RankingContext {
        Objects.requireNonNull(requester, "requester is required");
        Objects.requireNonNull(query, "query is required");
        Objects.requireNonNull(parsedQuery, "parsedQuery is required");
        candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates are required"));
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0");
        }
    }
}
