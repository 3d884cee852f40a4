package com.network.matching.api;

import com.network.matching.core.model.ParsedQuery;
import com.network.matching.core.model.ProfileSummary;

import java.util.List;

/**
 * Result of {@link ConnectionMatcher#findConnections(String, String, int, boolean)}.
 * Results are ordered by rank.
 */
public record MatchResponse(
        String query,
        ParsedQuery parsedQuery,
        ProfileSummary requester,
        List<MatchResult> results,
        MatchMetadata metadata
) {
    public MatchResponse {
        results = List.copyOf(results);
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
