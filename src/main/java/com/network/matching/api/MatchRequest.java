package com.network.matching.api;

import java.util.Objects;

/**
 * A match request for batch submission through {@link AsyncConnectionMatcher}.
 * A null {@code maxResults} uses the matcher's configured default.
 */
public record MatchRequest(String requesterId, String query, Integer maxResults, boolean includeExplanations) {

    public MatchRequest {
        Objects.requireNonNull(requesterId, "requesterId is required");
        Objects.requireNonNull(query, "query is required");
    }

    public static MatchRequest of(String requesterId, String query) {
        return new MatchRequest(requesterId, query, null, true);
    }
}
