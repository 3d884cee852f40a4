package com.network.matching.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Async view of a {@link ConnectionMatcher}. Every returned future fails with a
 * {@link java.util.concurrent.TimeoutException} when the call outlives the configured timeout;
 * the underlying collaborator calls are not cancelled.
 */
public interface AsyncConnectionMatcher extends AutoCloseable {

    CompletableFuture<MatchResponse> findConnectionsAsync(String requesterId, String query,
                                                          int maxResults, boolean includeExplanations);

    /**
     * Runs a batch of requests in parallel. Results are in request order.
     */
    CompletableFuture<List<MatchResponse>> findConnectionsBatchAsync(List<MatchRequest> requests);

    /**
     * Runs a batch of requests with at most {@code maxConcurrency} in flight.
     */
    CompletableFuture<List<MatchResponse>> findConnectionsBatchAsync(List<MatchRequest> requests,
                                                                     int maxConcurrency);

    @Override
    void close();
}
