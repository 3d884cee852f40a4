package com.network.matching.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Thread-pool implementation of {@link AsyncConnectionMatcher}.
 */
public class AsyncConnectionMatcherImpl implements AsyncConnectionMatcher {
    private static final Logger log = LoggerFactory.getLogger(AsyncConnectionMatcherImpl.class);

    private final ConnectionMatcher matcher;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncConnectionMatcherImpl(ConnectionMatcher matcher, long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.matcher = matcher;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newCachedThreadPool(new AsyncThreadFactory());
    }

    @Override
    public CompletableFuture<MatchResponse> findConnectionsAsync(String requesterId, String query,
                                                                 int maxResults, boolean includeExplanations) {
        return CompletableFuture.supplyAsync(
                () -> matcher.findConnections(requesterId, query, maxResults, includeExplanations),
                executor
        ).orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<MatchResponse>> findConnectionsBatchAsync(List<MatchRequest> requests) {
        List<CompletableFuture<MatchResponse>> futures = requests.stream()
                .map(req -> findConnectionsAsync(req.requesterId(), req.query(),
                        maxResultsOf(req), req.includeExplanations()))
                .collect(Collectors.toList());
        return allOf(futures);
    }

    @Override
    public CompletableFuture<List<MatchResponse>> findConnectionsBatchAsync(List<MatchRequest> requests,
                                                                            int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }

        Semaphore semaphore = new Semaphore(maxConcurrency);

        List<CompletableFuture<MatchResponse>> futures = requests.stream()
                .map(req -> CompletableFuture.supplyAsync(() -> {
                    try {
                        semaphore.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CompletionException(e);
                    }
                    try {
                        return matcher.findConnections(req.requesterId(), req.query(),
                                maxResultsOf(req), req.includeExplanations());
                    } finally {
                        semaphore.release();
                    }
                }, executor).orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .collect(Collectors.toList());

        log.debug("Submitted batch of {} match requests (maxConcurrency={})", requests.size(), maxConcurrency);
        return allOf(futures);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private int maxResultsOf(MatchRequest request) {
        return request.maxResults() != null ? request.maxResults() : matcher.getOptions().getDefaultMaxResults();
    }

    private static CompletableFuture<List<MatchResponse>> allOf(List<CompletableFuture<MatchResponse>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList()));
    }

    private static class AsyncThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "matching-async-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
