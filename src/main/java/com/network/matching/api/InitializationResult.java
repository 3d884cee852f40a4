package com.network.matching.api;

/**
 * Outcome of {@link ConnectionMatcher#initialize(int)}.
 *
 * @param profileCount    profiles loaded
 * @param connectionCount undirected connections after symmetrization
 * @param source          description of the population source
 */
public record InitializationResult(int profileCount, int connectionCount, String source) {
}
