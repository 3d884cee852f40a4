package com.network.matching.store;

/**
 * Outcome of a successful population load.
 *
 * @param profileCount     number of profiles loaded
 * @param connectionCount  number of undirected connections after back-edge insertion
 * @param interactionCount number of directed interaction records
 * @param backEdgesAdded   number of reverse connection entries the store had to insert
 */
public record LoadResult(int profileCount, int connectionCount, int interactionCount, int backEdgesAdded) {
}
