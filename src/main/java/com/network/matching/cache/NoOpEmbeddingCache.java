package com.network.matching.cache;

import com.network.matching.core.model.Embedding;

import java.util.Collection;
import java.util.Map;

/**
 * Cache that stores nothing, used when caching is disabled.
 */
public class NoOpEmbeddingCache implements EmbeddingCache {

    @Override
    public Map<String, Embedding> getAllPresent(Collection<String> profileIds) {
        return Map.of();
    }

    @Override
    public void putAll(Map<String, Embedding> embeddings) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
