package com.network.matching.cache;

import com.network.matching.core.model.Embedding;

import java.util.Collection;
import java.util.Map;

/**
 * Cache of profile document embeddings keyed by profile id.
 */
public interface EmbeddingCache {

    /**
     * Returns the cached embeddings among {@code profileIds}. Ids without an entry are absent
     * from the returned map.
     */
    Map<String, Embedding> getAllPresent(Collection<String> profileIds);

    void putAll(Map<String, Embedding> embeddings);

    void invalidateAll();

    CacheStats getStats();
}
