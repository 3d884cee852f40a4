package com.network.matching.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.network.matching.core.model.Embedding;
import com.network.matching.store.LoadResult;
import com.network.matching.store.StoreReloadListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Caffeine-backed embedding cache.
 * Implements {@link StoreReloadListener} so a population reload drops every cached vector:
 * profile ids may be reused with different content after a reload.
 */
public class CaffeineEmbeddingCache implements EmbeddingCache, StoreReloadListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineEmbeddingCache.class);

    private final Cache<String, Embedding> cache;

    public CaffeineEmbeddingCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineEmbeddingCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Map<String, Embedding> getAllPresent(Collection<String> profileIds) {
        return cache.getAllPresent(profileIds);
    }

    @Override
    public void putAll(Map<String, Embedding> embeddings) {
        cache.putAll(embeddings);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached embeddings");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onReload(LoadResult result) {
        invalidateAll();
        log.debug("Embedding cache cleared after reload of {} profiles", result.profileCount());
    }
}
