package com.network.matching.store;

/**
 * Listener notified after the profile store has published a new population.
 * Implementations should invalidate any state derived from the previous population.
 */
@FunctionalInterface
public interface StoreReloadListener {

    void onReload(LoadResult result);
}
