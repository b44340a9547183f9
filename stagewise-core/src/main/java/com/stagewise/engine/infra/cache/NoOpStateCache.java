package com.stagewise.engine.infra.cache;

import com.stagewise.engine.api.store.StateCache;

import java.time.Duration;
import java.util.Optional;

/**
 * Disabled cache: every lookup misses.
 */
public final class NoOpStateCache implements StateCache {

    public static final NoOpStateCache INSTANCE = new NoOpStateCache();

    private NoOpStateCache() {
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        // nothing cached
    }

    @Override
    public void evict(String key) {
        // nothing cached
    }
}
