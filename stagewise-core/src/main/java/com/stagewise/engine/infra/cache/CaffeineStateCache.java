package com.stagewise.engine.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.stagewise.engine.api.store.StateCache;

import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * In-process session state cache backed by Caffeine.
 *
 * <p>Each entry carries its own time-to-live, so session state and jump
 * return points can share one cache with different lifetimes.
 */
public class CaffeineStateCache implements StateCache {

    private static final Logger logger = Logger.getLogger(CaffeineStateCache.class.getName());

    private final Cache<String, Entry> cache;

    public CaffeineStateCache(long maxSize) {
        this(maxSize, Ticker.systemTicker());
    }

    public CaffeineStateCache(long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .recordStats()
                .build();
        logger.info("Created Caffeine state cache: maxSize=" + maxSize);
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl.toNanos()));
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private record Entry(String value, long ttlNanos) {
    }

    private static final class PerEntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
