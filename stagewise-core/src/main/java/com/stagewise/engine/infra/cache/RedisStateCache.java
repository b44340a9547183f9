/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.infra.cache;

import com.stagewise.engine.api.store.StateCache;
import org.redisson.api.RMapCache;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Session state cache shared by every engine instance through a Redis map
 * with per-entry TTL.
 *
 * <p>The cache is an accelerator only. A Redis failure is logged and treated
 * as a miss, and the engine falls back to the document store.
 */
public class RedisStateCache implements StateCache {

    private static final Logger logger = Logger.getLogger(RedisStateCache.class.getName());

    private static final String CACHE_NAME = "stagewise:session-state";

    private final RMapCache<String, String> map;

    public RedisStateCache(RedissonClient redisson) {
        this.map = redisson.getMapCache(CACHE_NAME, StringCodec.INSTANCE);
        logger.info("RedisStateCache initialized: map=" + CACHE_NAME);
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(map.get(key));
        } catch (RedisException e) {
            logger.log(Level.WARNING, "Redis read failed for " + key + ", treating as miss", e);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        try {
            map.fastPut(key, value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RedisException e) {
            logger.log(Level.WARNING, "Redis write failed for " + key, e);
        }
    }

    @Override
    public void evict(String key) {
        try {
            map.fastRemove(key);
        } catch (RedisException e) {
            logger.log(Level.WARNING, "Redis evict failed for " + key, e);
        }
    }
}
