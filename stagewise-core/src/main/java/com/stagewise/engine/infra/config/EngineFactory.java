/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.infra.config;

import com.stagewise.engine.api.store.CapacityLedger;
import com.stagewise.engine.api.store.DistributionCounterStore;
import com.stagewise.engine.api.store.DocumentStore;
import com.stagewise.engine.api.store.StateCache;
import com.stagewise.engine.compiler.model.ExperimentModel;
import com.stagewise.engine.evaluator.counter.InMemoryDistributionCounterStore;
import com.stagewise.engine.infra.cache.CaffeineStateCache;
import com.stagewise.engine.infra.cache.NoOpStateCache;
import com.stagewise.engine.infra.cache.RedisStateCache;
import com.stagewise.engine.infra.capacity.InMemoryCapacityLedger;
import com.stagewise.engine.infra.capacity.RedisCapacityLedger;
import com.stagewise.engine.infra.metrics.NavigationMetrics;
import com.stagewise.engine.infra.store.InMemoryDocumentStore;
import com.stagewise.engine.infra.store.JdbcDistributionCounterStore;
import com.stagewise.engine.infra.store.JdbcDocumentStore;
import com.stagewise.engine.infra.telemetry.TracingService;
import com.stagewise.engine.navigation.NavigationEngine;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires a {@link NavigationEngine} and its stores from an {@link EngineConfig}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * // Development: everything in process memory
 * NavigationEngine engine = EngineFactory.create(model, EngineConfig.forDevelopment());
 *
 * // Production: sessions and counters in PostgreSQL, cache and quotas in Redis
 * EngineConfig config = EngineConfig.loadDefault();
 * NavigationEngine engine = EngineFactory.create(model, config, dataSource,
 *         EngineFactory.createRedissonClient(config));
 * }</pre>
 *
 * <p>With {@code REDIS} caching, capacity reservations are kept in Redis as
 * well so that every instance sees the same holds; otherwise they stay in
 * process memory.
 */
public final class EngineFactory {

    private static final Logger logger = Logger.getLogger(EngineFactory.class.getName());

    private EngineFactory() {
        throw new AssertionError("EngineFactory should not be instantiated");
    }

    /**
     * Creates an engine without external resources. A Redis client is opened
     * when the config asks for the Redis cache.
     *
     * @throws IllegalStateException if the config asks for the JDBC store
     */
    public static NavigationEngine create(ExperimentModel model, EngineConfig config) {
        RedissonClient redisson = config.getCacheType() == EngineConfig.CacheType.REDIS
                ? createRedissonClient(config) : null;
        return create(model, config, null, redisson);
    }

    /**
     * @param dataSource required for {@code JDBC} storage, ignored otherwise
     * @param redisson   required for the {@code REDIS} cache, ignored otherwise
     */
    public static NavigationEngine create(ExperimentModel model, EngineConfig config, DataSource dataSource,
                                          RedissonClient redisson) {
        logger.info("Creating navigation engine for " + model.experimentId() + ": " + config);
        Clock clock = Clock.systemUTC();
        return NavigationEngine.builder(model)
                .config(config)
                .clock(clock)
                .documentStore(createDocumentStore(config, dataSource, clock))
                .counters(createCounterStore(config, dataSource))
                .cache(createCache(config, redisson))
                .capacity(createCapacityLedger(config, redisson, clock))
                .tracing(TracingService.getInstance())
                .metrics(new NavigationMetrics())
                .build();
    }

    public static DocumentStore createDocumentStore(EngineConfig config, DataSource dataSource, Clock clock) {
        return switch (config.getStoreType()) {
            case IN_MEMORY -> new InMemoryDocumentStore(clock);
            case JDBC -> {
                DataSource source = requireDataSource(dataSource);
                JdbcDocumentStore.initializeSchema(source);
                yield new JdbcDocumentStore(source, clock);
            }
        };
    }

    public static DistributionCounterStore createCounterStore(EngineConfig config, DataSource dataSource) {
        return switch (config.getStoreType()) {
            case IN_MEMORY -> new InMemoryDistributionCounterStore();
            case JDBC -> new JdbcDistributionCounterStore(requireDataSource(dataSource));
        };
    }

    public static StateCache createCache(EngineConfig config, RedissonClient redisson) {
        return switch (config.getCacheType()) {
            case CAFFEINE -> new CaffeineStateCache(config.getCacheMaxSize());
            case REDIS -> new RedisStateCache(requireRedisson(redisson));
            case NO_OP -> NoOpStateCache.INSTANCE;
        };
    }

    public static CapacityLedger createCapacityLedger(EngineConfig config, RedissonClient redisson, Clock clock) {
        if (config.getCacheType() == EngineConfig.CacheType.REDIS) {
            return new RedisCapacityLedger(requireRedisson(redisson));
        }
        return new InMemoryCapacityLedger(clock);
    }

    /**
     * Opens a single-server Redisson client and checks the connection.
     *
     * @throws IllegalStateException if Redis cannot be reached
     */
    public static RedissonClient createRedissonClient(EngineConfig config) {
        Config redisConfig = new Config();
        redisConfig.useSingleServer()
                .setAddress(config.getRedisAddress())
                .setPassword(config.getRedisPassword())
                .setTimeout(config.getRedisTimeoutMs());
        logger.info(String.format("Configuring Redis: address=%s, timeout=%dms",
                config.getRedisAddress(), config.getRedisTimeoutMs()));

        RedissonClient redisson = Redisson.create(redisConfig);
        try {
            redisson.getKeys().count();
            logger.info("Redis connection validated successfully");
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to connect to Redis", e);
            redisson.shutdown();
            throw new IllegalStateException("Redis connection failed", e);
        }
        return redisson;
    }

    private static DataSource requireDataSource(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalStateException("JDBC storage requires a DataSource");
        }
        return dataSource;
    }

    private static RedissonClient requireRedisson(RedissonClient redisson) {
        if (redisson == null) {
            throw new IllegalStateException("Redis caching requires a RedissonClient");
        }
        return redisson;
    }
}
