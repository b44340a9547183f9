/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.infra.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runtime configuration of the navigation engine.
 *
 * <p>Values come from three layers, later layers winning:
 * <ol>
 *   <li>builder defaults</li>
 *   <li>{@code stagewise.properties} (classpath first, then file system)</li>
 *   <li>environment variables {@code STAGEWISE_*}</li>
 * </ol>
 *
 * <h2>Environment Variables</h2>
 * <pre>
 * STAGEWISE_CACHE_TYPE              CAFFEINE | REDIS | NO_OP
 * STAGEWISE_STORE_TYPE              IN_MEMORY | JDBC
 * STAGEWISE_SESSION_TTL_SECONDS     cached session lifetime (86400)
 * STAGEWISE_HOLD_TTL_SECONDS        capacity hold lifetime (1800)
 * STAGEWISE_JUMP_RETURN_TTL_SECONDS jump return point lifetime (3600)
 * STAGEWISE_ACTIVE_TIMEOUT_SECONDS  stale active marker cutoff (7200)
 * STAGEWISE_BALANCED_MAX_ATTEMPTS   compare-and-increment attempts (16)
 * STAGEWISE_CACHE_MAX_SIZE          in-process cache entries (10000)
 * STAGEWISE_REDIS_ADDRESS           redis://host:port
 * STAGEWISE_REDIS_PASSWORD
 * STAGEWISE_REDIS_TIMEOUT_MS        (3000)
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EngineConfig config = EngineConfig.loadDefault();
 *
 * EngineConfig custom = EngineConfig.builder()
 *     .cacheType(EngineConfig.CacheType.REDIS)
 *     .redisAddress("redis://cache:6379")
 *     .build();
 * }</pre>
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "stagewise.properties";

    private static final String ENV_PREFIX = "STAGEWISE_";

    public enum CacheType {
        /** In-process Caffeine cache with per-entry expiry. */
        CAFFEINE,
        /** Shared Redis map cache, for multi-instance deployments. */
        REDIS,
        /** Caching disabled; every read goes to the document store. */
        NO_OP
    }

    public enum StoreType {
        IN_MEMORY,
        JDBC
    }

    private final CacheType cacheType;
    private final StoreType storeType;
    private final Duration sessionTtl;
    private final Duration holdTtl;
    private final Duration jumpReturnTtl;
    private final Duration activeTimeout;
    private final int balancedMaxAttempts;
    private final long cacheMaxSize;
    private final String redisAddress;
    private final String redisPassword;
    private final int redisTimeoutMs;

    private EngineConfig(Builder builder) {
        this.cacheType = builder.cacheType;
        this.storeType = builder.storeType;
        this.sessionTtl = Duration.ofSeconds(builder.sessionTtlSeconds);
        this.holdTtl = Duration.ofSeconds(builder.holdTtlSeconds);
        this.jumpReturnTtl = Duration.ofSeconds(builder.jumpReturnTtlSeconds);
        this.activeTimeout = Duration.ofSeconds(builder.activeTimeoutSeconds);
        this.balancedMaxAttempts = builder.balancedMaxAttempts;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.redisAddress = builder.redisAddress;
        this.redisPassword = builder.redisPassword;
        this.redisTimeoutMs = builder.redisTimeoutMs;
        validate(builder);
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static Builder builder() {
        return new Builder(false);
    }

    /**
     * Builder that ignores the process environment. Used by tests so a
     * developer's shell variables cannot change the outcome.
     */
    public static Builder isolatedBuilder() {
        return new Builder(true);
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES}, falling back to defaults plus
     * environment overrides when the file is absent.
     */
    public static EngineConfig loadDefault() {
        try {
            return loadFromProperties(DEFAULT_PROPERTIES);
        } catch (IOException e) {
            logger.info("No " + DEFAULT_PROPERTIES + " found, using defaults and environment");
            return builder().build();
        }
    }

    /**
     * Loads a properties file from the classpath, then from the file system.
     * Environment variables override file values.
     *
     * @throws IOException if the file is found in neither place
     */
    public static EngineConfig loadFromProperties(String path) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(path)) {
            if (in != null) {
                properties.load(in);
                logger.info("Loaded engine configuration from classpath: " + path);
                return builderFromProperties(properties, false).build();
            }
        }
        try (InputStream in = new FileInputStream(path)) {
            properties.load(in);
            logger.info("Loaded engine configuration from file: " + path);
            return builderFromProperties(properties, false).build();
        }
    }

    /**
     * Builder seeded from {@code properties}. Keys are the lower-case,
     * dot-separated forms of the environment variable names, e.g.
     * {@code cache.type} or {@code hold.ttl.seconds}.
     */
    public static Builder builderFromProperties(Properties properties, boolean skipEnvironment) {
        Builder builder = new Builder(true);
        prop(properties, "cache.type", v -> CacheType.valueOf(v.toUpperCase())).ifPresent(builder::cacheType);
        prop(properties, "store.type", v -> StoreType.valueOf(v.toUpperCase())).ifPresent(builder::storeType);
        prop(properties, "session.ttl.seconds", Long::parseLong).ifPresent(builder::sessionTtlSeconds);
        prop(properties, "hold.ttl.seconds", Long::parseLong).ifPresent(builder::holdTtlSeconds);
        prop(properties, "jump.return.ttl.seconds", Long::parseLong).ifPresent(builder::jumpReturnTtlSeconds);
        prop(properties, "active.timeout.seconds", Long::parseLong).ifPresent(builder::activeTimeoutSeconds);
        prop(properties, "balanced.max.attempts", Integer::parseInt).ifPresent(builder::balancedMaxAttempts);
        prop(properties, "cache.max.size", Long::parseLong).ifPresent(builder::cacheMaxSize);
        prop(properties, "redis.address", Function.identity()).ifPresent(builder::redisAddress);
        prop(properties, "redis.password", Function.identity()).ifPresent(builder::redisPassword);
        prop(properties, "redis.timeout.ms", Integer::parseInt).ifPresent(builder::redisTimeoutMs);
        if (!skipEnvironment) {
            builder.applyEnvironmentVariables();
        }
        return builder;
    }

    /**
     * Development preset: in-process cache and store, short holds.
     */
    public static EngineConfig forDevelopment() {
        return isolatedBuilder()
                .cacheType(CacheType.CAFFEINE)
                .storeType(StoreType.IN_MEMORY)
                .holdTtlSeconds(300)
                .build();
    }

    /**
     * Production preset: shared Redis cache and JDBC store.
     */
    public static EngineConfig forProduction(String redisAddress, String redisPassword) {
        return builder()
                .cacheType(CacheType.REDIS)
                .storeType(StoreType.JDBC)
                .redisAddress(redisAddress)
                .redisPassword(redisPassword)
                .build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(true);
        builder.cacheType = cacheType;
        builder.storeType = storeType;
        builder.sessionTtlSeconds = sessionTtl.getSeconds();
        builder.holdTtlSeconds = holdTtl.getSeconds();
        builder.jumpReturnTtlSeconds = jumpReturnTtl.getSeconds();
        builder.activeTimeoutSeconds = activeTimeout.getSeconds();
        builder.balancedMaxAttempts = balancedMaxAttempts;
        builder.cacheMaxSize = cacheMaxSize;
        builder.redisAddress = redisAddress;
        builder.redisPassword = redisPassword;
        builder.redisTimeoutMs = redisTimeoutMs;
        return builder;
    }

    private static <T> Optional<T> prop(Properties properties, String key, Function<String, T> parser) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parser.apply(value.trim()));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Ignoring invalid value for " + key + ": " + value, e);
            return Optional.empty();
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private static void validate(Builder b) {
        requirePositive("sessionTtlSeconds", b.sessionTtlSeconds);
        requirePositive("holdTtlSeconds", b.holdTtlSeconds);
        requirePositive("jumpReturnTtlSeconds", b.jumpReturnTtlSeconds);
        requirePositive("activeTimeoutSeconds", b.activeTimeoutSeconds);
        requirePositive("balancedMaxAttempts", b.balancedMaxAttempts);
        requirePositive("cacheMaxSize", b.cacheMaxSize);
        if (b.cacheType == CacheType.REDIS) {
            if (b.redisAddress == null || b.redisAddress.isBlank()) {
                throw new IllegalArgumentException("redisAddress is required for REDIS cache type");
            }
            requirePositive("redisTimeoutMs", b.redisTimeoutMs);
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public CacheType getCacheType() { return cacheType; }

    public StoreType getStoreType() { return storeType; }

    public Duration getSessionTtl() { return sessionTtl; }

    public Duration getHoldTtl() { return holdTtl; }

    public Duration getJumpReturnTtl() { return jumpReturnTtl; }

    public Duration getActiveTimeout() { return activeTimeout; }

    public int getBalancedMaxAttempts() { return balancedMaxAttempts; }

    public long getCacheMaxSize() { return cacheMaxSize; }

    public String getRedisAddress() { return redisAddress; }

    public String getRedisPassword() { return redisPassword; }

    public int getRedisTimeoutMs() { return redisTimeoutMs; }

    @Override
    public String toString() {
        return "EngineConfig{cacheType=" + cacheType
                + ", storeType=" + storeType
                + ", sessionTtl=" + sessionTtl
                + ", holdTtl=" + holdTtl
                + ", jumpReturnTtl=" + jumpReturnTtl
                + ", activeTimeout=" + activeTimeout
                + ", balancedMaxAttempts=" + balancedMaxAttempts
                + ", cacheMaxSize=" + cacheMaxSize
                + (cacheType == CacheType.REDIS ? ", redisAddress=" + redisAddress : "")
                + '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private CacheType cacheType = CacheType.CAFFEINE;
        private StoreType storeType = StoreType.IN_MEMORY;
        private long sessionTtlSeconds = 86_400;
        private long holdTtlSeconds = 1_800;
        private long jumpReturnTtlSeconds = 3_600;
        private long activeTimeoutSeconds = 7_200;
        private int balancedMaxAttempts = 16;
        private long cacheMaxSize = 10_000;
        private String redisAddress = "redis://localhost:6379";
        private String redisPassword;
        private int redisTimeoutMs = 3_000;

        private Builder(boolean skipEnvironment) {
            if (!skipEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnv("CACHE_TYPE").map(v -> CacheType.valueOf(v.toUpperCase())).ifPresent(this::cacheType);
            getEnv("STORE_TYPE").map(v -> StoreType.valueOf(v.toUpperCase())).ifPresent(this::storeType);
            getEnvLong("SESSION_TTL_SECONDS").ifPresent(this::sessionTtlSeconds);
            getEnvLong("HOLD_TTL_SECONDS").ifPresent(this::holdTtlSeconds);
            getEnvLong("JUMP_RETURN_TTL_SECONDS").ifPresent(this::jumpReturnTtlSeconds);
            getEnvLong("ACTIVE_TIMEOUT_SECONDS").ifPresent(this::activeTimeoutSeconds);
            getEnvInt("BALANCED_MAX_ATTEMPTS").ifPresent(this::balancedMaxAttempts);
            getEnvLong("CACHE_MAX_SIZE").ifPresent(this::cacheMaxSize);
            getEnv("REDIS_ADDRESS").ifPresent(this::redisAddress);
            getEnv("REDIS_PASSWORD").ifPresent(this::redisPassword);
            getEnvInt("REDIS_TIMEOUT_MS").ifPresent(this::redisTimeoutMs);
        }

        private static Optional<String> getEnv(String name) {
            String value = System.getenv(ENV_PREFIX + name);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        }

        private static Optional<Long> getEnvLong(String name) {
            return getEnv(name).flatMap(v -> parse(name, v, Long::parseLong));
        }

        private static Optional<Integer> getEnvInt(String name) {
            return getEnv(name).flatMap(v -> parse(name, v, Integer::parseInt));
        }

        private static <T> Optional<T> parse(String name, String value, Function<String, T> parser) {
            try {
                return Optional.of(parser.apply(value));
            } catch (NumberFormatException e) {
                logger.warning("Invalid " + ENV_PREFIX + name + ": " + value);
                return Optional.empty();
            }
        }

        public Builder cacheType(CacheType cacheType) {
            this.cacheType = cacheType;
            return this;
        }

        public Builder storeType(StoreType storeType) {
            this.storeType = storeType;
            return this;
        }

        public Builder sessionTtlSeconds(long seconds) {
            this.sessionTtlSeconds = seconds;
            return this;
        }

        public Builder holdTtlSeconds(long seconds) {
            this.holdTtlSeconds = seconds;
            return this;
        }

        public Builder jumpReturnTtlSeconds(long seconds) {
            this.jumpReturnTtlSeconds = seconds;
            return this;
        }

        public Builder activeTimeoutSeconds(long seconds) {
            this.activeTimeoutSeconds = seconds;
            return this;
        }

        public Builder balancedMaxAttempts(int attempts) {
            this.balancedMaxAttempts = attempts;
            return this;
        }

        public Builder cacheMaxSize(long maxSize) {
            this.cacheMaxSize = maxSize;
            return this;
        }

        public Builder redisAddress(String address) {
            this.redisAddress = address;
            return this;
        }

        public Builder redisPassword(String password) {
            this.redisPassword = password;
            return this;
        }

        public Builder redisTimeoutMs(int timeoutMs) {
            this.redisTimeoutMs = timeoutMs;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
