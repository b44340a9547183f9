/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.stagewise.engine.api.exceptions.NavigationException;
import com.stagewise.engine.api.store.DocumentStore;
import com.stagewise.engine.api.store.StateCache;
import com.stagewise.engine.api.store.VersionedDocument;
import com.stagewise.engine.infra.metrics.NavigationMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-through cache over a versioned document collection, with values
 * serialized as JSON.
 *
 * <p>Reads try the cache first and fall back to the document store,
 * re-caching what they find. Writes are optimistic: a value carries the
 * version it was read at, and saving it succeeds only if nobody wrote in
 * between. A lost race evicts the cached copy and is reported as
 * {@link NavigationException.Reason#CONCURRENT_MODIFICATION}.
 *
 * @param <T> stored value type
 */
public abstract class JsonDocumentRepository<T> {

    private static final Logger logger = Logger.getLogger(JsonDocumentRepository.class.getName());

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final String collection;
    private final Class<T> type;
    private final DocumentStore store;
    private final StateCache cache;
    private final Duration ttl;
    private final Clock clock;
    private final NavigationMetrics metrics;

    protected JsonDocumentRepository(String collection, Class<T> type, DocumentStore store, StateCache cache,
                                     Duration ttl, Clock clock, NavigationMetrics metrics) {
        this.collection = collection;
        this.type = type;
        this.store = store;
        this.cache = cache;
        this.ttl = ttl;
        this.clock = clock;
        this.metrics = metrics;
    }

    protected abstract long versionOf(T value);

    protected abstract T withVersion(T value, long version, Instant updatedAt);

    /**
     * Cached copy if present, durable copy otherwise.
     */
    public Optional<T> find(String id) {
        Optional<String> cached = cache.get(cacheKey(id));
        if (cached.isPresent()) {
            T value = readQuietly(cached.get(), id);
            if (value != null) {
                metrics.recordCacheLookup(true);
                return Optional.of(value);
            }
            cache.evict(cacheKey(id));
        }
        metrics.recordCacheLookup(false);
        Optional<VersionedDocument> document = store.find(collection, id);
        if (document.isEmpty()) {
            return Optional.empty();
        }
        VersionedDocument doc = document.get();
        T value = withVersion(read(doc.body()), doc.version(), doc.updatedAt());
        cache.put(cacheKey(id), write(value), ttl);
        return Optional.of(value);
    }

    /**
     * Writes {@code value} if its version is still current.
     *
     * @return the stored value, carrying the new version
     * @throws NavigationException with {@code CONCURRENT_MODIFICATION} if
     *         another writer got there first
     */
    public T save(String id, T value) {
        long expected = versionOf(value);
        T next = withVersion(value, expected + 1, clock.instant());
        String body = write(next);
        if (!store.compareAndSet(collection, id, expected, body)) {
            cache.evict(cacheKey(id));
            logger.info("Concurrent modification of " + collection + "/" + id + " at version " + expected);
            throw new NavigationException(NavigationException.Reason.CONCURRENT_MODIFICATION,
                    "Concurrent modification of " + collection + " " + id);
        }
        cache.put(cacheKey(id), body, ttl);
        return next;
    }

    public void evict(String id) {
        cache.evict(cacheKey(id));
    }

    /**
     * Removes the durable document and its cached copy.
     */
    public void delete(String id) {
        store.delete(collection, id);
        cache.evict(cacheKey(id));
    }

    private String cacheKey(String id) {
        return collection + ":" + id;
    }

    private String write(T value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    private T read(String body) {
        try {
            return MAPPER.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " document", e);
        }
    }

    private T readQuietly(String body, String id) {
        try {
            return MAPPER.readValue(body, type);
        } catch (JsonProcessingException e) {
            logger.log(Level.WARNING, "Discarding unreadable cache entry for " + collection + "/" + id, e);
            return null;
        }
    }
}
