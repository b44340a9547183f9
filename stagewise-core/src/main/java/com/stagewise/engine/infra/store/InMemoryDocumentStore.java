package com.stagewise.engine.infra.store;

import com.stagewise.engine.api.store.DocumentStore;
import com.stagewise.engine.api.store.VersionedDocument;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local document store for development and tests. Version checks run
 * inside {@link ConcurrentHashMap#compute} so they are atomic per key.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final ConcurrentMap<String, VersionedDocument> documents = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDocumentStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<VersionedDocument> find(String collection, String id) {
        return Optional.ofNullable(documents.get(key(collection, id)));
    }

    @Override
    public boolean compareAndSet(String collection, String id, long expectedVersion, String body) {
        boolean[] written = {false};
        documents.compute(key(collection, id), (k, existing) -> {
            long currentVersion = existing == null ? 0 : existing.version();
            if (currentVersion != expectedVersion) {
                return existing;
            }
            written[0] = true;
            return new VersionedDocument(id, expectedVersion + 1, body, clock.instant());
        });
        return written[0];
    }

    @Override
    public void delete(String collection, String id) {
        documents.remove(key(collection, id));
    }

    public int size() {
        return documents.size();
    }

    private static String key(String collection, String id) {
        return collection + '/' + id;
    }
}
