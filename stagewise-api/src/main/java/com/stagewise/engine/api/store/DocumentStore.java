package com.stagewise.engine.api.store;

import java.util.Optional;

/**
 * Durable key-value store for serialized session documents.
 */
public interface DocumentStore {

    Optional<VersionedDocument> find(String collection, String id);

    /**
     * Writes {@code body} if the stored version equals {@code expectedVersion}.
     * An expected version of {@code 0} means the document must not exist yet.
     * On success the stored version becomes {@code expectedVersion + 1}.
     *
     * @return false if another writer got there first
     */
    boolean compareAndSet(String collection, String id, long expectedVersion, String body);

    void delete(String collection, String id);
}
