package com.stagewise.engine.api.store;

import java.time.Instant;

/**
 * A stored document body with its optimistic-locking version.
 */
public record VersionedDocument(String id, long version, String body, Instant updatedAt) {
}
