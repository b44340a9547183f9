package com.stagewise.engine.context;

import com.stagewise.engine.api.model.SessionState;
import com.stagewise.engine.api.store.DocumentStore;
import com.stagewise.engine.api.store.StateCache;
import com.stagewise.engine.infra.metrics.NavigationMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Persists {@link SessionState} documents, cache first.
 */
public class SessionStore extends JsonDocumentRepository<SessionState> {

    public static final String COLLECTION = "sessions";

    public SessionStore(DocumentStore store, StateCache cache, Duration ttl, Clock clock,
                   NavigationMetrics metrics) {
        super(COLLECTION, SessionState.class, store, cache, ttl, clock, metrics);
    }

    public SessionState save(SessionState state) {
        return save(state.sessionId(), state);
    }

    @Override
    protected long versionOf(SessionState value) {
        return value.version();
    }

    @Override
    protected SessionState withVersion(SessionState value, long version, Instant updatedAt) {
        return value.toBuilder().version(version).updatedAt(updatedAt).build();
    }
}
