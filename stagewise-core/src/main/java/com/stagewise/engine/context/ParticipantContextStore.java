package com.stagewise.engine.context;

import com.stagewise.engine.api.model.ParticipantContext;
import com.stagewise.engine.api.store.DocumentStore;
import com.stagewise.engine.api.store.StateCache;
import com.stagewise.engine.infra.metrics.NavigationMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Persists the per-session variables visibility rules read: participant
 * fields, environment, URL parameters, responses and scores.
 */
public class ParticipantContextStore extends JsonDocumentRepository<ParticipantContext> {

    public static final String COLLECTION = "participant_contexts";

    public ParticipantContextStore(DocumentStore store, StateCache cache, Duration ttl, Clock clock,
                                   NavigationMetrics metrics) {
        super(COLLECTION, ParticipantContext.class, store, cache, ttl, clock, metrics);
    }

    public ParticipantContext save(ParticipantContext context) {
        return save(context.sessionId(), context);
    }

    @Override
    protected long versionOf(ParticipantContext value) {
        return value.version();
    }

    @Override
    protected ParticipantContext withVersion(ParticipantContext value, long version, Instant updatedAt) {
        return value.withVersion(version, updatedAt);
    }
}
