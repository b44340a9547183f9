/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.navigation;

import com.stagewise.engine.api.model.QuotaStatus;
import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CapacityLedger;
import com.stagewise.engine.api.store.CounterCondition;
import com.stagewise.engine.api.store.CounterField;
import com.stagewise.engine.api.store.CounterSnapshot;
import com.stagewise.engine.api.store.DistributionCounterStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Undo log for the shared writes a request makes before its session is
 * saved: counter increments, active markers and capacity holds.
 *
 * <p>Entries are kept per thread, since a request runs on one thread from
 * start to finish. {@link #commit()} forgets them once the session write
 * succeeded; {@link #rollback(RuntimeException)} applies their compensations
 * newest first when the request fails.
 *
 * <p>The stores handed to the sequencer and the tree walker are wrapped by
 * {@link #counters(DistributionCounterStore)} and
 * {@link #capacity(CapacityLedger)} so every such write is recorded.
 */
final class RequestJournal {

    private static final Logger logger = Logger.getLogger(RequestJournal.class.getName());

    private final ThreadLocal<Deque<Entry>> entries = ThreadLocal.withInitial(ArrayDeque::new);

    private record Entry(String description, Runnable undo) {
    }

    void record(String description, Runnable undo) {
        entries.get().push(new Entry(description, undo));
    }

    void commit() {
        entries.remove();
    }

    /**
     * Undoes every recorded write of the current thread. A compensation that
     * fails is logged and attached to {@code cause} as suppressed; the
     * remaining ones still run.
     */
    void rollback(RuntimeException cause) {
        Deque<Entry> pending = entries.get();
        entries.remove();
        if (pending.isEmpty()) {
            return;
        }
        int undone = 0;
        while (!pending.isEmpty()) {
            Entry entry = pending.pop();
            try {
                entry.undo().run();
                undone++;
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to undo " + entry.description(), e);
                cause.addSuppressed(e);
            }
        }
        logger.info("Rolled back " + undone + " shared writes of a failed request");
    }

    DistributionCounterStore counters(DistributionCounterStore delegate) {
        return new JournaledCounterStore(delegate);
    }

    CapacityLedger capacity(CapacityLedger delegate) {
        return new JournaledCapacityLedger(delegate);
    }

    private final class JournaledCounterStore implements DistributionCounterStore {
        private final DistributionCounterStore delegate;

        JournaledCounterStore(DistributionCounterStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public CounterSnapshot get(BranchKey key) {
            return delegate.get(key);
        }

        @Override
        public Map<String, CounterSnapshot> getAll(String experimentId, String decisionPointId) {
            return delegate.getAll(experimentId, decisionPointId);
        }

        @Override
        public long incrementAndGet(BranchKey key, CounterField field) {
            long value = delegate.incrementAndGet(key, field);
            record("increment of " + field + " on " + key, () -> delegate.decrement(key, field));
            return value;
        }

        @Override
        public boolean incrementIf(BranchKey key, CounterField field, CounterCondition condition) {
            boolean incremented = delegate.incrementIf(key, field, condition);
            if (incremented) {
                record("increment of " + field + " on " + key, () -> delegate.decrement(key, field));
            }
            return incremented;
        }

        @Override
        public void decrement(BranchKey key, CounterField field) {
            delegate.decrement(key, field);
        }

        @Override
        public void markActive(BranchKey key, String sessionId, Instant since) {
            delegate.markActive(key, sessionId, since);
            record("active marker of " + sessionId + " on " + key, () -> delegate.clearActive(key, sessionId));
        }

        @Override
        public void clearActive(BranchKey key, String sessionId) {
            delegate.clearActive(key, sessionId);
        }

        @Override
        public int sweepStaleActive(String experimentId, Instant cutoff) {
            return delegate.sweepStaleActive(experimentId, cutoff);
        }

        @Override
        public void reset(String experimentId, String decisionPointId) {
            delegate.reset(experimentId, decisionPointId);
        }
    }

    /**
     * Only reservations are recorded: the walker reserves a node once per
     * session, so a successful reservation within a request is a new hold.
     */
    private final class JournaledCapacityLedger implements CapacityLedger {
        private final CapacityLedger delegate;

        JournaledCapacityLedger(CapacityLedger delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean tryReserve(BranchKey key, String sessionId, long limit, Duration holdTtl) {
            boolean reserved = delegate.tryReserve(key, sessionId, limit, holdTtl);
            if (reserved) {
                record("hold of " + sessionId + " on " + key, () -> delegate.release(key, sessionId));
            }
            return reserved;
        }

        @Override
        public long tryComplete(BranchKey key, String sessionId) {
            return delegate.tryComplete(key, sessionId);
        }

        @Override
        public void release(BranchKey key, String sessionId) {
            delegate.release(key, sessionId);
        }

        @Override
        public boolean holds(BranchKey key, String sessionId) {
            return delegate.holds(key, sessionId);
        }

        @Override
        public QuotaStatus status(BranchKey key, long limit) {
            return delegate.status(key, limit);
        }

        @Override
        public void reset(BranchKey key) {
            delegate.reset(key);
        }
    }
}
