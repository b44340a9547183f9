package com.stagewise.engine.infra.capacity;

import com.stagewise.engine.api.model.QuotaStatus;
import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CapacityLedger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Capacity ledger held in process memory. Hold expiry is driven by the
 * injected {@link Clock}; expired holds are purged lazily whenever the branch
 * is touched.
 *
 * <p>Each branch is guarded by its own monitor, so reservations on different
 * branches never contend.
 */
public class InMemoryCapacityLedger implements CapacityLedger {

    private static final Logger logger = Logger.getLogger(InMemoryCapacityLedger.class.getName());

    private final ConcurrentMap<BranchKey, Branch> branches = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCapacityLedger() {
        this(Clock.systemUTC());
    }

    public InMemoryCapacityLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryReserve(BranchKey key, String sessionId, long limit, Duration holdTtl) {
        Branch branch = branch(key);
        synchronized (branch) {
            Instant now = clock.instant();
            branch.purge(now);
            if (branch.holds.containsKey(sessionId)) {
                return true;
            }
            if (branch.completed >= limit) {
                logger.fine("Capacity of " + key + " exhausted (" + branch.completed + "/" + limit + ")");
                return false;
            }
            branch.holds.put(sessionId, now.plus(holdTtl));
            return true;
        }
    }

    @Override
    public long tryComplete(BranchKey key, String sessionId) {
        Branch branch = branch(key);
        synchronized (branch) {
            branch.holds.remove(sessionId);
            return ++branch.completed;
        }
    }

    @Override
    public void release(BranchKey key, String sessionId) {
        Branch branch = branches.get(key);
        if (branch == null) {
            return;
        }
        synchronized (branch) {
            branch.holds.remove(sessionId);
        }
    }

    @Override
    public boolean holds(BranchKey key, String sessionId) {
        Branch branch = branches.get(key);
        if (branch == null) {
            return false;
        }
        synchronized (branch) {
            branch.purge(clock.instant());
            return branch.holds.containsKey(sessionId);
        }
    }

    @Override
    public QuotaStatus status(BranchKey key, long limit) {
        Branch branch = branches.get(key);
        if (branch == null) {
            return QuotaStatus.of(limit, 0, 0);
        }
        synchronized (branch) {
            branch.purge(clock.instant());
            return QuotaStatus.of(limit, branch.completed, branch.holds.size());
        }
    }

    @Override
    public void reset(BranchKey key) {
        Branch branch = branches.get(key);
        if (branch == null) {
            return;
        }
        // cleared in place: a completion racing the reset lands on the live branch
        synchronized (branch) {
            branch.completed = 0;
            branch.holds.clear();
        }
    }

    private Branch branch(BranchKey key) {
        return branches.computeIfAbsent(key, k -> new Branch());
    }

    private static final class Branch {
        private long completed;
        private final Map<String, Instant> holds = new HashMap<>();

        void purge(Instant now) {
            holds.values().removeIf(expiry -> !expiry.isAfter(now));
        }
    }
}
