package com.stagewise.engine.infra.metrics;

import com.stagewise.engine.api.exceptions.NavigationException;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for navigation traffic.
 *
 * <p>Lock-free ({@link LongAdder}); safe to update from every request thread.
 * {@link #getSnapshot()} builds a fresh map on each call.
 */
public final class NavigationMetrics {

    private final LongAdder sessionsInitialized = new LongAdder();
    private final LongAdder sessionsCompleted = new LongAdder();
    private final LongAdder sessionsAbandoned = new LongAdder();
    private final LongAdder submissions = new LongAdder();
    private final LongAdder jumps = new LongAdder();
    private final LongAdder invalidatedUnits = new LongAdder();
    private final LongAdder quotaSkips = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder totalRequestTimeNanos = new LongAdder();
    private final LongAdder totalRequests = new LongAdder();
    private final Map<NavigationException.Reason, LongAdder> rejections =
            new EnumMap<>(NavigationException.Reason.class);

    public NavigationMetrics() {
        for (NavigationException.Reason reason : NavigationException.Reason.values()) {
            rejections.put(reason, new LongAdder());
        }
    }

    public void recordInitialized() {
        sessionsInitialized.increment();
    }

    public void recordCompleted() {
        sessionsCompleted.increment();
    }

    public void recordAbandoned() {
        sessionsAbandoned.increment();
    }

    public void recordSubmission() {
        submissions.increment();
    }

    public void recordJump(int invalidated) {
        jumps.increment();
        invalidatedUnits.add(invalidated);
    }

    public void recordQuotaSkip() {
        quotaSkips.increment();
    }

    public void recordRejection(NavigationException.Reason reason) {
        rejections.get(reason).increment();
    }

    public void recordCacheLookup(boolean hit) {
        if (hit) {
            cacheHits.increment();
        } else {
            cacheMisses.increment();
        }
    }

    public void recordRequest(long elapsedNanos) {
        totalRequests.increment();
        totalRequestTimeNanos.add(elapsedNanos);
    }

    public long rejections(NavigationException.Reason reason) {
        return rejections.get(reason).sum();
    }

    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("sessionsInitialized", sessionsInitialized.sum());
        snapshot.put("sessionsCompleted", sessionsCompleted.sum());
        snapshot.put("sessionsAbandoned", sessionsAbandoned.sum());
        snapshot.put("submissions", submissions.sum());
        snapshot.put("jumps", jumps.sum());
        snapshot.put("invalidatedUnits", invalidatedUnits.sum());
        snapshot.put("quotaSkips", quotaSkips.sum());

        long hits = cacheHits.sum();
        long lookups = hits + cacheMisses.sum();
        snapshot.put("cacheHitRate", lookups > 0 ? (double) hits / lookups * 100.0 : 0.0);

        long requests = totalRequests.sum();
        snapshot.put("avgRequestTimeNanos", requests > 0 ? totalRequestTimeNanos.sum() / requests : 0);

        Map<String, Long> rejected = new LinkedHashMap<>();
        rejections.forEach((reason, count) -> {
            long value = count.sum();
            if (value > 0) {
                rejected.put(reason.name(), value);
            }
        });
        snapshot.put("rejections", rejected);
        return snapshot;
    }
}
