package com.stagewise.engine.evaluator.counter;

import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CounterCondition;
import com.stagewise.engine.api.store.CounterField;
import com.stagewise.engine.api.store.CounterSnapshot;
import com.stagewise.engine.api.store.DistributionCounterStore;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Process-local {@link DistributionCounterStore}. Each counter is an
 * {@link AtomicLong}; conditional increments are compare-and-set loops, so
 * the store is safe under concurrent sessions within one JVM.
 */
public class InMemoryDistributionCounterStore implements DistributionCounterStore {

    private static final Logger logger = Logger.getLogger(InMemoryDistributionCounterStore.class.getName());

    private final ConcurrentMap<BranchKey, Record> records = new ConcurrentHashMap<>();

    @Override
    public CounterSnapshot get(BranchKey key) {
        Record record = records.get(key);
        return record == null ? CounterSnapshot.zero() : record.snapshot();
    }

    @Override
    public Map<String, CounterSnapshot> getAll(String experimentId, String decisionPointId) {
        Map<String, CounterSnapshot> result = new LinkedHashMap<>();
        records.forEach((key, record) -> {
            if (key.experimentId().equals(experimentId) && key.decisionPointId().equals(decisionPointId)) {
                result.put(key.branchId(), record.snapshot());
            }
        });
        return result;
    }

    @Override
    public long incrementAndGet(BranchKey key, CounterField field) {
        return record(key).counter(field).incrementAndGet();
    }

    @Override
    public boolean incrementIf(BranchKey key, CounterField field, CounterCondition condition) {
        AtomicLong counter = record(key).counter(field);
        while (true) {
            long current = counter.get();
            if (!condition.test(current)) {
                return false;
            }
            if (counter.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    @Override
    public void decrement(BranchKey key, CounterField field) {
        Record record = records.get(key);
        if (record != null) {
            record.counter(field).updateAndGet(value -> Math.max(0, value - 1));
        }
    }

    @Override
    public void markActive(BranchKey key, String sessionId, Instant since) {
        record(key).active.put(sessionId, since);
    }

    @Override
    public void clearActive(BranchKey key, String sessionId) {
        Record record = records.get(key);
        if (record != null) {
            record.active.remove(sessionId);
        }
    }

    @Override
    public int sweepStaleActive(String experimentId, Instant cutoff) {
        int dropped = 0;
        for (Map.Entry<BranchKey, Record> entry : records.entrySet()) {
            if (!entry.getKey().experimentId().equals(experimentId)) {
                continue;
            }
            Record record = entry.getValue();
            int droppedHere = 0;
            Iterator<Map.Entry<String, Instant>> it = record.active.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isBefore(cutoff)) {
                    it.remove();
                    droppedHere++;
                }
            }
            if (droppedHere > 0) {
                long removed = droppedHere;
                record.started.updateAndGet(value -> Math.max(0, value - removed));
                dropped += droppedHere;
            }
        }
        if (dropped > 0) {
            logger.info("Swept " + dropped + " stale active markers of experiment " + experimentId);
        }
        return dropped;
    }

    @Override
    public void reset(String experimentId, String decisionPointId) {
        records.keySet().removeIf(key -> key.experimentId().equals(experimentId)
                && key.decisionPointId().equals(decisionPointId));
    }

    private Record record(BranchKey key) {
        return records.computeIfAbsent(key, k -> new Record());
    }

    private static final class Record {
        final AtomicLong started = new AtomicLong();
        final AtomicLong completed = new AtomicLong();
        final ConcurrentMap<String, Instant> active = new ConcurrentHashMap<>();

        AtomicLong counter(CounterField field) {
            return field == CounterField.STARTED ? started : completed;
        }

        CounterSnapshot snapshot() {
            return new CounterSnapshot(started.get(), completed.get(), active.size());
        }
    }
}
