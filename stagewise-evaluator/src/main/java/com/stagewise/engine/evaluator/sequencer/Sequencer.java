/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.evaluator.sequencer;

import com.stagewise.engine.api.model.definition.BalanceOn;
import com.stagewise.engine.api.model.definition.OrderingMode;
import com.stagewise.engine.api.model.definition.PickCondition;
import com.stagewise.engine.api.model.definition.PickOperator;
import com.stagewise.engine.api.model.definition.PickStrategy;
import com.stagewise.engine.api.model.definition.RulesConfig;
import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CounterField;
import com.stagewise.engine.api.store.CounterSnapshot;
import com.stagewise.engine.api.store.DistributionCounterStore;
import com.stagewise.engine.compiler.model.DecisionMode;
import com.stagewise.engine.compiler.model.ExperimentNode;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.ToIntFunction;
import java.util.logging.Logger;

/**
 * Resolves ordering and pick decisions for one experiment.
 *
 * <h2>Ordering</h2>
 * <p>At SELECT decision points (experiment root and phases) {@code balanced}
 * and {@code weighted} choose exactly one child. At ORDER decision points
 * (stages and blocks) {@code balanced} is realized as a balanced Latin-square
 * row and {@code weighted} as a weighted permutation of all children.
 * {@code randomized} and {@code latin_square} always order every child.
 *
 * <h2>Determinism</h2>
 * <p>Every random draw comes from a generator seeded with the session seed
 * mixed with the decision point id. A stored assignment is always restored
 * verbatim, so replays after a reconnect reproduce the same decisions.
 *
 * <h2>Shared counters</h2>
 * <p>Balanced selection reads the counters, picks among the least-filled
 * branches and commits with a compare-and-increment on the observed minimum.
 * A participant that loses the race re-reads and tries again, which keeps
 * branch sizes within one of each other under concurrent arrivals.
 *
 * <p>Thread-safe; shared by all sessions of the experiment.
 */
public final class Sequencer {

    private static final Logger logger = Logger.getLogger(Sequencer.class.getName());

    public static final String LATIN_SQUARE_SUFFIX = ":ls";
    public static final String ROUND_ROBIN_SUFFIX = ":rr";
    static final String ROUND_ROBIN_BRANCH = "counter";

    private final String experimentId;
    private final DistributionCounterStore counters;
    private final int maxAttempts;
    private final Clock clock;
    private final Tracer tracer;

    private Sequencer(Builder builder) {
        this.experimentId = builder.experimentId;
        this.counters = builder.counters;
        this.maxAttempts = builder.maxAttempts;
        this.clock = builder.clock;
        this.tracer = builder.tracer;
    }

    public static Builder builder(String experimentId, DistributionCounterStore counters) {
        return new Builder(experimentId, counters);
    }

    /**
     * Seed of the generator used at one decision point. Sibling decision
     * points with equal child counts get different permutations.
     */
    public static long decisionSeed(long sessionSeed, String decisionPointId) {
        return sessionSeed * 31 + decisionPointId.hashCode();
    }

    public OrderingResult order(List<ExperimentNode> children, RulesConfig rules, DecisionMode mode,
                                String sessionId, String decisionPointId, String existingAssignment,
                                Long seed) {
        return order(children, rules, mode, sessionId, decisionPointId, existingAssignment, seed, Set.of());
    }

    /**
     * Orders or selects {@code children} according to {@code rules.ordering}.
     *
     * @param unavailable branch ids a SELECT decision should avoid while any
     *                    other branch is left, e.g. branches whose quota is full
     * @throws com.stagewise.engine.api.exceptions.StoreUnavailableException if
     *         the counter store cannot be reached
     */
    public OrderingResult order(List<ExperimentNode> children, RulesConfig rules, DecisionMode mode,
                                String sessionId, String decisionPointId, String existingAssignment,
                                Long seed, Set<String> unavailable) {
        if (children.isEmpty()) {
            return OrderingResult.of(List.of(), "No children to order");
        }
        OrderingMode ordering = rules == null ? OrderingMode.SEQUENTIAL : rules.ordering();
        boolean selects = mode == DecisionMode.SELECT
                && (ordering == OrderingMode.BALANCED || ordering == OrderingMode.WEIGHTED);

        if (existingAssignment != null && ordering != OrderingMode.SEQUENTIAL
                && ordering != OrderingMode.RANDOMIZED) {
            OrderingResult restored = selects
                    ? restoreSelection(children, existingAssignment)
                    : restoreOrder(children, existingAssignment);
            if (restored != null) {
                return restored;
            }
            logger.fine("Stored assignment '" + existingAssignment + "' at " + decisionPointId
                    + " no longer matches the children, deciding again");
        }

        Random random = new Random(decisionSeed(seedOf(seed, sessionId), decisionPointId));
        return switch (ordering) {
            case SEQUENTIAL -> OrderingResult.of(children, "Sequential ordering");
            case RANDOMIZED -> {
                List<ExperimentNode> shuffled = new ArrayList<>(children);
                Collections.shuffle(shuffled, random);
                yield OrderingResult.of(shuffled, "Randomized ordering");
            }
            case BALANCED -> selects
                    ? balancedSelect(children, rules, sessionId, decisionPointId, random, unavailable)
                    : latinSquare(children, rules, sessionId, decisionPointId, random);
            case WEIGHTED -> selects
                    ? weightedSelect(children, rules, random, unavailable)
                    : weightedOrder(children, rules, random);
            case LATIN_SQUARE -> latinSquare(children, rules, sessionId, decisionPointId, random);
        };
    }

    /**
     * Picks a subset of {@code children} according to {@code rules.pick_count}.
     *
     * @param existingPicks ids stored for this decision point, {@code null} if
     *                      none were stored yet
     * @param ledger        pick-assign values accumulated over the session
     */
    public PickResult pick(List<ExperimentNode> children, RulesConfig rules, String sessionId,
                           String decisionPointId, List<String> existingPicks, Long seed,
                           Map<String, List<Object>> ledger) {
        if (children.isEmpty()) {
            return new PickResult(List.of(), List.of(), "No children to pick from", Map.of(), false);
        }
        if (rules == null || !rules.hasPick()) {
            return new PickResult(children, ids(children), "No pick_count specified, using all children",
                    Map.of(), false);
        }
        int pickCount = rules.pickCount();

        if (existingPicks != null) {
            PickResult restored = restorePicks(children, existingPicks, pickCount);
            if (restored != null) {
                return restored;
            }
            logger.fine("Stored picks " + existingPicks + " at " + decisionPointId + " are stale, picking again");
        }

        List<ExperimentNode> candidates = children;
        if (!rules.pickConditions().isEmpty()) {
            candidates = filterByConditions(children, rules.pickConditions(),
                    ledger == null ? Map.of() : ledger);
            if (candidates.isEmpty()) {
                logger.fine("No candidate at " + decisionPointId + " satisfies pick conditions");
                return new PickResult(List.of(), List.of(), "No candidates satisfy pick_conditions",
                        Map.of(), false);
            }
        }

        if (pickCount >= candidates.size()) {
            return picked(candidates, "pick_count (" + pickCount + ") >= candidates (" + candidates.size()
                    + "), using all");
        }

        Random random = new Random(decisionSeed(seedOf(seed, sessionId), decisionPointId));
        PickStrategy strategy = rules.pickStrategy();
        IntList indices = switch (strategy) {
            case RANDOM -> randomIndices(candidates.size(), pickCount, random);
            case ROUND_ROBIN -> roundRobinIndices(candidates.size(), pickCount, decisionPointId);
            case WEIGHTED_RANDOM -> WeightedDraw.drawWithoutReplacement(
                    weights(candidates, rules::pickWeightOf), pickCount, random);
        };

        int[] sorted = indices.toIntArray();
        Arrays.sort(sorted);
        List<ExperimentNode> picked = new ArrayList<>(pickCount);
        for (int index : sorted) {
            picked.add(candidates.get(index));
        }
        return picked(picked, strategy.name().toLowerCase() + " pick: " + pickCount + " of "
                + candidates.size() + " candidates");
    }

    /**
     * Distribution counter a balanced decision was recorded on, derived from
     * its stored assignment. Used to count completions and to clear the
     * session's active marker.
     */
    public Optional<BranchKey> balanceKey(List<ExperimentNode> children, RulesConfig rules, DecisionMode mode,
                                          String decisionPointId, String assignment) {
        if (assignment == null || rules == null) {
            return Optional.empty();
        }
        OrderingMode ordering = rules.ordering();
        if (ordering == OrderingMode.BALANCED && mode == DecisionMode.SELECT) {
            return Optional.of(new BranchKey(experimentId, decisionPointId, assignment));
        }
        if (ordering == OrderingMode.BALANCED || ordering == OrderingMode.LATIN_SQUARE) {
            int row = LatinSquare.rowOf(ids(children), splitIds(assignment));
            if (row >= 0) {
                return Optional.of(new BranchKey(experimentId, decisionPointId + LATIN_SQUARE_SUFFIX,
                        String.valueOf(row)));
            }
        }
        return Optional.empty();
    }

    public String experimentId() {
        return experimentId;
    }

    // ------------------------------------------------------------------
    // Ordering policies
    // ------------------------------------------------------------------

    private OrderingResult balancedSelect(List<ExperimentNode> children, RulesConfig rules, String sessionId,
                                          String decisionPointId, Random random, Set<String> unavailable) {
        List<ExperimentNode> candidates = available(children, unavailable);
        BalancedChoice choice = balancedBranch(decisionPointId, ids(candidates), counterField(rules),
                sessionId, random);
        ExperimentNode selected = findById(candidates, choice.key().branchId());
        String reason = "Balanced: counts=" + choice.counts() + ", selected=" + selected.id()
                + " (min=" + choice.min() + ")";
        return new OrderingResult(List.of(selected), selected.id(), reason, false, choice.key());
    }

    private OrderingResult latinSquare(List<ExperimentNode> children, RulesConfig rules, String sessionId,
                                       String decisionPointId, Random random) {
        int size = children.size();
        List<String> rows = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            rows.add(String.valueOf(i));
        }
        BalancedChoice choice = balancedBranch(decisionPointId + LATIN_SQUARE_SUFFIX, rows,
                counterField(rules), sessionId, random);
        int rowIndex = Integer.parseInt(choice.key().branchId());
        List<ExperimentNode> ordered = new ArrayList<>(size);
        for (int index : LatinSquare.row(size, rowIndex)) {
            ordered.add(children.get(index));
        }
        String assignment = String.join(",", ids(ordered));
        return new OrderingResult(ordered, assignment,
                "Latin Square: order " + (rowIndex + 1) + " of " + size + ", sequence=" + assignment,
                false, choice.key());
    }

    private OrderingResult weightedSelect(List<ExperimentNode> children, RulesConfig rules, Random random,
                                          Set<String> unavailable) {
        List<ExperimentNode> candidates = available(children, unavailable);
        IntList weights = weights(candidates, rules::weightOf);
        ExperimentNode selected = candidates.get(WeightedDraw.select(weights, random));
        return new OrderingResult(List.of(selected), selected.id(),
                "Weighted: weights=" + weights + ", assigned=" + selected.id(), false, null);
    }

    private OrderingResult weightedOrder(List<ExperimentNode> children, RulesConfig rules, Random random) {
        IntList drawn = WeightedDraw.drawWithoutReplacement(weights(children, rules::weightOf),
                children.size(), random);
        List<ExperimentNode> ordered = new ArrayList<>(children.size());
        for (int i = 0; i < drawn.size(); i++) {
            ordered.add(children.get(drawn.getInt(i)));
        }
        String assignment = String.join(",", ids(ordered));
        return new OrderingResult(ordered, assignment, "Weighted order: " + assignment, false, null);
    }

    /**
     * Least-filled branch selection over one counter namespace.
     */
    private BalancedChoice balancedBranch(String namespace, List<String> branchIds, CounterField field,
                                          String sessionId, Random random) {
        Span span = tracer.spanBuilder("balanced-selection").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("decisionPoint", namespace);
            span.setAttribute("branchCount", branchIds.size());
            BalancedChoice choice = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                choice = leastFilled(namespace, branchIds, field, random);
                if (field == CounterField.COMPLETED) {
                    // completions are counted when the branch is finished
                    counters.incrementAndGet(choice.key(), CounterField.STARTED);
                    return committed(choice, sessionId, span, attempt);
                }
                if (counters.compareAndIncrement(choice.key(), CounterField.STARTED, choice.min())) {
                    return committed(choice, sessionId, span, attempt);
                }
                logger.fine("Concurrent update on " + choice.key() + ", retrying balanced selection");
            }
            logger.warning("Balanced selection at " + namespace + " still contended after " + maxAttempts
                    + " attempts, incrementing " + choice.key() + " unconditionally");
            counters.incrementAndGet(choice.key(), CounterField.STARTED);
            return committed(choice, sessionId, span, maxAttempts);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private BalancedChoice leastFilled(String namespace, List<String> branchIds, CounterField field,
                                       Random random) {
        Map<String, CounterSnapshot> stored = counters.getAll(experimentId, namespace);
        Map<String, Long> counts = new LinkedHashMap<>();
        long min = Long.MAX_VALUE;
        for (String branchId : branchIds) {
            long count = stored.getOrDefault(branchId, CounterSnapshot.zero()).valueOf(field);
            counts.put(branchId, count);
            min = Math.min(min, count);
        }
        List<String> tied = new ArrayList<>();
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (entry.getValue() == min) {
                tied.add(entry.getKey());
            }
        }
        String selected = tied.get(random.nextInt(tied.size()));
        long observed = counts.get(selected);
        return new BalancedChoice(new BranchKey(experimentId, namespace, selected), observed, counts);
    }

    private BalancedChoice committed(BalancedChoice choice, String sessionId, Span span, int attempts) {
        counters.markActive(choice.key(), sessionId, clock.instant());
        span.setAttribute("selectedBranch", choice.key().branchId());
        span.setAttribute("attempts", attempts);
        return choice;
    }

    private record BalancedChoice(BranchKey key, long min, Map<String, Long> counts) {
    }

    // ------------------------------------------------------------------
    // Pick policies
    // ------------------------------------------------------------------

    private static IntList randomIndices(int size, int count, Random random) {
        List<Integer> pool = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            pool.add(i);
        }
        Collections.shuffle(pool, random);
        return new IntArrayList(pool.subList(0, count));
    }

    private IntList roundRobinIndices(int size, int count, String decisionPointId) {
        Span span = tracer.spanBuilder("round-robin-pick").startSpan();
        try (Scope scope = span.makeCurrent()) {
            BranchKey key = new BranchKey(experimentId, decisionPointId + ROUND_ROBIN_SUFFIX, ROUND_ROBIN_BRANCH);
            long turn = counters.incrementAndGet(key, CounterField.STARTED);
            span.setAttribute("decisionPoint", decisionPointId);
            span.setAttribute("turn", turn);
            return Combinations.unrank(size, count, turn - 1);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static List<ExperimentNode> filterByConditions(List<ExperimentNode> children,
                                                           List<PickCondition> conditions,
                                                           Map<String, List<Object>> ledger) {
        List<ExperimentNode> passed = new ArrayList<>();
        for (ExperimentNode child : children) {
            Map<String, List<Object>> assigns = child.effectivePickAssigns();
            boolean passes = true;
            for (PickCondition condition : conditions) {
                List<Object> values = assigns.getOrDefault(condition.variable(), List.of());
                if (values.isEmpty()) {
                    // a candidate that assigns nothing to the variable is unconstrained by it
                    continue;
                }
                List<Object> accumulated = ledger.getOrDefault(condition.variable(), List.of());
                for (Object value : values) {
                    boolean seen = containsValue(accumulated, value);
                    if (condition.operator() == PickOperator.NOT_IN ? seen : !seen) {
                        passes = false;
                        break;
                    }
                }
                if (!passes) {
                    break;
                }
            }
            if (passes) {
                passed.add(child);
            }
        }
        return passed;
    }

    private static PickResult picked(List<ExperimentNode> picked, String reason) {
        return new PickResult(picked, ids(picked), reason, ledgerDelta(picked), false);
    }

    private static Map<String, List<Object>> ledgerDelta(List<ExperimentNode> picked) {
        Map<String, List<Object>> delta = new LinkedHashMap<>();
        for (ExperimentNode node : picked) {
            node.effectivePickAssigns().forEach((variable, values) -> {
                List<Object> merged = delta.computeIfAbsent(variable, k -> new ArrayList<>());
                for (Object value : values) {
                    if (!containsValue(merged, value)) {
                        merged.add(value);
                    }
                }
            });
        }
        return delta;
    }

    /**
     * Pick-assign value equality; numbers compare by value since stored
     * ledgers may come back with a different numeric type.
     */
    public static boolean containsValue(List<Object> values, Object value) {
        for (Object candidate : values) {
            if (candidate instanceof Number a && value instanceof Number b) {
                if (Double.compare(a.doubleValue(), b.doubleValue()) == 0) {
                    return true;
                }
            } else if (candidate == null ? value == null : candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Restoration
    // ------------------------------------------------------------------

    private static OrderingResult restoreSelection(List<ExperimentNode> children, String assignment) {
        for (ExperimentNode child : children) {
            if (child.id().equals(assignment)) {
                return new OrderingResult(List.of(child), assignment,
                        "Restored previous assignment: " + assignment, true, null);
            }
        }
        return null;
    }

    private static OrderingResult restoreOrder(List<ExperimentNode> children, String assignment) {
        List<ExperimentNode> ordered = new ArrayList<>(children.size());
        for (String id : splitIds(assignment)) {
            ExperimentNode child = findById(children, id);
            if (child != null && !ordered.contains(child)) {
                ordered.add(child);
            }
        }
        if (ordered.isEmpty()) {
            return null;
        }
        for (ExperimentNode child : children) {
            if (!ordered.contains(child)) {
                ordered.add(child);
            }
        }
        return new OrderingResult(ordered, String.join(",", ids(ordered)),
                "Restored previous order: " + assignment, true, null);
    }

    private static PickResult restorePicks(List<ExperimentNode> children, List<String> existingPicks,
                                           int pickCount) {
        if (existingPicks.size() > pickCount) {
            return null;
        }
        List<ExperimentNode> picked = new ArrayList<>(existingPicks.size());
        for (ExperimentNode child : children) {
            if (existingPicks.contains(child.id())) {
                picked.add(child);
            }
        }
        if (picked.size() != existingPicks.size()) {
            return null;
        }
        return new PickResult(picked, ids(picked), "Restored previous picks: " + existingPicks,
                ledgerDelta(picked), true);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static CounterField counterField(RulesConfig rules) {
        return rules.balanceOn() == BalanceOn.COMPLETED ? CounterField.COMPLETED : CounterField.STARTED;
    }

    private static List<ExperimentNode> available(List<ExperimentNode> children, Set<String> unavailable) {
        if (unavailable == null || unavailable.isEmpty()) {
            return children;
        }
        List<ExperimentNode> open = new ArrayList<>(children.size());
        for (ExperimentNode child : children) {
            if (!unavailable.contains(child.id())) {
                open.add(child);
            }
        }
        return open.isEmpty() ? children : open;
    }

    private static IntList weights(List<ExperimentNode> children, ToIntFunction<String> weightOf) {
        IntList weights = new IntArrayList(children.size());
        for (ExperimentNode child : children) {
            weights.add(weightOf.applyAsInt(child.id()));
        }
        return weights;
    }

    private static long seedOf(Long seed, String sessionId) {
        return seed != null ? seed : sessionId.hashCode();
    }

    private static ExperimentNode findById(List<ExperimentNode> nodes, String id) {
        for (ExperimentNode node : nodes) {
            if (node.id().equals(id)) {
                return node;
            }
        }
        return null;
    }

    static List<String> ids(List<ExperimentNode> nodes) {
        List<String> ids = new ArrayList<>(nodes.size());
        for (ExperimentNode node : nodes) {
            ids.add(node.id());
        }
        return ids;
    }

    static List<String> splitIds(String joined) {
        List<String> ids = new ArrayList<>();
        for (String part : joined.split(",")) {
            if (!part.isBlank()) {
                ids.add(part.trim());
            }
        }
        return ids;
    }

    public static final class Builder {
        private final String experimentId;
        private final DistributionCounterStore counters;
        private int maxAttempts = 16;
        private Clock clock = Clock.systemUTC();
        private Tracer tracer = OpenTelemetry.noop().getTracer("stagewise-sequencer");

        private Builder(String experimentId, DistributionCounterStore counters) {
            this.experimentId = experimentId;
            this.counters = counters;
        }

        /**
         * Compare-and-increment attempts before a balanced selection falls back
         * to an unconditional increment.
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Sequencer build() {
            return new Sequencer(this);
        }
    }
}
