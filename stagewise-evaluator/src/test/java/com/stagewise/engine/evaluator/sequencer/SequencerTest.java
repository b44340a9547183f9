package com.stagewise.engine.evaluator.sequencer;

import com.stagewise.engine.api.model.definition.BalanceOn;
import com.stagewise.engine.api.model.definition.OrderingMode;
import com.stagewise.engine.api.model.definition.PickCondition;
import com.stagewise.engine.api.model.definition.PickOperator;
import com.stagewise.engine.api.model.definition.PickStrategy;
import com.stagewise.engine.api.model.definition.RulesConfig;
import com.stagewise.engine.api.model.definition.WeightEntry;
import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CounterField;
import com.stagewise.engine.compiler.model.DecisionMode;
import com.stagewise.engine.compiler.model.ExperimentNode;
import com.stagewise.engine.compiler.model.NodeLevel;
import com.stagewise.engine.evaluator.counter.InMemoryDistributionCounterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SequencerTest {

    private static final String EXPERIMENT = "exp";

    private InMemoryDistributionCounterStore counters;
    private Sequencer sequencer;

    @BeforeEach
    void setUp() {
        counters = new InMemoryDistributionCounterStore();
        sequencer = Sequencer.builder(EXPERIMENT, counters).build();
    }

    private static ExperimentNode leaf(String id) {
        return ExperimentNode.builder(id, NodeLevel.STAGE).type("task").build();
    }

    private static ExperimentNode leaf(String id, String variable, Object value) {
        return ExperimentNode.builder(id, NodeLevel.STAGE).type("task").pickAssigns(Map.of(variable, value)).build();
    }

    private static List<ExperimentNode> leaves(String... ids) {
        List<ExperimentNode> nodes = new ArrayList<>();
        for (String id : ids) {
            nodes.add(leaf(id));
        }
        return nodes;
    }

    private static RulesConfig ordering(OrderingMode mode) {
        return new RulesConfig(mode, null, null, null, null, null, null, null, null, null);
    }

    private static RulesConfig picking(int count, PickStrategy strategy, List<PickCondition> conditions) {
        return new RulesConfig(null, null, null, null, count, strategy, null, conditions, null, null);
    }

    private static List<String> ids(List<ExperimentNode> nodes) {
        return Sequencer.ids(nodes);
    }

    @Nested
    class Ordering {

        @Test
        @DisplayName("Should keep definition order for sequential ordering")
        void shouldKeepSequentialOrder() {
            OrderingResult result = sequencer.order(leaves("a", "b", "c"), ordering(OrderingMode.SEQUENTIAL),
                    DecisionMode.ORDER, "s1", "dp", null, 7L);

            assertThat(ids(result.children())).containsExactly("a", "b", "c");
            assertThat(result.assignment()).isNull();
        }

        @Test
        @DisplayName("Should shuffle reproducibly for the same seed")
        void shouldShuffleDeterministically() {
            List<ExperimentNode> children = leaves("a", "b", "c", "d", "e", "f");
            RulesConfig rules = ordering(OrderingMode.RANDOMIZED);

            OrderingResult first = sequencer.order(children, rules, DecisionMode.ORDER, "s1", "dp", null, 99L);
            OrderingResult second = sequencer.order(children, rules, DecisionMode.ORDER, "s1", "dp", null, 99L);

            assertThat(ids(first.children())).isEqualTo(ids(second.children()))
                    .containsExactlyInAnyOrder("a", "b", "c", "d", "e", "f");
        }

        @Test
        @DisplayName("Should derive the seed from the session id when none is given")
        void shouldSeedFromSessionId() {
            List<ExperimentNode> children = leaves("a", "b", "c", "d", "e");
            RulesConfig rules = ordering(OrderingMode.RANDOMIZED);

            OrderingResult implicit = sequencer.order(children, rules, DecisionMode.ORDER, "session-x", "dp", null, null);
            OrderingResult explicit = sequencer.order(children, rules, DecisionMode.ORDER, "session-x", "dp", null,
                    (long) "session-x".hashCode());

            assertThat(ids(implicit.children())).isEqualTo(ids(explicit.children()));
        }

        @Test
        @DisplayName("Should return an empty result for no children")
        void shouldHandleEmptyChildren() {
            OrderingResult result = sequencer.order(List.of(), ordering(OrderingMode.BALANCED),
                    DecisionMode.SELECT, "s1", "dp", null, 1L);

            assertThat(result.children()).isEmpty();
            assertThat(result.reason()).isEqualTo("No children to order");
        }
    }

    @Nested
    class Balanced {

        @Test
        @DisplayName("Should select the least-filled branch and record it")
        void shouldSelectLeastFilled() {
            counters.incrementAndGet(new BranchKey(EXPERIMENT, "main", "a"), CounterField.STARTED);
            counters.incrementAndGet(new BranchKey(EXPERIMENT, "main", "c"), CounterField.STARTED);

            OrderingResult result = sequencer.order(leaves("a", "b", "c"), ordering(OrderingMode.BALANCED),
                    DecisionMode.SELECT, "s1", "main", null, 1L);

            assertThat(result.assignment()).isEqualTo("b");
            assertThat(ids(result.children())).containsExactly("b");
            assertThat(counters.get(new BranchKey(EXPERIMENT, "main", "b")).started()).isEqualTo(1);
            assertThat(counters.get(new BranchKey(EXPERIMENT, "main", "b")).active()).isEqualTo(1);
            assertThat(result.countedKey()).isEqualTo(new BranchKey(EXPERIMENT, "main", "b"));
        }

        @Test
        @DisplayName("Should restore an existing assignment without touching counters")
        void shouldRestoreAssignment() {
            OrderingResult result = sequencer.order(leaves("a", "b", "c"), ordering(OrderingMode.BALANCED),
                    DecisionMode.SELECT, "s1", "main", "c", 1L);

            assertThat(result.restored()).isTrue();
            assertThat(ids(result.children())).containsExactly("c");
            assertThat(counters.getAll(EXPERIMENT, "main")).isEmpty();
        }

        @Test
        @DisplayName("Should keep branch counts within one after sequential arrivals")
        void shouldConvergeSequentially() {
            List<ExperimentNode> children = leaves("a", "b", "c");
            for (int i = 0; i < 31; i++) {
                sequencer.order(children, ordering(OrderingMode.BALANCED), DecisionMode.SELECT,
                        "session-" + i, "main", null, (long) i);
            }

            assertThat(spread("main", "a", "b", "c")).isLessThanOrEqualTo(1);
        }

        @Test
        @DisplayName("Should keep branch counts within one under concurrent arrivals")
        void shouldConvergeConcurrently() throws InterruptedException {
            Sequencer contended = Sequencer.builder(EXPERIMENT, counters).maxAttempts(10_000).build();
            List<ExperimentNode> children = leaves("a", "b", "c", "d");
            int sessions = 400;
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(sessions);
            AtomicInteger failures = new AtomicInteger();

            for (int i = 0; i < sessions; i++) {
                int session = i;
                executor.submit(() -> {
                    try {
                        start.await();
                        contended.order(children, ordering(OrderingMode.BALANCED), DecisionMode.SELECT,
                                "session-" + session, "main", null, (long) session);
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(failures.get()).isZero();
            long total = 0;
            for (String id : List.of("a", "b", "c", "d")) {
                total += counters.get(new BranchKey(EXPERIMENT, "main", id)).started();
            }
            assertThat(total).isEqualTo(sessions);
            assertThat(spread("main", "a", "b", "c", "d")).isLessThanOrEqualTo(1);
        }

        @Test
        @DisplayName("Should avoid unavailable branches while another is open")
        void shouldAvoidUnavailableBranches() {
            OrderingResult result = sequencer.order(leaves("a", "b"), ordering(OrderingMode.BALANCED),
                    DecisionMode.SELECT, "s1", "main", null, 1L, Set.of("a"));
            assertThat(result.assignment()).isEqualTo("b");

            OrderingResult allFull = sequencer.order(leaves("a", "b"), ordering(OrderingMode.BALANCED),
                    DecisionMode.SELECT, "s2", "main", null, 2L, Set.of("a", "b"));
            assertThat(allFull.children()).hasSize(1);
        }

        @Test
        @DisplayName("Should balance on completions when configured")
        void shouldBalanceOnCompletions() {
            counters.incrementAndGet(new BranchKey(EXPERIMENT, "main", "a"), CounterField.COMPLETED);
            RulesConfig rules = new RulesConfig(OrderingMode.BALANCED, null, BalanceOn.COMPLETED,
                    null, null, null, null, null, null, null);

            for (int i = 0; i < 3; i++) {
                OrderingResult result = sequencer.order(leaves("a", "b"), rules, DecisionMode.SELECT,
                        "s" + i, "main", null, (long) i);
                assertThat(result.assignment()).isEqualTo("b");
            }
            assertThat(counters.get(new BranchKey(EXPERIMENT, "main", "b")).started()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should realize balanced ordering at stage level as a Latin square row")
        void shouldOrderBalancedStagesByLatinSquare() {
            List<ExperimentNode> children = leaves("x", "y", "z");
            List<List<String>> orders = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                OrderingResult result = sequencer.order(children, ordering(OrderingMode.BALANCED),
                        DecisionMode.ORDER, "s" + i, "stage", null, (long) i);
                orders.add(ids(result.children()));
                assertThat(result.assignment()).isEqualTo(String.join(",", ids(result.children())));
            }

            assertThat(orders).containsExactlyInAnyOrder(
                    List.of("x", "y", "z"), List.of("y", "z", "x"), List.of("z", "x", "y"));
        }

        private long spread(String decisionPoint, String... branches) {
            long min = Long.MAX_VALUE;
            long max = Long.MIN_VALUE;
            for (String branch : branches) {
                long count = counters.get(new BranchKey(EXPERIMENT, decisionPoint, branch)).started();
                min = Math.min(min, count);
                max = Math.max(max, count);
            }
            return max - min;
        }
    }

    @Nested
    class LatinSquareOrdering {

        @Test
        @DisplayName("Should restore a stored row verbatim")
        void shouldRestoreRow() {
            OrderingResult result = sequencer.order(leaves("x", "y", "z"), ordering(OrderingMode.LATIN_SQUARE),
                    DecisionMode.ORDER, "s1", "stage", "z,x,y", 1L);

            assertThat(result.restored()).isTrue();
            assertThat(ids(result.children())).containsExactly("z", "x", "y");
        }

        @Test
        @DisplayName("Should map a stored order back to its row counter")
        void shouldResolveBalanceKey() {
            assertThat(sequencer.balanceKey(leaves("x", "y", "z"), ordering(OrderingMode.LATIN_SQUARE),
                    DecisionMode.ORDER, "stage", "y,z,x"))
                    .contains(new BranchKey(EXPERIMENT, "stage:ls", "1"));
            assertThat(sequencer.balanceKey(leaves("x", "y", "z"), ordering(OrderingMode.BALANCED),
                    DecisionMode.SELECT, "main", "y"))
                    .contains(new BranchKey(EXPERIMENT, "main", "y"));
            assertThat(sequencer.balanceKey(leaves("x", "y"), ordering(OrderingMode.WEIGHTED),
                    DecisionMode.SELECT, "main", "y")).isEmpty();
        }
    }

    @Nested
    class Weighted {

        @Test
        @DisplayName("Should favour heavier branches")
        void shouldRespectWeights() {
            RulesConfig rules = new RulesConfig(OrderingMode.WEIGHTED, null, null,
                    List.of(new WeightEntry("a", 1), new WeightEntry("b", 9)),
                    null, null, null, null, null, null);
            Map<String, Integer> tally = new HashMap<>();
            Random seeds = new Random(2024);
            for (int i = 0; i < 1000; i++) {
                OrderingResult result = sequencer.order(leaves("a", "b"), rules, DecisionMode.SELECT,
                        "s" + i, "main", null, seeds.nextLong());
                tally.merge(result.assignment(), 1, Integer::sum);
            }

            assertThat(tally.get("b")).isGreaterThan(800);
            assertThat(tally.get("a")).isGreaterThan(40);
        }

        @Test
        @DisplayName("Should draw the same branch for the same seed")
        void shouldBeDeterministic() {
            RulesConfig rules = ordering(OrderingMode.WEIGHTED);
            String first = sequencer.order(leaves("a", "b", "c"), rules, DecisionMode.SELECT,
                    "s1", "main", null, 42L).assignment();

            for (int i = 0; i < 5; i++) {
                assertThat(sequencer.order(leaves("a", "b", "c"), rules, DecisionMode.SELECT,
                        "s1", "main", null, 42L).assignment()).isEqualTo(first);
            }
        }

        @Test
        @DisplayName("Should produce and restore a full weighted permutation at stage level")
        void shouldOrderAllChildren() {
            RulesConfig rules = ordering(OrderingMode.WEIGHTED);
            OrderingResult result = sequencer.order(leaves("a", "b", "c", "d"), rules, DecisionMode.ORDER,
                    "s1", "block", null, 3L);

            assertThat(ids(result.children())).containsExactlyInAnyOrder("a", "b", "c", "d");
            OrderingResult restored = sequencer.order(leaves("a", "b", "c", "d"), rules, DecisionMode.ORDER,
                    "s1", "block", result.assignment(), 999L);
            assertThat(ids(restored.children())).isEqualTo(ids(result.children()));
            assertThat(restored.restored()).isTrue();
        }
    }

    @Nested
    class Picking {

        @Test
        @DisplayName("Should use every combination equally often with round robin")
        void shouldCoverCombinationsRoundRobin() {
            List<ExperimentNode> children = leaves("a", "b", "c", "d");
            RulesConfig rules = picking(2, PickStrategy.ROUND_ROBIN, null);
            Map<List<String>, Integer> usage = new ConcurrentHashMap<>();

            for (int i = 0; i < 2 * 6; i++) {
                PickResult result = sequencer.pick(children, rules, "s" + i, "stage", null, (long) i, Map.of());
                usage.merge(result.pickedIds(), 1, Integer::sum);
            }

            assertThat(usage).hasSize(6);
            assertThat(usage.values()).containsOnly(2);
        }

        @Test
        @DisplayName("Should keep round-robin counters separate per decision point")
        void shouldIsolateRoundRobinCounters() {
            List<ExperimentNode> children = leaves("a", "b", "c");
            RulesConfig rules = picking(1, PickStrategy.ROUND_ROBIN, null);

            sequencer.pick(children, rules, "s1", "first", null, 1L, Map.of());
            sequencer.pick(children, rules, "s2", "first", null, 2L, Map.of());
            PickResult other = sequencer.pick(children, rules, "s3", "second", null, 3L, Map.of());

            assertThat(other.pickedIds()).containsExactly("a");
        }

        @Test
        @DisplayName("Should pick the same subset for the same seed")
        void shouldPickDeterministically() {
            List<ExperimentNode> children = leaves("a", "b", "c", "d", "e");
            RulesConfig rules = picking(2, PickStrategy.RANDOM, null);

            PickResult first = sequencer.pick(children, rules, "s1", "stage", null, 5L, Map.of());
            PickResult second = sequencer.pick(children, rules, "s1", "stage", null, 5L, Map.of());

            assertThat(first.pickedIds()).hasSize(2).isEqualTo(second.pickedIds());
        }

        @Test
        @DisplayName("Should pick distinct children with weighted random")
        void shouldPickWeightedWithoutReplacement() {
            RulesConfig rules = new RulesConfig(null, null, null, null, 2, PickStrategy.WEIGHTED_RANDOM,
                    List.of(new WeightEntry("c", 50)), null, null, null);

            PickResult result = sequencer.pick(leaves("a", "b", "c"), rules, "s1", "stage", null, 11L, Map.of());

            assertThat(result.pickedIds()).hasSize(2).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Should return all children when pick_count covers them")
        void shouldReturnAllWhenCountCoversCandidates() {
            PickResult result = sequencer.pick(leaves("a", "b"), picking(3, PickStrategy.RANDOM, null),
                    "s1", "stage", null, 1L, Map.of());

            assertThat(result.pickedIds()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Should restore stored picks and repick when they are stale")
        void shouldRestorePicks() {
            List<ExperimentNode> children = leaves("a", "b", "c");
            RulesConfig rules = picking(1, PickStrategy.RANDOM, null);

            PickResult restored = sequencer.pick(children, rules, "s1", "stage", List.of("c"), 1L, Map.of());
            assertThat(restored.restored()).isTrue();
            assertThat(restored.pickedIds()).containsExactly("c");

            PickResult stale = sequencer.pick(children, rules, "s1", "stage", List.of("gone"), 1L, Map.of());
            assertThat(stale.restored()).isFalse();
            assertThat(stale.pickedIds()).hasSize(1).isSubsetOf("a", "b", "c");
        }

        @Test
        @DisplayName("Should exclude candidates whose assigned value is already in the ledger")
        void shouldHonourNotInConditions() {
            List<ExperimentNode> children = List.of(
                    leaf("first_a", "v", "A"), leaf("only_b", "v", "B"), leaf("second_a", "v", "A"));
            RulesConfig rules = picking(3, PickStrategy.RANDOM,
                    List.of(new PickCondition("v", PickOperator.NOT_IN)));

            PickResult result = sequencer.pick(children, rules, "s1", "stage", null, 1L,
                    Map.of("v", List.of("A")));

            assertThat(result.pickedIds()).containsExactly("only_b");
            assertThat(result.ledgerDelta()).isEqualTo(Map.of("v", List.of("B")));
        }

        @Test
        @DisplayName("Should require ledger overlap for in conditions")
        void shouldHonourInConditions() {
            List<ExperimentNode> children = List.of(leaf("a", "v", "A"), leaf("b", "v", "B"), leaf("free"));
            RulesConfig rules = picking(3, PickStrategy.RANDOM, List.of(new PickCondition("v", PickOperator.IN)));

            PickResult result = sequencer.pick(children, rules, "s1", "stage", null, 1L, Map.of("v", List.of("B")));

            assertThat(result.pickedIds()).containsExactly("b", "free");
        }

        @Test
        @DisplayName("Should return an empty pick when conditions exclude every candidate")
        void shouldReturnEmptyWhenFilteredOut() {
            RulesConfig rules = picking(1, PickStrategy.RANDOM, List.of(new PickCondition("v", PickOperator.NOT_IN)));

            PickResult result = sequencer.pick(List.of(leaf("a", "v", "A")), rules, "s1", "stage", null, 1L,
                    Map.of("v", List.of("A")));

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.reason()).contains("No candidates satisfy");
        }

        @Test
        @DisplayName("Should aggregate pick assigns of container candidates")
        void shouldAggregateContainerAssigns() {
            ExperimentNode blockA = ExperimentNode.builder("block_a", NodeLevel.BLOCK)
                    .child(ExperimentNode.builder("t1", NodeLevel.TASK).type("task")
                            .pickAssigns(Map.of("arm", "x")).build())
                    .child(ExperimentNode.builder("t2", NodeLevel.TASK).type("task")
                            .pickAssigns(Map.of("arm", "y")).build())
                    .build();
            ExperimentNode blockB = ExperimentNode.builder("block_b", NodeLevel.BLOCK)
                    .child(ExperimentNode.builder("t3", NodeLevel.TASK).type("task")
                            .pickAssigns(Map.of("arm", "z")).build())
                    .build();
            RulesConfig rules = picking(1, PickStrategy.RANDOM, List.of(new PickCondition("arm", PickOperator.NOT_IN)));

            PickResult result = sequencer.pick(List.of(blockA, blockB), rules, "s1", "stage", null, 1L,
                    Map.of("arm", List.of("y")));

            assertThat(result.pickedIds()).containsExactly("block_b");
            assertThat(result.ledgerDelta()).isEqualTo(Map.of("arm", List.of("z")));
        }
    }
}
