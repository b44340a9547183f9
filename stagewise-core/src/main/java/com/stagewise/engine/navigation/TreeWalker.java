/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.navigation;

import com.stagewise.engine.api.exceptions.NavigationException;
import com.stagewise.engine.api.model.AssignmentRecord;
import com.stagewise.engine.api.model.ParticipantContext;
import com.stagewise.engine.api.model.QuotaDecision;
import com.stagewise.engine.api.model.SessionState;
import com.stagewise.engine.api.model.UnitStatus;
import com.stagewise.engine.api.model.definition.OrderingMode;
import com.stagewise.engine.api.model.definition.QuotaStrategy;
import com.stagewise.engine.api.model.definition.RulesConfig;
import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CapacityLedger;
import com.stagewise.engine.compiler.model.DecisionMode;
import com.stagewise.engine.compiler.model.ExperimentModel;
import com.stagewise.engine.compiler.model.ExperimentNode;
import com.stagewise.engine.evaluator.EvaluationContext;
import com.stagewise.engine.evaluator.RuleEvaluator;
import com.stagewise.engine.evaluator.sequencer.OrderingResult;
import com.stagewise.engine.evaluator.sequencer.PickResult;
import com.stagewise.engine.evaluator.sequencer.Sequencer;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the flattened list of visible units of a session.
 *
 * <p>The tree is walked depth-first. At every node with children the pick
 * decision runs first and the ordering decision second, both restored from
 * the session's stored assignments when present. Each child's visibility is
 * evaluated before descending, so a hidden node hides its whole subtree.
 * Nodes with a quota reserve a slot the first time the walk reaches them.
 *
 * <p>The walk writes new assignments, pick-ledger values and quota decisions
 * into the session builder it is given. Given the same stored decisions and
 * context, it always yields the same units.
 */
final class TreeWalker {

    private static final Logger logger = Logger.getLogger(TreeWalker.class.getName());

    static final String PICKS_SUFFIX = "_picks";

    private final ExperimentModel model;
    private final Sequencer sequencer;
    private final RuleEvaluator evaluator;
    private final CapacityLedger capacity;
    private final Duration holdTtl;
    private final Clock clock;

    TreeWalker(ExperimentModel model, Sequencer sequencer, RuleEvaluator evaluator, CapacityLedger capacity,
               Duration holdTtl, Clock clock) {
        this.model = model;
        this.sequencer = sequencer;
        this.evaluator = evaluator;
        this.capacity = capacity;
        this.holdTtl = holdTtl;
        this.clock = clock;
    }

    record Result(List<String> visibleUnitIds, List<AssignmentRecord> decisions, int skippedNodes) {
    }

    /**
     * @throws NavigationException with {@code QUOTA_FULL} when a node whose
     *         quota strategy is {@code block} has no capacity left; the
     *         caller rolls back holds and counters taken earlier in the walk
     */
    Result walk(SessionState.Builder state, ParticipantContext context) {
        Walk walk = new Walk(state, context);
        walk.descend(model.root());
        state.visibleUnitIds(walk.visible);
        return new Result(walk.visible, walk.decisions, walk.skipped);
    }

    static BranchKey quotaKey(String experimentId, ExperimentNode node) {
        return new BranchKey(experimentId, node.parentId() == null ? experimentId : node.parentId(), node.id());
    }

    static String picksKey(String decisionPointId) {
        return decisionPointId + PICKS_SUFFIX;
    }

    /**
     * Children a decision point's ordering was computed over: the stored
     * picks in definition order, or all children when the node does not pick.
     */
    static List<ExperimentNode> decisionChildren(ExperimentNode node, Map<String, String> assignments) {
        if (!node.rules().hasPick()) {
            return node.children();
        }
        String stored = assignments.get(picksKey(node.id()));
        if (stored == null) {
            return node.children();
        }
        Set<String> picked = new HashSet<>(splitIds(stored));
        List<ExperimentNode> children = new ArrayList<>();
        for (ExperimentNode child : node.children()) {
            if (picked.contains(child.id())) {
                children.add(child);
            }
        }
        return children;
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

    private final class Walk {
        private final SessionState.Builder state;
        private final ParticipantContext context;
        private final List<String> visible = new ArrayList<>();
        private final List<AssignmentRecord> decisions = new ArrayList<>();
        private EvaluationContext evaluationContext;
        private int skipped;

        Walk(SessionState.Builder state, ParticipantContext context) {
            this.state = state;
            this.context = context;
            this.evaluationContext = EvaluationContext.of(context, state.assignments());
        }

        void descend(ExperimentNode node) {
            for (ExperimentNode child : decide(node)) {
                visit(child);
            }
        }

        private void visit(ExperimentNode node) {
            if (!evaluator.evaluate(node.visibility(), evaluationContext)) {
                return;
            }
            if (node.rules().hasQuota() && !admitted(node)) {
                return;
            }
            if (node.isLeaf()) {
                visible.add(node.id());
            } else {
                descend(node);
            }
        }

        private List<ExperimentNode> decide(ExperimentNode node) {
            RulesConfig rules = node.rules();
            String decisionPoint = node.id();
            List<ExperimentNode> children = node.children();

            if (rules.hasPick()) {
                String stored = state.assignments().get(picksKey(decisionPoint));
                PickResult pick = sequencer.pick(children, rules, state.sessionId(), decisionPoint,
                        stored == null ? null : splitIds(stored), state.randomizationSeed(),
                        state.pickLedger());
                if (!pick.restored()) {
                    state.assignments().put(picksKey(decisionPoint), String.join(",", pick.pickedIds()));
                    mergeLedger(pick.ledgerDelta());
                    record(picksKey(decisionPoint), String.join(",", pick.pickedIds()), pick.reason());
                }
                children = pick.picked();
            }

            if (rules.ordering() != OrderingMode.SEQUENTIAL && !children.isEmpty()) {
                String stored = state.assignments().get(decisionPoint);
                Set<String> unavailable = stored == null ? fullBranches(node, children) : Set.of();
                OrderingResult ordering = sequencer.order(children, rules, node.decisionMode(),
                        state.sessionId(), decisionPoint, stored, state.randomizationSeed(), unavailable);
                if (ordering.assignment() != null && !ordering.restored()) {
                    state.assignments().put(decisionPoint, ordering.assignment());
                    record(decisionPoint, ordering.assignment(), ordering.reason());
                }
                children = ordering.children();
            }
            return children;
        }

        private boolean admitted(ExperimentNode node) {
            QuotaDecision decision = state.quotaDecisions().get(node.id());
            if (decision == QuotaDecision.SKIPPED) {
                return false;
            }
            if (decision != null) {
                return true;
            }
            BranchKey key = quotaKey(model.experimentId(), node);
            long limit = node.rules().quota();
            if (capacity.tryReserve(key, state.sessionId(), limit, holdTtl)) {
                state.quotaDecisions().put(node.id(), QuotaDecision.RESERVED);
                return true;
            }
            if (node.rules().quotaStrategy() == QuotaStrategy.BLOCK) {
                throw new NavigationException(NavigationException.Reason.QUOTA_FULL,
                        "Quota of '" + node.id() + "' is full (" + limit + ")");
            }
            logger.info("Quota of " + key + " is full, skipping for session " + state.sessionId());
            state.quotaDecisions().put(node.id(), QuotaDecision.SKIPPED);
            for (ExperimentNode leaf : node.leafDescendants()) {
                state.unitStatus().put(leaf.id(), UnitStatus.SKIPPED);
            }
            skipped++;
            return false;
        }

        /**
         * Branches a SELECT decision should avoid: children whose quota is
         * already used up.
         */
        private Set<String> fullBranches(ExperimentNode node, List<ExperimentNode> children) {
            if (node.decisionMode() != DecisionMode.SELECT) {
                return Set.of();
            }
            Set<String> full = new HashSet<>();
            for (ExperimentNode child : children) {
                if (child.rules().hasQuota()
                        && capacity.status(quotaKey(model.experimentId(), child), child.rules().quota()).full()) {
                    full.add(child.id());
                }
            }
            return full;
        }

        private void mergeLedger(Map<String, List<Object>> delta) {
            delta.forEach((variable, values) -> {
                List<Object> accumulated = state.pickLedger().computeIfAbsent(variable, k -> new ArrayList<>());
                for (Object value : values) {
                    if (!Sequencer.containsValue(accumulated, value)) {
                        accumulated.add(value);
                    }
                }
            });
        }

        private void record(String decisionPoint, String value, String reason) {
            decisions.add(new AssignmentRecord(decisionPoint, value, reason, clock.instant()));
            evaluationContext = EvaluationContext.of(context, state.assignments());
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Session " + state.sessionId() + " committed " + decisionPoint + "=" + value
                        + " (" + reason + ")");
            }
        }
    }
}
