/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.navigation;

import com.stagewise.engine.api.INavigationEngine;
import com.stagewise.engine.api.exceptions.NavigationException;
import com.stagewise.engine.api.model.DistributionSnapshot;
import com.stagewise.engine.api.model.InitializeResult;
import com.stagewise.engine.api.model.InvalidationPreview;
import com.stagewise.engine.api.model.JumpResult;
import com.stagewise.engine.api.model.ParticipantContext;
import com.stagewise.engine.api.model.QuotaDecision;
import com.stagewise.engine.api.model.QuotaStatus;
import com.stagewise.engine.api.model.SessionState;
import com.stagewise.engine.api.model.SessionStatus;
import com.stagewise.engine.api.model.SessionView;
import com.stagewise.engine.api.model.StartRequest;
import com.stagewise.engine.api.model.SubmitResult;
import com.stagewise.engine.api.model.UnitStatus;
import com.stagewise.engine.api.model.definition.OrderingMode;
import com.stagewise.engine.api.model.definition.PickStrategy;
import com.stagewise.engine.api.model.definition.RulesConfig;
import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CapacityLedger;
import com.stagewise.engine.api.store.CounterField;
import com.stagewise.engine.api.store.CounterSnapshot;
import com.stagewise.engine.api.store.DistributionCounterStore;
import com.stagewise.engine.api.store.DocumentStore;
import com.stagewise.engine.api.store.StateCache;
import com.stagewise.engine.compiler.graph.DependencyGraph;
import com.stagewise.engine.compiler.model.DecisionMode;
import com.stagewise.engine.compiler.model.ExperimentModel;
import com.stagewise.engine.compiler.model.ExperimentNode;
import com.stagewise.engine.context.EnvironmentDetector;
import com.stagewise.engine.context.ParticipantContextStore;
import com.stagewise.engine.context.SessionStore;
import com.stagewise.engine.evaluator.RuleEvaluator;
import com.stagewise.engine.evaluator.counter.InMemoryDistributionCounterStore;
import com.stagewise.engine.evaluator.sequencer.Sequencer;
import com.stagewise.engine.infra.cache.NoOpStateCache;
import com.stagewise.engine.infra.capacity.InMemoryCapacityLedger;
import com.stagewise.engine.infra.config.EngineConfig;
import com.stagewise.engine.infra.metrics.NavigationMetrics;
import com.stagewise.engine.infra.store.InMemoryDocumentStore;
import com.stagewise.engine.infra.telemetry.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Navigation state machine of one compiled experiment.
 *
 * <p>Every request follows the same shape: load the session and its
 * participant context, reject the request if it is not allowed, derive a new
 * state from a builder, recompute the visible units from scratch, then
 * persist the context and, last, the session with optimistic versioning.
 *
 * <h2>Failure</h2>
 * <p>The session write is the commit point. Counter increments, active
 * markers and capacity holds taken while computing a request are journaled
 * and undone if the request fails before that point, and a context written
 * ahead of a failed session write is restored. Retrying the identical
 * request therefore starts from the same shared state. Quota conversions and
 * balanced completion counts are applied after the commit.
 *
 * <h2>Determinism</h2>
 * <p>Assignments and picks are committed on first computation and restored on
 * every later walk, so recomputing the visible units never changes an
 * already-resolved branch. Random draws are seeded from the session seed.
 *
 * <h2>Capacity</h2>
 * <p>Quota-carrying nodes reserve a slot the first time a walk reaches them
 * and convert the reservation once the node is completed. Balanced decision
 * points count a completion once per session.
 *
 * <p>Thread-safe. Concurrent requests for the same session are detected by
 * the version check of the session store and rejected with
 * {@code CONCURRENT_MODIFICATION}.
 */
public class NavigationEngine implements INavigationEngine {

    private static final Logger logger = Logger.getLogger(NavigationEngine.class.getName());

    private static final Set<String> IDENTITY_TYPES = Set.of("user_info", "participant_identity");

    private final ExperimentModel model;
    private final String experimentId;
    private final DistributionCounterStore counters;
    private final CapacityLedger capacity;
    private final SessionStore sessions;
    private final ParticipantContextStore contexts;
    private final EngineConfig config;
    private final Clock clock;
    private final Tracer tracer;
    private final NavigationMetrics metrics;
    private final LongSupplier seedSource;
    private final Sequencer sequencer;
    private final TreeWalker walker;
    private final CompletionTracker completion;
    private final SubmissionValidator validator = new SubmissionValidator();
    private final RequestJournal journal = new RequestJournal();

    private NavigationEngine(Builder builder) {
        this.model = builder.model;
        this.experimentId = builder.model.experimentId();
        this.config = builder.config;
        this.clock = builder.clock;
        this.counters = builder.counters;
        this.capacity = builder.capacity != null ? builder.capacity : new InMemoryCapacityLedger(clock);
        this.tracer = builder.tracing.getTracer();
        this.metrics = builder.metrics;
        this.seedSource = builder.seedSource;
        this.sessions = new SessionStore(builder.documentStore, builder.cache, config.getSessionTtl(), clock, metrics);
        this.contexts = new ParticipantContextStore(builder.documentStore, builder.cache, config.getSessionTtl(),
                clock, metrics);
        this.sequencer = Sequencer.builder(experimentId, journal.counters(counters))
                .maxAttempts(config.getBalancedMaxAttempts())
                .clock(clock)
                .tracer(tracer)
                .build();
        this.walker = new TreeWalker(model, sequencer, new RuleEvaluator(), journal.capacity(capacity),
                config.getHoldTtl(), clock);
        this.completion = new CompletionTracker(model);
        logger.info("NavigationEngine initialized for " + model);
    }

    public static Builder builder(ExperimentModel model) {
        return new Builder(model);
    }

    public ExperimentModel getModel() {
        return model;
    }

    public NavigationMetrics getMetrics() {
        return metrics;
    }

    // ------------------------------------------------------------------
    // Session lifecycle
    // ------------------------------------------------------------------

    @Override
    public InitializeResult initialize(StartRequest request) {
        String sessionId = request.sessionId() != null ? request.sessionId() : UUID.randomUUID().toString();
        return traced("initialize", sessionId, () -> {
            Optional<SessionState> existing = sessions.find(sessionId);
            if (existing.isPresent()) {
                SessionState state = existing.get();
                logger.fine("Session " + sessionId + " already initialized, returning stored state");
                return new InitializeResult(state, state.currentUnitId(), state.visibleUnitIds(),
                        state.assignments(), CompletionTracker.progress(state));
            }

            Instant now = clock.instant();
            long seed = request.seed() != null ? request.seed() : seedSource.getAsLong();
            // a context without a session is left over from an attempt that never committed
            Optional<ParticipantContext> orphan = contexts.find(sessionId);
            long contextVersion = orphan.map(ParticipantContext::version).orElse(0L);
            ParticipantContext context = new ParticipantContext(sessionId, experimentId, request.userId(),
                    request.participant(), EnvironmentDetector.detect(request.userAgent(), request.screenSize()),
                    request.urlParams(), null, null, null, contextVersion, now);

            SessionState.Builder builder = SessionState.builder()
                    .sessionId(sessionId)
                    .experimentId(experimentId)
                    .definitionVersion(model.version())
                    .userId(request.userId())
                    .randomizationSeed(seed)
                    .createdAt(now)
                    .updatedAt(now);
            TreeWalker.Result walk = walker.walk(builder, context);
            recordSkips(walk);

            String first = CompletionTracker.firstPending(builder);
            if (first == null) {
                builder.status(SessionStatus.COMPLETED);
                logger.info("Session " + sessionId + " has no visible units, marked complete");
            } else {
                builder.currentUnitId(first);
                builder.unitStatus().put(first, UnitStatus.IN_PROGRESS);
            }

            saveContext(orphan, context.withAssignments(walk.decisions()));
            SessionState saved = sessions.save(builder.build());
            journal.commit();
            metrics.recordInitialized();
            Span.current().setAttribute("unit.id", first == null ? "" : first);
            logger.info("Session " + sessionId + " initialized with " + saved.visibleUnitIds().size()
                    + " visible units");
            return new InitializeResult(saved, first, saved.visibleUnitIds(), saved.assignments(),
                    CompletionTracker.progress(saved));
        });
    }

    @Override
    public SubmitResult submit(String sessionId, String unitId, Map<String, Object> payload) {
        return traced("submit", sessionId, () -> {
            Span.current().setAttribute("unit.id", String.valueOf(unitId));
            Map<String, Object> data = payload == null ? Map.of() : payload;
            SessionState state = activeSession(sessionId);
            ExperimentNode unit = requireUnit(unitId);
            if (!unitId.equals(state.currentUnitId())) {
                throw new NavigationException(NavigationException.Reason.STALE_SUBMISSION,
                        "Unit '" + unitId + "' is not the current unit '" + state.currentUnitId() + "'");
            }
            if (state.isCompleted(unitId) && !unit.isEditableAfterSubmit()) {
                throw new NavigationException(NavigationException.Reason.NOT_EDITABLE,
                        "Unit '" + unitId + "' was already submitted and is not editable");
            }
            List<String> errors = validator.validate(unit, data);
            if (!errors.isEmpty()) {
                throw new NavigationException(NavigationException.Reason.VALIDATION_FAILED,
                        "Submission for '" + unitId + "' failed validation", errors);
            }

            Optional<ParticipantContext> stored = contexts.find(sessionId);
            ParticipantContext context = stored.orElseGet(() -> ParticipantContext.empty(sessionId, experimentId))
                    .withResponse(unitId, data);
            if (unit.type() != null && IDENTITY_TYPES.contains(unit.type())) {
                context = context.withParticipantValues(data);
            }

            SessionState.Builder builder = state.toBuilder();
            builder.data().put(unitId, new LinkedHashMap<>(data));
            builder.completedUnitIds().add(unitId);
            builder.unitStatus().put(unitId, UnitStatus.COMPLETED);

            TreeWalker.Result walk = walker.walk(builder, context);
            recordSkips(walk);
            completion.recompute(builder);
            List<Runnable> afterCommit = new ArrayList<>(consumeQuotas(builder));
            afterCommit.addAll(countBalancedCompletions(builder));

            String next = CompletionTracker.firstPending(builder);
            builder.returnPoint(null, null);
            builder.currentUnitId(next);
            if (next == null) {
                builder.status(SessionStatus.COMPLETED);
            } else {
                builder.unitStatus().put(next, UnitStatus.IN_PROGRESS);
            }
            builder.updatedAt(clock.instant());

            saveContext(stored, context.withAssignments(walk.decisions()));
            SessionState saved = sessions.save(builder.build());
            journal.commit();
            applyCommitted(sessionId, afterCommit);
            metrics.recordSubmission();
            if (next == null) {
                metrics.recordCompleted();
                logger.info("Session " + sessionId + " completed");
            }
            return new SubmitResult(saved, next, saved.visibleUnitIds(), saved.completedUnitIds(),
                    completion.lockedItems(saved), next == null, CompletionTracker.progress(saved));
        });
    }

    @Override
    public JumpResult jump(String sessionId, String targetUnitId) {
        return traced("jump", sessionId, () -> {
            Span.current().setAttribute("unit.id", String.valueOf(targetUnitId));
            SessionState state = activeSession(sessionId);
            ExperimentNode target = requireUnit(targetUnitId);
            boolean completed = state.isCompleted(targetUnitId);
            boolean nextInLine = targetUnitId.equals(firstPending(state));
            if (!target.isReference() && !completed && !nextInLine) {
                throw new NavigationException(NavigationException.Reason.JUMP_NOT_ALLOWED,
                        "Unit '" + targetUnitId + "' is neither a reference, completed, nor the next unit");
            }
            if (completed && completion.isLocked(state, targetUnitId)) {
                throw new NavigationException(NavigationException.Reason.UNIT_LOCKED,
                        "Unit '" + targetUnitId + "' is locked");
            }

            Instant now = clock.instant();
            SessionState.Builder builder = state.toBuilder();
            String returnUnitId = state.currentUnitId();
            if (returnUnitId != null && !returnUnitId.equals(targetUnitId)) {
                builder.returnPoint(returnUnitId, now.plus(config.getJumpReturnTtl()));
            } else {
                returnUnitId = state.returnUnitId();
            }
            builder.currentUnitId(targetUnitId);

            List<String> invalidated = List.of();
            if (completed && target.isEditableAfterSubmit() && target.invalidatesDependents()) {
                invalidated = invalidateDependents(builder, targetUnitId);
                if (!invalidated.isEmpty()) {
                    Optional<ParticipantContext> stored = contexts.find(sessionId);
                    ParticipantContext context = stored
                            .orElseGet(() -> ParticipantContext.empty(sessionId, experimentId))
                            .withoutResponses(invalidated);
                    recordSkips(walker.walk(builder, context));
                    completion.recompute(builder);
                    saveContext(stored, context);
                }
            }
            builder.updatedAt(now);

            SessionState saved = sessions.save(builder.build());
            journal.commit();
            metrics.recordJump(invalidated.size());
            if (!invalidated.isEmpty()) {
                logger.info("Jump of " + sessionId + " to " + targetUnitId + " invalidated " + invalidated);
            }
            return new JumpResult(saved, targetUnitId, returnUnitId, invalidated);
        });
    }

    @Override
    public SessionView resume(String sessionId) {
        return traced("resume", sessionId, () -> {
            SessionState state = activeSession(sessionId);
            Instant now = clock.instant();
            String target = null;
            String returnUnitId = state.returnUnitId();
            if (returnUnitId != null && state.returnExpiresAt() != null && now.isBefore(state.returnExpiresAt())
                    && state.visibleUnitIds().contains(returnUnitId) && !state.isCompleted(returnUnitId)) {
                target = returnUnitId;
            }
            if (target == null) {
                target = firstPending(state);
            }

            SessionState.Builder builder = state.toBuilder()
                    .returnPoint(null, null)
                    .currentUnitId(target)
                    .updatedAt(now);
            if (target == null) {
                builder.status(SessionStatus.COMPLETED);
            }
            SessionState saved = sessions.save(builder.build());
            return view(saved);
        });
    }

    @Override
    public SessionView getState(String sessionId) {
        return traced("get_state", sessionId, () -> view(loadSession(sessionId)));
    }

    @Override
    public void abandon(String sessionId) {
        traced("abandon", sessionId, () -> {
            SessionState state = activeSession(sessionId);
            releaseHolds(state);
            for (ExperimentNode node : model.nodes()) {
                if (!state.recordedCompletions().contains(node.id())) {
                    balanceKey(node, state.assignments())
                            .ifPresent(key -> counters.clearActive(key, sessionId));
                }
            }
            sessions.save(state.toBuilder()
                    .status(SessionStatus.ABANDONED)
                    .updatedAt(clock.instant())
                    .build());
            metrics.recordAbandoned();
            logger.info("Session " + sessionId + " abandoned");
            return null;
        });
    }

    @Override
    public void recordScore(String sessionId, String name, Object value) {
        traced("record_score", sessionId, () -> {
            loadSession(sessionId);
            contexts.save(loadContext(sessionId).withScore(name, value));
            return null;
        });
    }

    // ------------------------------------------------------------------
    // Dependency inspection
    // ------------------------------------------------------------------

    @Override
    public List<String> getDependents(String unitId) {
        requireNode(unitId);
        return model.dependencyGraph().getDependents(unitId);
    }

    @Override
    public List<String> getDependencies(String unitId) {
        requireNode(unitId);
        return model.dependencyGraph().getDependencies(unitId);
    }

    @Override
    public InvalidationPreview wouldInvalidate(String unitId) {
        requireNode(unitId);
        List<String> affected = new ArrayList<>(affectedUnits(unitId));
        return new InvalidationPreview(unitId, affected, affected.size());
    }

    // ------------------------------------------------------------------
    // Administration
    // ------------------------------------------------------------------

    @Override
    public DistributionSnapshot distributionSnapshot(String decisionPointId) {
        ExperimentNode node = requireNode(decisionPointId);
        String namespace = counterNamespace(node);
        Map<String, CounterSnapshot> branches = new LinkedHashMap<>();
        if (namespace.equals(decisionPointId)) {
            for (ExperimentNode child : node.children()) {
                branches.put(child.id(), CounterSnapshot.zero());
            }
        } else if (namespace.endsWith(Sequencer.LATIN_SQUARE_SUFFIX)) {
            for (int row = 0; row < node.children().size(); row++) {
                branches.put(String.valueOf(row), CounterSnapshot.zero());
            }
        }
        branches.putAll(counters.getAll(experimentId, namespace));
        return DistributionSnapshot.of(experimentId, namespace, branches, clock.instant());
    }

    @Override
    public QuotaStatus quotaStatus(String nodeId) {
        ExperimentNode node = requireQuotaNode(nodeId);
        return capacity.status(TreeWalker.quotaKey(experimentId, node), node.rules().quota());
    }

    @Override
    public void resetDistribution(String decisionPointId, String actor) {
        requireNode(decisionPointId);
        counters.reset(experimentId, decisionPointId);
        counters.reset(experimentId, decisionPointId + Sequencer.LATIN_SQUARE_SUFFIX);
        counters.reset(experimentId, decisionPointId + Sequencer.ROUND_ROBIN_SUFFIX);
        logger.info("AUDIT: distribution counters of " + experimentId + ":" + decisionPointId
                + " reset by " + actor);
    }

    @Override
    public void resetQuota(String nodeId, String actor) {
        ExperimentNode node = requireQuotaNode(nodeId);
        capacity.reset(TreeWalker.quotaKey(experimentId, node));
        logger.info("AUDIT: quota of " + experimentId + ":" + nodeId + " reset by " + actor);
    }

    @Override
    public int sweepStaleHolds() {
        return counters.sweepStaleActive(experimentId, clock.instant().minus(config.getActiveTimeout()));
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private <T> T traced(String operation, String sessionId, Supplier<T> body) {
        Span span = tracer.spanBuilder("navigation." + operation).startSpan();
        long startTime = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("experiment.id", experimentId);
            span.setAttribute("session.id", String.valueOf(sessionId));
            return body.get();
        } catch (NavigationException e) {
            journal.rollback(e);
            metrics.recordRejection(e.getReason());
            span.setAttribute("rejection.reason", e.getReason().name());
            span.setStatus(StatusCode.ERROR, e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Rejected " + operation + " of " + sessionId + ": " + e.getReason() + " "
                        + e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            journal.rollback(e);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getName() : e.getMessage());
            throw e;
        } finally {
            metrics.recordRequest(System.nanoTime() - startTime);
            span.end();
        }
    }

    private SessionState loadSession(String sessionId) {
        return sessions.find(sessionId).orElseThrow(() -> new NavigationException(
                NavigationException.Reason.UNKNOWN_SESSION, "Unknown session '" + sessionId + "'"));
    }

    private SessionState activeSession(String sessionId) {
        SessionState state = loadSession(sessionId);
        if (!state.isActive()) {
            throw new NavigationException(NavigationException.Reason.SESSION_NOT_ACTIVE,
                    "Session '" + sessionId + "' is " + state.status());
        }
        return state;
    }

    private ParticipantContext loadContext(String sessionId) {
        return contexts.find(sessionId).orElseGet(() -> ParticipantContext.empty(sessionId, experimentId));
    }

    private ExperimentNode requireNode(String id) {
        return model.findNode(id).orElseThrow(() -> new NavigationException(
                NavigationException.Reason.UNKNOWN_UNIT, "Unknown node '" + id + "'"));
    }

    private ExperimentNode requireUnit(String unitId) {
        if (!model.isLeafUnit(unitId)) {
            throw new NavigationException(NavigationException.Reason.UNKNOWN_UNIT,
                    "Unknown unit '" + unitId + "'");
        }
        return model.getNode(unitId);
    }

    private ExperimentNode requireQuotaNode(String nodeId) {
        ExperimentNode node = requireNode(nodeId);
        if (!node.rules().hasQuota()) {
            throw new IllegalArgumentException("Node '" + nodeId + "' has no quota");
        }
        return node;
    }

    private SessionView view(SessionState state) {
        return new SessionView(state, completion.lockedItems(state), CompletionTracker.progress(state));
    }

    private static String firstPending(SessionState state) {
        for (String unitId : state.visibleUnitIds()) {
            if (!state.isCompleted(unitId)) {
                return unitId;
            }
        }
        return null;
    }

    private void recordSkips(TreeWalker.Result walk) {
        for (int i = 0; i < walk.skippedNodes(); i++) {
            metrics.recordQuotaSkip();
        }
    }

    /**
     * Marks the reservations of completed quota nodes as consumed.
     *
     * @return the conversions into permanent completions, to run once the
     *         session is saved
     */
    private List<Runnable> consumeQuotas(SessionState.Builder builder) {
        SessionState snapshot = builder.build();
        String sessionId = builder.sessionId();
        List<Runnable> conversions = new ArrayList<>();
        for (Map.Entry<String, QuotaDecision> entry : builder.quotaDecisions().entrySet()) {
            if (entry.getValue() != QuotaDecision.RESERVED) {
                continue;
            }
            ExperimentNode node = model.getNode(entry.getKey());
            if (completion.isCompleted(snapshot, node)) {
                entry.setValue(QuotaDecision.CONSUMED);
                conversions.add(() -> {
                    long used = capacity.tryComplete(TreeWalker.quotaKey(experimentId, node), sessionId);
                    logger.fine("Quota of " + node.id() + " consumed (" + used + "/" + node.rules().quota() + ")");
                });
            }
        }
        return conversions;
    }

    /**
     * Flags every balanced decision whose committed branch the session has
     * just finished. Recorded once per decision point.
     *
     * @return the completion counts, to run once the session is saved
     */
    private List<Runnable> countBalancedCompletions(SessionState.Builder builder) {
        SessionState snapshot = builder.build();
        String sessionId = builder.sessionId();
        List<Runnable> counts = new ArrayList<>();
        for (ExperimentNode node : model.nodes()) {
            if (builder.recordedCompletions().contains(node.id())) {
                continue;
            }
            Optional<BranchKey> key = balanceKey(node, builder.assignments());
            if (key.isEmpty()) {
                continue;
            }
            boolean selects = node.decisionMode() == DecisionMode.SELECT
                    && node.rules().ordering() == OrderingMode.BALANCED;
            ExperimentNode finished = selects
                    ? model.findNode(builder.assignments().get(node.id())).orElse(null)
                    : node;
            if (finished != null && completion.isCompleted(snapshot, finished)) {
                BranchKey branch = key.get();
                builder.recordedCompletions().add(node.id());
                counts.add(() -> {
                    counters.incrementAndGet(branch, CounterField.COMPLETED);
                    counters.clearActive(branch, sessionId);
                });
            }
        }
        return counts;
    }

    /**
     * Writes the context ahead of the session. Should the session write fail,
     * the journal puts the previous context back, or deletes the context if
     * there was none.
     */
    private void saveContext(Optional<ParticipantContext> previous, ParticipantContext updated) {
        ParticipantContext saved = contexts.save(updated);
        String sessionId = saved.sessionId();
        if (previous.isPresent()) {
            ParticipantContext restored = previous.get();
            journal.record("context of " + sessionId,
                    () -> contexts.save(restored.withVersion(saved.version(), saved.updatedAt())));
        } else {
            journal.record("context of " + sessionId, () -> contexts.delete(sessionId));
        }
    }

    /**
     * Applies capacity and counter updates of a committed submission. The
     * saved session already records them as done, so a failing store is
     * logged instead of failing the request; an unconverted hold expires on
     * its own.
     */
    private void applyCommitted(String sessionId, List<Runnable> updates) {
        for (Runnable update : updates) {
            try {
                update.run();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to apply committed updates of session " + sessionId, e);
                Span.current().recordException(e);
            }
        }
    }

    private Optional<BranchKey> balanceKey(ExperimentNode node, Map<String, String> assignments) {
        if (node.isLeaf()) {
            return Optional.empty();
        }
        return sequencer.balanceKey(TreeWalker.decisionChildren(node, assignments), node.rules(),
                node.decisionMode(), node.id(), assignments.get(node.id()));
    }

    private void releaseHolds(SessionState state) {
        state.quotaDecisions().forEach((nodeId, decision) -> {
            if (decision == QuotaDecision.RESERVED) {
                capacity.release(TreeWalker.quotaKey(experimentId, model.getNode(nodeId)), state.sessionId());
            }
        });
    }

    /**
     * Demotes completed dependents of {@code unitId} to invalidated and drops
     * their stored data.
     *
     * @return the demoted unit ids in topological order
     */
    private List<String> invalidateDependents(SessionState.Builder builder, String unitId) {
        List<String> invalidated = new ArrayList<>();
        for (String dependent : affectedUnits(unitId)) {
            if (builder.completedUnitIds().remove(dependent)) {
                builder.unitStatus().put(dependent, UnitStatus.INVALIDATED);
                builder.data().remove(dependent);
                invalidated.add(dependent);
            }
        }
        return invalidated;
    }

    /**
     * Leaf units beneath every transitive dependent of {@code unitId}.
     */
    private Set<String> affectedUnits(String unitId) {
        DependencyGraph graph = model.dependencyGraph();
        Set<String> affected = new LinkedHashSet<>();
        for (String dependent : graph.getDependents(unitId)) {
            model.findNode(dependent).ifPresent(node -> {
                for (ExperimentNode leaf : node.leafDescendants()) {
                    affected.add(leaf.id());
                }
            });
        }
        affected.remove(unitId);
        return affected;
    }

    /**
     * Counter namespace a decision point records its distribution under.
     */
    private static String counterNamespace(ExperimentNode node) {
        RulesConfig rules = node.rules();
        if (rules.ordering() == OrderingMode.BALANCED && node.decisionMode() == DecisionMode.SELECT) {
            return node.id();
        }
        if (rules.ordering() == OrderingMode.BALANCED || rules.ordering() == OrderingMode.LATIN_SQUARE) {
            return node.id() + Sequencer.LATIN_SQUARE_SUFFIX;
        }
        if (rules.hasPick() && rules.pickStrategy() == PickStrategy.ROUND_ROBIN) {
            return node.id() + Sequencer.ROUND_ROBIN_SUFFIX;
        }
        return node.id();
    }

    public static final class Builder {
        private final ExperimentModel model;
        private DocumentStore documentStore;
        private StateCache cache = NoOpStateCache.INSTANCE;
        private DistributionCounterStore counters = new InMemoryDistributionCounterStore();
        private CapacityLedger capacity;
        private EngineConfig config;
        private Clock clock = Clock.systemUTC();
        private TracingService tracing;
        private NavigationMetrics metrics = new NavigationMetrics();
        private LongSupplier seedSource = () -> ThreadLocalRandom.current().nextLong();

        private Builder(ExperimentModel model) {
            this.model = model;
        }

        public Builder documentStore(DocumentStore documentStore) {
            this.documentStore = documentStore;
            return this;
        }

        public Builder cache(StateCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder counters(DistributionCounterStore counters) {
            this.counters = counters;
            return this;
        }

        public Builder capacity(CapacityLedger capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder metrics(NavigationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Source of session seeds for requests that do not carry one.
         */
        public Builder seedSource(LongSupplier seedSource) {
            this.seedSource = seedSource;
            return this;
        }

        public NavigationEngine build() {
            if (model == null) {
                throw new IllegalStateException("An experiment model is required");
            }
            if (config == null) {
                config = EngineConfig.isolatedBuilder().build();
            }
            if (documentStore == null) {
                documentStore = new InMemoryDocumentStore(clock);
            }
            if (tracing == null) {
                tracing = TracingService.noop();
            }
            return new NavigationEngine(this);
        }
    }
}
