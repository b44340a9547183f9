package com.stagewise.engine.navigation;

import com.stagewise.engine.MutableClock;
import com.stagewise.engine.api.exceptions.NavigationException;
import com.stagewise.engine.api.exceptions.StoreUnavailableException;
import com.stagewise.engine.api.model.DistributionSnapshot;
import com.stagewise.engine.api.model.InitializeResult;
import com.stagewise.engine.api.model.InvalidationPreview;
import com.stagewise.engine.api.model.JumpResult;
import com.stagewise.engine.api.model.ParticipantContext;
import com.stagewise.engine.api.model.QuotaDecision;
import com.stagewise.engine.api.model.SessionState;
import com.stagewise.engine.api.model.SessionStatus;
import com.stagewise.engine.api.model.SessionView;
import com.stagewise.engine.api.model.StartRequest;
import com.stagewise.engine.api.model.SubmitResult;
import com.stagewise.engine.api.model.UnitStatus;
import com.stagewise.engine.api.store.DocumentStore;
import com.stagewise.engine.api.store.VersionedDocument;
import com.stagewise.engine.compiler.DefinitionCompiler;
import com.stagewise.engine.compiler.model.ExperimentModel;
import com.stagewise.engine.context.ParticipantContextStore;
import com.stagewise.engine.evaluator.counter.InMemoryDistributionCounterStore;
import com.stagewise.engine.infra.cache.NoOpStateCache;
import com.stagewise.engine.infra.capacity.InMemoryCapacityLedger;
import com.stagewise.engine.infra.metrics.NavigationMetrics;
import com.stagewise.engine.infra.store.InMemoryDocumentStore;
import com.stagewise.engine.infra.telemetry.TracingService;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NavigationEngineTest {

    private static final String STUDY = """
            {
              "meta": {"id": "nav_study", "version": 2, "name": "Navigation"},
              "phases": [
                {"id": "consent", "type": "consent", "allow_jump_to_completed": false,
                 "fields": [{"field": "agreed"}]},
                {"id": "profile", "type": "user_info", "editable_after_submit": true,
                 "fields": [
                   {"field": "age", "validation": "[0-9]+", "validation_message": "Age must be a number"},
                   {"field": "nickname", "required": false}
                 ]},
                {"id": "main", "stages": [
                  {"id": "arms", "rules": {"pick_count": 1}, "blocks": [
                    {"id": "block_x", "pick_assigns": {"arm": "x"}, "tasks": [{"id": "task_x", "type": "rating"}]},
                    {"id": "block_y", "pick_assigns": {"arm": "y"}, "tasks": [{"id": "task_y", "type": "rating"}]}
                  ]},
                  {"id": "adult", "rules": {"visibility": "profile.age >= 18"}, "blocks": [
                    {"id": "adult_block", "tasks": [
                      {"id": "adult_task_1", "type": "survey"},
                      {"id": "adult_task_2", "type": "survey"}
                    ]}
                  ]},
                  {"id": "minor_task", "type": "survey", "rules": {"visibility": "profile.age < 18"}}
                ]},
                {"id": "help", "type": "instructions", "reference": true}
              ]
            }
            """;

    private static final String QUOTA_STUDY = """
            {
              "meta": {"id": "quota_study", "version": 1},
              "rules": {"ordering": "balanced"},
              "phases": [
                {"id": "A", "rules": {"quota": 2}, "stages": [{"id": "a_task", "type": "survey"}]},
                {"id": "B", "rules": {"quota": 2}, "stages": [{"id": "b_task", "type": "survey"}]},
                {"id": "C", "rules": {"quota": 2}, "stages": [{"id": "c_task", "type": "survey"}]}
              ]
            }
            """;

    private static final String BLOCKING_STUDY = """
            {
              "meta": {"id": "blocking_study", "version": 1},
              "phases": [
                {"id": "intro", "type": "consent"},
                {"id": "limited", "rules": {"quota": 1, "quota_strategy": "block"},
                 "stages": [{"id": "limited_task", "type": "survey"}]}
              ]
            }
            """;

    private final DefinitionCompiler compiler = new DefinitionCompiler(OpenTelemetry.noop().getTracer("test"));

    private MutableClock clock;
    private InMemoryDocumentStore documents;
    private InMemoryDistributionCounterStore counters;
    private InMemoryCapacityLedger capacity;
    private InMemorySpanExporter spans;
    private NavigationMetrics metrics;
    private NavigationEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        documents = new InMemoryDocumentStore(clock);
        counters = new InMemoryDistributionCounterStore();
        capacity = new InMemoryCapacityLedger(clock);
        spans = InMemorySpanExporter.create();
        metrics = new NavigationMetrics();
        engine = engineFor(STUDY);
    }

    private NavigationEngine engineFor(String definition) {
        return engineFor(definition, documents);
    }

    private NavigationEngine engineFor(String definition, DocumentStore store) {
        ExperimentModel model = compiler.compileJson(definition);
        SdkTracerProvider provider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spans))
                .build();
        return NavigationEngine.builder(model)
                .documentStore(store)
                .counters(counters)
                .capacity(capacity)
                .clock(clock)
                .metrics(metrics)
                .tracing(TracingService.using(OpenTelemetrySdk.builder().setTracerProvider(provider).build()))
                .seedSource(() -> 42L)
                .build();
    }

    private static String armTask(SessionState state) {
        return state.visibleUnitIds().contains("task_x") ? "task_x" : "task_y";
    }

    /** Consent, profile with the given age, the picked arm task. */
    private SubmitResult advanceThroughArm(String sessionId, int age) {
        engine.submit(sessionId, "consent", Map.of("agreed", true));
        SubmitResult profile = engine.submit(sessionId, "profile", Map.of("age", age));
        return engine.submit(sessionId, profile.nextUnitId(), Map.of());
    }

    private Optional<ParticipantContext> findContext(String sessionId) {
        return new ParticipantContextStore(documents, NoOpStateCache.INSTANCE, Duration.ofHours(1), clock,
                new NavigationMetrics()).find(sessionId);
    }

    private ParticipantContext storedContext(String sessionId) {
        return new ParticipantContextStore(documents, NoOpStateCache.INSTANCE, Duration.ofHours(1), clock,
                new NavigationMetrics()).find(sessionId).orElseThrow();
    }

    @Nested
    class Initialization {

        @Test
        @DisplayName("Should present the first visible unit and persist the session")
        void shouldInitializeSession() {
            InitializeResult result = engine.initialize(StartRequest.of("s1"));

            assertThat(result.firstUnitId()).isEqualTo("consent");
            assertThat(result.visibleUnitIds()).hasSize(4);
            assertThat(result.visibleUnitIds()).startsWith("consent", "profile").endsWith("help");
            assertThat(result.state().status()).isEqualTo(SessionStatus.ACTIVE);
            assertThat(result.state().statusOf("consent")).isEqualTo(UnitStatus.IN_PROGRESS);
            assertThat(result.state().randomizationSeed()).isEqualTo(42L);
            assertThat(result.state().definitionVersion()).isEqualTo(2);
            assertThat(result.progress().total()).isEqualTo(4);
            assertThat(engine.getState("s1").state().currentUnitId()).isEqualTo("consent");
        }

        @Test
        @DisplayName("Should return the stored session when initialized twice")
        void shouldBeIdempotent() {
            InitializeResult first = engine.initialize(StartRequest.of("s1"));
            InitializeResult second = engine.initialize(StartRequest.of("s1").withSeed(7L));

            assertThat(second.state().version()).isEqualTo(first.state().version());
            assertThat(second.state().randomizationSeed()).isEqualTo(42L);
            assertThat(second.visibleUnitIds()).isEqualTo(first.visibleUnitIds());
            assertThat(metrics.getSnapshot()).containsEntry("sessionsInitialized", 1L);
        }

        @Test
        @DisplayName("Should generate a session id when none is given")
        void shouldGenerateSessionId() {
            InitializeResult result = engine.initialize(StartRequest.of(null));

            assertThat(result.state().sessionId()).isNotBlank();
            assertThat(engine.getState(result.state().sessionId()).state().currentUnitId()).isEqualTo("consent");
        }

        @Test
        @DisplayName("Should record detected environment and url parameters in the context")
        void shouldRecordEnvironment() {
            StartRequest request = new StartRequest("s1", "user-7", Map.of("panel", "prolific"),
                    Map.of("source", "mail"), "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0) Mobile/15E148 Safari/604.1",
                    "390x844", 42L);

            engine.initialize(request);

            ParticipantContext context = storedContext("s1");
            assertThat(context.userId()).isEqualTo("user-7");
            assertThat(context.environment()).containsEntry("device", "mobile")
                    .containsEntry("browser", "safari")
                    .containsEntry("screen_size", "390x844");
            assertThat(context.urlParams()).containsEntry("source", "mail");
            assertThat(context.participant()).containsEntry("panel", "prolific");
            assertThat(context.assignmentHistory()).extracting("decisionPointId").contains("arms_picks");
        }

        @Test
        @DisplayName("Should open a span per operation")
        void shouldTraceOperations() {
            engine.initialize(StartRequest.of("s1"));

            assertThat(spans.getFinishedSpanItems()).extracting(SpanData::getName)
                    .contains("navigation.initialize");
            SpanData span = spans.getFinishedSpanItems().stream()
                    .filter(s -> s.getName().equals("navigation.initialize"))
                    .findFirst().orElseThrow();
            assertThat(span.getAttributes().get(AttributeKey.stringKey("session.id"))).isEqualTo("s1");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("experiment.id"))).isEqualTo("nav_study");
        }
    }

    @Nested
    class PickAndVisibility {

        @Test
        @DisplayName("Should show exactly one picked arm and keep it across recomputation")
        void shouldKeepPickedArm() {
            InitializeResult start = engine.initialize(StartRequest.of("s1"));
            String arm = armTask(start.state());
            String pickedBlock = start.state().assignments().get("arms_picks");

            assertThat(start.visibleUnitIds()).containsOnlyOnce(arm);
            assertThat(start.visibleUnitIds()).doesNotContain(arm.equals("task_x") ? "task_y" : "task_x");
            assertThat(pickedBlock).isEqualTo(arm.equals("task_x") ? "block_x" : "block_y");
            assertThat(start.state().pickLedger().get("arm")).containsExactly(arm.equals("task_x") ? "x" : "y");

            engine.submit("s1", "consent", Map.of("agreed", true));
            SubmitResult result = engine.submit("s1", "profile", Map.of("age", 30));

            assertThat(result.visibleUnitIds()).contains(arm);
            assertThat(result.state().assignments()).containsEntry("arms_picks", pickedBlock);
            assertThat(result.nextUnitId()).isEqualTo(arm);
        }

        @Test
        @DisplayName("Should pick one arm for every participant whatever the seed")
        void shouldPickOneArmPerSeed() {
            for (long seed = 0; seed < 20; seed++) {
                InitializeResult start = engine.initialize(StartRequest.of("s" + seed).withSeed(seed));
                long arms = start.visibleUnitIds().stream()
                        .filter(id -> id.equals("task_x") || id.equals("task_y"))
                        .count();
                assertThat(arms).isEqualTo(1);
            }
        }

        @Test
        @DisplayName("Should hide a container's units when its own rule is false")
        void shouldInheritContainerVisibility() {
            engine.initialize(StartRequest.of("adult"));
            engine.initialize(StartRequest.of("minor"));

            engine.submit("adult", "consent", Map.of("agreed", true));
            SubmitResult adult = engine.submit("adult", "profile", Map.of("age", 30));
            engine.submit("minor", "consent", Map.of("agreed", true));
            SubmitResult minor = engine.submit("minor", "profile", Map.of("age", 12));

            assertThat(adult.visibleUnitIds()).contains("adult_task_1", "adult_task_2").doesNotContain("minor_task");
            assertThat(minor.visibleUnitIds()).contains("minor_task")
                    .doesNotContain("adult_task_1", "adult_task_2");
        }

        @Test
        @DisplayName("Should merge identity payloads into the participant namespace")
        void shouldMergeIdentityPayload() {
            engine.initialize(StartRequest.of("s1"));
            engine.submit("s1", "consent", Map.of("agreed", true));
            engine.submit("s1", "profile", Map.of("age", 30, "nickname", "kit"));

            ParticipantContext context = storedContext("s1");
            assertThat(context.participant()).containsEntry("age", 30).containsEntry("nickname", "kit");
            assertThat(context.responses()).containsKeys("consent", "profile");
        }
    }

    @Nested
    class Submission {

        @Test
        @DisplayName("Should advance to the next pending unit and report progress")
        void shouldAdvance() {
            engine.initialize(StartRequest.of("s1"));

            SubmitResult result = engine.submit("s1", "consent", Map.of("agreed", true));

            assertThat(result.nextUnitId()).isEqualTo("profile");
            assertThat(result.completedUnitIds()).containsExactly("consent");
            assertThat(result.complete()).isFalse();
            assertThat(result.progress().completed()).isEqualTo(1);
            assertThat(result.progress().percentage()).isEqualTo(25.0);
            assertThat(result.state().completedPhaseIds()).containsExactly("consent");
            assertThat(result.state().data()).containsKey("consent");
        }

        @Test
        @DisplayName("Should reject a submission for a unit other than the current one")
        void shouldRejectStaleSubmission() {
            InitializeResult start = engine.initialize(StartRequest.of("s1"));

            assertThatThrownBy(() -> engine.submit("s1", "profile", Map.of("age", 30)))
                    .isInstanceOf(NavigationException.class)
                    .extracting("reason").isEqualTo(NavigationException.Reason.STALE_SUBMISSION);

            SessionView view = engine.getState("s1");
            assertThat(view.state().version()).isEqualTo(start.state().version());
            assertThat(view.state().completedUnitIds()).isEmpty();
            assertThat(metrics.rejections(NavigationException.Reason.STALE_SUBMISSION)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should mark the rejected submission span as an error")
        void shouldTraceRejection() {
            engine.initialize(StartRequest.of("s1"));
            spans.reset();

            assertThatThrownBy(() -> engine.submit("s1", "help", Map.of()))
                    .isInstanceOf(NavigationException.class);

            SpanData span = spans.getFinishedSpanItems().stream()
                    .filter(s -> s.getName().equals("navigation.submit"))
                    .findFirst().orElseThrow();
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(span.getAttributes().get(AttributeKey.stringKey("rejection.reason")))
                    .isEqualTo("STALE_SUBMISSION");
        }

        @Test
        @DisplayName("Should report every failing field of an invalid payload")
        void shouldValidateFields() {
            engine.initialize(StartRequest.of("s1"));

            assertThatThrownBy(() -> engine.submit("s1", "consent", Map.of()))
                    .isInstanceOfSatisfying(NavigationException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(NavigationException.Reason.VALIDATION_FAILED);
                        assertThat(e.getDetails()).containsExactly("Field 'agreed' is required");
                    });

            engine.submit("s1", "consent", Map.of("agreed", true));
            assertThatThrownBy(() -> engine.submit("s1", "profile", Map.of("age", "abc")))
                    .isInstanceOfSatisfying(NavigationException.class, e ->
                            assertThat(e.getDetails()).containsExactly("Field 'age': Age must be a number"));
        }

        @Test
        @DisplayName("Should reject unknown sessions and units")
        void shouldRejectUnknowns() {
            engine.initialize(StartRequest.of("s1"));

            assertThatThrownBy(() -> engine.submit("missing", "consent", Map.of()))
                    .extracting("reason").isEqualTo(NavigationException.Reason.UNKNOWN_SESSION);
            assertThatThrownBy(() -> engine.submit("s1", "main", Map.of()))
                    .extracting("reason").isEqualTo(NavigationException.Reason.UNKNOWN_UNIT);
        }

        @Test
        @DisplayName("Should complete the session after the last visible unit")
        void shouldCompleteSession() {
            engine.initialize(StartRequest.of("s1"));
            advanceThroughArm("s1", 30);
            engine.submit("s1", "adult_task_1", Map.of());
            engine.submit("s1", "adult_task_2", Map.of());

            SubmitResult last = engine.submit("s1", "help", Map.of());

            assertThat(last.complete()).isTrue();
            assertThat(last.nextUnitId()).isNull();
            assertThat(last.state().status()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(last.state().completedPhaseIds()).contains("consent", "profile", "main", "help");
            assertThat(last.state().completedStageIds()).contains("arms", "adult");
            assertThat(last.progress().percentage()).isEqualTo(100.0);
            assertThat(metrics.getSnapshot()).containsEntry("sessionsCompleted", 1L);
            assertThatThrownBy(() -> engine.submit("s1", "help", Map.of()))
                    .extracting("reason").isEqualTo(NavigationException.Reason.SESSION_NOT_ACTIVE);
        }

        @Test
        @DisplayName("Should lock completed items whose level forbids revisiting")
        void shouldReportLockedItems() {
            engine.initialize(StartRequest.of("s1"));

            SubmitResult result = engine.submit("s1", "consent", Map.of("agreed", true));

            assertThat(result.lockedItems().phases()).containsExactly("consent");
            assertThat(result.lockedItems().contains("profile")).isFalse();
        }
    }

    @Nested
    class Jumping {

        @Test
        @DisplayName("Should jump to a reference unit and resume at the unit left")
        void shouldJumpToReferenceAndResume() {
            engine.initialize(StartRequest.of("s1"));

            JumpResult jump = engine.jump("s1", "help");

            assertThat(jump.currentUnitId()).isEqualTo("help");
            assertThat(jump.returnUnitId()).isEqualTo("consent");
            assertThat(jump.state().returnExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(1)));

            SessionView resumed = engine.resume("s1");
            assertThat(resumed.state().currentUnitId()).isEqualTo("consent");
            assertThat(resumed.state().returnUnitId()).isNull();
        }

        @Test
        @DisplayName("Should resume at the first pending unit when the return unit is completed")
        void shouldResumeAtFirstPending() {
            engine.initialize(StartRequest.of("s1"));
            SubmitResult atAdult = advanceThroughArm("s1", 30);
            String arm = armTask(atAdult.state());

            engine.jump("s1", arm);
            engine.jump("s1", "help");

            assertThat(engine.resume("s1").state().currentUnitId()).isEqualTo("adult_task_1");
        }

        @Test
        @DisplayName("Should refuse jumps to units that are not reachable")
        void shouldRejectDisallowedJumps() {
            engine.initialize(StartRequest.of("s1"));

            assertThatThrownBy(() -> engine.jump("s1", "minor_task"))
                    .extracting("reason").isEqualTo(NavigationException.Reason.JUMP_NOT_ALLOWED);
            assertThatThrownBy(() -> engine.jump("s1", "main"))
                    .extracting("reason").isEqualTo(NavigationException.Reason.UNKNOWN_UNIT);
        }

        @Test
        @DisplayName("Should refuse jumps back into a locked unit")
        void shouldRejectLockedJump() {
            engine.initialize(StartRequest.of("s1"));
            engine.submit("s1", "consent", Map.of("agreed", true));

            assertThatThrownBy(() -> engine.jump("s1", "consent"))
                    .extracting("reason").isEqualTo(NavigationException.Reason.UNIT_LOCKED);
        }

        @Test
        @DisplayName("Should allow viewing a completed unit but not resubmitting it")
        void shouldRejectResubmissionOfReadOnlyUnit() {
            engine.initialize(StartRequest.of("s1"));
            SubmitResult atAdult = advanceThroughArm("s1", 30);
            String arm = armTask(atAdult.state());

            JumpResult jump = engine.jump("s1", arm);

            assertThat(jump.invalidatedUnitIds()).isEmpty();
            assertThatThrownBy(() -> engine.submit("s1", arm, Map.of()))
                    .extracting("reason").isEqualTo(NavigationException.Reason.NOT_EDITABLE);
        }

        @Test
        @DisplayName("Should invalidate completed dependents when jumping back to an editable unit")
        void shouldInvalidateDependents() {
            engine.initialize(StartRequest.of("s1"));
            advanceThroughArm("s1", 30);
            engine.submit("s1", "adult_task_1", Map.of());

            JumpResult jump = engine.jump("s1", "profile");

            assertThat(jump.invalidatedUnitIds()).containsExactly("adult_task_1");
            assertThat(jump.returnUnitId()).isEqualTo("adult_task_2");
            assertThat(jump.state().completedUnitIds()).doesNotContain("adult_task_1");
            assertThat(jump.state().statusOf("adult_task_1")).isEqualTo(UnitStatus.INVALIDATED);
            assertThat(jump.state().data()).doesNotContainKey("adult_task_1");
            assertThat(storedContext("s1").responses()).doesNotContainKey("adult_task_1");
            assertThat(metrics.getSnapshot()).containsEntry("invalidatedUnits", 1L);

            SubmitResult edited = engine.submit("s1", "profile", Map.of("age", 12));

            assertThat(edited.visibleUnitIds()).contains("minor_task").doesNotContain("adult_task_1");
            assertThat(edited.nextUnitId()).isEqualTo("minor_task");
            assertThat(edited.state().returnUnitId()).isNull();
        }
    }

    @Nested
    class Dependencies {

        @Test
        @DisplayName("Should expose dependents and dependencies of a unit")
        void shouldExposeGraph() {
            assertThat(engine.getDependents("profile")).containsExactlyInAnyOrder("adult", "minor_task");
            assertThat(engine.getDependencies("minor_task")).containsExactly("profile");
            assertThat(engine.getDependents("consent")).isEmpty();
        }

        @Test
        @DisplayName("Should preview the units an edit would invalidate")
        void shouldPreviewInvalidation() {
            InvalidationPreview preview = engine.wouldInvalidate("profile");

            assertThat(preview.affectedUnitIds())
                    .containsExactlyInAnyOrder("adult_task_1", "adult_task_2", "minor_task");
            assertThat(preview.count()).isEqualTo(3);
            assertThat(preview.wouldInvalidate()).isTrue();
            assertThat(engine.wouldInvalidate("help").wouldInvalidate()).isFalse();
        }

        @Test
        @DisplayName("Should reject graph queries for unknown ids")
        void shouldRejectUnknownNode() {
            assertThatThrownBy(() -> engine.getDependents("nope"))
                    .extracting("reason").isEqualTo(NavigationException.Reason.UNKNOWN_UNIT);
        }
    }

    @Nested
    class SessionLifecycle {

        @Test
        @DisplayName("Should stop accepting requests after abandonment")
        void shouldAbandon() {
            engine.initialize(StartRequest.of("s1"));

            engine.abandon("s1");

            assertThat(engine.getState("s1").state().status()).isEqualTo(SessionStatus.ABANDONED);
            assertThatThrownBy(() -> engine.submit("s1", "consent", Map.of("agreed", true)))
                    .extracting("reason").isEqualTo(NavigationException.Reason.SESSION_NOT_ACTIVE);
            assertThat(metrics.getSnapshot()).containsEntry("sessionsAbandoned", 1L);
        }

        @Test
        @DisplayName("Should record scores in the participant context")
        void shouldRecordScore() {
            engine.initialize(StartRequest.of("s1"));

            engine.recordScore("s1", "accuracy", 0.9);

            assertThat(storedContext("s1").scores()).containsEntry("accuracy", 0.9);
        }

        @Test
        @DisplayName("Should recover state with locks and progress")
        void shouldRecoverState() {
            engine.initialize(StartRequest.of("s1"));
            engine.submit("s1", "consent", Map.of("agreed", true));

            SessionView view = engine.getState("s1");

            assertThat(view.state().currentUnitId()).isEqualTo("profile");
            assertThat(view.lockedItems().phases()).containsExactly("consent");
            assertThat(view.progress().completed()).isEqualTo(1);
        }
    }

    @Nested
    class Capacity {

        @Test
        @DisplayName("Should fill balanced quota branches evenly and skip when all are full")
        void shouldExhaustQuota() {
            NavigationEngine quota = engineFor(QUOTA_STUDY);
            Map<String, Integer> perPhase = new TreeMap<>();

            for (int i = 1; i <= 6; i++) {
                InitializeResult start = quota.initialize(StartRequest.of("p" + i).withSeed(i));
                String phase = start.state().assignments().get("quota_study");
                perPhase.merge(phase, 1, Integer::sum);
                SubmitResult done = quota.submit("p" + i, start.firstUnitId(), Map.of());
                assertThat(done.complete()).isTrue();
            }

            assertThat(perPhase).containsOnly(Map.entry("A", 2), Map.entry("B", 2), Map.entry("C", 2));
            for (String phase : new String[]{"A", "B", "C"}) {
                assertThat(quota.quotaStatus(phase).completed()).isEqualTo(2);
                assertThat(quota.quotaStatus(phase).full()).isTrue();
                assertThat(quota.quotaStatus(phase).reserved()).isZero();
            }
            DistributionSnapshot snapshot = quota.distributionSnapshot("quota_study");
            assertThat(snapshot.totals().started()).isEqualTo(6);
            assertThat(snapshot.totals().completed()).isEqualTo(6);
            assertThat(snapshot.totals().active()).isZero();

            InitializeResult seventh = quota.initialize(StartRequest.of("p7").withSeed(7L));

            assertThat(seventh.firstUnitId()).isNull();
            assertThat(seventh.visibleUnitIds()).isEmpty();
            assertThat(seventh.state().status()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(seventh.state().quotaDecisions()).containsValue(
                    QuotaDecision.SKIPPED);
            assertThat(metrics.getSnapshot()).containsEntry("quotaSkips", 1L);
        }

        @Test
        @DisplayName("Should reject a session when a blocking quota is full")
        void shouldBlockWhenFull() {
            NavigationEngine blocking = engineFor(BLOCKING_STUDY);
            blocking.initialize(StartRequest.of("first"));
            blocking.submit("first", "intro", Map.of());
            blocking.submit("first", "limited_task", Map.of());

            assertThatThrownBy(() -> blocking.initialize(StartRequest.of("second")))
                    .extracting("reason").isEqualTo(NavigationException.Reason.QUOTA_FULL);
            assertThatThrownBy(() -> blocking.getState("second"))
                    .extracting("reason").isEqualTo(NavigationException.Reason.UNKNOWN_SESSION);
            assertThat(metrics.rejections(NavigationException.Reason.QUOTA_FULL)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should release a session's reservation when it is abandoned")
        void shouldReleaseHoldOnAbandon() {
            NavigationEngine blocking = engineFor(BLOCKING_STUDY);
            blocking.initialize(StartRequest.of("first"));
            assertThat(blocking.quotaStatus("limited").reserved()).isEqualTo(1);

            blocking.abandon("first");

            assertThat(blocking.quotaStatus("limited").reserved()).isZero();
            assertThat(blocking.quotaStatus("limited").completed()).isZero();
        }

        @Test
        @DisplayName("Should let an unconsumed reservation expire")
        void shouldExpireHold() {
            NavigationEngine blocking = engineFor(BLOCKING_STUDY);
            blocking.initialize(StartRequest.of("first"));

            clock.advance(Duration.ofMinutes(31));

            assertThat(blocking.quotaStatus("limited").reserved()).isZero();
        }

        @Test
        @DisplayName("Should reset a quota and audit the actor")
        void shouldResetQuota() {
            NavigationEngine blocking = engineFor(BLOCKING_STUDY);
            blocking.initialize(StartRequest.of("first"));
            blocking.submit("first", "intro", Map.of());
            blocking.submit("first", "limited_task", Map.of());

            blocking.resetQuota("limited", "admin@lab");

            assertThat(blocking.quotaStatus("limited").completed()).isZero();
            assertThatThrownBy(() -> blocking.quotaStatus("intro"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should sweep stale active holds of unfinished balanced sessions")
        void shouldSweepStaleHolds() {
            NavigationEngine quota = engineFor(QUOTA_STUDY);
            quota.initialize(StartRequest.of("p1"));
            assertThat(quota.distributionSnapshot("quota_study").totals().active()).isEqualTo(1);

            clock.advance(Duration.ofHours(3));

            assertThat(quota.sweepStaleHolds()).isEqualTo(1);
            assertThat(quota.distributionSnapshot("quota_study").totals().started()).isZero();
        }

        @Test
        @DisplayName("Should zero-fill branches and reset distribution counters")
        void shouldSnapshotAndResetDistribution() {
            NavigationEngine quota = engineFor(QUOTA_STUDY);

            assertThat(quota.distributionSnapshot("quota_study").branches()).containsOnlyKeys("A", "B", "C");

            quota.initialize(StartRequest.of("p1"));
            quota.resetDistribution("quota_study", "admin@lab");

            assertThat(quota.distributionSnapshot("quota_study").totals().started()).isZero();
        }
    }

    @Nested
    class Recovery {

        private FlakyDocumentStore flaky;

        @BeforeEach
        void setUp() {
            flaky = new FlakyDocumentStore(documents);
        }

        @Test
        @DisplayName("Should leave no counters or context behind when the session write loses a race")
        void shouldRollBackInitializeOnConflict() {
            NavigationEngine quota = engineFor(QUOTA_STUDY, flaky);
            flaky.refuseNextWrite("sessions");

            assertThatThrownBy(() -> quota.initialize(StartRequest.of("s1")))
                    .isInstanceOf(NavigationException.class)
                    .extracting("reason").isEqualTo(NavigationException.Reason.CONCURRENT_MODIFICATION);

            DistributionSnapshot afterFailure = quota.distributionSnapshot("quota_study");
            assertThat(afterFailure.totals().started()).isZero();
            assertThat(afterFailure.totals().active()).isZero();
            assertThat(findContext("s1")).isEmpty();
            for (String phase : new String[]{"A", "B", "C"}) {
                assertThat(quota.quotaStatus(phase).reserved()).isZero();
            }
        }

        @Test
        @DisplayName("Should accept a retried initialize after a failed session write")
        void shouldRetryInitializeAfterConflict() {
            NavigationEngine quota = engineFor(QUOTA_STUDY, flaky);
            flaky.refuseNextWrite("sessions");
            assertThatThrownBy(() -> quota.initialize(StartRequest.of("s1")))
                    .isInstanceOf(NavigationException.class);

            InitializeResult retried = quota.initialize(StartRequest.of("s1"));
            for (int attempt = 0; attempt < 2; attempt++) {
                assertThat(quota.initialize(StartRequest.of("s1")).state().version())
                        .isEqualTo(retried.state().version());
            }

            DistributionSnapshot snapshot = quota.distributionSnapshot("quota_study");
            assertThat(snapshot.totals().started()).isEqualTo(1);
            assertThat(snapshot.totals().active()).isEqualTo(1);
            String phase = retried.state().assignments().get("quota_study");
            assertThat(snapshot.branches().get(phase).started()).isEqualTo(1);
            assertThat(quota.quotaStatus(phase).reserved()).isEqualTo(1);
            assertThat(storedContext("s1").assignmentHistory())
                    .filteredOn(entry -> entry.decisionPointId().equals("quota_study"))
                    .extracting(entry -> entry.value())
                    .containsExactly(phase);
        }

        @Test
        @DisplayName("Should release holds when the store fails outright")
        void shouldReleaseHoldsOnStoreFailure() {
            NavigationEngine blocking = engineFor(BLOCKING_STUDY, flaky);
            flaky.failNextWrite("sessions", new StoreUnavailableException("connection reset"));

            assertThatThrownBy(() -> blocking.initialize(StartRequest.of("first")))
                    .isInstanceOf(StoreUnavailableException.class);

            assertThat(blocking.quotaStatus("limited").reserved()).isZero();
            assertThat(findContext("first")).isEmpty();

            blocking.initialize(StartRequest.of("first"));

            assertThat(blocking.quotaStatus("limited").reserved()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should restore the stored context when a submission fails to commit")
        void shouldRollBackSubmitOnConflict() {
            NavigationEngine flakyEngine = engineFor(STUDY, flaky);
            flakyEngine.initialize(StartRequest.of("s1"));
            flaky.refuseNextWrite("sessions");

            assertThatThrownBy(() -> flakyEngine.submit("s1", "consent", Map.of("agreed", true)))
                    .isInstanceOf(NavigationException.class)
                    .extracting("reason").isEqualTo(NavigationException.Reason.CONCURRENT_MODIFICATION);

            assertThat(storedContext("s1").responses()).doesNotContainKey("consent");
            assertThat(flakyEngine.getState("s1").state().completedUnitIds()).isEmpty();

            SubmitResult retried = flakyEngine.submit("s1", "consent", Map.of("agreed", true));

            assertThat(retried.nextUnitId()).isEqualTo("profile");
            assertThat(storedContext("s1").responses()).containsKey("consent");
        }

        @Test
        @DisplayName("Should count a balanced completion once across a failed and a retried submission")
        void shouldCountCompletionOnceAfterRetry() {
            NavigationEngine quota = engineFor(QUOTA_STUDY, flaky);
            InitializeResult start = quota.initialize(StartRequest.of("s1"));
            String phase = start.state().assignments().get("quota_study");
            flaky.refuseNextWrite("sessions");

            assertThatThrownBy(() -> quota.submit("s1", start.firstUnitId(), Map.of()))
                    .isInstanceOf(NavigationException.class);
            assertThat(quota.quotaStatus(phase).completed()).isZero();
            assertThat(quota.quotaStatus(phase).reserved()).isEqualTo(1);

            SubmitResult done = quota.submit("s1", start.firstUnitId(), Map.of());

            assertThat(done.complete()).isTrue();
            assertThat(quota.quotaStatus(phase).completed()).isEqualTo(1);
            assertThat(quota.quotaStatus(phase).reserved()).isZero();
            DistributionSnapshot snapshot = quota.distributionSnapshot("quota_study");
            assertThat(snapshot.totals().completed()).isEqualTo(1);
            assertThat(snapshot.totals().active()).isZero();
        }
    }

    /** Document store whose next write to one collection is refused or fails. */
    private static final class FlakyDocumentStore implements DocumentStore {
        private final DocumentStore delegate;
        private String failingCollection;
        private RuntimeException failure;

        FlakyDocumentStore(DocumentStore delegate) {
            this.delegate = delegate;
        }

        void refuseNextWrite(String collection) {
            failNextWrite(collection, null);
        }

        void failNextWrite(String collection, RuntimeException error) {
            this.failingCollection = collection;
            this.failure = error;
        }

        @Override
        public Optional<VersionedDocument> find(String collection, String id) {
            return delegate.find(collection, id);
        }

        @Override
        public boolean compareAndSet(String collection, String id, long expectedVersion, String body) {
            if (collection.equals(failingCollection)) {
                failingCollection = null;
                if (failure != null) {
                    throw failure;
                }
                return false;
            }
            return delegate.compareAndSet(collection, id, expectedVersion, body);
        }

        @Override
        public void delete(String collection, String id) {
            delegate.delete(collection, id);
        }
    }
}
