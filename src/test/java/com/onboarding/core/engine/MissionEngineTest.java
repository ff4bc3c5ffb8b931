package com.onboarding.core.engine;

import com.onboarding.core.assignment.AssignmentChecker;
import com.onboarding.core.assignment.AssignmentUnreachableException;
import com.onboarding.core.events.OnboardingEvent;
import com.onboarding.core.model.AssignmentVerdict;
import com.onboarding.core.model.Mission;
import com.onboarding.core.model.MissionContext;
import com.onboarding.core.model.MissionMode;
import com.onboarding.core.model.Protocol;
import com.onboarding.core.model.StepKinds;
import com.onboarding.core.model.StepOutcome;
import com.onboarding.core.model.StepResult;
import com.onboarding.core.model.StepSpec;
import com.onboarding.core.model.StepStatus;
import com.onboarding.core.protocol.InMemoryProtocolStore;
import com.onboarding.core.protocol.ProtocolProperties;
import com.onboarding.core.protocol.ProtocolStore;
import com.onboarding.core.protocol.ProtocolStoreUnavailableException;
import com.onboarding.core.protocol.ProtocolValidator;
import com.onboarding.core.provisioning.ProvisioningWorker;
import com.onboarding.core.provisioning.RecordingWorker;
import com.onboarding.core.provisioning.WorkerUnreachableException;
import com.onboarding.core.tracker.MissionNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the MissionEngine running the real coordinator graph against
 * in-memory collaborators.
 */
class MissionEngineTest {

    private static final String MARIA = "maria.rosa@enterprise.com";
    private static final String ALPHA = "PROJ-ALPHA";
    private static final String BETA = "PROJ-BETA";
    private static final String GAMMA = "PROJ-GAMMA";

    private static final AssignmentChecker CONTRIBUTOR =
            (employee, project, ctx) -> AssignmentVerdict.granted("Contributor", "assigned");
    private static final AssignmentChecker DENY_ALL =
            (employee, project, ctx) -> AssignmentVerdict.denied("not on roster");

    private final List<CoordinatorHarness> harnesses = new ArrayList<>();

    @AfterEach
    void tearDown() {
        harnesses.forEach(CoordinatorHarness::close);
    }

    private CoordinatorHarness harness(ProtocolStore store, AssignmentChecker checker,
                                       ProvisioningWorker... workers) throws Exception {
        var harness = new CoordinatorHarness(store, checker, List.of(workers));
        harnesses.add(harness);
        return harness;
    }

    private static StepSpec step(String kind, boolean fatal) {
        return new StepSpec(kind, "test-system", Map.of(), fatal);
    }

    private static InMemoryProtocolStore storeWith(String projectId, StepSpec... steps) {
        var store = new InMemoryProtocolStore();
        store.create(projectId, List.of(steps), MissionContext.administrative("system", projectId));
        return store;
    }

    private static InMemoryProtocolStore alphaStore() {
        return storeWith(ALPHA,
                new StepSpec(StepKinds.ASSIGNMENT_CHECK, "enterprise-allocation", Map.of(), true),
                new StepSpec(StepKinds.CHAT_PROVISION, "google-chat",
                        Map.of("spaces", "spaces/ALPHA-GENERAL,spaces/ALPHA-DEV"), true));
    }

    @Nested
    @DisplayName("protocol resolution")
    class ProtocolResolution {

        @Test
        @DisplayName("existing protocol runs in EXECUTION and completes with a result per step")
        void existingProtocolCompletes() throws Exception {
            var assignment = RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK);
            var chat = RecordingWorker.succeeding(StepKinds.CHAT_PROVISION);
            var h = harness(alphaStore(), CONTRIBUTOR, assignment, chat);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.COMPLETED, mission.mode());
            assertEquals(List.of(MissionMode.PENDING, MissionMode.EXECUTION, MissionMode.COMPLETED),
                    mission.modes());
            assertEquals(2, mission.stepResults().size());
            assertTrue(mission.stepResults().stream().allMatch(r -> r.status() == StepStatus.SUCCESS));
            assertEquals("Contributor", mission.assignmentVerdict().role());
            assertEquals(1, mission.protocolVersion());
            assertEquals(1, assignment.calls().size());
            assertEquals(1, chat.calls().size());
            assertNotNull(mission.completedAt());
            assertNull(mission.failureReason());
        }

        @Test
        @DisplayName("missing protocol is created as version 1 before execution")
        void missingProtocolIsCreated() throws Exception {
            var store = new InMemoryProtocolStore();
            var h = harness(store, CONTRIBUTOR,
                    RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK),
                    RecordingWorker.succeeding(StepKinds.CHAT_PROVISION));

            Mission mission = h.engine.runMission(MARIA, BETA);

            assertEquals(List.of(MissionMode.PENDING, MissionMode.PROTOCOL_CREATION,
                    MissionMode.EXECUTION, MissionMode.COMPLETED), mission.modes());
            Protocol stored = store.get(BETA, MissionContext.administrative("test", BETA)).orElseThrow();
            assertEquals(1, stored.version());
            assertEquals(MARIA, stored.createdBy());
            assertEquals(List.of(StepKinds.ASSIGNMENT_CHECK, StepKinds.CHAT_PROVISION),
                    stored.steps().stream().map(StepSpec::kind).toList());
            assertEquals("spaces/PROJ-BETA-GENERAL", stored.steps().get(1).parameter("spaces"));
            assertEquals(2, mission.stepResults().size());
        }

        @Test
        @DisplayName("second mission on a created project finds the protocol")
        void secondMissionFindsProtocol() throws Exception {
            var store = new InMemoryProtocolStore();
            var h = harness(store, CONTRIBUTOR,
                    RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK),
                    RecordingWorker.succeeding(StepKinds.CHAT_PROVISION));

            h.engine.runMission(MARIA, BETA);
            Mission second = h.engine.runMission("alice.manfieldr@enterprise.com", BETA);

            assertEquals(List.of(MissionMode.PENDING, MissionMode.EXECUTION, MissionMode.COMPLETED),
                    second.modes());
            assertEquals(1, h.registry.find("onboarding.protocol.creations").counter().count());
        }

        @Test
        @DisplayName("empty protocol completes without dispatching")
        void emptyProtocolCompletes() throws Exception {
            var worker = RecordingWorker.succeeding(StepKinds.CHAT_PROVISION);
            var h = harness(storeWith(ALPHA), CONTRIBUTOR, worker);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.COMPLETED, mission.mode());
            assertTrue(mission.stepResults().isEmpty());
            assertTrue(worker.calls().isEmpty());
        }

        @Test
        @DisplayName("protocol store outage fails the mission with a lookup reason")
        void protocolStoreUnreachable() throws Exception {
            ProtocolStore store = mock(ProtocolStore.class);
            when(store.get(anyString(), any())).thenThrow(
                    new ProtocolStoreUnavailableException("connection refused", "trace", null));
            var worker = RecordingWorker.succeeding(StepKinds.CHAT_PROVISION);
            var h = harness(store, CONTRIBUTOR, worker);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(List.of(MissionMode.PENDING, MissionMode.FAILED), mission.modes());
            assertEquals("protocol store unreachable", mission.failureReason());
            assertEquals(1, mission.errors().size());
            assertTrue(mission.errors().get(0).contains("connection refused"));
            assertTrue(worker.calls().isEmpty());
        }

        @Test
        @DisplayName("a replacement during a mission does not change the bound protocol")
        void replacementDoesNotAffectRunningMission() throws Exception {
            var store = storeWith(ALPHA, step("first", true), step("second", true));
            var first = new RecordingWorker("first", s -> {
                store.replace(ALPHA, List.of(step("first", true)), MissionContext.administrative("ops", ALPHA));
                return StepOutcome.success("ok");
            });
            var second = RecordingWorker.succeeding("second");
            var h = harness(store, CONTRIBUTOR, first, second);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.COMPLETED, mission.mode());
            assertEquals(1, mission.protocolVersion());
            assertEquals(2, mission.stepResults().size());
            assertEquals(1, second.calls().size());
            assertEquals(2, store.get(ALPHA, MissionContext.administrative("t", ALPHA)).orElseThrow().version());
        }
    }

    @Nested
    @DisplayName("authorization")
    class Authorization {

        @Test
        @DisplayName("denied assignment blocks the mission and no step is delegated")
        void deniedAssignmentBlocks() throws Exception {
            var assignment = RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK);
            var chat = RecordingWorker.succeeding(StepKinds.CHAT_PROVISION);
            var h = harness(alphaStore(), DENY_ALL, assignment, chat);

            Mission mission = h.engine.runMission("mallory@enterprise.com", ALPHA);

            assertEquals(List.of(MissionMode.PENDING, MissionMode.EXECUTION, MissionMode.BLOCKED,
                    MissionMode.FAILED), mission.modes());
            assertEquals("unauthorized", mission.failureReason());
            assertFalse(mission.assignmentVerdict().authorized());
            assertTrue(mission.stepResults().isEmpty());
            assertTrue(assignment.calls().isEmpty());
            assertTrue(chat.calls().isEmpty());
        }

        @Test
        @DisplayName("denied assignment on a new project still creates the protocol")
        void deniedAssignmentAfterCreation() throws Exception {
            var store = new InMemoryProtocolStore();
            var h = harness(store, DENY_ALL);

            Mission mission = h.engine.runMission("mallory@enterprise.com", BETA);

            assertEquals(List.of(MissionMode.PENDING, MissionMode.PROTOCOL_CREATION, MissionMode.EXECUTION,
                    MissionMode.BLOCKED, MissionMode.FAILED), mission.modes());
            assertTrue(store.get(BETA, MissionContext.administrative("t", BETA)).isPresent());
        }

        @Test
        @DisplayName("unreachable assignment checker fails the mission before any step")
        void assignmentCheckerUnreachable() throws Exception {
            AssignmentChecker unreachable = (e, p, ctx) -> {
                throw new AssignmentUnreachableException("allocation API timed out", ctx.traceId());
            };
            var chat = RecordingWorker.succeeding(StepKinds.CHAT_PROVISION);
            var h = harness(alphaStore(), unreachable, chat);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.FAILED, mission.mode());
            assertEquals("assignment checker unreachable", mission.failureReason());
            assertNull(mission.assignmentVerdict());
            assertTrue(chat.calls().isEmpty());
            assertFalse(mission.modes().contains(MissionMode.BLOCKED));
        }
    }

    @Nested
    @DisplayName("step delegation")
    class StepDelegation {

        @Test
        @DisplayName("fatal failure at step k stops the mission with k+1 results")
        void fatalFailureStops() throws Exception {
            var ok = RecordingWorker.succeeding("ok");
            var broken = RecordingWorker.failing("broken", "permission denied");
            var never = RecordingWorker.succeeding("never");
            var store = storeWith(ALPHA, step("ok", true), step("broken", true), step("never", true));
            var h = harness(store, CONTRIBUTOR, ok, broken, never);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.FAILED, mission.mode());
            assertEquals(2, mission.stepResults().size());
            assertEquals(StepStatus.FAILURE, mission.stepResults().get(1).status());
            assertEquals("step 1 failed: permission denied", mission.failureReason());
            assertTrue(never.calls().isEmpty());
        }

        @Test
        @DisplayName("non-fatal failure is recorded and execution continues")
        void nonFatalFailureContinues() throws Exception {
            var store = storeWith(ALPHA, step("ok", true), step("flaky", false), step("last", true));
            var last = RecordingWorker.succeeding("last");
            var h = harness(store, CONTRIBUTOR,
                    RecordingWorker.succeeding("ok"), RecordingWorker.failing("flaky", "quota"), last);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.COMPLETED, mission.mode());
            assertEquals(List.of(StepStatus.SUCCESS, StepStatus.FAILURE, StepStatus.SUCCESS),
                    mission.stepResults().stream().map(StepResult::status).toList());
            assertEquals(1, last.calls().size());
        }

        @Test
        @DisplayName("results are appended in step order")
        void resultsInStepOrder() throws Exception {
            var order = new CopyOnWriteArrayList<String>();
            var a = new RecordingWorker("a", s -> { order.add("a"); return StepOutcome.success("a"); });
            var b = new RecordingWorker("b", s -> { order.add("b"); return StepOutcome.skipped("b"); });
            var store = storeWith(ALPHA, step("a", true), step("b", true), step("a", true));
            var h = harness(store, CONTRIBUTOR, a, b);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(List.of("a", "b", "a"), order);
            assertEquals(List.of(0, 1, 2), mission.stepResults().stream().map(StepResult::stepIndex).toList());
            assertEquals(List.of("a", "b", "a"), mission.stepResults().stream().map(StepResult::kind).toList());
            assertEquals(MissionMode.COMPLETED, mission.mode());
        }

        @Test
        @DisplayName("step kind without a worker is an Unreachable failure")
        void unknownCapability() throws Exception {
            var store = storeWith(ALPHA, step("drive-access", false), step("ok", true));
            var h = harness(store, CONTRIBUTOR, RecordingWorker.succeeding("ok"));

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.COMPLETED, mission.mode());
            StepResult first = mission.stepResults().get(0);
            assertEquals(StepStatus.FAILURE, first.status());
            assertTrue(first.detail().startsWith("Unreachable"));
            assertTrue(first.detail().contains("drive-access"));
        }

        @Test
        @DisplayName("fatal step kind without a worker fails the mission")
        void unknownFatalCapability() throws Exception {
            var store = storeWith(ALPHA, step("drive-access", true));
            var h = harness(store, CONTRIBUTOR);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.FAILED, mission.mode());
            assertTrue(mission.failureReason().startsWith("step 0 failed: Unreachable"));
        }

        @Test
        @DisplayName("unreachable worker becomes a failed step result")
        void unreachableWorker() throws Exception {
            var store = storeWith(ALPHA, step("remote", true));
            var remote = new RecordingWorker("remote", s -> {
                throw new WorkerUnreachableException("503 from chat API", "trace");
            });
            var h = harness(store, CONTRIBUTOR, remote);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.FAILED, mission.mode());
            assertEquals("Unreachable: 503 from chat API", mission.stepResults().get(0).detail());
        }

        @Test
        @DisplayName("every worker call carries the mission's correlation ids")
        void workerCallsCarryContext() throws Exception {
            var worker = RecordingWorker.succeeding("ok");
            var h = harness(storeWith(ALPHA, step("ok", true), step("ok", true)), CONTRIBUTOR, worker);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(2, worker.contexts().size());
            for (MissionContext ctx : worker.contexts()) {
                assertEquals(mission.missionId(), ctx.missionId());
                assertEquals(mission.traceId(), ctx.traceId());
                assertEquals(ALPHA, ctx.projectId());
            }
        }
    }

    @Nested
    @DisplayName("failure containment")
    class FailureContainment {

        @Test
        @DisplayName("unexpected error escaping the graph fails the mission")
        void unexpectedErrorFailsMission() throws Exception {
            AssignmentChecker buggy = (e, p, ctx) -> {
                throw new IllegalStateException("roster cache corrupted");
            };
            var h = harness(alphaStore(), buggy);

            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(MissionMode.FAILED, mission.mode());
            assertTrue(mission.failureReason().startsWith("internal error"));
            assertTrue(mission.errors().stream().anyMatch(e -> e.startsWith("unexpected")));
        }
    }

    @Nested
    @DisplayName("retention")
    class Retention {

        private CoordinatorHarness harnessWithRetention(Duration retention) throws Exception {
            var coordinatorProperties = new CoordinatorProperties();
            coordinatorProperties.setMissionRetention(retention);
            var harness = new CoordinatorHarness(alphaStore(), CONTRIBUTOR,
                    List.of(RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK),
                            RecordingWorker.succeeding(StepKinds.CHAT_PROVISION)),
                    new ProtocolProperties(), coordinatorProperties);
            harnesses.add(harness);
            return harness;
        }

        @Test
        @DisplayName("finished missions past the retention are dropped when a new mission registers")
        void expiredMissionsEvicted() throws Exception {
            var h = harnessWithRetention(Duration.ofMillis(1));
            Mission first = h.engine.runMission(MARIA, ALPHA);
            Thread.sleep(20);

            Mission second = h.engine.runMission(MARIA, ALPHA);

            assertThrows(MissionNotFoundException.class, () -> h.engine.status(first.missionId()));
            assertEquals(List.of(second.missionId()),
                    h.engine.missions().stream().map(Mission::missionId).toList());
        }

        @Test
        @DisplayName("zero retention keeps every finished mission")
        void zeroRetentionKeepsMissions() throws Exception {
            var h = harnessWithRetention(Duration.ZERO);
            h.engine.runMission(MARIA, ALPHA);
            Thread.sleep(5);
            h.engine.runMission(MARIA, ALPHA);

            assertEquals(2, h.engine.missions().size());
        }
    }

    @Nested
    @DisplayName("protocol length")
    class ProtocolLength {

        private CoordinatorHarness harnessWithLimit(ProtocolStore store, int maxSteps,
                                                    ProvisioningWorker... workers) throws Exception {
            var protocolProperties = new ProtocolProperties();
            protocolProperties.setMaxSteps(maxSteps);
            var harness = new CoordinatorHarness(store, CONTRIBUTOR, List.of(workers),
                    protocolProperties, new CoordinatorProperties());
            harnesses.add(harness);
            return harness;
        }

        private InMemoryProtocolStore storeWithSteps(int count, int storeLimit) {
            var store = new InMemoryProtocolStore(Clock.systemUTC(), new ProtocolValidator(storeLimit));
            List<StepSpec> steps = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                steps.add(new StepSpec("noop", "test-system", Map.of("index", String.valueOf(i)), true));
            }
            store.create(GAMMA, steps, MissionContext.administrative("system", GAMMA));
            return store;
        }

        @Test
        @DisplayName("a 300-step protocol within the configured limit completes with 300 results")
        void longProtocolCompletes() throws Exception {
            var worker = RecordingWorker.succeeding("noop");
            var h = harnessWithLimit(storeWithSteps(300, 300), 300, worker);

            Mission mission = h.engine.runMission(MARIA, GAMMA);

            assertEquals(MissionMode.COMPLETED, mission.mode());
            assertEquals(300, mission.stepResults().size());
            assertEquals(300, worker.calls().size());
            assertEquals("299", worker.calls().get(299).parameter("index"));
            assertTrue(mission.errors().isEmpty());
        }

        @Test
        @DisplayName("a stored protocol above the limit fails before any step is delegated")
        void storedProtocolAboveLimitFails() throws Exception {
            var worker = RecordingWorker.succeeding("noop");
            var h = harnessWithLimit(storeWithSteps(20, 50), 10, worker);

            Mission mission = h.engine.runMission(MARIA, GAMMA);

            assertEquals(MissionMode.FAILED, mission.mode());
            assertEquals("protocol exceeds step limit", mission.failureReason());
            assertTrue(mission.stepResults().isEmpty());
            assertTrue(worker.calls().isEmpty());
            assertTrue(mission.errors().get(0).contains("limit is 10"));
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("concurrent first onboardings create exactly one protocol")
        void concurrentCreationRace() throws Exception {
            int missions = 4;
            var store = new LatchedProtocolStore(new InMemoryProtocolStore(), missions);
            var h = harness(store, CONTRIBUTOR,
                    RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK),
                    RecordingWorker.succeeding(StepKinds.CHAT_PROVISION));

            ExecutorService pool = Executors.newFixedThreadPool(missions);
            try {
                List<Future<Mission>> futures = new ArrayList<>();
                for (int i = 0; i < missions; i++) {
                    String employee = "employee" + i + "@enterprise.com";
                    futures.add(pool.submit(() -> h.engine.runMission(employee, BETA)));
                }
                for (Future<Mission> future : futures) {
                    Mission mission = future.get(30, TimeUnit.SECONDS);
                    assertEquals(MissionMode.COMPLETED, mission.mode());
                    assertEquals(1, mission.protocolVersion());
                    assertTrue(mission.modes().contains(MissionMode.PROTOCOL_CREATION));
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, store.get(BETA, MissionContext.administrative("t", BETA)).orElseThrow().version());
            assertEquals(1.0, h.registry.find("onboarding.protocol.creations")
                    .tag("outcome", "created").counter().count());
            assertEquals(missions - 1.0, h.registry.find("onboarding.protocol.creations")
                    .tag("outcome", "race_recovered").counter().count());
        }

        @Test
        @DisplayName("submit runs the mission asynchronously")
        void submitRunsAsync() throws Exception {
            var h = harness(alphaStore(), CONTRIBUTOR,
                    RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK),
                    RecordingWorker.succeeding(StepKinds.CHAT_PROVISION));
            var finished = new CountDownLatch(1);
            h.eventBus.subscribeAll(event -> {
                if (OnboardingEvent.MISSION_COMPLETED.equals(event.eventType())) {
                    finished.countDown();
                }
            });

            String missionId = h.engine.submit(MARIA, ALPHA);

            assertTrue(finished.await(10, TimeUnit.SECONDS));
            assertEquals(MissionMode.COMPLETED, h.engine.status(missionId).mode());
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("status is idempotent once the mission finished")
        void statusIsIdempotent() throws Exception {
            var h = harness(alphaStore(), CONTRIBUTOR,
                    RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK),
                    RecordingWorker.succeeding(StepKinds.CHAT_PROVISION));
            Mission mission = h.engine.runMission(MARIA, ALPHA);

            assertEquals(h.engine.status(mission.missionId()), h.engine.status(mission.missionId()));
        }

        @Test
        @DisplayName("status of an unknown mission throws MissionNotFoundException")
        void unknownMission() throws Exception {
            var h = harness(alphaStore(), CONTRIBUTOR);
            assertThrows(MissionNotFoundException.class, () -> h.engine.status("ONBD-2026-9999"));
        }

        @Test
        @DisplayName("blank employee or project is rejected")
        void blankInputRejected() throws Exception {
            var h = harness(alphaStore(), CONTRIBUTOR);
            assertThrows(IllegalArgumentException.class, () -> h.engine.runMission(" ", ALPHA));
            assertThrows(IllegalArgumentException.class, () -> h.engine.submit(MARIA, ""));
            assertTrue(h.engine.missions().isEmpty());
        }

        @Test
        @DisplayName("mission ids are unique and follow ONBD-YYYY-NNNN")
        void missionIdFormat() throws Exception {
            var h = harness(alphaStore(), CONTRIBUTOR);
            String first = h.engine.generateMissionId();
            String second = h.engine.generateMissionId();
            assertTrue(first.matches("ONBD-\\d{4}-\\d{4}"), first);
            assertNotEquals(first, second);
        }

        @Test
        @DisplayName("missions lists every run, each with its own trace id")
        void missionsListed() throws Exception {
            var h = harness(alphaStore(), DENY_ALL);
            Mission a = h.engine.runMission(MARIA, ALPHA);
            Mission b = h.engine.runMission(MARIA, ALPHA);

            assertEquals(2, h.engine.missions().size());
            assertNotEquals(a.traceId(), b.traceId());
        }

        @Test
        @DisplayName("events run from mission.created to mission.completed")
        void eventSequence() throws Exception {
            var h = harness(alphaStore(), CONTRIBUTOR,
                    RecordingWorker.succeeding(StepKinds.ASSIGNMENT_CHECK),
                    RecordingWorker.succeeding(StepKinds.CHAT_PROVISION));
            var events = new CopyOnWriteArrayList<OnboardingEvent>();
            h.eventBus.subscribeAll(events::add);

            h.engine.runMission(MARIA, ALPHA);

            assertEquals(OnboardingEvent.MISSION_CREATED, events.get(0).eventType());
            assertEquals(OnboardingEvent.MISSION_COMPLETED, events.get(events.size() - 1).eventType());
            assertEquals(2, events.stream()
                    .filter(e -> OnboardingEvent.STEP_COMPLETED.equals(e.eventType())).count());
            assertEquals(1.0, h.registry.find("onboarding.missions.total")
                    .tag("mode", "completed").counter().count());
        }
    }

    /**
     * Holds the first {@code parties} lookups until all of them arrived, so every
     * racing mission sees the project without a protocol.
     */
    private static final class LatchedProtocolStore implements ProtocolStore {

        private final ProtocolStore delegate;
        private final int parties;
        private final CountDownLatch latch;
        private final AtomicInteger lookups = new AtomicInteger();

        LatchedProtocolStore(ProtocolStore delegate, int parties) {
            this.delegate = delegate;
            this.parties = parties;
            this.latch = new CountDownLatch(parties);
        }

        @Override
        public Optional<Protocol> get(String projectId, MissionContext context) {
            if (lookups.incrementAndGet() <= parties) {
                latch.countDown();
                try {
                    assertTrue(latch.await(10, TimeUnit.SECONDS), "racing missions did not all arrive");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return delegate.get(projectId, context);
        }

        @Override
        public Protocol create(String projectId, List<StepSpec> steps, MissionContext context) {
            return delegate.create(projectId, steps, context);
        }

        @Override
        public Protocol replace(String projectId, List<StepSpec> steps, MissionContext context) {
            return delegate.replace(projectId, steps, context);
        }
    }
}
