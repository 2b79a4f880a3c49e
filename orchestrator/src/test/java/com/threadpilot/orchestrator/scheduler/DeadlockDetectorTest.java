package com.threadpilot.orchestrator.scheduler;

import com.threadpilot.orchestrator.MutableClock;
import com.threadpilot.orchestrator.event.EventBus;
import com.threadpilot.orchestrator.event.SchedulerEvent;
import com.threadpilot.orchestrator.event.SchedulerEventType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlockDetectorTest {

    MutableClock             clock;
    List<SchedulerEvent>     deadlocks;
    ScheduledExecutorService timer;
    SimpleMeterRegistry      meterRegistry;
    ExecutionScheduler       scheduler;

    @BeforeEach
    void setUp() {
        clock         = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        deadlocks     = new ArrayList<>();
        timer         = Executors.newSingleThreadScheduledExecutor();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    private void newScheduler(int maxSessions) {
        EventBus<SchedulerEventType, SchedulerEvent> events = new EventBus<>("scheduler", SchedulerEvent::type);
        events.on(SchedulerEventType.DEADLOCK_DETECTED, deadlocks::add);
        scheduler = new ExecutionScheduler(new SchedulerSettings(maxSessions, Duration.ZERO),
                events, timer, clock, meterRegistry);
    }

    private DeadlockDetector detector() {
        return new DeadlockDetector(scheduler, new OldestDependencyPolicy(), meterRegistry);
    }

    private CompletableFuture<AdmissionOutcome> request(String id, String... deps) {
        CompletableFuture<AdmissionOutcome> handle = scheduler.requestExecution(id, 10, List.of(deps));
        clock.advance(Duration.ofSeconds(1));
        return handle;
    }

    // ------------------------------------------------------------------
    // Detection
    // ------------------------------------------------------------------

    @Test
    void sweep_noCycle_detectsNothing() {
        newScheduler(1);
        request("a");
        request("b", "a");

        assertThat(detector().sweep()).isZero();
        assertThat(deadlocks).isEmpty();
    }

    @Test
    void sweep_mutualDependency_dropsEdgeOfOlderSession() {
        newScheduler(1);
        request("blocker");
        CompletableFuture<AdmissionOutcome> s1 = request("s1", "s2");
        CompletableFuture<AdmissionOutcome> s2 = request("s2", "s1");

        int detected = detector().sweep();

        assertThat(detected).isEqualTo(1);
        assertThat(deadlocks)
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.sessionId()).isEqualTo("s1");
                    assertThat(e.data()).containsEntry("dependencies", List.of("s2"));
                });
        assertThat(meterRegistry.counter("threadpilot.deadlocks.detected").count()).isEqualTo(1.0);

        scheduler.completeExecution("blocker");
        assertThat(s1.join().isGranted()).isTrue();
        assertThat(s2).isNotDone();

        scheduler.completeExecution("s1");
        assertThat(s2.join().isGranted()).isTrue();
    }

    @Test
    void sweep_selfDependency_isResolvedAndStartsWhenSlotFree() {
        newScheduler(1);
        CompletableFuture<AdmissionOutcome> self = request("self", "self");
        assertThat(self).isNotDone();

        assertThat(detector().sweep()).isEqualTo(1);

        assertThat(self.join().isGranted()).isTrue();
        assertThat(scheduler.isRunning("self")).isTrue();
    }

    @Test
    void sweep_resolutionReevaluatesQueueWithFreeSlots() {
        newScheduler(3);
        request("x");
        CompletableFuture<AdmissionOutcome> s1 = request("s1", "x", "s2");
        CompletableFuture<AdmissionOutcome> s2 = request("s2", "s1");
        scheduler.completeExecution("x");
        assertThat(s1).isNotDone();
        assertThat(s2).isNotDone();

        // s1 drops the already-completed x (oldest), which does not break the
        // loop; s2 is then found on the cycle and drops s1.
        int detected = detector().sweep();

        assertThat(detected).isEqualTo(2);
        assertThat(s2.join().isGranted()).isTrue();
        assertThat(s1).isNotDone();

        scheduler.completeExecution("s2");
        assertThat(s1.join().isGranted()).isTrue();
    }

    @Test
    void sweep_policyDecliningToDrop_leavesDeadlockInPlace() {
        newScheduler(1);
        request("blocker");
        request("s1", "s2");
        request("s2", "s1");
        DeadlockDetector detector = new DeadlockDetector(scheduler, (session, contexts) -> Optional.empty(),
                meterRegistry);

        assertThat(detector.sweep()).isEqualTo(2);
        assertThat(detector.sweep()).isEqualTo(2);
        assertThat(scheduler.stateOf("s1")).isEqualTo(SchedulerState.WAITING);
        assertThat(scheduler.stateOf("s2")).isEqualTo(SchedulerState.WAITING);
    }

    // ------------------------------------------------------------------
    // Resolution policy
    // ------------------------------------------------------------------

    @Test
    void oldestDependencyPolicy_picksEarliestEnqueuedDependency() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        SchedulerContext older   = new SchedulerContext("older", t0, List.of());
        SchedulerContext newer   = new SchedulerContext("newer", t0.plusSeconds(5), List.of());
        SchedulerContext session = new SchedulerContext("s", t0.plusSeconds(9), List.of("newer", "older"));

        Optional<String> victim = new OldestDependencyPolicy()
                .edgeToDrop(session, Map.of("older", older, "newer", newer, "s", session));

        assertThat(victim).contains("older");
    }

    @Test
    void oldestDependencyPolicy_noDependencies_dropsNothing() {
        SchedulerContext session = new SchedulerContext("s", Instant.EPOCH, List.of());

        assertThat(new OldestDependencyPolicy().edgeToDrop(session, Map.of())).isEmpty();
    }
}
