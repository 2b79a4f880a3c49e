package com.threadpilot.orchestrator.config;

import com.threadpilot.orchestrator.MutableClock;
import com.threadpilot.orchestrator.event.EventBus;
import com.threadpilot.orchestrator.event.SchedulerEvent;
import com.threadpilot.orchestrator.event.SessionEvent;
import com.threadpilot.orchestrator.event.SessionEventType;
import com.threadpilot.orchestrator.model.NewSession;
import com.threadpilot.orchestrator.model.Session;
import com.threadpilot.orchestrator.model.SessionState;
import com.threadpilot.orchestrator.model.SessionUpdate;
import com.threadpilot.orchestrator.repository.SessionFileRepository;
import com.threadpilot.orchestrator.scheduler.AdmissionOutcome;
import com.threadpilot.orchestrator.scheduler.ExecutionScheduler;
import com.threadpilot.orchestrator.scheduler.SchedulerSettings;
import com.threadpilot.orchestrator.scheduler.SchedulerState;
import com.threadpilot.orchestrator.service.SessionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class SessionSchedulingBridgeTest {

    @Mock SessionFileRepository repository;

    ScheduledExecutorService timer;
    ExecutionScheduler       scheduler;
    SessionService           sessions;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-02-01T08:00:00Z"));
        timer     = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ExecutionScheduler(new SchedulerSettings(1, Duration.ZERO),
                new EventBus<>("scheduler", SchedulerEvent::type), timer, clock, new SimpleMeterRegistry());
        EventBus<SessionEventType, SessionEvent> sessionEvents = new EventBus<>("sessions", SessionEvent::type);
        sessions  = new SessionService(repository, sessionEvents, Runnable::run, clock);
        new SessionSchedulingBridge(scheduler).register(sessionEvents);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    private Session runningSession(String threadId) {
        Session session = sessions.createSession(threadId, "u", "g", "c", new NewSession("acme/api", null, null));
        for (SessionState s : List.of(SessionState.STARTING, SessionState.READY, SessionState.RUNNING)) {
            sessions.updateSession(threadId, SessionUpdate.toState(s));
        }
        return session;
    }

    @Test
    void completedSession_releasesSlotAndSatisfiesDependents() {
        Session first = runningSession("t1");
        scheduler.requestExecution(first.getId());
        CompletableFuture<AdmissionOutcome> next =
                scheduler.requestExecution("follow-up", 10, List.of(first.getId()));

        sessions.updateSession("t1", SessionUpdate.toState(SessionState.COMPLETED));

        assertThat(scheduler.stateOf(first.getId())).isEqualTo(SchedulerState.COMPLETED);
        assertThat(next.join().isGranted()).isTrue();
    }

    @Test
    void failedSession_isCancelledInScheduler() {
        Session first = runningSession("t1");
        scheduler.requestExecution(first.getId());
        CompletableFuture<AdmissionOutcome> waiting = scheduler.requestExecution("other");

        sessions.updateSession("t1", SessionUpdate.failed("container died"));

        assertThat(scheduler.stateOf(first.getId())).isNull();
        assertThat(waiting.join().isGranted()).isTrue();
    }

    @Test
    void sessionNotKnownToScheduler_isIgnored() {
        runningSession("t1");
        scheduler.requestExecution("someone-else");

        sessions.updateSession("t1", SessionUpdate.toState(SessionState.COMPLETED));

        assertThat(scheduler.isRunning("someone-else")).isTrue();
        assertThat(scheduler.getQueueStats().running()).isEqualTo(1);
    }
}
