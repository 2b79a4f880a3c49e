package com.threadpilot.orchestrator.service;

import com.threadpilot.orchestrator.MutableClock;
import com.threadpilot.orchestrator.event.EventBus;
import com.threadpilot.orchestrator.event.SessionEvent;
import com.threadpilot.orchestrator.model.NewSession;
import com.threadpilot.orchestrator.model.Session;
import com.threadpilot.orchestrator.model.SessionState;
import com.threadpilot.orchestrator.model.SessionUpdate;
import com.threadpilot.orchestrator.repository.SessionFileRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

@ExtendWith(MockitoExtension.class)
class StalledSessionRecoveryTest {

    @Mock SessionFileRepository repository;

    MutableClock           clock;
    SessionService         sessions;
    SimpleMeterRegistry    meterRegistry;
    StalledSessionRecovery recovery;

    @BeforeEach
    void setUp() {
        clock         = new MutableClock(Instant.parse("2026-02-01T08:00:00Z"));
        sessions      = new SessionService(repository, new EventBus<>("sessions", SessionEvent::type),
                Runnable::run, clock);
        meterRegistry = new SimpleMeterRegistry();
        recovery      = new StalledSessionRecovery(sessions, clock, meterRegistry);
    }

    private void create(String threadId) {
        sessions.createSession(threadId, "user", "guild", "channel", new NewSession("acme/api", null, null));
    }

    private Session get(String threadId) {
        return sessions.getSession(threadId).orElseThrow();
    }

    @Test
    void initializingPastTenMinutes_isForcedIntoError() {
        create("stuck");
        clock.advance(Duration.ofMinutes(11));

        int recovered = recovery.recoverStalledSessions();

        assertThat(recovered).isEqualTo(1);
        assertThat(get("stuck").getState()).isEqualTo(SessionState.ERROR);
        assertThat(get("stuck").getError()).isEqualTo("initialization timed out");
        assertThat(meterRegistry.counter("threadpilot.sessions.recovered").count()).isEqualTo(1.0);
    }

    @Test
    void initializingWithinTenMinutes_isLeftAlone() {
        create("fresh");
        clock.advance(Duration.ofMinutes(9));

        assertThat(recovery.recoverStalledSessions()).isZero();
        assertThat(get("fresh").getState()).isEqualTo(SessionState.INITIALIZING);
    }

    @Test
    void initializingTimeout_countsFromCreationNotLastUpdate() {
        create("chatty");
        clock.advance(Duration.ofMinutes(8));
        sessions.updateSession("chatty", SessionUpdate.logs("still cloning"));
        clock.advance(Duration.ofMinutes(3));

        assertThat(recovery.recoverStalledSessions()).isEqualTo(1);
        assertThat(get("chatty").getState()).isEqualTo(SessionState.ERROR);
    }

    @Test
    void startingIdlePastFifteenMinutes_isForcedIntoError() {
        create("booting");
        sessions.updateSession("booting", SessionUpdate.toState(SessionState.STARTING));
        clock.advance(Duration.ofMinutes(16));

        assertThat(recovery.recoverStalledSessions()).isEqualTo(1);
        assertThat(get("booting").getError()).isEqualTo("startup timed out");
    }

    @Test
    void startingWithRecentUpdate_isLeftAlone() {
        create("booting");
        sessions.updateSession("booting", SessionUpdate.toState(SessionState.STARTING));
        clock.advance(Duration.ofMinutes(14));
        sessions.updateSession("booting", SessionUpdate.logs("pulling image"));
        clock.advance(Duration.ofMinutes(14));

        assertThat(recovery.recoverStalledSessions()).isZero();
        assertThat(get("booting").getState()).isEqualTo(SessionState.STARTING);
    }

    @Test
    void longRunningSession_isOnlyWarnedAbout() {
        create("busy");
        sessions.updateSession("busy", SessionUpdate.toState(SessionState.STARTING));
        sessions.updateSession("busy", SessionUpdate.toState(SessionState.READY));
        sessions.updateSession("busy", SessionUpdate.toState(SessionState.RUNNING));
        clock.advance(Duration.ofHours(3));

        assertThat(recovery.recoverStalledSessions()).isZero();
        assertThat(get("busy").getState()).isEqualTo(SessionState.RUNNING);
    }

    @Test
    void terminalSessions_areIgnored() {
        create("gone");
        sessions.updateSession("gone", SessionUpdate.failed("boom"));
        clock.advance(Duration.ofDays(1));

        assertThat(recovery.recoverStalledSessions()).isZero();
        assertThat(get("gone").getError()).isEqualTo("boom");
    }

    @Test
    void sessionAdvancingAfterSweepSnapshot_isNotFailed() {
        create("racing");
        clock.advance(Duration.ofMinutes(11));
        SessionService racing = spy(sessions);
        // The session reaches STARTING between the sweep's read and its decision.
        doAnswer(invocation -> {
            @SuppressWarnings("unchecked")
            List<Session> snapshot = (List<Session>) invocation.callRealMethod();
            racing.updateSession("racing", SessionUpdate.toState(SessionState.STARTING));
            return snapshot;
        }).when(racing).getActiveSessions();
        StalledSessionRecovery sweep = new StalledSessionRecovery(racing, clock, meterRegistry);

        assertThat(sweep.recoverStalledSessions()).isZero();
        Session current = racing.getSession("racing").orElseThrow();
        assertThat(current.getState()).isEqualTo(SessionState.STARTING);
        assertThat(current.getError()).isNull();
    }
}
