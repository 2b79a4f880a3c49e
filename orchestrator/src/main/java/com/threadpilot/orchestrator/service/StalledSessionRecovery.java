package com.threadpilot.orchestrator.service;

import com.threadpilot.orchestrator.model.Session;
import com.threadpilot.orchestrator.model.SessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Forces sessions that are stuck in a boot phase into ERROR so that nothing
 * downstream waits on them forever.
 *
 * <ul>
 *   <li>INITIALIZING for more than 10 minutes since creation → ERROR</li>
 *   <li>STARTING with no update for more than 15 minutes → ERROR</li>
 *   <li>RUNNING with no update for more than 1 hour → warning only</li>
 * </ul>
 *
 * Called by {@link SweepScheduler} every 10 minutes and once after the store is loaded.
 */
public class StalledSessionRecovery {

    private static final Logger log = LoggerFactory.getLogger(StalledSessionRecovery.class);

    static final Duration INITIALIZING_TIMEOUT = Duration.ofMinutes(10);
    static final Duration STARTING_TIMEOUT     = Duration.ofMinutes(15);
    static final Duration RUNNING_WARNING      = Duration.ofHours(1);

    private final SessionService sessionService;
    private final Clock          clock;
    private final Counter        recoveredCounter;

    public StalledSessionRecovery(SessionService sessionService, Clock clock, MeterRegistry meterRegistry) {
        this.sessionService   = sessionService;
        this.clock            = clock;
        this.recoveredCounter = meterRegistry.counter("threadpilot.sessions.recovered");
    }

    /**
     * Run one recovery pass. A failure on one session is logged and the pass
     * moves on to the next.
     *
     * @return number of sessions forced into ERROR
     */
    public int recoverStalledSessions() {
        Instant now = clock.instant();
        int recovered = 0;

        for (Session session : sessionService.getActiveSessions()) {
            MDC.put("sessionId", session.getId());
            MDC.put("threadId",  session.getThreadId());
            try {
                if (recover(session, now)) {
                    recovered++;
                    recoveredCounter.increment();
                }
            } catch (Exception e) {
                log.error("Recovery failed for session {}: {}", session.getId(), e.getMessage(), e);
            } finally {
                MDC.remove("sessionId");
                MDC.remove("threadId");
            }
        }

        if (recovered > 0) {
            log.info("Auto-recovery moved {} stalled session(s) to ERROR", recovered);
        }
        return recovered;
    }

    private boolean recover(Session session, Instant now) {
        String threadId = session.getThreadId();
        switch (session.getState()) {
            case INITIALIZING -> {
                // Re-checked under the store lock: the session may have moved on.
                boolean failed = sessionService.failIfStalled(threadId, SessionState.INITIALIZING,
                        s -> olderThan(s.getMetadata().getCreatedAt(), now, INITIALIZING_TIMEOUT),
                        "initialization timed out");
                if (failed) {
                    log.warn("Session {} stuck in INITIALIZING for {} min", session.getId(),
                            Duration.between(session.getMetadata().getCreatedAt(), now).toMinutes());
                }
                return failed;
            }
            case STARTING -> {
                boolean failed = sessionService.failIfStalled(threadId, SessionState.STARTING,
                        s -> olderThan(s.getMetadata().getUpdatedAt(), now, STARTING_TIMEOUT),
                        "startup timed out");
                if (failed) {
                    log.warn("Session {} stuck in STARTING for {} min", session.getId(),
                            Duration.between(session.getMetadata().getUpdatedAt(), now).toMinutes());
                }
                return failed;
            }
            case RUNNING -> {
                if (olderThan(session.getMetadata().getUpdatedAt(), now, RUNNING_WARNING)) {
                    log.warn("Long-running session {} (thread={}): no update for {} min",
                            session.getId(), threadId,
                            Duration.between(session.getMetadata().getUpdatedAt(), now).toMinutes());
                }
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    private static boolean olderThan(Instant since, Instant now, Duration limit) {
        return Duration.between(since, now).compareTo(limit) > 0;
    }
}
