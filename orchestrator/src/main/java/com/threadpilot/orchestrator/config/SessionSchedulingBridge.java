package com.threadpilot.orchestrator.config;

import com.threadpilot.orchestrator.event.EventBus;
import com.threadpilot.orchestrator.event.SessionEvent;
import com.threadpilot.orchestrator.event.SessionEventType;
import com.threadpilot.orchestrator.model.SessionState;
import com.threadpilot.orchestrator.scheduler.ExecutionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Releases run slots when the session store reports that running work has
 * ended. Scheduler ids are session ids (not thread ids).
 *
 *   COMPLETED        → completeExecution (satisfies dependents)
 *   ERROR, CANCELLED → cancelExecution
 *
 * Sessions the scheduler is not running are ignored.
 */
public class SessionSchedulingBridge {

    private static final Logger log = LoggerFactory.getLogger(SessionSchedulingBridge.class);

    private final ExecutionScheduler scheduler;

    public SessionSchedulingBridge(ExecutionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public void register(EventBus<SessionEventType, SessionEvent> sessionEvents) {
        sessionEvents.on(SessionEventType.STATE_CHANGED, this::onStateChanged);
    }

    void onStateChanged(SessionEvent event) {
        String sessionId = event.sessionId();
        if (!scheduler.isRunning(sessionId)) return;

        SessionState state = event.session().getState();
        switch (state) {
            case COMPLETED -> {
                log.debug("Session {} completed, releasing its slot", sessionId);
                scheduler.completeExecution(sessionId);
            }
            case ERROR, CANCELLED -> {
                log.debug("Session {} ended in {}, releasing its slot", sessionId, state);
                scheduler.cancelExecution(sessionId);
            }
            default -> { }
        }
    }
}
