package com.threadpilot.orchestrator.health;

import com.threadpilot.orchestrator.model.SessionState;
import com.threadpilot.orchestrator.model.SessionStats;
import com.threadpilot.orchestrator.service.SessionService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the session store as DEGRADED once more than {@value #MAX_ACTIVE}
 * sessions are ready, running or waiting.
 */
@Component("sessionStore")
public class SessionStoreHealthIndicator implements HealthIndicator {

    static final int MAX_ACTIVE = 100;

    private final SessionService sessionService;

    public SessionStoreHealthIndicator(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Override
    public Health health() {
        SessionStats stats = sessionService.getStats();
        int busy = stats.byState().get(SessionState.RUNNING)
                 + stats.byState().get(SessionState.WAITING)
                 + stats.byState().get(SessionState.READY);

        Health.Builder builder = busy > MAX_ACTIVE
                ? Health.status(HealthStatuses.DEGRADED)
                : Health.up();
        return builder
                .withDetail("totalSessions", stats.total())
                .withDetail("activeSessions", busy)
                .withDetail("errorRate", stats.errorRate())
                .build();
    }
}
