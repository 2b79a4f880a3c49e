package com.threadpilot.orchestrator.health;

import com.threadpilot.orchestrator.scheduler.ExecutionScheduler;
import com.threadpilot.orchestrator.scheduler.QueueStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * DEGRADED when more than 90% of run slots are taken or more than
 * {@value #MAX_WAITING} requests are queued.
 */
@Component("executionScheduler")
public class SchedulerHealthIndicator implements HealthIndicator {

    static final double MAX_UTILIZATION = 0.9;
    static final int    MAX_WAITING     = 50;

    private final ExecutionScheduler scheduler;

    public SchedulerHealthIndicator(ExecutionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Health health() {
        QueueStats stats = scheduler.getQueueStats();
        double utilization = (double) stats.running() / stats.maxSessions();

        boolean degraded = utilization > MAX_UTILIZATION || stats.waiting() > MAX_WAITING;
        Health.Builder builder = degraded ? Health.status(HealthStatuses.DEGRADED) : Health.up();
        return builder
                .withDetail("running", stats.running())
                .withDetail("waiting", stats.waiting())
                .withDetail("maxSessions", stats.maxSessions())
                .withDetail("utilizationRate", utilization * 100)
                .withDetail("maxWaitSeconds", stats.maxWaitTime())
                .build();
    }
}
