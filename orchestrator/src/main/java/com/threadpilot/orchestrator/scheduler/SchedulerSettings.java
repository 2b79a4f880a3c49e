package com.threadpilot.orchestrator.scheduler;

import java.time.Duration;

/**
 * Admission limits for the {@link ExecutionScheduler}.
 *
 * @param maxSessions  concurrency budget, at least 1
 * @param queueTimeout how long a request may wait for a slot; {@link Duration#ZERO} disables the timeout
 */
public record SchedulerSettings(int maxSessions, Duration queueTimeout) {

    public SchedulerSettings {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be >= 1, got " + maxSessions);
        }
        if (queueTimeout == null) queueTimeout = Duration.ZERO;
        if (queueTimeout.isNegative()) {
            throw new IllegalArgumentException("queueTimeout must not be negative, got " + queueTimeout);
        }
    }

    public static SchedulerSettings of(int maxSessions, long queueTimeoutSeconds) {
        return new SchedulerSettings(maxSessions, Duration.ofSeconds(queueTimeoutSeconds));
    }

    public boolean hasQueueTimeout() {
        return !queueTimeout.isZero();
    }
}
