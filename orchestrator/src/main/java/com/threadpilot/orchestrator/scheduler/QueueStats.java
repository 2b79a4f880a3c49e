package com.threadpilot.orchestrator.scheduler;

import java.util.Map;

/**
 * Snapshot of the scheduler's load. Wait times are in seconds and computed
 * from the age of each entry currently in the wait list.
 */
public record QueueStats(
        int    running,
        int    waiting,
        int    maxSessions,
        double avgWaitTime,
        double maxWaitTime
) {
    public Map<String, Object> toMap() {
        return Map.of(
                "running",     running,
                "waiting",     waiting,
                "maxSessions", maxSessions,
                "avgWaitTime", avgWaitTime,
                "maxWaitTime", maxWaitTime);
    }
}
