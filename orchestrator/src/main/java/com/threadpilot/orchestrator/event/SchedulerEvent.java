package com.threadpilot.orchestrator.event;

import java.util.Map;

/**
 * Lifecycle or queue notification published by the execution scheduler.
 *
 * {@code data} carries event-specific details, e.g. {@code position} for
 * SESSION_QUEUED or {@code runningCount} for SESSION_STARTED.
 */
public record SchedulerEvent(SchedulerEventType type, String sessionId, Map<String, Object> data) {

    public SchedulerEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
