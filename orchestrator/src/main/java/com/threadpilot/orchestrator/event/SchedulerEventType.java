package com.threadpilot.orchestrator.event;

public enum SchedulerEventType {
    SESSION_QUEUED,
    SESSION_STARTED,
    SESSION_COMPLETED,
    SESSION_TIMEOUT,
    DEADLOCK_DETECTED,
    QUEUE_STATUS_CHANGED
}
