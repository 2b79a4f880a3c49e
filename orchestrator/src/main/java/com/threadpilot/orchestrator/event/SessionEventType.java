package com.threadpilot.orchestrator.event;

public enum SessionEventType {
    CREATED,
    UPDATED,
    STATE_CHANGED,
    LOG_ADDED,
    ERROR_OCCURRED,
    DELETED
}
