package com.threadpilot.orchestrator.scheduler;

/**
 * Base class for admission failures surfaced to the caller that asked for a slot.
 */
public class SchedulerException extends RuntimeException {

    private final String sessionId;

    public SchedulerException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
