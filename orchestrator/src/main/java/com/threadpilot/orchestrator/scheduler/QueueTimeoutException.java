package com.threadpilot.orchestrator.scheduler;

public class QueueTimeoutException extends SchedulerException {
    public QueueTimeoutException(String sessionId, String reason) {
        super(sessionId, "Session " + sessionId + ": " + reason);
    }
}
