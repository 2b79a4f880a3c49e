package com.threadpilot.orchestrator.scheduler;

public class AdmissionCancelledException extends SchedulerException {
    public AdmissionCancelledException(String sessionId, String reason) {
        super(sessionId, "Session " + sessionId + " admission cancelled: " + reason);
    }
}
