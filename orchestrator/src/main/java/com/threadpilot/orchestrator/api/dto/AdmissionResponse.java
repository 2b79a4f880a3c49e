package com.threadpilot.orchestrator.api.dto;

/**
 * Result of an admission request: RUNNING when a slot was granted on the
 * spot, QUEUED with a 1-indexed position otherwise.
 */
public record AdmissionResponse(String sessionId, String status, int position) {

    public static AdmissionResponse running(String sessionId) {
        return new AdmissionResponse(sessionId, "RUNNING", -1);
    }

    public static AdmissionResponse queued(String sessionId, int position) {
        return new AdmissionResponse(sessionId, "QUEUED", position);
    }
}
