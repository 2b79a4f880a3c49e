package com.threadpilot.orchestrator.scheduler;

import java.time.Duration;

/**
 * How a pending admission request ended. Exactly one of the three kinds is
 * ever delivered for a given request.
 */
public record AdmissionOutcome(String sessionId, Kind kind, String reason) {

    public enum Kind { GRANTED, TIMED_OUT, CANCELLED }

    public static AdmissionOutcome granted(String sessionId) {
        return new AdmissionOutcome(sessionId, Kind.GRANTED, null);
    }

    public static AdmissionOutcome timedOut(String sessionId, Duration timeout) {
        return new AdmissionOutcome(sessionId, Kind.TIMED_OUT,
                "Queue wait timed out after " + timeout.toSeconds() + "s");
    }

    public static AdmissionOutcome cancelled(String sessionId, String reason) {
        return new AdmissionOutcome(sessionId, Kind.CANCELLED, reason);
    }

    public boolean isGranted() {
        return kind == Kind.GRANTED;
    }

    /**
     * Returns this outcome if the slot was granted, otherwise throws the
     * matching {@link SchedulerException}.
     */
    public AdmissionOutcome orThrow() {
        return switch (kind) {
            case GRANTED   -> this;
            case TIMED_OUT -> throw new QueueTimeoutException(sessionId, reason);
            case CANCELLED -> throw new AdmissionCancelledException(sessionId, reason);
        };
    }
}
