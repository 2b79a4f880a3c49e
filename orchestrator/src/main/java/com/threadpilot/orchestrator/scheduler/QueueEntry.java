package com.threadpilot.orchestrator.scheduler;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A pending admission request. Lives in the scheduler's wait list until it is
 * granted, cancelled or timed out; whichever removes it from the list first
 * decides the outcome.
 */
final class QueueEntry {

    private final String  sessionId;
    private final int     priority;
    private final Instant enqueuedAt;
    private final CompletableFuture<AdmissionOutcome> handle = new CompletableFuture<>();

    private ScheduledFuture<?> timeout;

    QueueEntry(String sessionId, int priority, Instant enqueuedAt) {
        this.sessionId  = sessionId;
        this.priority   = priority;
        this.enqueuedAt = enqueuedAt;
    }

    String  sessionId()  { return sessionId; }
    int     priority()   { return priority; }
    Instant enqueuedAt() { return enqueuedAt; }

    CompletableFuture<AdmissionOutcome> handle() { return handle; }

    void armTimeout(ScheduledFuture<?> timeout) {
        this.timeout = timeout;
    }

    void disarmTimeout() {
        if (timeout != null) {
            timeout.cancel(false);
            timeout = null;
        }
    }
}
