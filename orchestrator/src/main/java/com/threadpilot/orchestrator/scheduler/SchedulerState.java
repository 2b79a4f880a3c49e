package com.threadpilot.orchestrator.scheduler;

/**
 * Scheduler-local view of a session. Independent of the persisted
 * {@link com.threadpilot.orchestrator.model.SessionState}.
 *
 *   WAITING → RUNNING → COMPLETED
 *   WAITING → TIMED_OUT
 *
 * Only COMPLETED satisfies a dependent. A TIMED_OUT context stays until it is
 * cancelled, released or requested again.
 */
public enum SchedulerState {
    WAITING,
    RUNNING,
    COMPLETED,
    TIMED_OUT;

    /** No longer holds a slot or a queue entry. */
    public boolean isFinished() {
        return this == COMPLETED || this == TIMED_OUT;
    }
}
