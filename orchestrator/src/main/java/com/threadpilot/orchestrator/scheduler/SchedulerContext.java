package com.threadpilot.orchestrator.scheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shadow bookkeeping the scheduler keeps for every session it has been asked
 * to run. Dependencies name other contexts by session id; a dependency with
 * no context is treated as already satisfied.
 *
 * Mutated only while holding the scheduler's monitor.
 */
public class SchedulerContext {

    private final String       sessionId;
    private final Instant      enqueuedAt;
    private final List<String> dependencies;

    private SchedulerState state = SchedulerState.WAITING;
    private Instant        startedAt;
    private Instant        completedAt;

    SchedulerContext(String sessionId, Instant enqueuedAt, List<String> dependencies) {
        this.sessionId    = sessionId;
        this.enqueuedAt   = enqueuedAt;
        this.dependencies = new ArrayList<>(dependencies);
    }

    public String         getSessionId()    { return sessionId; }
    public Instant        getEnqueuedAt()   { return enqueuedAt; }
    public SchedulerState getState()        { return state; }
    public Instant        getStartedAt()    { return startedAt; }
    public Instant        getCompletedAt()  { return completedAt; }
    public List<String>   getDependencies() { return Collections.unmodifiableList(dependencies); }

    void markRunning(Instant now) {
        state     = SchedulerState.RUNNING;
        startedAt = now;
    }

    void markCompleted(Instant now) {
        state       = SchedulerState.COMPLETED;
        completedAt = now;
    }

    void markTimedOut(Instant now) {
        state       = SchedulerState.TIMED_OUT;
        completedAt = now;
    }

    boolean removeDependency(String dependencyId) {
        return dependencies.remove(dependencyId);
    }
}
