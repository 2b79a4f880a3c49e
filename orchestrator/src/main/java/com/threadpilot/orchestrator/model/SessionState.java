package com.threadpilot.orchestrator.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle state of a coding-agent session.
 *
 * Transitions:
 *   INITIALIZING → STARTING | WAITING | ERROR | CANCELLED
 *   STARTING     → READY | ERROR | CANCELLED
 *   READY        → RUNNING | WAITING | CANCELLED
 *   RUNNING      → COMPLETED | ERROR | CANCELLED
 *   WAITING      → RUNNING | CANCELLED
 *   ERROR        → READY (retry) | CANCELLED
 *   COMPLETED    → READY (next task in the same thread)
 *   CANCELLED    → (none)
 */
public enum SessionState {
    INITIALIZING,   // repository clone, worktree creation
    STARTING,       // container boot
    READY,          // waiting for a prompt
    RUNNING,        // agent process is working
    WAITING,        // parked in the execution queue
    COMPLETED,
    ERROR,
    CANCELLED;      // aborted by the user

    private static final Map<SessionState, Set<SessionState>> TRANSITIONS = Map.of(
            INITIALIZING, EnumSet.of(STARTING, WAITING, ERROR, CANCELLED),
            STARTING,     EnumSet.of(READY, ERROR, CANCELLED),
            READY,        EnumSet.of(RUNNING, WAITING, CANCELLED),
            RUNNING,      EnumSet.of(COMPLETED, ERROR, CANCELLED),
            WAITING,      EnumSet.of(RUNNING, CANCELLED),
            ERROR,        EnumSet.of(READY, CANCELLED),
            COMPLETED,    EnumSet.of(READY),
            CANCELLED,    EnumSet.noneOf(SessionState.class)
    );

    public boolean canTransitionTo(SessionState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /** Initializing through Waiting: the session still holds, or is about to hold, resources. */
    public boolean isActive() {
        return switch (this) {
            case INITIALIZING, STARTING, READY, RUNNING, WAITING -> true;
            case COMPLETED, ERROR, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
