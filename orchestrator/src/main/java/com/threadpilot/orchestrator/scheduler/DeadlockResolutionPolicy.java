package com.threadpilot.orchestrator.scheduler;

import java.util.Map;
import java.util.Optional;

/**
 * Chooses which dependency edge to drop when a waiting session sits on a
 * dependency cycle.
 */
@FunctionalInterface
public interface DeadlockResolutionPolicy {

    /**
     * @param session  the waiting session found on (or leading into) a cycle
     * @param contexts every context the scheduler currently knows, by session id
     * @return the dependency id to remove from {@code session}, or empty to leave it alone
     */
    Optional<String> edgeToDrop(SchedulerContext session, Map<String, SchedulerContext> contexts);
}
