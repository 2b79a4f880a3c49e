package com.threadpilot.orchestrator.scheduler;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drops the direct dependency that was enqueued first. Unknown dependencies
 * never win over known ones; among equal timestamps the earlier list entry wins.
 *
 * Guarantees progress for simple two-party cycles only.
 */
public class OldestDependencyPolicy implements DeadlockResolutionPolicy {

    @Override
    public Optional<String> edgeToDrop(SchedulerContext session, Map<String, SchedulerContext> contexts) {
        List<String> deps = session.getDependencies();
        if (deps.isEmpty()) return Optional.empty();

        String oldest = deps.get(0);
        for (String candidate : deps.subList(1, deps.size())) {
            SchedulerContext current = contexts.get(oldest);
            SchedulerContext other   = contexts.get(candidate);
            if (current == null || other == null) continue;
            if (other.getEnqueuedAt().isBefore(current.getEnqueuedAt())) {
                oldest = candidate;
            }
        }
        return Optional.of(oldest);
    }
}
