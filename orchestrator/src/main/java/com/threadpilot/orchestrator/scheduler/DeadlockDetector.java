package com.threadpilot.orchestrator.scheduler;

import com.threadpilot.orchestrator.event.SchedulerEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds waiting sessions that can never become eligible because their
 * dependencies loop back on themselves, and breaks the loop.
 *
 * For each waiting session a depth-first walk follows dependency edges that
 * point at other waiting sessions; reaching a node already on the current
 * path means a cycle. The detector then emits DEADLOCK_DETECTED, drops one
 * edge chosen by the {@link DeadlockResolutionPolicy} and re-evaluates the
 * queue.
 *
 * {@link #sweep()} is driven periodically by
 * {@link com.threadpilot.orchestrator.service.SweepScheduler}.
 */
public class DeadlockDetector {

    private static final Logger log = LoggerFactory.getLogger(DeadlockDetector.class);

    private final ExecutionScheduler       scheduler;
    private final DeadlockResolutionPolicy policy;
    private final Counter                  deadlockCounter;

    public DeadlockDetector(ExecutionScheduler scheduler,
                            DeadlockResolutionPolicy policy,
                            MeterRegistry meterRegistry) {
        this.scheduler = scheduler;
        this.policy    = policy;
        this.deadlockCounter = meterRegistry.counter("threadpilot.deadlocks.detected");
    }

    /**
     * Run one detection pass.
     *
     * @return number of waiting sessions found on a cycle
     */
    public int sweep() {
        int detected = 0;
        List<QueueEntry> granted = new ArrayList<>();
        synchronized (scheduler) {
            Map<String, SchedulerContext> contexts = scheduler.contextView();
            for (SchedulerContext session : scheduler.waitingContexts()) {
                // An earlier resolution in this pass may already have started it.
                if (session.getState() != SchedulerState.WAITING) continue;
                if (!onCycle(session.getSessionId(), new HashSet<>(), contexts)) continue;

                detected++;
                deadlockCounter.increment();
                List<String> dependencies = List.copyOf(session.getDependencies());
                log.error("Deadlock detected: session={} dependencies={}",
                        session.getSessionId(), dependencies);
                scheduler.emit(SchedulerEventType.DEADLOCK_DETECTED, session.getSessionId(),
                        Map.of("dependencies", dependencies));

                resolve(session, contexts);
                granted.addAll(scheduler.drainQueue());
            }
        }
        ExecutionScheduler.grantAll(granted);
        return detected;
    }

    private void resolve(SchedulerContext session, Map<String, SchedulerContext> contexts) {
        Optional<String> victim = policy.edgeToDrop(session, contexts);
        if (victim.isPresent() && session.removeDependency(victim.get())) {
            log.warn("Deadlock resolved: dropped dependency {} from session {}",
                    victim.get(), session.getSessionId());
        } else {
            log.warn("Deadlock on session {} left unresolved by {}",
                    session.getSessionId(), policy.getClass().getSimpleName());
        }
    }

    private boolean onCycle(String sessionId, Set<String> path, Map<String, SchedulerContext> contexts) {
        if (!path.add(sessionId)) {
            return true;
        }
        SchedulerContext context = contexts.get(sessionId);
        if (context != null) {
            for (String depId : context.getDependencies()) {
                SchedulerContext dep = contexts.get(depId);
                if (dep != null && dep.getState() == SchedulerState.WAITING
                        && onCycle(depId, path, contexts)) {
                    return true;
                }
            }
        }
        path.remove(sessionId);
        return false;
    }
}
