package com.threadpilot.orchestrator.scheduler;

import com.threadpilot.orchestrator.event.EventBus;
import com.threadpilot.orchestrator.event.SchedulerEvent;
import com.threadpilot.orchestrator.event.SchedulerEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Admission control for coding-agent sessions.
 *
 * At most {@code maxSessions} sessions hold a run slot at once. Requests that
 * cannot start immediately wait in a list ordered by ascending priority
 * (lower value first), ties broken by arrival order. A session whose
 * dependencies have not all completed is never granted a slot; such entries
 * are skipped during re-evaluation, so they never block eligible entries
 * behind them.
 *
 * <p>Every public operation runs to completion under this object's monitor,
 * so the slot counter, wait list and context map are never observed
 * half-updated. Completion handles are resolved after the monitor is
 * released; callbacks chained on them may safely call back into the
 * scheduler.
 *
 * <p>This class decides <em>when</em> work may run. It never runs it.
 */
public class ExecutionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

    public static final int DEFAULT_PRIORITY = 10;

    private final SchedulerSettings        settings;
    private final EventBus<SchedulerEventType, SchedulerEvent> events;
    private final ScheduledExecutorService timer;
    private final Clock                    clock;
    private final Counter                  timeoutCounter;

    // Guarded by this.
    private final List<QueueEntry>              queue    = new ArrayList<>();
    private final Map<String, SchedulerContext> contexts = new HashMap<>();
    private int runningCount;

    public ExecutionScheduler(SchedulerSettings settings,
                              EventBus<SchedulerEventType, SchedulerEvent> events,
                              ScheduledExecutorService timer,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.settings = settings;
        this.events   = events;
        this.timer    = timer;
        this.clock    = clock;
        this.timeoutCounter = meterRegistry.counter("threadpilot.queue.timeouts");
        Gauge.builder("threadpilot.queue.running", this, s -> s.getQueueStats().running())
                .register(meterRegistry);
        Gauge.builder("threadpilot.queue.waiting", this, s -> s.getQueueStats().waiting())
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Admission
    // ------------------------------------------------------------------

    public CompletableFuture<AdmissionOutcome> requestExecution(String sessionId) {
        return requestExecution(sessionId, DEFAULT_PRIORITY, List.of());
    }

    /**
     * Ask for a run slot.
     *
     * The returned handle is already complete with {@link AdmissionOutcome.Kind#GRANTED}
     * when a slot is free and every dependency has completed. Otherwise the
     * request is queued and the handle completes later with GRANTED,
     * TIMED_OUT (queue timeout elapsed) or CANCELLED.
     *
     * @throws IllegalStateException if the session is already waiting or running
     */
    public CompletableFuture<AdmissionOutcome> requestExecution(String sessionId,
                                                                int priority,
                                                                List<String> dependencies) {
        Objects.requireNonNull(sessionId, "sessionId");
        List<String> deps = dependencies == null ? List.of() : dependencies;

        synchronized (this) {
            SchedulerContext existing = contexts.get(sessionId);
            if (existing != null && !existing.getState().isFinished()) {
                throw new IllegalStateException(
                        "Session " + sessionId + " is already " + existing.getState());
            }
            log.info("Execution requested: session={} priority={} dependencies={}",
                    sessionId, priority, deps);

            Instant now = clock.instant();
            SchedulerContext context = new SchedulerContext(sessionId, now, deps);
            contexts.put(sessionId, context);

            List<String> unresolved = unresolvedDependencies(context);
            if (!unresolved.isEmpty()) {
                log.warn("Session {} is waiting on dependencies {}", sessionId, unresolved);
                emit(SchedulerEventType.SESSION_QUEUED, sessionId,
                        Map.of("reason", "dependencies", "unresolved", unresolved));
            }

            if (runningCount < settings.maxSessions() && unresolved.isEmpty()) {
                start(context);
                return CompletableFuture.completedFuture(AdmissionOutcome.granted(sessionId));
            }

            QueueEntry entry = new QueueEntry(sessionId, priority, now);
            insert(entry);
            if (settings.hasQueueTimeout()) {
                Duration timeout = settings.queueTimeout();
                entry.armTimeout(timer.schedule(() -> expire(entry),
                        timeout.toMillis(), TimeUnit.MILLISECONDS));
            }

            int position = positionOf(sessionId);
            emit(SchedulerEventType.SESSION_QUEUED, sessionId,
                    Map.of("priority", priority, "position", position));
            log.debug("Session {} queued at position {}", sessionId, position);
            return entry.handle();
        }
    }

    /**
     * Release the slot held by a running session and mark it completed, which
     * satisfies any session that depends on it. Then re-evaluates the queue.
     */
    public void completeExecution(String sessionId) {
        List<QueueEntry> granted;
        synchronized (this) {
            log.info("Execution completed: session={}", sessionId);
            SchedulerContext context = contexts.get(sessionId);
            if (context != null && context.getState() == SchedulerState.RUNNING) {
                if (runningCount > 0) runningCount--;
                context.markCompleted(clock.instant());
                emit(SchedulerEventType.SESSION_COMPLETED, sessionId,
                        Map.of("runningCount", runningCount));
            } else {
                log.warn("Ignoring completion of session {}: not running (state={})",
                        sessionId, context == null ? "unknown" : context.getState());
            }
            granted = drainQueue();
        }
        grantAll(granted);
    }

    /**
     * Withdraw a session: drops its queue entry (resolving the handle as
     * CANCELLED), frees its slot if it was running, and forgets its context.
     * Safe to call repeatedly or for an unknown id.
     */
    public void cancelExecution(String sessionId) {
        QueueEntry removed;
        List<QueueEntry> granted;
        synchronized (this) {
            log.info("Execution cancelled: session={}", sessionId);
            removed = removeEntry(sessionId);
            SchedulerContext context = contexts.remove(sessionId);
            if (context != null && context.getState() == SchedulerState.RUNNING && runningCount > 0) {
                runningCount--;
            }
            granted = drainQueue();
        }
        if (removed != null) {
            removed.handle().complete(AdmissionOutcome.cancelled(sessionId, "cancelled by caller"));
        }
        grantAll(granted);
    }

    /**
     * Forget the context of a completed or timed-out session. Dependents will
     * then treat it as satisfied, so the queue is re-evaluated.
     *
     * @return false if the session is unknown or still waiting/running
     */
    public boolean releaseContext(String sessionId) {
        List<QueueEntry> granted;
        synchronized (this) {
            SchedulerContext context = contexts.get(sessionId);
            if (context == null || !context.getState().isFinished()) {
                return false;
            }
            contexts.remove(sessionId);
            log.debug("Released context of session {} ({})", sessionId, context.getState());
            granted = drainQueue();
        }
        grantAll(granted);
        return true;
    }

    /** Resolve every pending request as CANCELLED and drop all bookkeeping. */
    public void shutdown() {
        List<QueueEntry> pending;
        synchronized (this) {
            pending = new ArrayList<>(queue);
            pending.forEach(QueueEntry::disarmTimeout);
            queue.clear();
            contexts.clear();
            runningCount = 0;
        }
        if (!pending.isEmpty()) {
            log.info("Scheduler shutting down, cancelling {} queued request(s)", pending.size());
        }
        for (QueueEntry entry : pending) {
            entry.handle().complete(AdmissionOutcome.cancelled(entry.sessionId(), "scheduler shut down"));
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public synchronized QueueStats getQueueStats() {
        Instant now = clock.instant();
        double total = 0;
        double max   = 0;
        for (QueueEntry entry : queue) {
            double waited = Duration.between(entry.enqueuedAt(), now).toMillis() / 1000.0;
            total += waited;
            max    = Math.max(max, waited);
        }
        double avg = queue.isEmpty() ? 0 : total / queue.size();
        return new QueueStats(runningCount, queue.size(), settings.maxSessions(), avg, max);
    }

    /** 1-indexed rank in the wait list, or -1 when the session is not queued. */
    public synchronized int getQueuePosition(String sessionId) {
        return positionOf(sessionId);
    }

    public synchronized boolean isRunning(String sessionId) {
        SchedulerContext context = contexts.get(sessionId);
        return context != null && context.getState() == SchedulerState.RUNNING;
    }

    public synchronized SchedulerState stateOf(String sessionId) {
        SchedulerContext context = contexts.get(sessionId);
        return context == null ? null : context.getState();
    }

    public SchedulerSettings getSettings() {
        return settings;
    }

    // ------------------------------------------------------------------
    // Package-private hooks for DeadlockDetector (caller holds the monitor)
    // ------------------------------------------------------------------

    List<SchedulerContext> waitingContexts() {
        return contexts.values().stream()
                .filter(c -> c.getState() == SchedulerState.WAITING)
                .sorted((a, b) -> a.getEnqueuedAt().compareTo(b.getEnqueuedAt()))
                .toList();
    }

    Map<String, SchedulerContext> contextView() {
        return Collections.unmodifiableMap(contexts);
    }

    void emit(SchedulerEventType type, String sessionId, Map<String, Object> data) {
        events.emit(new SchedulerEvent(type, sessionId, data));
    }

    /**
     * Grant slots to eligible waiting entries until none are free or no
     * entry is eligible. Returns the entries granted; the caller resolves
     * their handles via {@link #grantAll} once it has released the monitor.
     */
    List<QueueEntry> drainQueue() {
        List<QueueEntry> granted = new ArrayList<>();
        while (runningCount < settings.maxSessions()) {
            QueueEntry next = firstEligible();
            if (next == null) break;

            queue.remove(next);
            next.disarmTimeout();
            start(contexts.get(next.sessionId()));
            granted.add(next);
            emit(SchedulerEventType.QUEUE_STATUS_CHANGED, next.sessionId(), getQueueStats().toMap());
        }
        return granted;
    }

    static void grantAll(Collection<QueueEntry> granted) {
        for (QueueEntry entry : granted) {
            entry.handle().complete(AdmissionOutcome.granted(entry.sessionId()));
        }
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private void expire(QueueEntry entry) {
        List<QueueEntry> granted;
        synchronized (this) {
            // Lost the race: already granted or cancelled.
            if (!queue.remove(entry)) return;
            // Kept so that dependents stay blocked.
            SchedulerContext context = contexts.get(entry.sessionId());
            if (context != null) context.markTimedOut(clock.instant());
            timeoutCounter.increment();
            log.warn("Session {} timed out after waiting {}s in queue",
                    entry.sessionId(), settings.queueTimeout().toSeconds());
            emit(SchedulerEventType.SESSION_TIMEOUT, entry.sessionId(),
                    Map.of("timeout", settings.queueTimeout().toSeconds()));
            granted = drainQueue();
        }
        entry.handle().complete(AdmissionOutcome.timedOut(entry.sessionId(), settings.queueTimeout()));
        grantAll(granted);
    }

    private void start(SchedulerContext context) {
        runningCount++;
        context.markRunning(clock.instant());
        emit(SchedulerEventType.SESSION_STARTED, context.getSessionId(),
                Map.of("runningCount", runningCount));
        log.info("Session {} started ({}/{} running)",
                context.getSessionId(), runningCount, settings.maxSessions());
    }

    private QueueEntry firstEligible() {
        for (QueueEntry entry : queue) {
            SchedulerContext context = contexts.get(entry.sessionId());
            if (context != null && unresolvedDependencies(context).isEmpty()) {
                return entry;
            }
        }
        return null;
    }

    /** Direct dependencies that are known to the scheduler and not yet completed. */
    private List<String> unresolvedDependencies(SchedulerContext context) {
        List<String> unresolved = new ArrayList<>();
        for (String depId : context.getDependencies()) {
            SchedulerContext dep = contexts.get(depId);
            if (dep != null && dep.getState() != SchedulerState.COMPLETED) {
                unresolved.add(depId);
            }
        }
        return unresolved;
    }

    /** Insert before the first strictly greater priority, so equal priorities stay FIFO. */
    private void insert(QueueEntry entry) {
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).priority() > entry.priority()) {
                queue.add(i, entry);
                return;
            }
        }
        queue.add(entry);
    }

    private QueueEntry removeEntry(String sessionId) {
        Iterator<QueueEntry> it = queue.iterator();
        while (it.hasNext()) {
            QueueEntry entry = it.next();
            if (entry.sessionId().equals(sessionId)) {
                it.remove();
                entry.disarmTimeout();
                return entry;
            }
        }
        return null;
    }

    private int positionOf(String sessionId) {
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).sessionId().equals(sessionId)) {
                return i + 1;
            }
        }
        return -1;
    }
}
