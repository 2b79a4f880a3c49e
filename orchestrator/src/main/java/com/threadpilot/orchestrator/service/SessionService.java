package com.threadpilot.orchestrator.service;

import com.threadpilot.orchestrator.event.EventBus;
import com.threadpilot.orchestrator.event.SessionEvent;
import com.threadpilot.orchestrator.event.SessionEventType;
import com.threadpilot.orchestrator.model.NewSession;
import com.threadpilot.orchestrator.model.Session;
import com.threadpilot.orchestrator.model.SessionFilter;
import com.threadpilot.orchestrator.model.SessionMetadata;
import com.threadpilot.orchestrator.model.SessionState;
import com.threadpilot.orchestrator.model.SessionStats;
import com.threadpilot.orchestrator.model.SessionUpdate;
import com.threadpilot.orchestrator.repository.SessionFileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;

/**
 * Authority for session records: creation, validated state transitions,
 * bounded log retention, statistics and persistence.
 *
 * Records live in memory keyed by thread id. Every mutation is followed by a
 * fire-and-forget save on {@code persistenceExecutor}; save failures are
 * logged and never reach the caller. {@link #flush()} writes synchronously
 * and is used for periodic flushes and on shutdown.
 *
 * All mutations are serialized on this object's monitor. Events are emitted
 * while holding it, so listeners observe mutations in order.
 */
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionFileRepository repository;
    private final EventBus<SessionEventType, SessionEvent> events;
    private final Executor              persistenceExecutor;
    private final Clock                 clock;

    private final Map<String, Session> sessions = new LinkedHashMap<>();

    // Taken before this object's monitor, never while holding it.
    private final Object flushLock = new Object();

    public SessionService(SessionFileRepository repository,
                          EventBus<SessionEventType, SessionEvent> events,
                          Executor persistenceExecutor,
                          Clock clock) {
        this.repository          = repository;
        this.events              = events;
        this.persistenceExecutor = persistenceExecutor;
        this.clock               = clock;
    }

    // ------------------------------------------------------------------
    // Startup / shutdown
    // ------------------------------------------------------------------

    /**
     * Replace the in-memory records with the persisted ones.
     *
     * @throws com.threadpilot.orchestrator.repository.PersistenceException
     *         if the store exists but is unreadable; startup must not continue
     */
    public synchronized void load() {
        Map<String, Session> loaded = repository.load();
        sessions.clear();
        sessions.putAll(loaded);
        log.info("Session store initialised with {} session(s)", sessions.size());
    }

    /**
     * Write the current record set synchronously. Failures are logged, not thrown.
     *
     * Snapshot and write happen under {@code flushLock}, so concurrent flushes
     * (save-after-mutation, periodic, shutdown) land in snapshot order.
     */
    public void flush() {
        synchronized (flushLock) {
            Map<String, Session> snapshot = snapshot();
            try {
                repository.save(snapshot, clock.instant());
                log.debug("Flushed {} session(s) to {}", snapshot.size(), repository.getFile());
            } catch (Exception e) {
                log.error("Session store flush failed: {}", e.getMessage(), e);
            }
        }
    }

    // ------------------------------------------------------------------
    // Mutations
    // ------------------------------------------------------------------

    public Session createSession(String threadId, String userId, String guildId,
                                 String channelId, NewSession options) {
        Session session;
        synchronized (this) {
            if (sessions.containsKey(threadId)) {
                throw new SessionException(SessionException.Kind.ALREADY_EXISTS,
                        "Session for thread " + threadId + " already exists");
            }
            Instant now = clock.instant();
            session = new Session(
                    "session_" + UUID.randomUUID(),
                    threadId,
                    options.repository(),
                    options.branch(),
                    new SessionMetadata(userId, guildId, channelId, now, options.priority()));
            sessions.put(threadId, session);
            session = session.copy();

            events.emit(SessionEvent.of(SessionEventType.CREATED, session));
            log.info("Created session {} for thread {} (repository={}, user={})",
                    session.getId(), threadId, options.repository(), userId);
        }
        saveAsync();
        return session;
    }

    /**
     * Apply a partial update.
     *
     * @throws SessionException NOT_FOUND if no session exists for the thread,
     *         INVALID_TRANSITION if the requested state change is not permitted;
     *         in that case nothing is modified
     */
    public Session updateSession(String threadId, SessionUpdate update) {
        Session result;
        synchronized (this) {
            result = apply(require(threadId), update);
        }
        saveAsync();
        return result;
    }

    /**
     * Force a session into ERROR, but only if it is still in {@code expected}
     * and {@code stalled} still holds. Both are checked under the store lock,
     * so a session that moved on since the caller looked at it is left alone.
     *
     * @return true if the session was moved to ERROR
     */
    public boolean failIfStalled(String threadId, SessionState expected,
                                 Predicate<Session> stalled, String error) {
        synchronized (this) {
            Session session = sessions.get(threadId);
            if (session == null || session.getState() != expected || !stalled.test(session)) {
                return false;
            }
            apply(session, SessionUpdate.failed(error));
        }
        saveAsync();
        return true;
    }

    public void deleteSession(String threadId) {
        synchronized (this) {
            Session session = require(threadId);
            sessions.remove(threadId);
            events.emit(SessionEvent.of(SessionEventType.DELETED, session.copy()));
            log.info("Deleted session {} (thread={})", session.getId(), threadId);
        }
        saveAsync();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    // Queries hand out detached copies; records change only through the methods above.

    public synchronized Optional<Session> getSession(String threadId) {
        return Optional.ofNullable(sessions.get(threadId)).map(Session::copy);
    }

    /** Sessions matching {@code filter}, newest first. */
    public synchronized List<Session> getAllSessions(SessionFilter filter) {
        SessionFilter f = filter == null ? SessionFilter.ALL : filter;
        return sessions.values().stream()
                .filter(f::matches)
                .sorted(Comparator.comparing((Session s) -> s.getMetadata().getCreatedAt()).reversed())
                .map(Session::copy)
                .toList();
    }

    public List<Session> getActiveSessions() {
        EnumSet<SessionState> active = EnumSet.noneOf(SessionState.class);
        for (SessionState s : SessionState.values()) {
            if (s.isActive()) active.add(s);
        }
        return getAllSessions(SessionFilter.inStates(active));
    }

    public synchronized SessionStats getStats() {
        Map<SessionState, Integer> byState = new EnumMap<>(SessionState.class);
        for (SessionState s : SessionState.values()) byState.put(s, 0);

        long completedMillis = 0;
        int completed = 0;
        int errors = 0;
        int active = 0;
        for (Session session : sessions.values()) {
            SessionState state = session.getState();
            byState.merge(state, 1, Integer::sum);
            if (state.isActive()) active++;
            if (state == SessionState.ERROR) errors++;
            if (state == SessionState.COMPLETED) {
                completed++;
                completedMillis += Duration.between(
                        session.getMetadata().getCreatedAt(),
                        session.getMetadata().getUpdatedAt()).toMillis();
            }
        }

        int total = sessions.size();
        Double avgMinutes = completed > 0 ? completedMillis / (double) completed / 60_000.0 : null;
        double errorRate = total > 0 ? errors * 100.0 / total : 0.0;
        return new SessionStats(total, byState, active, avgMinutes, errorRate);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Validate and apply {@code update}, then emit events. Caller holds the monitor. */
    private Session apply(Session session, SessionUpdate update) {
        String threadId = session.getThreadId();
        SessionState previous = session.getState();
        boolean stateChanged = update.state() != null && update.state() != previous;

        if (stateChanged && !previous.canTransitionTo(update.state())) {
            throw new SessionException(SessionException.Kind.INVALID_TRANSITION,
                    "Invalid state transition " + previous + " -> " + update.state()
                    + " for thread " + threadId);
        }

        if (stateChanged)                   session.setState(update.state());
        if (update.error() != null)         session.setError(update.error());
        if (update.worktreePath() != null)  session.setWorktreePath(update.worktreePath());
        if (update.containerId() != null)   session.setContainerId(update.containerId());
        if (update.clearLogs())             session.clearLogs();
        if (update.hasLogs())               session.appendLogs(update.addLogs());
        session.getMetadata().setUpdatedAt(clock.instant());

        Session view = session.copy();
        events.emit(new SessionEvent(SessionEventType.UPDATED, view.getId(), view,
                update.state() != null ? previous : null, Map.of()));
        if (stateChanged) {
            events.emit(new SessionEvent(SessionEventType.STATE_CHANGED, view.getId(), view,
                    previous, Map.of()));
        }
        if (update.hasLogs()) {
            events.emit(new SessionEvent(SessionEventType.LOG_ADDED, view.getId(), view,
                    null, Map.of("logs", update.addLogs())));
        }
        if (update.error() != null && !update.error().isEmpty()) {
            events.emit(new SessionEvent(SessionEventType.ERROR_OCCURRED, view.getId(), view,
                    null, Map.of("error", update.error())));
        }
        log.debug("Updated session {} (thread={}, {} -> {})",
                session.getId(), threadId, previous, session.getState());
        return view;
    }

    private Session require(String threadId) {
        Session session = sessions.get(threadId);
        if (session == null) {
            throw new SessionException(SessionException.Kind.NOT_FOUND,
                    "No session for thread " + threadId);
        }
        return session;
    }

    private synchronized Map<String, Session> snapshot() {
        Map<String, Session> copy = new LinkedHashMap<>();
        sessions.forEach((threadId, session) -> copy.put(threadId, session.copy()));
        return copy;
    }

    /**
     * Queue a save of the current state. The snapshot is taken on the
     * persistence thread, so a burst of mutations may collapse into fewer
     * writes with the latest data.
     */
    private void saveAsync() {
        try {
            persistenceExecutor.execute(this::flush);
        } catch (RejectedExecutionException e) {
            log.warn("Session save skipped, persistence executor rejected the task: {}", e.getMessage());
        }
    }
}
