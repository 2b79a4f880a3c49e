package com.threadpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One long-running coding-agent session, bound to a single chat thread.
 *
 * The thread id is the external correlation key: the session store holds at
 * most one live session per thread. State changes go through
 * {@link SessionState#canTransitionTo} and are applied by the session service;
 * this class itself does no validation.
 *
 * Serialized field-by-field into the session store file.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY,
                getterVisibility = Visibility.NONE,
                isGetterVisibility = Visibility.NONE)
public class Session {

    /** Ring-buffer capacity for {@link #getLogs()}; older lines are dropped first. */
    public static final int MAX_LOG_LINES = 100;

    private String       id;
    private String       threadId;
    private String       repository;
    private String       branch;
    private SessionState state = SessionState.INITIALIZING;

    // Filled in by the worktree / container collaborators as the session boots.
    private String worktreePath;
    private String containerId;

    // Last failure reported for the session; kept after a retry for diagnostics.
    private String error;

    private List<String>    logs = new ArrayList<>();
    private SessionMetadata metadata;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Session() {}   // required by Jackson

    public Session(String id, String threadId, String repository, String branch,
                   SessionMetadata metadata) {
        this.id         = id;
        this.threadId   = threadId;
        this.repository = repository;
        this.branch     = branch;
        this.metadata   = metadata;
    }

    /** Detached copy, used to hand snapshots to the persistence thread. */
    public Session copy() {
        Session s = new Session(id, threadId, repository, branch, metadata.copy());
        s.state        = state;
        s.worktreePath = worktreePath;
        s.containerId  = containerId;
        s.error        = error;
        s.logs         = new ArrayList<>(logs);
        return s;
    }

    // ------------------------------------------------------------------
    // Log buffer
    // ------------------------------------------------------------------

    public void appendLogs(List<String> lines) {
        logs.addAll(lines);
        if (logs.size() > MAX_LOG_LINES) {
            logs.subList(0, logs.size() - MAX_LOG_LINES).clear();
        }
    }

    public void clearLogs() {
        logs.clear();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String          getId()           { return id; }
    public String          getThreadId()     { return threadId; }
    public String          getRepository()   { return repository; }
    public String          getBranch()       { return branch; }
    public SessionState    getState()        { return state; }
    public String          getWorktreePath() { return worktreePath; }
    public String          getContainerId()  { return containerId; }
    public String          getError()        { return error; }
    public List<String>    getLogs()         { return Collections.unmodifiableList(logs); }
    public SessionMetadata getMetadata()     { return metadata; }

    public void setState(SessionState state)          { this.state = state; }
    public void setWorktreePath(String worktreePath)  { this.worktreePath = worktreePath; }
    public void setContainerId(String containerId)    { this.containerId = containerId; }
    public void setError(String error)                { this.error = error; }
}
