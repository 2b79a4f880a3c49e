package com.threadpilot.orchestrator.api.dto;

import com.threadpilot.orchestrator.model.SessionState;
import com.threadpilot.orchestrator.model.SessionUpdate;

import java.util.List;

/**
 * Request body for PATCH /sessions/{threadId}. Omitted fields are left unchanged.
 */
public record UpdateSessionRequest(SessionState state, String error, String worktreePath,
                                   String containerId, List<String> addLogs, Boolean clearLogs) {

    public SessionUpdate toUpdate() {
        return new SessionUpdate(state, error, worktreePath, containerId, addLogs,
                Boolean.TRUE.equals(clearLogs));
    }
}
