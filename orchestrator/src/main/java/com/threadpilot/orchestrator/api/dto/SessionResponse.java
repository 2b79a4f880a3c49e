package com.threadpilot.orchestrator.api.dto;

import com.threadpilot.orchestrator.model.Session;
import com.threadpilot.orchestrator.model.SessionState;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a session returned by the /sessions endpoints.
 */
public record SessionResponse(
        String       id,
        String       threadId,
        String       repository,
        String       branch,
        SessionState state,
        String       worktreePath,
        String       containerId,
        String       error,
        List<String> logs,
        String       userId,
        int          priority,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static SessionResponse from(Session s) {
        return new SessionResponse(
                s.getId(),
                s.getThreadId(),
                s.getRepository(),
                s.getBranch(),
                s.getState(),
                s.getWorktreePath(),
                s.getContainerId(),
                s.getError(),
                List.copyOf(s.getLogs()),
                s.getMetadata().getUserId(),
                s.getMetadata().getPriority(),
                s.getMetadata().getCreatedAt(),
                s.getMetadata().getUpdatedAt()
        );
    }
}
