package com.threadpilot.orchestrator.model;

import java.util.List;

/**
 * Partial update applied by {@code SessionService.updateSession}.
 *
 * Null fields are left untouched. {@code clearLogs} runs before
 * {@code addLogs}, so both together replace the log buffer.
 */
public record SessionUpdate(
        SessionState state,
        String       error,
        String       worktreePath,
        String       containerId,
        List<String> addLogs,
        boolean      clearLogs
) {
    public SessionUpdate {
        addLogs = addLogs == null ? List.of() : List.copyOf(addLogs);
    }

    public static SessionUpdate toState(SessionState state) {
        return new SessionUpdate(state, null, null, null, List.of(), false);
    }

    public static SessionUpdate failed(String error) {
        return new SessionUpdate(SessionState.ERROR, error, null, null, List.of(), false);
    }

    public static SessionUpdate logs(String... lines) {
        return new SessionUpdate(null, null, null, null, List.of(lines), false);
    }

    public boolean hasLogs() {
        return !addLogs.isEmpty();
    }
}
