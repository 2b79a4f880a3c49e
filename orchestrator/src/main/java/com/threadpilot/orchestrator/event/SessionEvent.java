package com.threadpilot.orchestrator.event;

import com.threadpilot.orchestrator.model.Session;
import com.threadpilot.orchestrator.model.SessionState;

import java.util.Map;

/**
 * Change notification published by the session store.
 *
 * @param previousState state before the update; null unless the update carried a state
 */
public record SessionEvent(
        SessionEventType    type,
        String              sessionId,
        Session             session,
        SessionState        previousState,
        Map<String, Object> data
) {
    public SessionEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static SessionEvent of(SessionEventType type, Session session) {
        return new SessionEvent(type, session.getId(), session, null, Map.of());
    }
}
