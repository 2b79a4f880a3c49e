package com.threadpilot.orchestrator.repository;

import com.threadpilot.orchestrator.model.Session;

import java.time.Instant;
import java.util.Map;

/**
 * On-disk layout of the session store: one record per thread id, plus the
 * time of the write and a schema version.
 */
public record PersistedSessions(Map<String, Session> sessions, Instant lastUpdated, String version) {

    public static final String CURRENT_VERSION = "1.0.0";

    public PersistedSessions {
        sessions = sessions == null ? Map.of() : sessions;
    }
}
