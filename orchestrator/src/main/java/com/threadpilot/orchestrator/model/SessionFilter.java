package com.threadpilot.orchestrator.model;

import java.time.Instant;
import java.util.Set;

/**
 * Criteria for listing sessions. Every null field matches everything.
 */
public record SessionFilter(
        Set<SessionState> states,
        String            userId,
        String            repository,
        Instant           createdAfter,
        Instant           createdBefore
) {
    public static final SessionFilter ALL = new SessionFilter(null, null, null, null, null);

    public static SessionFilter inStates(Set<SessionState> states) {
        return new SessionFilter(states, null, null, null, null);
    }

    public boolean matches(Session s) {
        if (states != null && !states.contains(s.getState())) return false;
        if (userId != null && !userId.equals(s.getMetadata().getUserId())) return false;
        if (repository != null && !repository.equals(s.getRepository())) return false;
        Instant created = s.getMetadata().getCreatedAt();
        if (createdAfter != null && created.isBefore(createdAfter)) return false;
        if (createdBefore != null && created.isAfter(createdBefore)) return false;
        return true;
    }
}
