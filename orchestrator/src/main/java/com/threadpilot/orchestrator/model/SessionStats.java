package com.threadpilot.orchestrator.model;

import java.util.Map;

/**
 * Point-in-time statistics over the session store.
 *
 * @param avgDurationMinutes mean createdAt→updatedAt span of COMPLETED sessions,
 *                           null when none have completed
 * @param errorRate          percentage of all sessions currently in ERROR
 */
public record SessionStats(
        int                       total,
        Map<SessionState, Integer> byState,
        int                       active,
        Double                    avgDurationMinutes,
        double                    errorRate
) {}
