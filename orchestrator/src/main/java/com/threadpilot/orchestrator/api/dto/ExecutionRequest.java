package com.threadpilot.orchestrator.api.dto;

import com.threadpilot.orchestrator.scheduler.ExecutionScheduler;

import java.util.List;

/**
 * Optional request body for POST /queue/{sessionId}.
 */
public record ExecutionRequest(Integer priority, List<String> dependencies) {

    public ExecutionRequest {
        if (priority == null) priority = ExecutionScheduler.DEFAULT_PRIORITY;
        if (dependencies == null) dependencies = List.of();
    }
}
