package com.threadpilot.orchestrator.model;

/**
 * Options for creating a session. Priority defaults to 5 when omitted.
 */
public record NewSession(String repository, String branch, Integer priority) {

    public static final int DEFAULT_PRIORITY = 5;

    public NewSession {
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("repository is required");
        }
        if (priority == null) priority = DEFAULT_PRIORITY;
    }
}
