package com.threadpilot.orchestrator.api.dto;

import com.threadpilot.orchestrator.model.NewSession;

/**
 * Request body for POST /sessions.
 *
 * Required: threadId, repository
 * Optional: branch (defaults to the repository's default branch downstream),
 *   priority (defaults to 5), and the owning user/guild/channel ids.
 */
public record CreateSessionRequest(String threadId, String userId, String guildId, String channelId,
                                   String repository, String branch, Integer priority) {

    public CreateSessionRequest {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("threadId is required");
        }
    }

    public NewSession toOptions() {
        return new NewSession(repository, branch, priority);
    }
}
