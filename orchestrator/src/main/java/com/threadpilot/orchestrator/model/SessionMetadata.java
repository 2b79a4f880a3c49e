package com.threadpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;

import java.time.Instant;

/**
 * Ownership and bookkeeping attached to every {@link Session}.
 * Identifiers come from the chat platform and are stored verbatim.
 */
@JsonAutoDetect(fieldVisibility = Visibility.ANY,
                getterVisibility = Visibility.NONE,
                isGetterVisibility = Visibility.NONE)
public class SessionMetadata {

    private String  userId;
    private String  guildId;
    private String  channelId;
    private Instant createdAt;
    private Instant updatedAt;
    private int     priority;

    protected SessionMetadata() {}   // required by Jackson

    public SessionMetadata(String userId, String guildId, String channelId,
                           Instant createdAt, int priority) {
        this.userId    = userId;
        this.guildId   = guildId;
        this.channelId = channelId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.priority  = priority;
    }

    SessionMetadata copy() {
        SessionMetadata m = new SessionMetadata(userId, guildId, channelId, createdAt, priority);
        m.updatedAt = updatedAt;
        return m;
    }

    public String  getUserId()    { return userId; }
    public String  getGuildId()   { return guildId; }
    public String  getChannelId() { return channelId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public int     getPriority()  { return priority; }

    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
