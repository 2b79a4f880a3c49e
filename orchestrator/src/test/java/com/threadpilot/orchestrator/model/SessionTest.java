package com.threadpilot.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class SessionTest {

    private final Session session = new Session("session_1", "thread-1", "org/repo", "main",
            new SessionMetadata("user", "guild", "channel", Instant.parse("2026-01-01T00:00:00Z"), 5));

    @Test
    void appendLogs_keepsOnlyTheNewestHundredLines() {
        session.appendLogs(IntStream.range(0, 60).mapToObj(i -> "line-" + i).toList());
        session.appendLogs(IntStream.range(60, 130).mapToObj(i -> "line-" + i).toList());

        assertThat(session.getLogs()).hasSize(Session.MAX_LOG_LINES);
        assertThat(session.getLogs().get(0)).isEqualTo("line-30");
        assertThat(session.getLogs().get(99)).isEqualTo("line-129");
    }

    @Test
    void copy_isDetachedFromSource() {
        session.appendLogs(List.of("a"));
        Session copy = session.copy();

        session.appendLogs(List.of("b"));
        session.setState(SessionState.STARTING);
        session.getMetadata().setUpdatedAt(Instant.parse("2026-01-01T01:00:00Z"));

        assertThat(copy.getLogs()).containsExactly("a");
        assertThat(copy.getState()).isEqualTo(SessionState.INITIALIZING);
        assertThat(copy.getMetadata().getUpdatedAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
    }
}
