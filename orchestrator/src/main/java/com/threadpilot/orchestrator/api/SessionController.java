package com.threadpilot.orchestrator.api;

import com.threadpilot.orchestrator.api.dto.CreateSessionRequest;
import com.threadpilot.orchestrator.api.dto.SessionResponse;
import com.threadpilot.orchestrator.api.dto.UpdateSessionRequest;
import com.threadpilot.orchestrator.model.Session;
import com.threadpilot.orchestrator.model.SessionFilter;
import com.threadpilot.orchestrator.model.SessionState;
import com.threadpilot.orchestrator.model.SessionStats;
import com.threadpilot.orchestrator.service.SessionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Set;

/**
 * REST API over the session store.
 *
 * POST   /sessions              - create a session for a chat thread
 * GET    /sessions              - list sessions (optional state / userId / repository filters)
 * GET    /sessions/stats        - aggregate statistics
 * GET    /sessions/{threadId}   - one session
 * PATCH  /sessions/{threadId}   - partial update (state transition, logs, error, ...)
 * DELETE /sessions/{threadId}   - remove a session
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @PostMapping
    public ResponseEntity<SessionResponse> create(@RequestBody CreateSessionRequest req) {
        Session session = sessionService.createSession(
                req.threadId(), req.userId(), req.guildId(), req.channelId(), req.toOptions());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    @GetMapping
    public List<SessionResponse> list(@RequestParam(required = false) Set<SessionState> state,
                                      @RequestParam(required = false) String userId,
                                      @RequestParam(required = false) String repository) {
        SessionFilter filter = new SessionFilter(state, userId, repository, null, null);
        return sessionService.getAllSessions(filter).stream()
                .map(SessionResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public SessionStats stats() {
        return sessionService.getStats();
    }

    @GetMapping("/{threadId}")
    public SessionResponse get(@PathVariable String threadId) {
        return sessionService.getSession(threadId)
                .map(SessionResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Session not found: " + threadId));
    }

    @PatchMapping("/{threadId}")
    public SessionResponse update(@PathVariable String threadId, @RequestBody UpdateSessionRequest req) {
        return SessionResponse.from(sessionService.updateSession(threadId, req.toUpdate()));
    }

    @DeleteMapping("/{threadId}")
    public ResponseEntity<Void> delete(@PathVariable String threadId) {
        sessionService.deleteSession(threadId);
        return ResponseEntity.noContent().build();
    }
}
