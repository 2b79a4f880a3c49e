package com.threadpilot.orchestrator.api;

import com.threadpilot.orchestrator.api.dto.AdmissionResponse;
import com.threadpilot.orchestrator.api.dto.ExecutionRequest;
import com.threadpilot.orchestrator.scheduler.AdmissionOutcome;
import com.threadpilot.orchestrator.scheduler.ExecutionScheduler;
import com.threadpilot.orchestrator.scheduler.QueueStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST API over the execution scheduler.
 *
 * POST   /queue/{sessionId}            - ask for a run slot (200 running, 202 queued)
 * POST   /queue/{sessionId}/complete   - report that the session's work finished
 * DELETE /queue/{sessionId}            - withdraw the request / free the slot
 * GET    /queue/{sessionId}/position   - 1-indexed queue position, -1 if not queued
 * GET    /queue/stats                  - running / waiting counts and wait times
 *
 * Queued callers learn about the grant through scheduler events or by polling
 * the position endpoint.
 */
@RestController
@RequestMapping("/queue")
public class QueueController {

    private final ExecutionScheduler scheduler;

    public QueueController(ExecutionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping("/{sessionId}")
    public ResponseEntity<AdmissionResponse> request(@PathVariable String sessionId,
                                                     @RequestBody(required = false) ExecutionRequest req) {
        ExecutionRequest body = req == null ? new ExecutionRequest(null, null) : req;
        CompletableFuture<AdmissionOutcome> handle =
                scheduler.requestExecution(sessionId, body.priority(), body.dependencies());

        if (handle.isDone() && handle.join().isGranted()) {
            return ResponseEntity.ok(AdmissionResponse.running(sessionId));
        }
        return ResponseEntity.accepted()
                .body(AdmissionResponse.queued(sessionId, scheduler.getQueuePosition(sessionId)));
    }

    @PostMapping("/{sessionId}/complete")
    public ResponseEntity<Void> complete(@PathVariable String sessionId) {
        scheduler.completeExecution(sessionId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> cancel(@PathVariable String sessionId) {
        scheduler.cancelExecution(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/position")
    public Map<String, Object> position(@PathVariable String sessionId) {
        return Map.of("sessionId", sessionId, "position", scheduler.getQueuePosition(sessionId));
    }

    @GetMapping("/stats")
    public QueueStats stats() {
        return scheduler.getQueueStats();
    }
}
