package com.threadpilot.orchestrator.api;

import com.threadpilot.orchestrator.service.SessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain exceptions thrown by the controllers to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionException.class)
    public ResponseEntity<Map<String, String>> onSessionException(SessionException e) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_FOUND                          -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS, INVALID_TRANSITION -> HttpStatus.CONFLICT;
        };
        log.debug("Rejected session request: {}", e.getMessage());
        return ResponseEntity.status(status)
                .body(Map.of("error", e.getKind().name(), "message", e.getMessage()));
    }

    // Second admission for a session that is already waiting or running.
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> onConflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "CONFLICT", "message", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> onBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "BAD_REQUEST", "message", e.getMessage()));
    }
}
