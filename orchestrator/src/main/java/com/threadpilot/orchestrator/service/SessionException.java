package com.threadpilot.orchestrator.service;

/**
 * Thrown when a caller's create/update/delete request cannot be applied.
 *
 * Unchecked: the REST layer maps {@link Kind} to an HTTP status, other
 * callers catch it only when they have a recovery strategy.
 */
public class SessionException extends RuntimeException {

    public enum Kind { ALREADY_EXISTS, NOT_FOUND, INVALID_TRANSITION }

    private final Kind kind;

    public SessionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
