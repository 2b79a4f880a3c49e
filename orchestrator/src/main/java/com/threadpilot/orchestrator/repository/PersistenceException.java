package com.threadpilot.orchestrator.repository;

/**
 * Thrown when the session store file cannot be read or written.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
