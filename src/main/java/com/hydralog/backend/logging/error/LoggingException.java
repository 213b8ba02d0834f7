package com.hydralog.backend.logging.error;

import java.util.Map;

/**
 * Base of the logging failures. Each subtype fixes its {@link ErrorKind} and exposes
 * structured context for the error response and analytics.
 */
public abstract sealed class LoggingException extends RuntimeException
        permits SessionValidationException, DuplicateConflictException, SessionNotFoundException,
        AtomicWriteFailureException, QueueFullException, SyncFailureException,
        ReconciliationEmptyException, NoSchedulesTodayException {

    protected LoggingException(String message) {
        super(message);
    }

    protected LoggingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    public Map<String, Object> context() {
        return Map.of();
    }
}
