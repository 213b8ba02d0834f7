package com.hydralog.backend.logging.error;

/**
 * Every way a logging operation can end without a plain success.
 * QUEUE_WARNING is informational: the enqueue it reports has already succeeded.
 */
public enum ErrorKind {
    VALIDATION_FAILURE,
    DUPLICATE_CONFLICT,
    SESSION_NOT_FOUND,
    ATOMIC_WRITE_FAILURE,
    QUEUE_FULL,
    QUEUE_WARNING,
    SYNC_FAILURE,
    RECONCILIATION_EMPTY,
    NO_SCHEDULES
}
