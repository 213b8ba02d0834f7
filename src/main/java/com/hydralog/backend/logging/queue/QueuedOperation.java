package com.hydralog.backend.logging.queue;

import java.time.Instant;
import java.util.UUID;

public record QueuedOperation(
        String id,
        LoggingCommand command,
        QueueStatus status,
        int retryCount,
        String lastError,
        Instant enqueuedAt
) {
    public static QueuedOperation pending(LoggingCommand command, Instant now) {
        return new QueuedOperation(UUID.randomUUID().toString(), command, QueueStatus.PENDING, 0, null, now);
    }

    public QueuedOperation withStatus(QueueStatus next) {
        return new QueuedOperation(id, command, next, retryCount, lastError, enqueuedAt);
    }

    public QueuedOperation withAttempt(int retries, String error) {
        return new QueuedOperation(id, command, status, retries, error, enqueuedAt);
    }

    public QueuedOperation failed(int retries, String error) {
        return new QueuedOperation(id, command, QueueStatus.FAILED, retries, error, enqueuedAt);
    }

    /** User-triggered retry: back to a fresh pending entry. */
    public QueuedOperation resetForRetry() {
        return new QueuedOperation(id, command, QueueStatus.PENDING, 0, null, enqueuedAt);
    }
}
