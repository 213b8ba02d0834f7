package com.hydralog.backend.logging.queue;

public enum QueueStatus {
    PENDING,
    SYNCING,
    FAILED
}
