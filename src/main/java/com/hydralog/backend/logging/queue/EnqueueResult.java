package com.hydralog.backend.logging.queue;

/** {@code warning} is set when the queue reached the soft cap; the enqueue itself succeeded. */
public record EnqueueResult(QueuedOperation operation, int queueSize, boolean warning) {
}
