package com.hydralog.backend.logging.error;

import java.util.Map;

/** The offline queue is at its hard cap; the operation was not captured. */
public final class QueueFullException extends LoggingException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super("Offline queue is full (" + capacity + " operations)");
        this.capacity = capacity;
    }

    public int capacity() { return capacity; }

    @Override
    public ErrorKind kind() { return ErrorKind.QUEUE_FULL; }

    @Override
    public Map<String, Object> context() {
        return Map.of("capacity", capacity);
    }
}
