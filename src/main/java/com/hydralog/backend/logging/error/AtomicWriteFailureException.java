package com.hydralog.backend.logging.error;

import java.util.Map;

/**
 * A write unit failed in the durable store. For chunked bulk writes {@code chunkIndex} names the failing
 * unit (0-based) and {@code committedChunks} how many earlier units stay committed. Single writes use 0/0.
 */
public final class AtomicWriteFailureException extends LoggingException {

    private final String operation;
    private final int chunkIndex;
    private final int committedChunks;

    public AtomicWriteFailureException(String operation, int chunkIndex, int committedChunks, Throwable cause) {
        super(operation + " failed at chunk " + chunkIndex + " (" + committedChunks + " committed): "
                + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.operation = operation;
        this.chunkIndex = chunkIndex;
        this.committedChunks = committedChunks;
    }

    public static AtomicWriteFailureException of(String operation, Throwable cause) {
        return new AtomicWriteFailureException(operation, 0, 0, cause);
    }

    public String operation() { return operation; }
    public int chunkIndex() { return chunkIndex; }
    public int committedChunks() { return committedChunks; }

    public boolean partiallyCommitted() {
        return committedChunks > 0;
    }

    @Override
    public ErrorKind kind() { return ErrorKind.ATOMIC_WRITE_FAILURE; }

    @Override
    public Map<String, Object> context() {
        return Map.of(
                "operation", operation,
                "chunkIndex", chunkIndex,
                "committedChunks", committedChunks);
    }
}
