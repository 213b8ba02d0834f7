package com.hydralog.backend.logging.error;

import java.util.List;
import java.util.Map;

/** At least one queued operation ended in FAILED during a drain. Failed entries stay queryable. */
public final class SyncFailureException extends LoggingException {

    private final int successCount;
    private final int failureCount;
    private final List<String> failedOperationIds;

    public SyncFailureException(int successCount, int failureCount, List<String> failedOperationIds) {
        super(failureCount + " queued operation(s) failed to sync");
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.failedOperationIds = List.copyOf(failedOperationIds);
    }

    public int successCount() { return successCount; }
    public int failureCount() { return failureCount; }
    public List<String> failedOperationIds() { return failedOperationIds; }

    @Override
    public ErrorKind kind() { return ErrorKind.SYNC_FAILURE; }

    @Override
    public Map<String, Object> context() {
        return Map.of(
                "successCount", successCount,
                "failureCount", failureCount,
                "failedOperationIds", failedOperationIds);
    }
}
