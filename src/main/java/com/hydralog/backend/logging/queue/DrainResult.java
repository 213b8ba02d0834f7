package com.hydralog.backend.logging.queue;

import java.util.List;

public record DrainResult(int successCount, int failureCount, List<String> failedOperationIds) {

    public static final DrainResult NOTHING = new DrainResult(0, 0, List.of());

    public DrainResult {
        failedOperationIds = List.copyOf(failedOperationIds);
    }

    public boolean hasFailures() {
        return failureCount > 0;
    }
}
