package com.hydralog.backend.logging.store;

import java.util.List;

/** Operations committed all-or-nothing. */
public record WriteUnit(List<StoreOperation> operations) {

    public WriteUnit {
        operations = List.copyOf(operations);
    }

    public int size() {
        return operations.size();
    }

    public long rollupCount() {
        return operations.stream().filter(op -> op instanceof StoreOperation.ApplyRollup).count();
    }

    public long sessionCount() {
        return operations.size() - rollupCount();
    }
}
