package com.hydralog.backend.logging.store;

import com.hydralog.backend.logging.model.TreatmentSession;
import com.hydralog.backend.logging.summary.SummaryUpdateDto;

/** One write inside a {@link WriteUnit}. */
public sealed interface StoreOperation {

    record UpsertSession(TreatmentSession session) implements StoreOperation {}

    record DeleteSession(TreatmentSession session) implements StoreOperation {}

    /** Merge-upsert of one rollup row: identity init, increments, then guarded constants. */
    record ApplyRollup(RollupRef ref, SummaryUpdateDto dto) implements StoreOperation {}
}
