package com.hydralog.backend.logging.write;

/** Outcome of a chunked bulk write: every unit committed. */
public record BulkWriteReport(int sessionsWritten, int rollupsWritten, int unitsCommitted) {
}
