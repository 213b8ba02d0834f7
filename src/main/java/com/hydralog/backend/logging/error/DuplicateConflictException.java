package com.hydralog.backend.logging.error;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/** A medication dose already exists close to the candidate's time. The caller may offer an update instead. */
public final class DuplicateConflictException extends LoggingException {

    private final String medicationName;
    private final Instant conflictingTime;
    private final String existingSessionId;

    public DuplicateConflictException(String medicationName, Instant conflictingTime, String existingSessionId) {
        super("Medication '" + medicationName + "' already logged at " + conflictingTime);
        this.medicationName = medicationName;
        this.conflictingTime = conflictingTime;
        this.existingSessionId = existingSessionId;
    }

    public String medicationName() { return medicationName; }
    public Instant conflictingTime() { return conflictingTime; }
    public String existingSessionId() { return existingSessionId; }

    @Override
    public ErrorKind kind() { return ErrorKind.DUPLICATE_CONFLICT; }

    @Override
    public Map<String, Object> context() {
        Map<String, Object> m = new HashMap<>();
        m.put("medicationName", medicationName);
        m.put("conflictingTime", String.valueOf(conflictingTime));
        if (existingSessionId != null) m.put("existingSessionId", existingSessionId);
        return m;
    }
}
