package com.hydralog.backend.logging.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Serialized lowercase ("low", "medium", "high"). */
public enum StressLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StressLevel fromWire(String v) {
        return v == null ? null : valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
