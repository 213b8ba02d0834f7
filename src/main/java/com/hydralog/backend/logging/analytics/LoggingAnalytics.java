package com.hydralog.backend.logging.analytics;

import com.hydralog.backend.logging.error.ErrorKind;

import java.util.Map;

/** Fire-and-forget telemetry. Implementations must never throw into the caller's outcome. */
public interface LoggingAnalytics {

    void trackLoggingFailure(ErrorKind kind, Map<String, Object> context);

    void trackFeatureUsed(String feature, Map<String, Object> properties);
}
